package ca.gc.cra.logmerge.domain.adif;

import java.util.Locale;
import java.util.Objects;

/**
 * Coarse duplicate bucket within a group: uppercased contact callsign, band and mode.
 *
 * @param callsign worked station; empty when missing
 * @param band band; empty when missing
 * @param mode mode; empty when missing
 * @since 0.1.0
 */
public record ComparisonKey(String callsign, String band, String mode) {

  public ComparisonKey {
    callsign = normalize(callsign);
    band = normalize(band);
    mode = normalize(mode);
  }

  /**
   * Extracts the comparison fields of {@code record}.
   *
   * @param record source record; must not be {@code null}
   * @return comparison key
   */
  public static ComparisonKey of(AdifRecord record) {
    Objects.requireNonNull(record, "record");
    return new ComparisonKey(
        record.getOrEmpty(AdifTags.CALL),
        record.getOrEmpty(AdifTags.BAND),
        record.getOrEmpty(AdifTags.MODE));
  }

  /**
   * Indicates whether the contact callsign is missing.
   *
   * @return {@code true} when no callsign was logged
   */
  public boolean hasCallsign() {
    return !callsign.isEmpty();
  }

  private static String normalize(String value) {
    return value == null ? "" : value.toUpperCase(Locale.ROOT);
  }
}
