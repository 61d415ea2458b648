package ca.gc.cra.logmerge.domain.adif;

import java.util.Locale;

/**
 * <strong>What:</strong> Derives the station identity that partitions output files and isolates duplicate checks.
 * <p><strong>Why:</strong> Two contacts logged by different stations are never duplicates of each other, and
 * each station gets its own merged log.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Callsign: trimmed, uppercased, {@code '/'} replaced by {@code '_'}, empty becomes {@link #UNKNOWN_CALLSIGN}.
 * Locator: trimmed, uppercased, non-alphanumerics stripped, empty becomes {@link #NO_GRID}.
 * @since 0.1.0
 */
public final class GroupKey {
  /** Placeholder for records without a station callsign. */
  public static final String UNKNOWN_CALLSIGN = "UNKNOWN";
  /** Placeholder for records without a station locator. */
  public static final String NO_GRID = "NOGRID";

  private GroupKey() {}

  /**
   * Derives {@code "{callsign}-{locator}"} for {@code record}.
   *
   * @param record source record
   * @return group key
   */
  public static String of(AdifRecord record) {
    return of(record, true);
  }

  /**
   * Derives the group key, optionally including the station locator.
   *
   * @param record source record
   * @param includeLocator when {@code false} the key is the sanitized callsign alone
   * @return group key
   */
  public static String of(AdifRecord record, boolean includeLocator) {
    String callsign = sanitizeCallsign(record.getOrEmpty(AdifTags.STATION_CALLSIGN));
    if (!includeLocator) {
      return callsign;
    }
    return callsign + "-" + sanitizeLocator(record.getOrEmpty(AdifTags.MY_GRIDSQUARE));
  }

  /**
   * Indicates whether {@code record} names its station, i.e. whether the callsign placeholder is avoided.
   *
   * @param record source record
   * @return {@code true} when {@code STATION_CALLSIGN} is present and non-blank
   */
  public static boolean hasCallsign(AdifRecord record) {
    return !record.getOrEmpty(AdifTags.STATION_CALLSIGN).isBlank();
  }

  static String sanitizeCallsign(String raw) {
    String trimmed = raw == null ? "" : raw.trim();
    if (trimmed.isEmpty()) {
      return UNKNOWN_CALLSIGN;
    }
    return trimmed.toUpperCase(Locale.ROOT).replace('/', '_');
  }

  static String sanitizeLocator(String raw) {
    String trimmed = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(trimmed.length());
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
        sb.append(c);
      }
    }
    return sb.length() == 0 ? NO_GRID : sb.toString();
  }
}
