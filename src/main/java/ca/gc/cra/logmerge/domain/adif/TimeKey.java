package ca.gc.cra.logmerge.domain.adif;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * <strong>What:</strong> Normalized contact instant derived from {@code QSO_DATE} and {@code TIME_ON}, or {@link #ABSENT}.
 * <p><strong>Why:</strong> Duplicate detection compares contacts by time distance; every record needs one
 * comparable value without throwing on malformed logs.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @implNote Times are right-padded with zeros to six digits or truncated to six, then parsed with
 * {@code uuuuMMddHHmmss} under {@link ResolverStyle#STRICT} as UTC.
 * @since 0.1.0
 */
public final class TimeKey {
  /** Sentinel for records whose date/time is missing or unparsable. */
  public static final TimeKey ABSENT = new TimeKey(null);

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("uuuuMMddHHmmss").withResolverStyle(ResolverStyle.STRICT);
  private static final int DATE_DIGITS = 8;
  private static final int TIME_DIGITS = 6;

  private final Instant instant;

  private TimeKey(Instant instant) {
    this.instant = instant;
  }

  /**
   * Derives the time key of {@code record}.
   *
   * @param record source record; {@code null} yields {@link #ABSENT}
   * @return parsed key or {@link #ABSENT}
   */
  public static TimeKey of(AdifRecord record) {
    if (record == null) {
      return ABSENT;
    }
    return parse(record.getOrEmpty(AdifTags.QSO_DATE), record.get(AdifTags.TIME_ON).orElse(null));
  }

  /**
   * Parses a date and time pair.
   *
   * @param date eight digit {@code YYYYMMDD}; anything else yields {@link #ABSENT}
   * @param time up to six digits {@code HHMMSS}; {@code null} means midnight
   * @return parsed key or {@link #ABSENT}; never throws
   */
  public static TimeKey parse(String date, String time) {
    if (date == null) {
      return ABSENT;
    }
    String d = date.trim();
    if (d.length() != DATE_DIGITS) {
      return ABSENT;
    }
    String t = normalizeTime(time);
    try {
      LocalDateTime parsed = LocalDateTime.parse(d + t, FORMAT);
      return new TimeKey(parsed.toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException ex) {
      return ABSENT;
    }
  }

  /**
   * Creates a key for a known instant.
   *
   * @param instant instant; must not be {@code null}
   * @return key wrapping {@code instant}
   */
  public static TimeKey ofInstant(Instant instant) {
    return new TimeKey(Objects.requireNonNull(instant, "instant"));
  }

  static String normalizeTime(String time) {
    String t = time == null ? "" : time.trim();
    if (t.length() >= TIME_DIGITS) {
      return t.substring(0, TIME_DIGITS);
    }
    StringBuilder padded = new StringBuilder(TIME_DIGITS).append(t);
    while (padded.length() < TIME_DIGITS) {
      padded.append('0');
    }
    return padded.toString();
  }

  /**
   * Indicates whether this key carries an instant.
   *
   * @return {@code false} for {@link #ABSENT}
   */
  public boolean isPresent() {
    return instant != null;
  }

  /**
   * Returns the instant.
   *
   * @return instant
   * @throws IllegalStateException when called on {@link #ABSENT}
   */
  public Instant instant() {
    if (instant == null) {
      throw new IllegalStateException("time key is absent");
    }
    return instant;
  }

  /**
   * Absolute distance to {@code other} in seconds.
   *
   * @param other present key
   * @return absolute difference in whole seconds
   * @throws IllegalStateException when either key is absent
   */
  public long secondsApart(TimeKey other) {
    Objects.requireNonNull(other, "other");
    return Math.abs(instant().getEpochSecond() - other.instant().getEpochSecond());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeKey that)) {
      return false;
    }
    return Objects.equals(instant, that.instant);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(instant);
  }

  @Override
  public String toString() {
    return instant == null ? "TimeKey[ABSENT]" : "TimeKey[" + instant + "]";
  }
}
