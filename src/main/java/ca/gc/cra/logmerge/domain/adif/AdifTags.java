package ca.gc.cra.logmerge.domain.adif;

/**
 * Tag names and framing markers of the tag-length-value log format.
 *
 * @since 0.1.0
 */
public final class AdifTags {
  /** Worked station callsign. */
  public static final String CALL = "CALL";
  /** Band, e.g. {@code 20M}. */
  public static final String BAND = "BAND";
  /** Mode, e.g. {@code SSB}. */
  public static final String MODE = "MODE";
  /** Contact date as {@code YYYYMMDD}. */
  public static final String QSO_DATE = "QSO_DATE";
  /** Contact start time as {@code HHMM} or {@code HHMMSS}. */
  public static final String TIME_ON = "TIME_ON";
  /** Callsign of the logging station. */
  public static final String STATION_CALLSIGN = "STATION_CALLSIGN";
  /** Maidenhead locator of the logging station. */
  public static final String MY_GRIDSQUARE = "MY_GRIDSQUARE";

  /** End-of-header marker, matched case-insensitively. */
  public static final String END_OF_HEADER = "<EOH>";
  /** End-of-record marker, matched case-insensitively. */
  public static final String END_OF_RECORD = "<EOR>";

  private AdifTags() {}
}
