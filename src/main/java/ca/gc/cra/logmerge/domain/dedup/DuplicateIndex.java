package ca.gc.cra.logmerge.domain.dedup;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.ComparisonKey;
import ca.gc.cra.logmerge.domain.adif.TimeKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Windowed duplicate detector and per-group store of accepted records.
 * <p><strong>Why:</strong> Merging overlapping logs re-imports the same contacts; a contact logged twice within
 * the tolerance window with the same callsign, band and mode must be kept once.</p>
 * <p><strong>Role:</strong> Stateful domain engine owned by a single merge run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify each record as accepted or duplicate; the earliest accepted record wins.</li>
 *   <li>Keep candidates in a two-level container {@code groupKey -> ComparisonKey -> [(TimeKey, record)]}
 *   so scans only touch comparable records.</li>
 *   <li>Retain accepted records per group in acceptance order for output.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per run, one thread.</p>
 * <p><strong>Performance:</strong> Each lookup scans one candidate bucket; memory grows with accepted records
 * for the lifetime of the run.</p>
 *
 * @implNote Records lacking a contact callsign or a parsable time are accepted but never indexed, since they
 * offer no reliable key for future matches either.
 * @since 0.1.0
 */
public final class DuplicateIndex {
  /** Default tolerance window. */
  public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(900);

  private final long toleranceSeconds;
  private final Map<String, Map<ComparisonKey, List<Candidate>>> candidates = new HashMap<>();
  private final Map<String, List<AdifRecord>> groups = new LinkedHashMap<>();
  private long accepted;
  private long duplicates;

  /**
   * Creates an index with the {@link #DEFAULT_TOLERANCE default} window.
   */
  public DuplicateIndex() {
    this(DEFAULT_TOLERANCE);
  }

  /**
   * Creates an index with a custom tolerance window.
   *
   * @param tolerance maximum absolute time difference still considered the same contact; must not be negative
   */
  public DuplicateIndex(Duration tolerance) {
    Objects.requireNonNull(tolerance, "tolerance");
    if (tolerance.isNegative()) {
      throw new IllegalArgumentException("tolerance must not be negative");
    }
    this.toleranceSeconds = tolerance.getSeconds();
  }

  /**
   * Classifies {@code record} within {@code groupKey}, storing it when accepted.
   *
   * @param record incoming record; must not be {@code null}
   * @param groupKey group identity; must not be {@code null}
   * @return {@link Outcome.Accepted} or {@link Outcome.Duplicate} carrying the matched record
   */
  public Outcome process(AdifRecord record, String groupKey) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(groupKey, "groupKey");
    ComparisonKey key = ComparisonKey.of(record);
    TimeKey time = TimeKey.of(record);

    if (!key.hasCallsign() || !time.isPresent()) {
      store(groupKey, record);
      return Outcome.accepted();
    }

    List<Candidate> bucket = candidates
        .computeIfAbsent(groupKey, k -> new HashMap<>())
        .computeIfAbsent(key, k -> new ArrayList<>());
    for (Candidate candidate : bucket) {
      if (candidate.time().secondsApart(time) <= toleranceSeconds) {
        duplicates++;
        return new Outcome.Duplicate(candidate.record());
      }
    }

    store(groupKey, record);
    bucket.add(new Candidate(time, record));
    return Outcome.accepted();
  }

  private void store(String groupKey, AdifRecord record) {
    groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(record);
    accepted++;
  }

  /**
   * Accepted records per group, groups in order of first acceptance.
   *
   * @return read-only view; inner lists are read-only
   */
  public Map<String, List<AdifRecord>> groups() {
    Map<String, List<AdifRecord>> view = new LinkedHashMap<>();
    groups.forEach((group, records) -> view.put(group, Collections.unmodifiableList(records)));
    return Collections.unmodifiableMap(view);
  }

  /**
   * Total accepted records across groups.
   *
   * @return accepted count
   */
  public long acceptedCount() {
    return accepted;
  }

  /**
   * Total records classified as duplicates.
   *
   * @return duplicate count
   */
  public long duplicateCount() {
    return duplicates;
  }

  /**
   * Configured tolerance window.
   *
   * @return tolerance
   */
  public Duration tolerance() {
    return Duration.ofSeconds(toleranceSeconds);
  }

  private record Candidate(TimeKey time, AdifRecord record) {}
}
