package ca.gc.cra.logmerge.application.pipeline;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.dedup.DuplicateEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of one merge run.
 * <p><strong>Role:</strong> Returned by {@link MergeUseCase#run()} and handed to the run summary port.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are read-only copies preserving order.</p>
 *
 * @param groups accepted records per group key, in group order of first acceptance
 * @param duplicates rejected near-duplicates in detection order
 * @param missingCallsigns per source id, records that carried no station callsign
 * @param sourcesRead sources that were opened
 * @param sourcesFailed sources that could not be opened or ended on an I/O failure
 * @param recordsParsed records yielded by all readers
 * @param outputs locations written by the merged log writer
 * @param archived ids of sources moved to the done directory
 * @since 0.1.0
 */
public record MergeResult(
    Map<String, List<AdifRecord>> groups,
    List<DuplicateEvent> duplicates,
    Map<String, Long> missingCallsigns,
    int sourcesRead,
    int sourcesFailed,
    long recordsParsed,
    List<String> outputs,
    List<String> archived) {

  public MergeResult {
    Objects.requireNonNull(groups, "groups");
    Map<String, List<AdifRecord>> groupsCopy = new LinkedHashMap<>();
    groups.forEach((key, records) -> groupsCopy.put(key, List.copyOf(records)));
    groups = Collections.unmodifiableMap(groupsCopy);
    duplicates = List.copyOf(Objects.requireNonNull(duplicates, "duplicates"));
    missingCallsigns = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(missingCallsigns, "missingCallsigns")));
    outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
    archived = List.copyOf(Objects.requireNonNull(archived, "archived"));
  }

  /**
   * Records kept across all groups.
   *
   * @return accepted record count
   */
  public long recordsAccepted() {
    long total = 0;
    for (List<AdifRecord> records : groups.values()) {
      total += records.size();
    }
    return total;
  }

  /**
   * Records removed as near-duplicates.
   *
   * @return duplicate count
   */
  public int duplicateCount() {
    return duplicates.size();
  }

  /**
   * Records routed to the unknown-callsign group across all sources.
   *
   * @return missing-callsign count
   */
  public long missingCallsignTotal() {
    long total = 0;
    for (long count : missingCallsigns.values()) {
      total += count;
    }
    return total;
  }

  /**
   * Copy of this result with the archived source ids replaced.
   *
   * @param archivedIds ids of archived sources
   * @return new result
   */
  public MergeResult withArchived(List<String> archivedIds) {
    return new MergeResult(groups, duplicates, missingCallsigns, sourcesRead, sourcesFailed, recordsParsed,
        outputs, new ArrayList<>(archivedIds));
  }
}
