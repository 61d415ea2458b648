package ca.gc.cra.logmerge.domain.dedup;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import java.util.Objects;

/**
 * <strong>What:</strong> A rejected near-duplicate paired with the accepted record it matched.
 * <p><strong>Role:</strong> Read-only output consumed by the duplicate report adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param groupKey group both records belong to
 * @param incoming record that was rejected
 * @param existing earlier accepted record
 * @since 0.1.0
 */
public record DuplicateEvent(String groupKey, AdifRecord incoming, AdifRecord existing) {

  public DuplicateEvent {
    Objects.requireNonNull(groupKey, "groupKey");
    Objects.requireNonNull(incoming, "incoming");
    Objects.requireNonNull(existing, "existing");
  }
}
