package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.domain.dedup.DuplicateEvent;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Output port publishing the rejected near-duplicates of a run for operator review.
 *
 * @since 0.1.0
 */
public interface DuplicateReportPort {
  /**
   * Publishes the report; called once per run, also when {@code events} is empty.
   *
   * @param events duplicate events in detection order
   * @param generatedAt report timestamp
   * @throws IOException if publishing fails
   */
  void publish(List<DuplicateEvent> events, Instant generatedAt) throws IOException;

  /** Report port that discards events. */
  DuplicateReportPort NONE = (events, generatedAt) -> {};
}
