package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.application.pipeline.MergeResult;
import java.io.IOException;

/**
 * Output port persisting the machine-readable totals of a run.
 *
 * @since 0.1.0
 */
public interface RunSummaryPort {
  /**
   * Writes the summary.
   *
   * @param result finished run
   * @throws IOException if writing fails
   */
  void write(MergeResult result) throws IOException;

  /** Summary port that discards results. */
  RunSummaryPort NONE = result -> {};
}
