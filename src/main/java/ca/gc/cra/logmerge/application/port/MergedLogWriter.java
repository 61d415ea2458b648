package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Output port receiving the accepted records of each group.
 * <p><strong>Role:</strong> Implemented by {@code AdifFileWriterAdapter}; one call per group after all sources
 * are read.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded use.</p>
 *
 * @since 0.1.0
 */
public interface MergedLogWriter {
  /**
   * Prepares the destination before the first group is written, e.g. clears stale output.
   *
   * @throws IOException if the destination cannot be prepared
   */
  default void prepare() throws IOException {}

  /**
   * Writes one group.
   *
   * @param groupKey group identity
   * @param records accepted records in acceptance order
   * @return human readable location of the written output
   * @throws IOException if writing fails
   */
  String write(String groupKey, List<AdifRecord> records) throws IOException;
}
