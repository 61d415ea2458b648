package ca.gc.cra.logmerge.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port listing the logs of one merge run in processing order.
 * <p><strong>Why:</strong> "Oldest accepted wins" makes order significant; the catalog owns that order.</p>
 * <p><strong>Role:</strong> Implemented by {@code DirectoryLogSourceCatalog}.</p>
 *
 * @since 0.1.0
 */
public interface LogSourceCatalog {
  /**
   * Lists the sources to merge.
   *
   * @return ordered sources; empty when there is nothing to merge
   * @throws IOException if discovery fails
   */
  List<LogSource> sources() throws IOException;
}
