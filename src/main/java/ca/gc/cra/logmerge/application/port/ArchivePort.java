package ca.gc.cra.logmerge.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Port moving processed input out of the way so the next run treats it as history.
 * <p><strong>Role:</strong> Implemented by {@code DoneDirectoryArchiver}.</p>
 * <p><strong>Observability:</strong> Per-source failures are logged by the implementation and skipped.</p>
 *
 * @since 0.1.0
 */
public interface ArchivePort {
  /**
   * Archives the given sources.
   *
   * @param sources archivable sources
   * @return identifiers of the sources that were archived
   */
  List<String> archive(List<LogSource> sources);

  /** Archive port that keeps every source in place. */
  ArchivePort NONE = sources -> List.of();
}
