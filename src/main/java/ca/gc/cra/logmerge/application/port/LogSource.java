package ca.gc.cra.logmerge.application.port;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> One contact log to merge, identified by a provenance string.
 * <p><strong>Role:</strong> Produced by a {@link LogSourceCatalog}; opened once by the merge use case.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable descriptors; each {@link #open()} returns a
 * fresh stream.</p>
 *
 * @since 0.1.0
 */
public interface LogSource {
  /**
   * Provenance identifier stamped on every record read from this source.
   *
   * @return non-blank identifier, e.g. {@code done/20240101_120000-field.adi}
   */
  String id();

  /**
   * Opens the raw bytes of the log.
   *
   * @return new stream; the caller closes it
   * @throws IOException if the source cannot be opened
   */
  InputStream open() throws IOException;

  /**
   * Indicates whether this source is new input that should be archived after a successful run.
   *
   * @return {@code true} for new input, {@code false} for previously processed logs
   */
  boolean archivable();

  /**
   * File backing this source, when there is one.
   *
   * @return file path or empty for in-memory sources
   */
  default Optional<Path> location() {
    return Optional.empty();
  }
}
