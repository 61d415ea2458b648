package ca.gc.cra.logmerge.infrastructure.source;

import ca.gc.cra.logmerge.application.port.LogSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LogSource} backed by a file.
 *
 * @param id provenance identifier, the path relative to the input directory
 * @param path file location
 * @param archivable whether the file is new input
 * @since 0.1.0
 */
public record FileLogSource(String id, Path path, boolean archivable) implements LogSource {

  public FileLogSource {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(path, "path");
  }

  @Override
  public InputStream open() throws IOException {
    return Files.newInputStream(path);
  }

  @Override
  public Optional<Path> location() {
    return Optional.of(path);
  }
}
