package ca.gc.cra.logmerge.infrastructure.source;

import ca.gc.cra.logmerge.application.port.LogSource;
import ca.gc.cra.logmerge.application.port.LogSourceCatalog;
import ca.gc.cra.logmerge.util.PathUtils;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lists the {@code .adi}/{@code .adif} logs of an input directory and its done directory.
 * <p><strong>Why:</strong> Each run re-reads the archived history so new input is deduplicated against everything
 * merged before.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>New files from the input directory first, marked archivable.</li>
 *   <li>Archived files from the done directory next, marked not archivable.</li>
 *   <li>Each group sorted by file name; subdirectories are not descended.</li>
 * </ul>
 *
 * @implNote Source ids are paths relative to the input directory, so archived files read as {@code done/x.adi}
 * when the done directory sits inside the input directory.
 * @since 0.1.0
 */
public final class DirectoryLogSourceCatalog implements LogSourceCatalog {
  private static final Logger log = LoggerFactory.getLogger(DirectoryLogSourceCatalog.class);
  private static final String[] EXTENSIONS = {".adi", ".adif"};

  private final Path inputDirectory;
  private final Path doneDirectory;

  /**
   * Creates a catalog.
   *
   * @param inputDirectory directory holding new logs
   * @param doneDirectory directory holding archived logs; may not exist yet
   */
  public DirectoryLogSourceCatalog(Path inputDirectory, Path doneDirectory) {
    this.inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory").toAbsolutePath().normalize();
    this.doneDirectory = Objects.requireNonNull(doneDirectory, "doneDirectory").toAbsolutePath().normalize();
  }

  @Override
  public List<LogSource> sources() throws IOException {
    List<LogSource> sources = new ArrayList<>();
    List<Path> fresh = list(inputDirectory);
    for (Path file : fresh) {
      sources.add(new FileLogSource(idOf(file), file, true));
    }
    List<Path> archived = Files.isDirectory(doneDirectory) ? list(doneDirectory) : List.of();
    for (Path file : archived) {
      sources.add(new FileLogSource(idOf(file), file, false));
    }
    log.info("Found {} new and {} archived logs", fresh.size(), archived.size());
    return sources;
  }

  private static List<Path> list(Path directory) throws IOException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        if (Files.isRegularFile(entry) && PathUtils.hasExtension(entry, EXTENSIONS)) {
          files.add(entry);
        }
      }
    }
    files.sort(Comparator.comparing(path -> PathUtils.fileName(path).orElse("")));
    return files;
  }

  private String idOf(Path file) {
    Path normalized = file.toAbsolutePath().normalize();
    if (normalized.startsWith(inputDirectory)) {
      return inputDirectory.relativize(normalized).toString().replace('\\', '/');
    }
    return normalized.toString();
  }
}
