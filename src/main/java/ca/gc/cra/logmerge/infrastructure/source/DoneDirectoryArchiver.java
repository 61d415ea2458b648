package ca.gc.cra.logmerge.infrastructure.source;

import ca.gc.cra.logmerge.application.port.ArchivePort;
import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.LogSource;
import ca.gc.cra.logmerge.util.PathUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves processed input files into the done directory as {@code {yyyyMMdd_HHmmss}-{name}} in local time.
 *
 * <p>Sources without a backing file are skipped. A move failure is logged and the remaining files are still
 * archived. An existing target gets a counter after the stamp instead of being replaced.</p>
 *
 * @since 0.1.0
 */
public final class DoneDirectoryArchiver implements ArchivePort {
  private static final Logger log = LoggerFactory.getLogger(DoneDirectoryArchiver.class);
  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Path doneDirectory;
  private final ClockPort clock;
  private final ZoneId zone;

  /**
   * Creates an archiver using the system time zone for stamps.
   *
   * @param doneDirectory destination directory; created on first use
   * @param clock time source for stamps
   */
  public DoneDirectoryArchiver(Path doneDirectory, ClockPort clock) {
    this(doneDirectory, clock, ZoneId.systemDefault());
  }

  DoneDirectoryArchiver(Path doneDirectory, ClockPort clock, ZoneId zone) {
    this.doneDirectory = Objects.requireNonNull(doneDirectory, "doneDirectory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public List<String> archive(List<LogSource> sources) {
    List<String> archived = new ArrayList<>();
    if (sources.isEmpty()) {
      return archived;
    }
    String stamp = STAMP.format(Instant.ofEpochMilli(clock.nowMillis()).atZone(zone));
    try {
      Files.createDirectories(doneDirectory);
    } catch (IOException ex) {
      log.error("Cannot create done directory {}; inputs stay in place", doneDirectory, ex);
      return archived;
    }
    for (LogSource source : sources) {
      Optional<Path> file = source.location();
      if (file.isEmpty()) {
        continue;
      }
      String name = PathUtils.fileName(file.get()).orElse(source.id());
      Path target = uniqueTarget(stamp, name);
      try {
        Files.move(file.get(), target);
        archived.add(source.id());
        log.info("Archived {} to {}", source.id(), target);
      } catch (IOException ex) {
        log.error("Failed to archive {} to {}", source.id(), target, ex);
      }
    }
    return archived;
  }

  private Path uniqueTarget(String stamp, String name) {
    Path candidate = doneDirectory.resolve(stamp + "-" + name);
    for (int i = 1; Files.exists(candidate); i++) {
      candidate = doneDirectory.resolve(stamp + "_" + i + "-" + name);
    }
    return candidate;
  }
}
