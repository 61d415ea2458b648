package ca.gc.cra.logmerge.infrastructure.output;

import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.MergedLogWriter;
import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.infrastructure.adif.RecordEncoder;
import ca.gc.cra.logmerge.util.PathUtils;
import ca.gc.cra.logmerge.validation.Strings;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes each group to {@code {outputDirectory}/{groupKey}.adi}.
 * <p><strong>Role:</strong> File adapter for {@link MergedLogWriter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Remove stale {@code .adi} files of a previous run in {@link #prepare()}.</li>
 *   <li>Map group keys to portable file names, disambiguating clashes with a counter.</li>
 *   <li>Write through a temporary file so a failed group never leaves a truncated log behind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AdifFileWriterAdapter implements MergedLogWriter {
  private static final Logger log = LoggerFactory.getLogger(AdifFileWriterAdapter.class);

  /** Extension of merged files. */
  public static final String EXTENSION = ".adi";
  /** Value written to the {@code PROGRAMID} header field. */
  public static final String PROGRAM_ID = "logmerge";

  private final Path outputDirectory;
  private final RecordEncoder encoder;
  private final ClockPort clock;
  private final Set<String> usedNames = new HashSet<>();

  /**
   * Creates a writer.
   *
   * @param outputDirectory destination directory
   * @param charset output charset; declared lengths count bytes in this charset
   * @param clock source of the header creation time
   */
  public AdifFileWriterAdapter(Path outputDirectory, Charset charset, ClockPort clock) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.encoder = new RecordEncoder(Objects.requireNonNull(charset, "charset"));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void prepare() throws IOException {
    Files.createDirectories(outputDirectory);
    int removed = 0;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(outputDirectory)) {
      for (Path entry : entries) {
        if (Files.isRegularFile(entry) && PathUtils.hasExtension(entry, EXTENSION)) {
          Files.delete(entry);
          removed++;
        }
      }
    }
    usedNames.clear();
    if (removed > 0) {
      log.info("Removed {} merged logs of a previous run from {}", removed, outputDirectory);
    }
  }

  @Override
  public String write(String groupKey, List<AdifRecord> records) throws IOException {
    Objects.requireNonNull(groupKey, "groupKey");
    Objects.requireNonNull(records, "records");
    Path target = outputDirectory.resolve(fileNameFor(groupKey));
    Path temp = outputDirectory.resolve(PathUtils.fileName(target).orElse(groupKey) + ".tmp");
    Instant created = Instant.ofEpochMilli(clock.nowMillis());
    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
      encoder.writeHeader(out, PROGRAM_ID, created);
      for (AdifRecord record : records) {
        encoder.write(out, record);
      }
    } catch (IllegalArgumentException ex) {
      Files.deleteIfExists(temp);
      throw new IOException("Group " + groupKey + " cannot be written as " + encoder.charset().name(), ex);
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    log.debug("Wrote {} records of {} to {}", records.size(), groupKey, target);
    return target.toString();
  }

  private String fileNameFor(String groupKey) {
    String stem = Strings.toFileName(groupKey);
    String name = stem + EXTENSION;
    for (int i = 2; !usedNames.add(name.toLowerCase(Locale.ROOT)); i++) {
      name = stem + "_" + i + EXTENSION;
    }
    return name;
  }
}
