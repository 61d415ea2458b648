package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.domain.dedup.DuplicateIndex;
import ca.gc.cra.logmerge.infrastructure.adif.RecordStream;
import ca.gc.cra.logmerge.validation.Numbers;
import ca.gc.cra.logmerge.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings of one merge run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML values and defaults into one validated value so the
 * composition root never sees raw strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot} and the merge use case.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory holding new logs; its {@code done} history is read too
 * @param outputDirectory directory receiving one file per group plus the reports
 * @param doneDirectory directory holding previously processed logs
 * @param tolerance duplicate tolerance window
 * @param outputCharset charset merged files are written in
 * @param secondaryCharset strict fallback charset tried after UTF-8 when decoding values
 * @param chunkBytes bytes read per parser refill
 * @param groupByLocator whether group keys include the operator locator
 * @param archive whether new logs are moved into {@code doneDirectory} after a successful run
 * @since 0.1.0
 * @see ca.gc.cra.logmerge.application.pipeline.MergeUseCase
 */
public record MergeConfig(
    Path inputDirectory,
    Path outputDirectory,
    Path doneDirectory,
    Duration tolerance,
    Charset outputCharset,
    Charset secondaryCharset,
    int chunkBytes,
    boolean groupByLocator,
    boolean archive) {

  /** Largest accepted tolerance, one day. */
  public static final long MAX_TOLERANCE_SECONDS = 86_400;
  /** Largest accepted refill size. */
  public static final int MAX_CHUNK_BYTES = 16 * 1024 * 1024;

  /**
   * Normalizes paths and enforces ranges.
   *
   * @throws IllegalArgumentException if a value is missing or out of range
   */
  public MergeConfig {
    inputDirectory = normalizePath("inputDirectory", inputDirectory);
    outputDirectory = normalizePath("outputDirectory", outputDirectory);
    doneDirectory = normalizePath("doneDirectory", doneDirectory);
    Objects.requireNonNull(tolerance, "tolerance");
    Numbers.requireRange("toleranceSeconds", tolerance.getSeconds(), 0, MAX_TOLERANCE_SECONDS);
    outputCharset = Objects.requireNonNull(outputCharset, "outputCharset");
    secondaryCharset = Objects.requireNonNull(secondaryCharset, "secondaryCharset");
    Numbers.requireRange("chunkBytes", chunkBytes, 1, MAX_CHUNK_BYTES);
    if (outputDirectory.equals(inputDirectory)) {
      throw new IllegalArgumentException("out must differ from in");
    }
    if (doneDirectory.equals(inputDirectory)) {
      throw new IllegalArgumentException("done must differ from in");
    }
    // output preparation clears *.adi files, which would erase the archive
    if (outputDirectory.equals(doneDirectory)) {
      throw new IllegalArgumentException("out must differ from done");
    }
  }

  /**
   * Baseline configuration rooted at the working directory.
   *
   * @return default configuration
   */
  public static MergeConfig defaults() {
    Path in = Path.of("").toAbsolutePath();
    return new MergeConfig(
        in,
        in.resolve("output"),
        in.resolve("done"),
        DuplicateIndex.DEFAULT_TOLERANCE,
        StandardCharsets.UTF_8,
        Charset.forName("GBK"),
        RecordStream.DEFAULT_CHUNK_BYTES,
        true,
        true);
  }

  /**
   * Creates a configuration from flattened key/value settings.
   *
   * <p>Recognized keys: {@code in}, {@code out}, {@code done}, {@code toleranceSeconds}, {@code outputCharset},
   * {@code secondaryCharset}, {@code chunkBytes}, {@code groupByLocator}, {@code archive}. Blank {@code out} and
   * {@code done} resolve to {@code {in}/output} and {@code {in}/done}.
   *
   * @param options merged settings
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid
   */
  public static MergeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    MergeConfig defaults = defaults();

    String inRaw = options.get("in");
    Path in = isBlank(inRaw) ? defaults.inputDirectory() : parsePath("in", inRaw);
    String outRaw = options.get("out");
    Path out = isBlank(outRaw) ? in.resolve("output") : parsePath("out", outRaw);
    String doneRaw = options.get("done");
    Path done = isBlank(doneRaw) ? in.resolve("done") : parsePath("done", doneRaw);

    Duration tolerance = isBlank(options.get("toleranceSeconds"))
        ? defaults.tolerance()
        : Duration.ofSeconds(Numbers.parseInRange(
            "toleranceSeconds", options.get("toleranceSeconds"), 0, MAX_TOLERANCE_SECONDS));
    Charset outputCharset = isBlank(options.get("outputCharset"))
        ? defaults.outputCharset()
        : Strings.requireCharset("outputCharset", options.get("outputCharset"));
    Charset secondaryCharset = isBlank(options.get("secondaryCharset"))
        ? defaults.secondaryCharset()
        : Strings.requireCharset("secondaryCharset", options.get("secondaryCharset"));
    int chunkBytes = isBlank(options.get("chunkBytes"))
        ? defaults.chunkBytes()
        : (int) Numbers.parseInRange("chunkBytes", options.get("chunkBytes"), 1, MAX_CHUNK_BYTES);

    return new MergeConfig(
        in,
        out,
        done,
        tolerance,
        outputCharset,
        secondaryCharset,
        chunkBytes,
        parseBoolean("groupByLocator", options.get("groupByLocator"), defaults.groupByLocator()),
        parseBoolean("archive", options.get("archive"), defaults.archive()));
  }

  static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (isBlank(value)) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + value.trim() + ")");
    };
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
