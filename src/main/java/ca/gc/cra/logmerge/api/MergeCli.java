package ca.gc.cra.logmerge.api;

import ca.gc.cra.logmerge.application.pipeline.MergeResult;
import ca.gc.cra.logmerge.application.pipeline.MergeUseCase;
import ca.gc.cra.logmerge.application.port.LogSource;
import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.config.CompositionRoot;
import ca.gc.cra.logmerge.config.ConfigMerger;
import ca.gc.cra.logmerge.config.DefaultsForMode;
import ca.gc.cra.logmerge.config.MergeConfig;
import ca.gc.cra.logmerge.config.YamlConfigLoader;
import ca.gc.cra.logmerge.infrastructure.output.HtmlDuplicateReportAdapter;
import ca.gc.cra.logmerge.infrastructure.output.JsonRunSummaryAdapter;
import ca.gc.cra.logmerge.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.logmerge.logging.LoggingConfigurator;
import ca.gc.cra.logmerge.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for merging a directory of contact logs into one deduplicated log per station.
 *
 * @since 0.1.0
 */
public final class MergeCli {
  private static final Logger log = LoggerFactory.getLogger(MergeCli.class);
  private static final String MODE = "merge";
  private static final String SUMMARY_USAGE =
      "usage: merge [in=DIR] [out=DIR] [done=DIR] [toleranceSeconds=N] [outputCharset=CS] "
          + "[secondaryCharset=CS] [chunkBytes=N] [groupByLocator=true|false] [archive=true|false] "
          + "[config=FILE] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      logmerge merge

      Usage:
        merge in=./logs [options]

      Optional (validated):
        in=DIR                     Directory holding the .adi/.adif logs (default current directory)
        out=DIR                    Output directory (default IN/output)
        done=DIR                   Archive directory re-read on every run (default IN/done)
        toleranceSeconds=N         Seconds two contacts may differ and still count as one (default 900)
        outputCharset=CS           Charset of the merged logs (default UTF-8)
        secondaryCharset=CS        Charset tried when a value is not valid UTF-8 (default GBK)
        chunkBytes=N               Bytes read per refill (default 65536)
        groupByLocator=true|false  Split each station's output by MY_GRIDSQUARE (default true)
        archive=true|false         Move merged input logs into the done directory (default true)
        config=FILE                YAML file with 'common' and 'merge' sections
        --dry-run                  Validate inputs and list the logs without writing anything
        --allow-overwrite          Reuse a non-empty output directory
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        * Command-line values override the YAML file.
        * Earlier logs win: new input is read before the done directory, each in file name order.
      """;

  private MergeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the merge and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for merge CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid merge arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.verbose() && ConfigCliUtils.flagOrSetting(input, "--verbose", effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    boolean dryRun = ConfigCliUtils.flagOrSetting(input, "--dry-run", effective, "dryRun");
    boolean allowOverwrite = ConfigCliUtils.flagOrSetting(input, "--allow-overwrite", effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    String metricsExporter;
    MergeConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = MergeConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid merge arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      config = validatePaths(config, allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid merge path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      return printDryRunPlan(config, allowOverwrite);
    }

    MetricsPort metrics = CompositionRoot.metricsFor(metricsExporter);
    try {
      MergeUseCase useCase = new CompositionRoot(metrics, new SystemClockAdapter()).mergeUseCase(config);
      log.info("Configured merge: input={}, output={}, done={}, tolerance={}s, metricsExporter={}",
          config.inputDirectory(), config.outputDirectory(), config.doneDirectory(),
          config.tolerance().toSeconds(), metricsExporter);
      MergeResult result = useCase.run();
      printSummary(config, result);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Merge configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Merge I/O failure for {}", config.inputDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in merge", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeQuietly(metrics);
    }
  }

  private static MergeConfig validatePaths(MergeConfig config, boolean allowOverwrite, boolean createIfMissing) {
    Path in = Paths.requireReadableDir("in", config.inputDirectory());
    Path out = Paths.validateWritableDir(config.outputDirectory(), createIfMissing, allowOverwrite);
    // the done directory accumulates across runs and is created on first archive
    Path done = Paths.validateWritableDir(config.doneDirectory(), false, true);
    return new MergeConfig(in, out, done, config.tolerance(), config.outputCharset(), config.secondaryCharset(),
        config.chunkBytes(), config.groupByLocator(), config.archive());
  }

  private static ExitCode printDryRunPlan(MergeConfig config, boolean allowOverwrite) {
    List<LogSource> sources;
    try {
      sources = new CompositionRoot(MetricsPort.NO_OP, new SystemClockAdapter()).catalog(config).sources();
    } catch (IOException ex) {
      log.error("Unable to list logs in {}", config.inputDirectory(), ex);
      return ExitCode.IO_ERROR;
    }
    List<String> lines = new ArrayList<>();
    lines.add("Merge dry-run: no files will be written or moved.");
    lines.add(" Input directory   : " + config.inputDirectory());
    lines.add(" Output directory  : " + config.outputDirectory());
    lines.add(" Done directory    : " + config.doneDirectory());
    lines.add(" Tolerance         : " + config.tolerance().toSeconds() + "s");
    lines.add(" Output charset    : " + config.outputCharset().name());
    lines.add(" Secondary charset : " + config.secondaryCharset().name());
    lines.add(" Group by locator  : " + config.groupByLocator());
    lines.add(" Archive inputs    : " + config.archive());
    lines.add(" Allow overwrite   : " + allowOverwrite);
    lines.add(" Logs (" + sources.size() + "):");
    for (LogSource source : sources) {
      lines.add("   " + source.id() + (source.archivable() ? "" : " (archived)"));
    }
    lines.add(" Re-run without --dry-run to merge.");
    CliPrinter.printLines(lines.toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  private static void printSummary(MergeConfig config, MergeResult result) {
    List<String> lines = new ArrayList<>();
    lines.add("Merge complete.");
    lines.add(" Logs read         : " + result.sourcesRead()
        + (result.sourcesFailed() > 0 ? " (" + result.sourcesFailed() + " failed)" : ""));
    lines.add(" Records parsed    : " + result.recordsParsed());
    lines.add(" Unique contacts   : " + result.recordsAccepted());
    lines.add(" Duplicates removed: " + result.duplicateCount());
    lines.add(" Output files      : " + result.outputs().size() + " in " + config.outputDirectory());
    lines.add(" Duplicate report  : " + config.outputDirectory().resolve(HtmlDuplicateReportAdapter.FILE_NAME));
    lines.add(" Summary           : " + config.outputDirectory().resolve(JsonRunSummaryAdapter.FILE_NAME));
    if (config.archive()) {
      lines.add(" Archived logs     : " + result.archived().size() + " to " + config.doneDirectory());
    }
    result.missingCallsigns().forEach((source, count) ->
        lines.add(" Warning: " + count + " record(s) in " + source + " have no STATION_CALLSIGN"));
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void closeQuietly(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
