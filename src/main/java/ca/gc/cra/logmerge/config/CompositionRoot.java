package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.application.pipeline.MergeUseCase;
import ca.gc.cra.logmerge.application.port.ArchivePort;
import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.LogSourceCatalog;
import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.domain.util.FallbackDecoder;
import ca.gc.cra.logmerge.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.logmerge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logmerge.infrastructure.output.AdifFileWriterAdapter;
import ca.gc.cra.logmerge.infrastructure.output.HtmlDuplicateReportAdapter;
import ca.gc.cra.logmerge.infrastructure.output.JsonRunSummaryAdapter;
import ca.gc.cra.logmerge.infrastructure.source.DirectoryLogSourceCatalog;
import ca.gc.cra.logmerge.infrastructure.source.DoneDirectoryArchiver;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires file adapters, metrics and clock into a {@link MergeUseCase}.
 * <p><strong>Role:</strong> Bootstrap layer used by the CLI; tests build the use case directly with fakes.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root with explicit metrics and clock.
   *
   * @param metrics metrics sink shared by the run
   * @param clock time source
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Picks the metrics adapter for an exporter name.
   *
   * @param exporter {@code otlp} or {@code none}; blank means {@code none}
   * @return OpenTelemetry adapter for {@code otlp}, otherwise a no-op adapter
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("otlp") ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }

  /**
   * Catalog of the logs {@code config} would merge.
   *
   * @param config run settings
   * @return directory catalog
   */
  public LogSourceCatalog catalog(MergeConfig config) {
    return new DirectoryLogSourceCatalog(config.inputDirectory(), config.doneDirectory());
  }

  /**
   * Builds the merge use case for {@code config}.
   *
   * @param config run settings
   * @return wired use case
   */
  public MergeUseCase mergeUseCase(MergeConfig config) {
    Objects.requireNonNull(config, "config");
    ArchivePort archiver = config.archive()
        ? new DoneDirectoryArchiver(config.doneDirectory(), clock)
        : ArchivePort.NONE;
    return new MergeUseCase(
        config,
        catalog(config),
        MergeUseCase.recordStreamReaders(config.chunkBytes(), FallbackDecoder.utf8Then(config.secondaryCharset())),
        new AdifFileWriterAdapter(config.outputDirectory(), config.outputCharset(), clock),
        new HtmlDuplicateReportAdapter(config.outputDirectory()),
        new JsonRunSummaryAdapter(config.outputDirectory(), clock),
        archiver,
        metrics,
        clock);
  }
}
