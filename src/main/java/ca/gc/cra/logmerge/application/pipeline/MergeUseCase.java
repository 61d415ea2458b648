package ca.gc.cra.logmerge.application.pipeline;

import ca.gc.cra.logmerge.application.port.ArchivePort;
import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.DuplicateReportPort;
import ca.gc.cra.logmerge.application.port.LogSource;
import ca.gc.cra.logmerge.application.port.LogSourceCatalog;
import ca.gc.cra.logmerge.application.port.MergedLogWriter;
import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.RunSummaryPort;
import ca.gc.cra.logmerge.config.MergeConfig;
import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.AdifTags;
import ca.gc.cra.logmerge.domain.adif.GroupKey;
import ca.gc.cra.logmerge.domain.dedup.DuplicateEvent;
import ca.gc.cra.logmerge.domain.dedup.DuplicateIndex;
import ca.gc.cra.logmerge.domain.dedup.Outcome;
import ca.gc.cra.logmerge.domain.util.FallbackDecoder;
import ca.gc.cra.logmerge.infrastructure.adif.RecordStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Merges every log from a catalog into per-group outputs, dropping near-duplicate contacts.
 * <p><strong>Why:</strong> Operators re-import overlapping exports from several stations and programs; the merged
 * result must keep each contact once and show what was removed.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the parser, the duplicate index and output
 * ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read sources strictly in catalog order; earlier records win.</li>
 *   <li>Derive group keys, tally records lacking a station callsign, classify with {@link DuplicateIndex}.</li>
 *   <li>Write groups, publish the duplicate report and summary, then archive new inputs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run per instance at a time.</p>
 * <p><strong>Performance:</strong> One reader open at a time; accepted records stay in memory until output.</p>
 * <p><strong>Observability:</strong> Emits {@code merge.*} counters, {@code merge.run.durationMillis}, and logs
 * with the current source id in MDC key {@value #MDC_SOURCE}.</p>
 *
 * @implNote A source that fails to open or ends on an I/O failure is counted and skipped; its records read before
 * the failure are kept. Failed sources are never archived.
 * @since 0.1.0
 */
public final class MergeUseCase {
  private static final Logger log = LoggerFactory.getLogger(MergeUseCase.class);

  /** MDC key holding the id of the source being read. */
  public static final String MDC_SOURCE = "merge.source";

  private final MergeConfig config;
  private final LogSourceCatalog catalog;
  private final RecordReaderFactory readers;
  private final MergedLogWriter writer;
  private final DuplicateReportPort report;
  private final RunSummaryPort summary;
  private final ArchivePort archiver;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a merge use case with explicit dependencies.
   *
   * @param config run settings
   * @param catalog ordered sources
   * @param readers opens a record reader per source
   * @param writer receives accepted records per group
   * @param report receives duplicate events
   * @param summary receives the finished result
   * @param archiver moves new inputs aside after success
   * @param metrics counter sink
   * @param clock time source for report timestamps and durations
   */
  public MergeUseCase(
      MergeConfig config,
      LogSourceCatalog catalog,
      RecordReaderFactory readers,
      MergedLogWriter writer,
      DuplicateReportPort report,
      RunSummaryPort summary,
      ArchivePort archiver,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.readers = Objects.requireNonNull(readers, "readers");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.report = Objects.requireNonNull(report, "report");
    this.summary = Objects.requireNonNull(summary, "summary");
    this.archiver = Objects.requireNonNull(archiver, "archiver");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs one merge.
   *
   * @return finished result
   * @throws IOException if discovery or any output port fails
   */
  public MergeResult run() throws IOException {
    long started = clock.nowMillis();
    List<LogSource> sources = catalog.sources();
    log.info("Merging {} sources with a {}s duplicate window", sources.size(), config.tolerance().getSeconds());

    RunState state = new RunState(new DuplicateIndex(config.tolerance()));
    for (LogSource source : sources) {
      MDC.put(MDC_SOURCE, source.id());
      try {
        consume(source, state);
      } finally {
        MDC.remove(MDC_SOURCE);
      }
    }

    Map<String, List<AdifRecord>> groups = state.index.groups();
    List<String> outputs = new ArrayList<>();
    writer.prepare();
    for (Map.Entry<String, List<AdifRecord>> group : new TreeMap<>(groups).entrySet()) {
      outputs.add(writer.write(group.getKey(), group.getValue()));
    }
    report.publish(state.duplicates, clock.now());

    MergeResult result = new MergeResult(
        groups,
        state.duplicates,
        state.missingCallsigns,
        state.sourcesRead,
        state.failedSources.size(),
        state.recordsParsed,
        outputs,
        List.of());
    summary.write(result);

    if (config.archive()) {
      List<LogSource> archivable = new ArrayList<>();
      for (LogSource source : sources) {
        if (source.archivable() && !state.failedSources.contains(source.id())) {
          archivable.add(source);
        }
      }
      result = result.withArchived(archiver.archive(archivable));
    }

    long elapsed = clock.nowMillis() - started;
    metrics.observe("merge.run.durationMillis", elapsed);
    log.info("Merge finished in {} ms: {} parsed, {} kept in {} groups, {} duplicates, {} failed sources",
        elapsed, result.recordsParsed(), result.recordsAccepted(), groups.size(), result.duplicateCount(),
        result.sourcesFailed());
    return result;
  }

  private void consume(LogSource source, RunState state) {
    long handled = 0;
    long duplicates = 0;
    boolean failed;
    try (RecordReader reader = readers.open(source)) {
      state.sourcesRead++;
      metrics.increment("merge.sources.read");
      AdifRecord record;
      while ((record = reader.next()) != null) {
        handled++;
        if (handle(source, record, state)) {
          duplicates++;
        }
      }
      failed = reader.failed();
    } catch (IOException ex) {
      log.error("Failed to open {}; skipping it", source.id(), ex);
      failed = true;
    }
    if (failed) {
      state.failedSources.add(source.id());
      metrics.increment("merge.sources.failed");
    }
    log.info("{}: {} records handled, {} duplicates{}", source.id(), handled, duplicates,
        failed ? " (incomplete)" : "");
  }

  private boolean handle(LogSource source, AdifRecord record, RunState state) {
    state.recordsParsed++;
    metrics.increment("merge.records.parsed");
    if (!GroupKey.hasCallsign(record)) {
      state.missingCallsigns.merge(source.id(), 1L, Long::sum);
      metrics.increment("merge.records.missingCallsign");
    }
    String groupKey = GroupKey.of(record, config.groupByLocator());
    Outcome outcome = state.index.process(record, groupKey);
    if (outcome instanceof Outcome.Duplicate duplicate) {
      state.duplicates.add(new DuplicateEvent(groupKey, record, duplicate.existing()));
      metrics.increment("merge.records.duplicate");
      if (log.isDebugEnabled()) {
        log.debug("Duplicate {} {} {} in {} matches record from {}",
            record.getOrEmpty(AdifTags.CALL), record.getOrEmpty(AdifTags.QSO_DATE),
            record.getOrEmpty(AdifTags.TIME_ON), groupKey, duplicate.existing().source());
      }
      return true;
    }
    metrics.increment("merge.records.accepted");
    return false;
  }

  private static final class RunState {
    private final DuplicateIndex index;
    private final List<DuplicateEvent> duplicates = new ArrayList<>();
    private final Map<String, Long> missingCallsigns = new LinkedHashMap<>();
    private final Set<String> failedSources = new HashSet<>();
    private int sourcesRead;
    private long recordsParsed;

    private RunState(DuplicateIndex index) {
      this.index = index;
    }
  }

  /**
   * Forward-only record reader over one source.
   */
  public interface RecordReader extends AutoCloseable {
    /**
     * Returns the next record.
     *
     * @return next record or {@code null} once the source is depleted
     */
    AdifRecord next();

    /**
     * Indicates whether the reader stopped early because the source failed.
     *
     * @return {@code true} after an I/O failure
     */
    boolean failed();

    @Override
    void close();
  }

  /**
   * Factory for {@link RecordReader} instances.
   */
  @FunctionalInterface
  public interface RecordReaderFactory {
    /**
     * Opens a reader for {@code source}.
     *
     * @param source source to read
     * @return reader owning the opened stream
     * @throws IOException if the source cannot be opened
     */
    RecordReader open(LogSource source) throws IOException;
  }

  /**
   * Returns a factory backed by {@link RecordStream}.
   *
   * @param chunkBytes bytes requested per refill
   * @param decoder value decoder
   * @return reader factory
   */
  public static RecordReaderFactory recordStreamReaders(int chunkBytes, FallbackDecoder decoder) {
    Objects.requireNonNull(decoder, "decoder");
    return source -> new RecordStreamReader(new RecordStream(source.id(), source.open(), chunkBytes, decoder));
  }

  private static final class RecordStreamReader implements RecordReader {
    private final RecordStream stream;

    private RecordStreamReader(RecordStream stream) {
      this.stream = stream;
    }

    @Override
    public AdifRecord next() {
      return stream.next();
    }

    @Override
    public boolean failed() {
      return stream.failed();
    }

    @Override
    public void close() {
      stream.close();
    }
  }
}
