package ca.gc.cra.logmerge.api;

import static ca.gc.cra.logmerge.testutil.Qsos.header;
import static ca.gc.cra.logmerge.testutil.Qsos.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MergeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(MergeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  private Path inputWithTwoLogs() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("logs"));
    Files.writeString(in.resolve("a.adi"), header()
        + line("W1AW", "FN31", "K1ABC", "20240101", "120000")
        + line("W1AW", "FN31", "K2XYZ", "20240101", "123000"), StandardCharsets.UTF_8);
    Files.writeString(in.resolve("b.adi"), header()
        + line("W1AW", "FN31", "K1ABC", "20240101", "121000")
        + line(null, null, "K3LMN", "20240102", "080000"), StandardCharsets.UTF_8);
    return in;
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, MergeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("toleranceSeconds=N"));
  }

  @Test
  void missingInputDirectoryReturnsInvalidArgs() {
    ExitCode code = MergeCli.run(new String[] {"in=" + tempDir.resolve("missing")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: merge"));
    assertTrue(loggedError("not a directory"));
  }

  @Test
  void invalidToleranceReturnsInvalidArgs() {
    ExitCode code = MergeCli.run(new String[] {"in=" + tempDir, "toleranceSeconds=soon"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("toleranceSeconds"));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = MergeCli.run(new String[] {"config=" + tempDir.resolve("nope.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Configuration file does not exist"));
  }

  @Test
  void dryRunListsLogsAndWritesNothing() throws IOException {
    Path in = inputWithTwoLogs();

    ExitCode code = MergeCli.run(new String[] {"in=" + in, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Merge dry-run"));
    assertTrue(out.contains("a.adi"));
    assertTrue(out.contains("b.adi"));
    assertFalse(Files.exists(in.resolve("output")));
    assertFalse(Files.exists(in.resolve("done")));
    assertTrue(Files.exists(in.resolve("a.adi")));
  }

  @Test
  void fullRunWritesOutputsAndArchivesInputs() throws IOException {
    Path in = inputWithTwoLogs();

    ExitCode code = MergeCli.run(new String[] {"in=" + in});

    assertEquals(ExitCode.SUCCESS, code);
    Path out = in.resolve("output");
    assertTrue(Files.exists(out.resolve("W1AW-FN31.adi")));
    assertTrue(Files.exists(out.resolve("UNKNOWN-NOGRID.adi")));
    assertTrue(Files.exists(out.resolve("dupe_report.html")));
    assertTrue(Files.exists(out.resolve("summary.json")));
    assertFalse(Files.exists(in.resolve("a.adi")));
    try (Stream<Path> done = Files.list(in.resolve("done"))) {
      assertEquals(2, done.count());
    }
    String summary = buffer.toString();
    assertTrue(summary.contains("Records parsed    : 4"));
    assertTrue(summary.contains("Unique contacts   : 3"));
    assertTrue(summary.contains("Duplicates removed: 1"));
    assertTrue(summary.contains("1 record(s) in b.adi have no STATION_CALLSIGN"));
  }

  @Test
  void secondRunDeduplicatesAgainstArchiveAndNeedsOverwrite() throws IOException {
    Path in = inputWithTwoLogs();
    assertEquals(ExitCode.SUCCESS, MergeCli.run(new String[] {"in=" + in}));
    Files.writeString(in.resolve("c.adi"), line("W1AW", "FN31", "K1ABC", "20240101", "120500"));

    assertEquals(ExitCode.INVALID_ARGS, MergeCli.run(new String[] {"in=" + in}));
    assertTrue(loggedError("--allow-overwrite"));

    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, MergeCli.run(new String[] {"in=" + in, "--allow-overwrite"}));
    assertTrue(buffer.toString().contains("Duplicates removed: 2"));
    assertTrue(buffer.toString().contains("Unique contacts   : 3"));
  }

  @Test
  void yamlSuppliesSettingsAndCliOverrides() throws IOException {
    Path in = inputWithTwoLogs();
    Path out = tempDir.resolve("merged");
    Path yaml = Files.writeString(tempDir.resolve("logmerge.yaml"), String.join("\n",
        "merge:",
        "  in: " + in,
        "  out: " + out,
        "  archive: false",
        "  toleranceSeconds: 60",
        ""));

    ExitCode code = MergeCli.run(new String[] {"config=" + yaml, "toleranceSeconds=900"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(out.resolve("W1AW-FN31.adi")));
    assertTrue(Files.exists(in.resolve("a.adi")));
    assertTrue(buffer.toString().contains("Duplicates removed: 1"));
    List<String> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .map(ILoggingEvent::getFormattedMessage)
        .toList();
    assertTrue(warnings.contains("CLI overrides YAML for key: toleranceSeconds"));
  }
}
