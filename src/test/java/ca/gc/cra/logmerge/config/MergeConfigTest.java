package ca.gc.cra.logmerge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MergeConfigTest {
  @TempDir Path tempDir;

  @Test
  void outputAndDoneDefaultUnderInput() {
    MergeConfig config = MergeConfig.fromMap(Map.of("in", tempDir.toString()));

    assertEquals(tempDir.toAbsolutePath().normalize(), config.inputDirectory());
    assertEquals(config.inputDirectory().resolve("output"), config.outputDirectory());
    assertEquals(config.inputDirectory().resolve("done"), config.doneDirectory());
    assertEquals(Duration.ofSeconds(900), config.tolerance());
    assertEquals(StandardCharsets.UTF_8, config.outputCharset());
    assertEquals("GBK", config.secondaryCharset().name());
    assertTrue(config.groupByLocator());
    assertTrue(config.archive());
  }

  @Test
  void parsesExplicitValues() {
    MergeConfig config = MergeConfig.fromMap(Map.of(
        "in", tempDir.toString(),
        "out", tempDir.resolve("merged").toString(),
        "toleranceSeconds", "1800",
        "outputCharset", "gbk",
        "chunkBytes", "4096",
        "groupByLocator", "no",
        "archive", "OFF"));

    assertEquals(Duration.ofMinutes(30), config.tolerance());
    assertEquals("GBK", config.outputCharset().name());
    assertEquals(4096, config.chunkBytes());
    assertFalse(config.groupByLocator());
    assertFalse(config.archive());
    assertEquals(tempDir.resolve("merged").toAbsolutePath().normalize(), config.outputDirectory());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    MergeConfig config = MergeConfig.fromMap(Map.of("in", tempDir.toString(), "out", "", "toleranceSeconds", " "));

    assertEquals(Duration.ofSeconds(900), config.tolerance());
    assertEquals(config.inputDirectory().resolve("output"), config.outputDirectory());
  }

  @Test
  void rejectsInvalidValues() {
    String in = tempDir.toString();
    assertThrows(IllegalArgumentException.class, () -> MergeConfig.fromMap(Map.of("in", in, "toleranceSeconds", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> MergeConfig.fromMap(Map.of("in", in, "toleranceSeconds", "86401")));
    assertThrows(IllegalArgumentException.class, () -> MergeConfig.fromMap(Map.of("in", in, "chunkBytes", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> MergeConfig.fromMap(Map.of("in", in, "outputCharset", "no-such-charset")));
    assertThrows(IllegalArgumentException.class, () -> MergeConfig.fromMap(Map.of("in", in, "archive", "maybe")));
  }

  @Test
  void rejectsOutputOrDoneEqualToInput() {
    String in = tempDir.toString();
    assertThrows(IllegalArgumentException.class, () -> MergeConfig.fromMap(Map.of("in", in, "out", in)));
    assertThrows(IllegalArgumentException.class, () -> MergeConfig.fromMap(Map.of("in", in, "done", in + "/.")));
  }

  @Test
  void rejectsOutputSharedWithDone() {
    String in = tempDir.resolve("in").toString();
    String shared = tempDir.resolve("shared").toString();

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> MergeConfig.fromMap(Map.of("in", in, "out", shared, "done", shared + "/.")));
    assertEquals("out must differ from done", ex.getMessage());
  }

  @Test
  void parseBooleanAcceptsCommonSpellings() {
    assertTrue(MergeConfig.parseBoolean("x", "YES", false));
    assertTrue(MergeConfig.parseBoolean("x", "on", false));
    assertFalse(MergeConfig.parseBoolean("x", "false", true));
    assertTrue(MergeConfig.parseBoolean("x", null, true));
  }
}
