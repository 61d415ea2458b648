package ca.gc.cra.logmerge.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.LogSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DoneDirectoryArchiverTest {
  private static final ClockPort CLOCK = () -> Instant.parse("2024-05-06T07:08:09Z").toEpochMilli();

  @TempDir Path tempDir;

  @Test
  void movesFilesWithTimestampPrefix() throws IOException {
    Path log = Files.writeString(tempDir.resolve("field day.adi"), "x");
    Path done = tempDir.resolve("done");
    DoneDirectoryArchiver archiver = new DoneDirectoryArchiver(done, CLOCK, ZoneOffset.UTC);

    List<String> archived = archiver.archive(List.of(new FileLogSource("field day.adi", log, true)));

    assertEquals(List.of("field day.adi"), archived);
    assertFalse(Files.exists(log));
    assertTrue(Files.exists(done.resolve("20240506_070809-field day.adi")));
  }

  @Test
  void collidingNamesGetCounter() throws IOException {
    Path done = Files.createDirectories(tempDir.resolve("done"));
    Files.writeString(done.resolve("20240506_070809-a.adi"), "earlier");
    Path log = Files.writeString(tempDir.resolve("a.adi"), "x");
    DoneDirectoryArchiver archiver = new DoneDirectoryArchiver(done, CLOCK, ZoneOffset.UTC);

    archiver.archive(List.of(new FileLogSource("a.adi", log, true)));

    assertTrue(Files.exists(done.resolve("20240506_070809_1-a.adi")));
    assertEquals("earlier", Files.readString(done.resolve("20240506_070809-a.adi")));
  }

  @Test
  void missingFileIsSkippedAndOthersContinue() throws IOException {
    Path present = Files.writeString(tempDir.resolve("b.adi"), "x");
    DoneDirectoryArchiver archiver = new DoneDirectoryArchiver(tempDir.resolve("done"), CLOCK, ZoneOffset.UTC);

    List<String> archived = archiver.archive(List.of(
        new FileLogSource("a.adi", tempDir.resolve("a.adi"), true),
        new FileLogSource("b.adi", present, true)));

    assertEquals(List.of("b.adi"), archived);
  }

  @Test
  void sourcesWithoutLocationAreIgnored() {
    LogSource memory = new LogSource() {
      @Override
      public String id() {
        return "memory";
      }

      @Override
      public InputStream open() {
        return new ByteArrayInputStream(new byte[0]);
      }

      @Override
      public boolean archivable() {
        return true;
      }
    };
    DoneDirectoryArchiver archiver = new DoneDirectoryArchiver(tempDir.resolve("done"), CLOCK, ZoneOffset.UTC);

    assertTrue(archiver.archive(List.of(memory)).isEmpty());
    assertTrue(archiver.archive(List.of()).isEmpty());
  }
}
