package ca.gc.cra.logmerge.infrastructure.output;

import static ca.gc.cra.logmerge.testutil.Qsos.qso;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.logmerge.application.pipeline.MergeResult;
import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.dedup.DuplicateEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonRunSummaryAdapterTest {
  private static final ClockPort CLOCK = () -> Instant.parse("2024-02-03T04:05:06Z").toEpochMilli();

  @TempDir Path tempDir;

  @Test
  void writesCountsGroupsAndOutputs() throws IOException {
    AdifRecord kept = qso("a.adi", "W1AW", "FN31", "K1ABC", "20240101", "120000");
    AdifRecord dupe = qso("b.adi", "W1AW", "FN31", "K1ABC", "20240101", "120500");
    AdifRecord unknown = qso("b.adi", null, null, "K2XYZ", "20240101", "130000");
    Map<String, List<AdifRecord>> groups = new LinkedHashMap<>();
    groups.put("W1AW-FN31", List.of(kept));
    groups.put("UNKNOWN-NOGRID", List.of(unknown));
    MergeResult result = new MergeResult(groups, List.of(new DuplicateEvent("W1AW-FN31", dupe, kept)),
        Map.of("b.adi", 1L), 2, 0, 3, List.of("out/W1AW-FN31.adi", "out/UNKNOWN-NOGRID.adi"), List.of());

    new JsonRunSummaryAdapter(tempDir, CLOCK).write(result);

    Map<String, String> flat = flatten(tempDir.resolve(JsonRunSummaryAdapter.FILE_NAME));
    assertEquals("1", flat.get("schemaVersion"));
    assertEquals("2024-02-03T04:05:06Z", flat.get("generatedAt"));
    assertEquals("2", flat.get("sources.read"));
    assertEquals("0", flat.get("sources.failed"));
    assertEquals("3", flat.get("records.parsed"));
    assertEquals("2", flat.get("records.accepted"));
    assertEquals("1", flat.get("records.duplicates"));
    assertEquals("1", flat.get("records.missingCallsign"));
    assertEquals("1", flat.get("groups.W1AW-FN31"));
    assertEquals("1", flat.get("missingCallsign.b.adi"));
    assertEquals("out/W1AW-FN31.adi,out/UNKNOWN-NOGRID.adi", flat.get("outputs"));
  }

  // dotted paths for scalars; arrays joined with commas
  private static Map<String, String> flatten(Path file) throws IOException {
    Map<String, String> flat = new LinkedHashMap<>();
    List<String> path = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(file.toFile())) {
      String field = null;
      List<String> array = null;
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        switch (token) {
          case FIELD_NAME -> field = parser.currentName();
          case START_OBJECT -> {
            if (field != null) {
              path.add(field);
            }
            field = null;
          }
          case END_OBJECT -> {
            if (!path.isEmpty()) {
              path.remove(path.size() - 1);
            }
          }
          case START_ARRAY -> array = new ArrayList<>();
          case END_ARRAY -> {
            flat.put(key(path, field), String.join(",", array));
            array = null;
          }
          default -> {
            if (array != null) {
              array.add(parser.getText());
            } else {
              flat.put(key(path, field), parser.getText());
            }
          }
        }
      }
    }
    return flat;
  }

  private static String key(List<String> path, String field) {
    return path.isEmpty() ? field : String.join(".", path) + "." + field;
  }
}
