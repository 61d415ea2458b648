package ca.gc.cra.logmerge.infrastructure.output;

import ca.gc.cra.logmerge.application.pipeline.MergeResult;
import ca.gc.cra.logmerge.application.port.ClockPort;
import ca.gc.cra.logmerge.application.port.RunSummaryPort;
import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the totals of a run to {@code summary.json} with the Jackson streaming generator.
 *
 * <pre>{@code
 * {
 *   "schemaVersion" : 1,
 *   "generatedAt" : "2024-01-01T12:00:00Z",
 *   "sources" : { "read" : 3, "failed" : 0 },
 *   "records" : { "parsed" : 120, "accepted" : 110, "duplicates" : 10, "missingCallsign" : 2 },
 *   "groups" : { "W1AW-FN31" : 110 },
 *   "missingCallsign" : { "field.adi" : 2 },
 *   "outputs" : [ "/logs/output/W1AW-FN31.adi" ]
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonRunSummaryAdapter implements RunSummaryPort {
  /** Summary file name inside the output directory. */
  public static final String FILE_NAME = "summary.json";
  private static final int SCHEMA_VERSION = 1;

  private final Path outputDirectory;
  private final ClockPort clock;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a summary adapter.
   *
   * @param outputDirectory directory receiving {@value #FILE_NAME}
   * @param clock source of {@code generatedAt}
   */
  public JsonRunSummaryAdapter(Path outputDirectory, ClockPort clock) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void write(MergeResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    Files.createDirectories(outputDirectory);
    try (JsonGenerator gen = jsonFactory.createGenerator(
        outputDirectory.resolve(FILE_NAME).toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("generatedAt", Instant.ofEpochMilli(clock.nowMillis()).toString());

      gen.writeObjectFieldStart("sources");
      gen.writeNumberField("read", result.sourcesRead());
      gen.writeNumberField("failed", result.sourcesFailed());
      gen.writeEndObject();

      gen.writeObjectFieldStart("records");
      gen.writeNumberField("parsed", result.recordsParsed());
      gen.writeNumberField("accepted", result.recordsAccepted());
      gen.writeNumberField("duplicates", result.duplicateCount());
      gen.writeNumberField("missingCallsign", result.missingCallsignTotal());
      gen.writeEndObject();

      gen.writeObjectFieldStart("groups");
      for (Map.Entry<String, List<AdifRecord>> group : result.groups().entrySet()) {
        gen.writeNumberField(group.getKey(), group.getValue().size());
      }
      gen.writeEndObject();

      gen.writeObjectFieldStart("missingCallsign");
      for (Map.Entry<String, Long> entry : result.missingCallsigns().entrySet()) {
        gen.writeNumberField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();

      gen.writeArrayFieldStart("outputs");
      for (String output : result.outputs()) {
        gen.writeString(output);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }
}
