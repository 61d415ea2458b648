package ca.gc.cra.logmerge.infrastructure.adif;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.util.FallbackDecoder;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordEncoderTest {
  private static final Charset GBK = Charset.forName("GBK");

  private static AdifRecord contact(String qth) {
    return AdifRecord.builder("source.adi")
        .put("CALL", "BY1PK")
        .put("BAND", "20M")
        .put("QTH", qth)
        .build();
  }

  @Test
  void declaredLengthIsEncodedByteLength() {
    byte[] utf8 = new RecordEncoder(StandardCharsets.UTF_8).encode(List.of(contact("北京")));
    byte[] gbk = new RecordEncoder(GBK).encode(List.of(contact("北京")));

    assertTrue(new String(utf8, StandardCharsets.UTF_8).contains("<QTH:6>北京 "));
    assertTrue(new String(gbk, GBK).contains("<QTH:4>北京 "));
  }

  @Test
  void writesTagsInOrderAndTerminatesRecord() {
    byte[] bytes = new RecordEncoder(StandardCharsets.UTF_8).encode(List.of(contact("Paris")));

    assertArrayEquals(
        "<CALL:5>BY1PK <BAND:3>20M <QTH:5>Paris <EOR>\r\n".getBytes(StandardCharsets.US_ASCII), bytes);
  }

  @Test
  void sourceIsNeverWritten() {
    String text = new String(new RecordEncoder(StandardCharsets.UTF_8).encode(List.of(contact("x"))),
        StandardCharsets.UTF_8);

    assertFalse(text.contains("source.adi"));
  }

  @Test
  void multiByteValuesSurviveReparse() throws IOException {
    for (Charset charset : List.of(StandardCharsets.UTF_8, GBK)) {
      RecordEncoder encoder = new RecordEncoder(charset);
      AdifRecord original = contact("北京 · Zoë's shack");
      if (charset.equals(GBK)) {
        original = contact("北京市海淀区");
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      encoder.writeHeader(out, "logmerge", Instant.parse("2024-01-02T03:04:05Z"));
      encoder.write(out, original);

      try (RecordStream stream = new RecordStream("copy.adi", new ByteArrayInputStream(out.toByteArray()), 7,
          FallbackDecoder.utf8Then(GBK))) {
        assertEquals(original, stream.next(), charset.name());
        assertNull(stream.next());
      }
    }
  }

  @Test
  void headerCarriesVersionProgramAndTimestamp() {
    String header = new String(new RecordEncoder(StandardCharsets.UTF_8)
        .encodeHeader("logmerge", Instant.parse("2024-01-02T03:04:05Z")), StandardCharsets.UTF_8);

    assertTrue(header.startsWith("Merged contact log exported by logmerge\r\n"));
    assertTrue(header.contains("<ADIF_VER:5>3.1.4 "));
    assertTrue(header.contains("<PROGRAMID:8>logmerge "));
    assertTrue(header.contains("<CREATED_TIMESTAMP:15>20240102 030405 "));
    assertTrue(header.endsWith("<EOH>\r\n"));
  }

  @Test
  void unencodableValueIsRejected() {
    RecordEncoder ascii = new RecordEncoder(StandardCharsets.US_ASCII);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ascii.encode(List.of(contact("北京"))));
    assertEquals("Value of QTH cannot be encoded as US-ASCII", ex.getMessage());
  }

  @Test
  void headerRequiresProgramId() {
    RecordEncoder encoder = new RecordEncoder(StandardCharsets.UTF_8);

    assertThrows(NullPointerException.class,
        () -> encoder.encodeHeader(null, Instant.parse("2024-01-02T03:04:05Z")));
  }
}
