package ca.gc.cra.logmerge.infrastructure.adif;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import ca.gc.cra.logmerge.domain.adif.AdifTags;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes {@link AdifRecord}s back to tag-length-value bytes.
 * <p><strong>Why:</strong> Readers frame values by declared length, so each length must equal the value's byte
 * count in the charset the file is written in.</p>
 * <p><strong>Role:</strong> Codec used by the merged log writer.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; holds one {@link CharsetEncoder}.</p>
 *
 * @implNote The record's provenance lives outside its field map and is never emitted.
 * @since 0.1.0
 */
public final class RecordEncoder {
  /** Version written into generated headers. */
  public static final String ADIF_VERSION = "3.1.4";

  private static final byte[] CRLF = {'\r', '\n'};
  private static final DateTimeFormatter CREATED_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd HHmmss").withZone(ZoneOffset.UTC);

  private final Charset charset;
  private final CharsetEncoder encoder;

  /**
   * Creates an encoder for the given output charset.
   *
   * @param charset charset values are written in; must not be {@code null}
   */
  public RecordEncoder(Charset charset) {
    this.charset = Objects.requireNonNull(charset, "charset");
    this.encoder = charset.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }

  /**
   * Charset used for values.
   *
   * @return output charset
   */
  public Charset charset() {
    return charset;
  }

  /**
   * Writes a header block: a free-text banner line, then {@code ADIF_VER}, {@code PROGRAMID} and
   * {@code CREATED_TIMESTAMP}, terminated by {@code <EOH>} and CRLF.
   *
   * @param out destination
   * @param programId program name written to {@code PROGRAMID}
   * @param created creation instant, written in UTC
   * @throws IOException if the stream fails
   */
  public void writeHeader(OutputStream out, String programId, Instant created) throws IOException {
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(programId, "programId");
    Objects.requireNonNull(created, "created");
    out.write(("Merged contact log exported by " + programId).getBytes(charset));
    out.write(CRLF);
    writeField(out, "ADIF_VER", ADIF_VERSION);
    writeField(out, "PROGRAMID", programId);
    writeField(out, "CREATED_TIMESTAMP", CREATED_FORMAT.format(created));
    out.write(AdifTags.END_OF_HEADER.getBytes(StandardCharsets.US_ASCII));
    out.write(CRLF);
  }

  /**
   * Writes one record: every field as {@code <TAG:byteLength>value } then {@code <EOR>} and CRLF.
   *
   * @param out destination
   * @param record record to serialize
   * @throws IOException if the stream fails
   * @throws IllegalArgumentException if a value cannot be represented in {@link #charset()}
   */
  public void write(OutputStream out, AdifRecord record) throws IOException {
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(record, "record");
    for (Map.Entry<String, String> field : record.fields().entrySet()) {
      writeField(out, field.getKey(), field.getValue());
    }
    out.write(AdifTags.END_OF_RECORD.getBytes(StandardCharsets.US_ASCII));
    out.write(CRLF);
  }

  /**
   * Encodes records into a byte array.
   *
   * @param records records in output order
   * @return encoded bytes, without header
   * @throws IllegalArgumentException if a value cannot be represented in {@link #charset()}
   */
  public byte[] encode(Iterable<AdifRecord> records) {
    Objects.requireNonNull(records, "records");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      for (AdifRecord record : records) {
        write(out, record);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toByteArray();
  }

  /**
   * Encodes a header block into a byte array.
   *
   * @param programId program name
   * @param created creation instant
   * @return header bytes
   */
  public byte[] encodeHeader(String programId, Instant created) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      writeHeader(out, programId, created);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toByteArray();
  }

  private void writeField(OutputStream out, String tag, String value) throws IOException {
    byte[] bytes = encodeValue(tag, value == null ? "" : value);
    out.write(('<' + tag + ':' + bytes.length + '>').getBytes(StandardCharsets.US_ASCII));
    out.write(bytes);
    out.write(' ');
  }

  private byte[] encodeValue(String tag, String value) {
    try {
      ByteBuffer encoded = encoder.reset().encode(CharBuffer.wrap(value));
      byte[] bytes = new byte[encoded.remaining()];
      encoded.get(bytes);
      return bytes;
    } catch (CharacterCodingException ex) {
      throw new IllegalArgumentException(
          "Value of " + tag + " cannot be encoded as " + charset.name(), ex);
    }
  }
}
