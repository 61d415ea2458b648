package ca.gc.cra.logmerge.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class GrowableBufferTest {

  private static byte[] ascii(String text) {
    return text.getBytes(StandardCharsets.US_ASCII);
  }

  private static void fill(GrowableBuffer buffer, byte[] data) throws IOException {
    assertEquals(data.length, buffer.readFrom(new ByteArrayInputStream(data), data.length));
  }

  private static byte[] readable(GrowableBuffer buffer) {
    int from = buffer.readerIndex();
    return Arrays.copyOfRange(buffer.array(), from, from + buffer.readableBytes());
  }

  @Test
  void growsPastInitialCapacity() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(4);
    byte[] payload = new byte[5000];
    payload[4999] = 7;

    fill(buffer, payload);

    assertEquals(5000, buffer.readableBytes());
    assertEquals(7, buffer.array()[buffer.readerIndex() + 4999]);
  }

  @Test
  void findsNeedleIgnoringCaseRelativeToReader() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(16);
    fill(buffer, ascii("xx<CALL:1>a<eor>tail"));
    buffer.discard(2);

    assertEquals(9, buffer.indexOfIgnoreCase(ascii("<EOR>"), 0));
    assertEquals(9, buffer.indexOfIgnoreCase(ascii("<EOR>"), 9));
    assertEquals(-1, buffer.indexOfIgnoreCase(ascii("<EOR>"), 10));
  }

  @Test
  void readFromAppendsAndSignalsEof() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(8);
    ByteArrayInputStream in = new ByteArrayInputStream(ascii("hello"));

    assertEquals(3, buffer.readFrom(in, 3));
    assertEquals(2, buffer.readFrom(in, 3));
    assertEquals(-1, buffer.readFrom(in, 3));
    assertArrayEquals(ascii("hello"), readable(buffer));
  }

  @Test
  void compactsBeforeGrowing() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(16);
    fill(buffer, new byte[12]);
    buffer.discard(10);
    int capacity = buffer.array().length;

    fill(buffer, new byte[12]);

    assertEquals(capacity, buffer.array().length);
    assertEquals(14, buffer.readableBytes());
  }

  @Test
  void fullDiscardAndClearResetIndices() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(8);
    fill(buffer, ascii("abc"));
    buffer.discard(3);
    assertEquals(0, buffer.readerIndex());

    fill(buffer, ascii("def"));
    buffer.clear();
    assertEquals(0, buffer.readableBytes());
  }

  @Test
  void rejectsInvalidArguments() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer(8);
    fill(buffer, ascii("ab"));

    assertThrows(IllegalArgumentException.class, () -> buffer.discard(3));
    assertThrows(IllegalArgumentException.class, () -> buffer.readFrom(new ByteArrayInputStream(new byte[1]), 0));
    assertThrows(IllegalArgumentException.class, () -> new GrowableBuffer(0));
  }
}
