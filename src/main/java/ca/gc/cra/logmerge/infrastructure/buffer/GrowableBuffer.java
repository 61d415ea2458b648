package ca.gc.cra.logmerge.infrastructure.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Expandable byte buffer backed by a single array with manual read/write indices.
 * <p>Refills straight from an {@link InputStream} with exponential growth, compacts consumed bytes
 * before growing, and searches the readable region for ASCII markers case-insensitively.
 */
public final class GrowableBuffer {
  private static final int MAX_CAPACITY = 64 * 1024 * 1024; // 64 MiB safety guard

  private byte[] data;
  private int readIndex;
  private int writeIndex;

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
    readIndex = 0;
    writeIndex = 0;
  }

  /**
   * Reads at most {@code maxBytes} from {@code in} straight into the buffer.
   *
   * @param in source stream; must not be {@code null}
   * @param maxBytes upper bound for this read; must be positive
   * @return bytes appended, or {@code -1} at end of stream
   * @throws IOException if the stream fails
   */
  public int readFrom(InputStream in, int maxBytes) throws IOException {
    Objects.requireNonNull(in, "in");
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    ensureWritable(maxBytes);
    int read = in.read(data, writeIndex, maxBytes);
    if (read > 0) {
      writeIndex += read;
    }
    return read;
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex - readIndex;
  }

  /**
   * Provides the backing array for zero-copy inspection.
   */
  public byte[] array() {
    return data;
  }

  /**
   * Returns the current reader index.
   */
  public int readerIndex() {
    return readIndex;
  }

  /**
   * Advances the reader index by {@code length} bytes.
   */
  public void discard(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      // reset to avoid pathological growth when alternating read/write
      readIndex = 0;
      writeIndex = 0;
    }
  }

  /**
   * Finds the first case-insensitive occurrence of an ASCII {@code needle} at or after
   * {@code fromRelative} bytes past the reader index.
   *
   * @param needle ASCII marker such as {@code <EOR>}
   * @param fromRelative offset relative to the reader index where the search starts
   * @return relative index or {@code -1} when not found
   */
  public int indexOfIgnoreCase(byte[] needle, int fromRelative) {
    Objects.requireNonNull(needle, "needle");
    int needleLen = needle.length;
    if (needleLen == 0) {
      return 0;
    }
    int start = readIndex + Math.max(0, fromRelative);
    int limit = writeIndex - needleLen;
    outer:
    for (int i = start; i <= limit; i++) {
      for (int j = 0; j < needleLen; j++) {
        if (lower(data[i + j]) != lower(needle[j])) {
          continue outer;
        }
      }
      return i - readIndex;
    }
    return -1;
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   */
  private void ensureWritable(int minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    compact();
    writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    int required = readableBytes() + minWritableBytes;
    int newCapacity = data.length;
    while (newCapacity < required && newCapacity < MAX_CAPACITY) {
      newCapacity <<= 1;
    }
    if (newCapacity < required) {
      newCapacity = required;
    }
    if (newCapacity > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + newCapacity);
    }
    byte[] next = new byte[newCapacity];
    int readable = readableBytes();
    System.arraycopy(data, readIndex, next, 0, readable);
    data = next;
    readIndex = 0;
    writeIndex = readable;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    readIndex = 0;
    writeIndex = 0;
  }

  private void compact() {
    if (readIndex == 0) {
      return;
    }
    int readable = readableBytes();
    if (readable > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
    }
    readIndex = 0;
    writeIndex = readable;
  }

  private static int lower(byte b) {
    return (b >= 'A' && b <= 'Z') ? b + ('a' - 'A') : b;
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
