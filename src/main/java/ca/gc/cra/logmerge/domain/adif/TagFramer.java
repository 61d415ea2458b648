package ca.gc.cra.logmerge.domain.adif;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Locates {@code <NAME:LENGTH>} and {@code <NAME:LENGTH:TYPE>} headers in a byte buffer.
 * <p><strong>Why:</strong> Tag framing must be byte-exact; values are consumed by declared length, so the
 * framer only ever interprets header bytes and never the value content.</p>
 * <p><strong>Role:</strong> Domain codec helper used by {@code RecordStream} when decoding record spans.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single forward scan; O(n) in the bytes between {@code from} and the header end.</p>
 *
 * @implNote A {@code '<'} that does not open a well-formed header is skipped and the scan resumes one byte later.
 * The caller is responsible for checking {@link TagHeader#valueEnd()} against the available data.
 * @since 0.1.0
 */
public final class TagFramer {
  private static final int MAX_LENGTH_DIGITS = 9;

  private TagFramer() {}

  /**
   * Finds the next tag header in {@code data[from, limit)}.
   *
   * @param data buffer to scan; {@code null} yields empty
   * @param from scan cursor
   * @param limit exclusive upper bound of readable bytes
   * @return header when a complete one lies within the range, otherwise empty
   */
  public static Optional<TagHeader> next(byte[] data, int from, int limit) {
    if (data == null) {
      return Optional.empty();
    }
    int end = Math.min(limit, data.length);
    int cursor = Math.max(0, from);
    while (cursor < end) {
      int open = indexOf(data, (byte) '<', cursor, end);
      if (open < 0) {
        return Optional.empty();
      }
      TagHeader header = parseAt(data, open, end);
      if (header != null) {
        return Optional.of(header);
      }
      cursor = open + 1;
    }
    return Optional.empty();
  }

  private static TagHeader parseAt(byte[] data, int open, int end) {
    int i = open + 1;
    int nameStart = i;
    while (i < end && isNameByte(data[i])) {
      i++;
    }
    if (i == nameStart || i >= end || data[i] != ':') {
      return null;
    }
    int nameEnd = i;
    i++;

    int digitsStart = i;
    long length = 0;
    while (i < end && data[i] >= '0' && data[i] <= '9') {
      if (i - digitsStart >= MAX_LENGTH_DIGITS) {
        return null;
      }
      length = length * 10 + (data[i] - '0');
      i++;
    }
    if (i == digitsStart || i >= end) {
      return null;
    }

    Optional<String> type = Optional.empty();
    if (data[i] == ':') {
      i++;
      int typeStart = i;
      while (i < end && isTypeByte(data[i])) {
        i++;
      }
      if (i == typeStart || i >= end) {
        return null;
      }
      type = Optional.of(ascii(data, typeStart, i));
    }
    if (data[i] != '>') {
      return null;
    }
    String name = ascii(data, nameStart, nameEnd).toUpperCase(Locale.ROOT);
    return new TagHeader(name, (int) length, type, open, i + 1);
  }

  private static boolean isNameByte(byte b) {
    return b > 0x20 && b < 0x7F && b != ':' && b != '<' && b != '>';
  }

  private static boolean isTypeByte(byte b) {
    return b > 0x20 && b < 0x7F && b != '<' && b != '>';
  }

  private static String ascii(byte[] data, int from, int to) {
    return new String(data, from, to - from, StandardCharsets.US_ASCII);
  }

  private static int indexOf(byte[] data, byte target, int from, int end) {
    for (int i = from; i < end; i++) {
      if (data[i] == target) {
        return i;
      }
    }
    return -1;
  }
}
