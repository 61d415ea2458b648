package ca.gc.cra.logmerge.domain.adif;

import java.util.Objects;
import java.util.Optional;

/**
 * One decoded {@code <NAME:LENGTH[:TYPE]>} header and its position in the scanned buffer.
 *
 * @param name tag name, uppercased
 * @param length declared value length in bytes
 * @param type optional data type indicator, as written
 * @param start offset of the opening {@code '<'}
 * @param end offset just past the closing {@code '>'}; the value starts here
 * @since 0.1.0
 */
public record TagHeader(String name, int length, Optional<String> type, int start, int end) {

  public TagHeader {
    Objects.requireNonNull(name, "name");
    type = type == null ? Optional.empty() : type;
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0");
    }
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("invalid header offsets " + start + ".." + end);
    }
  }

  /**
   * Offset just past the value bytes.
   *
   * @return {@code end + length} as a long so oversize lengths never wrap
   */
  public long valueEnd() {
    return (long) end + length;
  }
}
