package ca.gc.cra.logmerge.domain.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Decodes byte slices by trying an ordered list of charsets strictly, then lossily.
 * <p><strong>Why:</strong> Contact logs arrive from many programs; most are UTF-8, some use a legacy
 * multi-byte charset, and a few are simply broken. Decoding must always yield a string.</p>
 * <p><strong>Role:</strong> Domain support class used by the record parser for every tag value.</p>
 * <p><strong>Thread-safety:</strong> Immutable; a fresh {@link CharsetDecoder} is created per attempt.</p>
 * <p><strong>Performance:</strong> The common case is a single strict UTF-8 pass over the value bytes.</p>
 *
 * @implNote The final attempt decodes with {@link CodingErrorAction#REPLACE} using the lossy charset
 * (the first of the ordered list), so {@link #decode(byte[], int, int)} never throws.
 * @since 0.1.0
 */
public final class FallbackDecoder {
  private final List<Charset> attempts;
  private final Charset lossy;

  /**
   * Creates a decoder trying {@code primary}, then each of {@code fallbacks}, then lossy {@code primary}.
   *
   * @param primary first charset to try; must not be {@code null}
   * @param fallbacks further charsets to try in order; duplicates are ignored
   */
  public FallbackDecoder(Charset primary, Charset... fallbacks) {
    Objects.requireNonNull(primary, "primary");
    LinkedHashSet<Charset> ordered = new LinkedHashSet<>();
    ordered.add(primary);
    if (fallbacks != null) {
      for (Charset fallback : fallbacks) {
        if (fallback != null) {
          ordered.add(fallback);
        }
      }
    }
    this.attempts = List.copyOf(new ArrayList<>(ordered));
    this.lossy = primary;
  }

  /**
   * Decoder trying UTF-8 then {@code secondary}.
   *
   * @param secondary legacy charset to try after UTF-8
   * @return configured decoder
   */
  public static FallbackDecoder utf8Then(Charset secondary) {
    return new FallbackDecoder(StandardCharsets.UTF_8, secondary);
  }

  /**
   * Charsets tried strictly, in order.
   *
   * @return ordered attempts
   */
  public List<Charset> attempts() {
    return attempts;
  }

  /**
   * Decodes {@code data[offset, offset + length)}.
   *
   * @param data backing array; may be {@code null}
   * @param offset starting offset
   * @param length number of bytes
   * @return decoded text; an empty string when inputs are {@code null} or empty
   */
  public String decode(byte[] data, int offset, int length) {
    if (data == null || length <= 0) {
      return "";
    }
    int start = Math.max(0, Math.min(data.length, offset));
    int len = Math.max(0, Math.min(length, data.length - start));
    if (len == 0) {
      return "";
    }
    for (Charset charset : attempts) {
      String decoded = tryStrict(charset, data, start, len);
      if (decoded != null) {
        return decoded;
      }
    }
    return new String(data, start, len, lossy);
  }

  private static String tryStrict(Charset charset, byte[] data, int offset, int length) {
    CharsetDecoder decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(data, offset, length)).toString();
    } catch (CharacterCodingException ex) {
      return null;
    }
  }
}
