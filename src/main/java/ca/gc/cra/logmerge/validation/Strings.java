package ca.gc.cra.logmerge.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML config.
 * <p><strong>Why:</strong> Directory names, charset names and file names derived from callsigns must be rejected or
 * normalized before any file is touched.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Resolve charset names to supported {@link Charset}s.</li>
 *   <li>Map arbitrary group keys to portable file names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is non-blank printable ASCII of bounded length.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum accepted length after trimming
   * @return trimmed input
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Resolves a charset name.
   *
   * @param name logical parameter name for diagnostics
   * @param value charset name such as {@code UTF-8} or {@code GBK}
   * @return resolved charset
   * @throws IllegalArgumentException if the name is blank, illegal, or unsupported by this JVM
   */
  public static Charset requireCharset(String name, String value) {
    String sanitized = requirePrintableAscii(name, value, 64);
    try {
      return Charset.forName(sanitized);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException(message(name, "is not a supported charset: " + sanitized), ex);
    }
  }

  /**
   * Maps a value to a portable file name stem: letters, digits, dot, underscore and hyphen are kept, every other
   * character becomes {@code _}. Leading dots are replaced too so the result is never hidden or relative.
   *
   * @param value raw value such as a group key
   * @return non-empty file name stem
   */
  public static String toFileName(String value) {
    if (value == null || value.isEmpty()) {
      return "_";
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean portable = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
          || c == '_' || c == '-' || (c == '.' && sb.length() > 0);
      sb.append(portable ? c : '_');
    }
    return sb.toString();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
