package ca.gc.cra.logmerge.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Tests whether the file name ends with one of {@code extensions}, ignoring case.
   *
   * @param path candidate file
   * @param extensions extensions including the dot, e.g. {@code .adi}
   * @return {@code true} on a match
   */
  public static boolean hasExtension(Path path, String... extensions) {
    String name = fileName(path).map(n -> n.toLowerCase(Locale.ROOT)).orElse("");
    for (String extension : extensions) {
      String lower = extension.toLowerCase(Locale.ROOT);
      if (name.length() > lower.length() && name.endsWith(lower)) {
        return true;
      }
    }
    return false;
  }
}
