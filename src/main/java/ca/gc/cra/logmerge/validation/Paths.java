package ca.gc.cra.logmerge.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for the input, output and done directories of a merge run.
 * <p><strong>Why:</strong> A run should fail before reading any log when its output cannot be written, and must
 * not silently mix fresh output with a previous run's files.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the filesystem at call time.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} is an existing readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return normalized real path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a directory that output will be written to.
   *
   * @param path candidate directory
   * @param createIfMissing create the directory (and parents) when absent
   * @param allowReuse accept an existing non-empty directory
   * @return normalized path; the real path when the directory exists
   * @throws IllegalArgumentException if the directory is unusable, or non-empty while {@code allowReuse} is off
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize("path", path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }

      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      Path existing = nearestExistingAncestor(parent);
      if (!Files.isDirectory(existing, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("parent is not a directory: " + existing);
      }
      if (!Files.isWritable(existing)) {
        throw new IllegalArgumentException("parent directory is not writable: " + existing);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
