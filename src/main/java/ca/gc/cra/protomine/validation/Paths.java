package ca.gc.cra.protomine.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation helpers for Protomine inputs.
 * <p><strong>Why:</strong> Page sources and YAML configs are read from operator-supplied paths; rejecting
 * unreadable or malformed paths up front yields a clear CLI error instead of a late I/O failure.
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> No logs; failures surface as {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return real path of the file
   * @throws IllegalArgumentException if the path is malformed, missing, not a file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path real = resolveExisting(name, path);
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException(label(name) + " is not a regular file: " + real);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(label(name) + " is not readable: " + real);
    }
    return real;
  }

  /**
   * Ensures {@code path} names an existing, readable file or directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file or directory
   * @return real path of the entry
   * @throws IllegalArgumentException if the path is malformed, missing, or unreadable
   */
  public static Path requireReadable(String name, Path path) {
    Path real = resolveExisting(name, path);
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(label(name) + " is not readable: " + real);
    }
    return real;
  }

  private static Path resolveExisting(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(label(name) + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(label(name) + " must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(label(name) + " does not exist: " + normalized);
    }
    try {
      return normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to access " + label(name) + ' ' + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "path" : name;
  }
}
