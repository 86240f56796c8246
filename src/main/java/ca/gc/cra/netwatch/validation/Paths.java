package ca.gc.cra.netwatch.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for NETWATCH inputs and outputs.
 * <ul>
 *   <li>Normalize user-supplied paths and reject null bytes or control characters.</li>
 *   <li>Ensure export directories exist (optionally creating them) and are writable.</li>
 *   <li>Ensure offline capture files are readable regular files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect filesystem state at call time.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a textual path into an absolute, normalized {@link Path}.
   *
   * @param name parameter name for diagnostics
   * @param raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank or not a valid path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Validates a writable directory, creating it when requested.
   *
   * @param path candidate directory
   * @param createIfMissing create the directory and parents when absent
   * @return absolute normalized directory
   * @throws IllegalArgumentException if the path is not a writable directory or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!createIfMissing) {
        Path ancestor = nearestExistingAncestor(normalized);
        if (!Files.isWritable(ancestor)) {
          throw new IllegalArgumentException("directory cannot be created under non-writable " + ancestor);
        }
        return normalized;
      }
      try {
        Files.createDirectories(normalized);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to create directory " + normalized, ex);
      }
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file exists and can be read.
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @return the same path
   * @throws IllegalArgumentException if the file is missing, not regular or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null || !Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " must reference a readable file: " + path);
    }
    return path;
  }

  private static Path nearestExistingAncestor(Path path) {
    Path current = path;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + path);
    }
    return current;
  }
}
