package ca.gc.cra.sentinel.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for SENTINEL CLI and configuration flows.
 * <p><strong>Why:</strong> Scans must start from a real, readable directory; config files must exist before
 * YAML parsing begins.
 * <p><strong>Thread-safety:</strong> Stateless methods.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a readable directory used as a scan root.
   *
   * @param path candidate directory; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the path is missing, not a directory, or unreadable
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("directory is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a readable regular file such as a YAML config.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
