package ca.gc.cra.sentinel.domain.source;

import java.util.Objects;

/**
 * Source file handed to the orchestrator by a {@code SourceFileProvider}.
 *
 * @param path path reported in findings, relative to the scan root when available
 * @param content decoded file text
 * @since 0.1.0
 */
public record SourceFile(String path, String content) {

  public SourceFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
    if (path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
  }

  /**
   * Number of lines in the content, counting a trailing partial line.
   *
   * @return line count; {@code 1} for empty content
   */
  public long lineCount() {
    return content.split("\n", -1).length;
  }
}
