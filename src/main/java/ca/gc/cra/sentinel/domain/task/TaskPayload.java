package ca.gc.cra.sentinel.domain.task;

import java.util.Map;
import java.util.Objects;

/**
 * File content and analyzer options carried by an {@link AnalysisTask}.
 *
 * @param filePath path of the analysed file as reported in issues; never {@code null}
 * @param content full text of the file; never {@code null}
 * @param options analyzer-specific string options; copied
 * @since 0.1.0
 */
public record TaskPayload(String filePath, String content, Map<String, String> options) {

  /**
   * Normalizes the payload and copies options.
   */
  public TaskPayload {
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(content, "content");
    options = options == null ? Map.of() : Map.copyOf(options);
  }

  /**
   * Creates a payload without options.
   *
   * @param filePath analysed file path
   * @param content file text
   * @return payload with empty options
   */
  public static TaskPayload of(String filePath, String content) {
    return new TaskPayload(filePath, content, Map.of());
  }
}
