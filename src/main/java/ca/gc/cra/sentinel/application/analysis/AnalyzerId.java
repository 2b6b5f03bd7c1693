package ca.gc.cra.sentinel.application.analysis;

import java.util.Locale;

/**
 * Closed set of analyzers a worker can run. Names outside the set resolve to {@link #UNKNOWN}, which
 * produces an empty result instead of an error.
 *
 * @since 0.1.0
 */
public enum AnalyzerId {
  SECURITY("security"),
  QUALITY("quality"),
  BUGS("bugs"),
  PERFORMANCE("performance"),
  SECRETS("secrets"),
  UNKNOWN("unknown");

  private final String wireName;

  AnalyzerId(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Name used in task payloads, CLI options and findings.
   *
   * @return lower-case analyzer name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a task's analyzer name.
   *
   * @param name analyzer name, case-insensitive; {@code null} resolves to {@link #UNKNOWN}
   * @return matching analyzer or {@link #UNKNOWN}
   */
  public static AnalyzerId fromName(String name) {
    if (name == null || name.isBlank()) {
      return UNKNOWN;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (AnalyzerId id : values()) {
      if (id != UNKNOWN && id.wireName.equals(normalized)) {
        return id;
      }
    }
    return UNKNOWN;
  }
}
