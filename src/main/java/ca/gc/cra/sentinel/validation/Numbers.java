package ca.gc.cra.sentinel.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SENTINEL CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid pool sizes, queue capacities and timeouts before the
 * engine allocates threads.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., workers, ms)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a number or lies outside {@code [min, max]}
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String label = name == null || name.isBlank() ? "value" : name;
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be a whole number (was '" + raw.trim() + "')", ex);
    }
    return requireRange(label, value, min, max);
  }
}
