package ca.gc.cra.sentinel.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by SENTINEL configuration and CLI layers.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Split and normalize comma-separated identifier lists such as analyzer names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-z0-9._-]+$");

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
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
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
   * Splits a comma-separated list of lower-case identifiers, dropping blanks and duplicates.
   *
   * @param name logical parameter name for diagnostics
   * @param raw comma-separated text, e.g. {@code security, quality}
   * @return identifiers in input order, lower-cased
   * @throws IllegalArgumentException if the list is empty or an entry contains unsupported characters
   */
  public static List<String> splitIdentifiers(String name, String raw) {
    String sanitized = requireNonBlank(name, raw);
    List<String> values = new ArrayList<>();
    for (String token : sanitized.split(",")) {
      String value = token.trim().toLowerCase(Locale.ROOT);
      if (value.isEmpty() || values.contains(value)) {
        continue;
      }
      if (!IDENTIFIER_PATTERN.matcher(value).matches()) {
        throw new IllegalArgumentException(message(name,
            "entries must only contain letters, digits, dot, underscore, or hyphen (was '" + value + "')"));
      }
      values.add(value);
    }
    if (values.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must name at least one entry"));
    }
    return List.copyOf(values);
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
