package ca.gc.cra.sentinel.domain.issue;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity assigned to an analysis finding.
 * <p><strong>Role:</strong> Domain enumeration used by rule tables, report filtering and CLI exit
 * status ({@code failOn}).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Exploitable defect that must block a merge. */
  CRITICAL(4),
  /** Serious defect. */
  HIGH(3),
  /** Defect worth fixing soon. */
  MEDIUM(2),
  /** Style or minor quality concern. */
  LOW(1),
  /** Informational finding. */
  INFO(0);

  private final int rank;

  Severity(int rank) {
    this.rank = rank;
  }

  /**
   * Tests whether this severity is at least as severe as {@code other}.
   *
   * @param other threshold severity
   * @return {@code true} when this severity ranks equal or higher
   */
  public boolean atLeast(Severity other) {
    return rank >= other.rank;
  }

  /**
   * Parses a case-insensitive severity name.
   *
   * @param raw textual severity such as {@code high}
   * @return matching severity
   * @throws IllegalArgumentException if the name is unknown or blank
   */
  public static Severity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown severity: " + raw, ex);
    }
  }
}
