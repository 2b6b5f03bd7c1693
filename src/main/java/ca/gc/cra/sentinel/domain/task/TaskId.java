package ca.gc.cra.sentinel.domain.task;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Opaque identifier correlating a submitted analysis task with its result.
 * <p><strong>Why:</strong> Results arrive out of order from independent workers; the id is the only
 * correlation key between a worker reply and the caller awaiting it.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param value non-blank identifier text
 * @since 0.1.0
 */
public record TaskId(String value) {

  /**
   * Validates the identifier text.
   *
   * @throws IllegalArgumentException if {@code value} is blank
   */
  public TaskId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("task id must not be blank");
    }
  }

  /**
   * Creates a sequence that mints unique ids for a single engine instance.
   *
   * @return new generator starting at sequence one
   */
  public static Generator generator() {
    return new Generator();
  }

  @Override
  public String toString() {
    return value;
  }

  /**
   * Mints ids of the form {@code task-<sequence>-<random>}; safe for concurrent use.
   */
  public static final class Generator {
    private final AtomicLong sequence = new AtomicLong();

    private Generator() {}

    /**
     * Returns the next unique id.
     *
     * @return fresh task id
     */
    public TaskId next() {
      long seq = sequence.incrementAndGet();
      String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
      return new TaskId("task-" + seq + "-" + suffix);
    }
  }
}
