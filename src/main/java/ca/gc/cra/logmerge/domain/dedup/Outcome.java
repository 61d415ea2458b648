package ca.gc.cra.logmerge.domain.dedup;

import ca.gc.cra.logmerge.domain.adif.AdifRecord;
import java.util.Objects;

/**
 * Classification returned by {@link DuplicateIndex#process(AdifRecord, String)}.
 *
 * @since 0.1.0
 */
public sealed interface Outcome permits Outcome.Accepted, Outcome.Duplicate {

  /**
   * Shared accepted outcome.
   *
   * @return accepted singleton
   */
  static Outcome accepted() {
    return Accepted.INSTANCE;
  }

  /**
   * Indicates whether the record was stored.
   *
   * @return {@code true} for {@link Accepted}
   */
  default boolean isAccepted() {
    return this instanceof Accepted;
  }

  /** The record was stored in its group. */
  final class Accepted implements Outcome {
    private static final Accepted INSTANCE = new Accepted();

    private Accepted() {}

    @Override
    public String toString() {
      return "Accepted";
    }
  }

  /**
   * The record matched an earlier accepted record and was not stored.
   *
   * @param existing the earlier record it matched
   */
  record Duplicate(AdifRecord existing) implements Outcome {
    public Duplicate {
      Objects.requireNonNull(existing, "existing");
    }
  }
}
