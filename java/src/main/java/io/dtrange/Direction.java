package io.dtrange;

import java.time.Duration;

/** Whether a range walks forward or backward in time. */
public enum Direction {
  /** Positive step: each element is later than the previous one. */
  ASCENDING,
  /** Negative step: each element is earlier than the previous one. */
  DESCENDING;

  /**
   * Classifies a non-zero step.
   *
   * @param step the step
   * @return ASCENDING for a positive step, DESCENDING for a negative one
   */
  public static Direction of(Duration step) {
    return step.isNegative() ? DESCENDING : ASCENDING;
  }

  /**
   * Checks whether {@code a} comes strictly before {@code b} when walking in this direction.
   *
   * @param a the first value
   * @param b the second value
   * @param <T> the compared type
   * @return true if {@code a} is met before {@code b}
   */
  public <T extends Comparable<? super T>> boolean precedes(T a, T b) {
    return this == ASCENDING ? a.compareTo(b) < 0 : a.compareTo(b) > 0;
  }
}
