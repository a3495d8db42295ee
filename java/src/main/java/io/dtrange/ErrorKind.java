package io.dtrange;

/** The type of error raised while building or combining datetime ranges. */
public enum ErrorKind {
  /** A range was built with a zero step. */
  INVALID_STEP("invalid_step"),
  /** A sequence index fell outside {@code [-length, length)}. */
  INDEX_OUT_OF_RANGE("index_out_of_range"),
  /** Timestamp or duration arithmetic left the supported domain. */
  OVERFLOW("overflow"),
  /** Two ranges run in opposite directions. */
  INCOMPATIBLE_DIRECTION("incompatible_direction"),
  /** Neither step is a multiple of the other. */
  INCOMPATIBLE_STEP("incompatible_step"),
  /** Steps differ and the boundaries do not match. */
  MISALIGNED_BOUNDARIES("misaligned_boundaries"),
  /** Two ranges neither overlap nor touch. */
  NON_CONTIGUOUS("non_contiguous"),
  /** Removing a middle chunk would leave a gap. */
  WOULD_CREATE_SPARSE_RANGE("would_create_sparse_range"),
  /** Steps differ and the subtrahend is not aligned with the minuend. */
  MISALIGNED_SUBTRACTION("misaligned_subtraction");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Looks up a kind by its lowercase value.
   *
   * @param value the lowercase value
   * @return the matching kind
   * @throws IllegalArgumentException if no kind has that value
   */
  public static ErrorKind fromValue(String value) {
    for (ErrorKind kind : values()) {
      if (kind.value.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown error kind: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
