package io.dtrange;

import java.math.BigInteger;
import java.util.Optional;

/** Exception thrown when a datetime range cannot be built, indexed, or combined. */
public final class DatetimeRangeException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending index, for index errors. */
  private final Long index;

  private DatetimeRangeException(ErrorKind kind, String message, Long index, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.index = index;
  }

  /**
   * Creates a new zero-step error.
   *
   * @return a new DatetimeRangeException for a zero step
   */
  public static DatetimeRangeException invalidStep() {
    return new DatetimeRangeException(ErrorKind.INVALID_STEP, "step must be non-zero", null, null);
  }

  /**
   * Creates a new index error.
   *
   * @param index the requested index
   * @param length the length of the indexed range
   * @return a new DatetimeRangeException for an out-of-range index
   */
  public static DatetimeRangeException indexOutOfRange(long index, BigInteger length) {
    return new DatetimeRangeException(
        ErrorKind.INDEX_OUT_OF_RANGE,
        "index " + index + " out of range for length " + length,
        index,
        null);
  }

  /**
   * Creates a new overflow error wrapping the failure of the underlying arithmetic.
   *
   * @param message the error message
   * @param cause the {@code DateTimeException} or {@code ArithmeticException} raised by java.time
   * @return a new DatetimeRangeException for an overflow
   */
  public static DatetimeRangeException overflow(String message, RuntimeException cause) {
    return new DatetimeRangeException(ErrorKind.OVERFLOW, message, null, cause);
  }

  /**
   * Creates a new error for an operation whose preconditions on its operands failed.
   *
   * @param kind the algebra error kind
   * @param message the error message
   * @return a new DatetimeRangeException
   */
  public static DatetimeRangeException algebra(ErrorKind kind, String message) {
    return new DatetimeRangeException(kind, message, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending index, if this is an index error.
   *
   * @return the index, or empty if not available
   */
  public Optional<Long> index() {
    return Optional.ofNullable(index);
  }
}
