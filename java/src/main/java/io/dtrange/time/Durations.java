package io.dtrange.time;

import io.dtrange.DatetimeRangeException;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Exact arithmetic on {@link Duration} and {@link LocalDateTime}.
 *
 * <p>Quantities are compared and divided as whole nanosecond counts held in {@link BigInteger},
 * since a {@code long} of nanoseconds only spans about 292 years while {@code LocalDateTime}
 * spans almost two billion.
 */
public final class Durations {
  private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

  private Durations() {}

  /**
   * Returns the total length of a duration in nanoseconds.
   *
   * @param duration the duration
   * @return the signed nanosecond count
   */
  public static BigInteger toNanos(Duration duration) {
    return BigInteger.valueOf(duration.getSeconds())
        .multiply(NANOS_PER_SECOND)
        .add(BigInteger.valueOf(duration.getNano()));
  }

  /**
   * Returns the signed number of nanoseconds from {@code from} to {@code to}.
   *
   * @param from the start timestamp
   * @param to the end timestamp
   * @return the nanosecond count, negative when {@code to} is before {@code from}
   */
  public static BigInteger nanosBetween(LocalDateTime from, LocalDateTime to) {
    return toNanos(Duration.between(from, to));
  }

  /**
   * Checks whether the magnitude of {@code value} is an exact multiple of the magnitude of
   * {@code divisor}.
   *
   * @param value the candidate multiple
   * @param divisor a non-zero duration
   * @return true if the remainder is zero
   */
  public static boolean isMultipleOf(BigInteger value, Duration divisor) {
    return value.remainder(toNanos(divisor)).signum() == 0;
  }

  /**
   * Counts the whole steps that fit between {@code start} and {@code stop}, that is {@code
   * max(0, floor((stop - start) / step))}.
   *
   * @param start the first point
   * @param stop the exclusive bound
   * @param step a non-zero step
   * @return the number of steps, never negative
   */
  public static BigInteger countSteps(LocalDateTime start, LocalDateTime stop, Duration step) {
    BigInteger span = nanosBetween(start, stop);
    BigInteger unit = toNanos(step);
    if (span.signum() != unit.signum()) {
      return BigInteger.ZERO;
    }
    // same sign, so truncation is floor
    return span.divide(unit);
  }

  /**
   * Returns {@code step * times} as an exact duration.
   *
   * @param step the unit
   * @param times the multiplier, of any size
   * @return the product
   * @throws ArithmeticException if the product does not fit in a {@code Duration}
   */
  public static Duration multiply(Duration step, BigInteger times) {
    BigInteger[] qr = toNanos(step).multiply(times).divideAndRemainder(NANOS_PER_SECOND);
    return Duration.ofSeconds(qr[0].longValueExact(), qr[1].longValue());
  }

  /**
   * Returns whichever step has the larger magnitude, {@code a} on a tie.
   *
   * @param a the first step
   * @param b the second step
   * @return the coarser step
   */
  public static Duration coarser(Duration a, Duration b) {
    return b.abs().compareTo(a.abs()) > 0 ? b : a;
  }

  /**
   * Returns whichever step has the smaller magnitude, {@code a} on a tie.
   *
   * @param a the first step
   * @param b the second step
   * @return the finer step
   */
  public static Duration finer(Duration a, Duration b) {
    return b.abs().compareTo(a.abs()) < 0 ? b : a;
  }

  /**
   * Checks whether the coarser of two steps is a whole multiple of the finer one.
   *
   * @param a a non-zero step
   * @param b a non-zero step
   * @return true if one step evenly divides the other
   */
  public static boolean areCommensurate(Duration a, Duration b) {
    return isMultipleOf(toNanos(coarser(a, b)), finer(a, b));
  }

  /**
   * Returns {@code timestamp + times * step}.
   *
   * @param timestamp the timestamp to shift
   * @param step the unit of the shift
   * @param times how many steps to shift by, possibly negative
   * @return the shifted timestamp
   * @throws DatetimeRangeException if the result falls outside the {@code LocalDateTime} domain
   */
  public static LocalDateTime shift(LocalDateTime timestamp, Duration step, long times)
      throws DatetimeRangeException {
    try {
      return timestamp.plus(step.multipliedBy(times));
    } catch (DateTimeException | ArithmeticException e) {
      throw DatetimeRangeException.overflow(
          "cannot shift " + timestamp + " by " + times + " x " + step, e);
    }
  }

  /**
   * Returns {@code -step}.
   *
   * @param step the step to negate
   * @return the negated step
   * @throws DatetimeRangeException if the negation does not fit in a {@code Duration}
   */
  public static Duration negate(Duration step) throws DatetimeRangeException {
    try {
      return step.negated();
    } catch (ArithmeticException e) {
      throw DatetimeRangeException.overflow("cannot negate " + step, e);
    }
  }
}
