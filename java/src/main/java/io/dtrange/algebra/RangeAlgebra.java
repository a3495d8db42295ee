package io.dtrange.algebra;

import io.dtrange.DatetimeRange;
import io.dtrange.DatetimeRangeException;
import io.dtrange.Direction;
import io.dtrange.ErrorKind;
import io.dtrange.time.Durations;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Set operations between two {@link DatetimeRange}s.
 *
 * <p>Every operation either returns a range holding exactly the combined elements or throws a
 * {@link DatetimeRangeException}; none of them approximates a result that is not a single
 * arithmetic progression.
 *
 * <h2>Step compatibility</h2>
 *
 * <p>Intersection and union require the larger step magnitude to be a whole multiple of the
 * smaller one. Intersection keeps the coarser step, union the finer one. Bounds are taken as-is;
 * phases are not re-aligned, so combining ranges whose elements are offset from one another yields
 * the progression implied by the combined bounds and step.
 */
public final class RangeAlgebra {
  private RangeAlgebra() {}

  /**
   * Intersects two ranges running in the same direction.
   *
   * @param a the first range
   * @param b the second range
   * @return the tighter bounds re-expressed with the coarser step, possibly empty
   * @throws DatetimeRangeException INCOMPATIBLE_DIRECTION or INCOMPATIBLE_STEP
   */
  public static DatetimeRange intersect(DatetimeRange a, DatetimeRange b)
      throws DatetimeRangeException {
    if (a.direction() != b.direction()) {
      throw DatetimeRangeException.algebra(
          ErrorKind.INCOMPATIBLE_DIRECTION,
          "cannot intersect ranges running in opposite directions");
    }
    requireCommensurate(
        a, b, "cannot intersect ranges whose steps are not multiples of one another");

    Duration step = Durations.coarser(a.step(), b.step());
    if (a.direction() == Direction.ASCENDING) {
      return DatetimeRange.of(max(a.start(), b.start()), min(a.stop(), b.stop()), step);
    }
    return DatetimeRange.of(min(a.start(), b.start()), max(a.stop(), b.stop()), step);
  }

  /**
   * Merges two ranges into one.
   *
   * <p>With different steps the ranges must share both bounds and the finer step wins. With equal
   * steps they must overlap or touch.
   *
   * @param a the first range
   * @param b the second range
   * @return the merged range
   * @throws DatetimeRangeException INCOMPATIBLE_STEP, MISALIGNED_BOUNDARIES or NON_CONTIGUOUS
   */
  public static DatetimeRange union(DatetimeRange a, DatetimeRange b)
      throws DatetimeRangeException {
    requireCommensurate(
        a, b, "cannot merge ranges whose steps are not at least multiples of one another");

    if (!a.step().equals(b.step())) {
      if (!a.start().equals(b.start()) || !a.stop().equals(b.stop())) {
        throw DatetimeRangeException.algebra(
            ErrorKind.MISALIGNED_BOUNDARIES,
            "cannot merge ranges whose steps differ and whose boundaries don't match");
      }
      return DatetimeRange.of(a.start(), a.stop(), Durations.finer(a.step(), b.step()));
    }

    boolean ascending = a.direction() == Direction.ASCENDING;
    boolean gap =
        ascending
            ? min(a.stop(), b.stop()).isBefore(max(a.start(), b.start()))
            : min(a.start(), b.start()).isBefore(max(a.stop(), b.stop()));
    if (gap) {
      throw DatetimeRangeException.algebra(
          ErrorKind.NON_CONTIGUOUS, "cannot merge non-overlapping and non-contiguous ranges");
    }

    if (ascending) {
      return DatetimeRange.of(min(a.start(), b.start()), max(a.stop(), b.stop()), a.step());
    }
    return DatetimeRange.of(max(a.start(), b.start()), min(a.stop(), b.stop()), a.step());
  }

  /**
   * Removes the elements of {@code b} from {@code a}.
   *
   * <p>Only removals that leave a single progression are supported: trimming a head or tail chunk
   * of the same step, trimming a single edge element, or, when {@code b}'s step is twice {@code
   * a}'s, removing every other element.
   *
   * @param a the minuend
   * @param b the subtrahend
   * @return the remaining elements of {@code a}
   * @throws DatetimeRangeException if the ranges cannot be intersected, or with
   *     WOULD_CREATE_SPARSE_RANGE or MISALIGNED_SUBTRACTION
   */
  public static DatetimeRange difference(DatetimeRange a, DatetimeRange b)
      throws DatetimeRangeException {
    DatetimeRange common = intersect(b, a);
    if (common.isEmpty()) {
      return a;
    }

    if (a.step().equals(common.step())) {
      if (a.start().equals(common.start())) {
        return DatetimeRange.of(common.stop(), a.stop(), a.step());
      }
      if (a.stop().equals(common.stop())) {
        return DatetimeRange.of(a.start(), common.start(), a.step());
      }
      throw DatetimeRangeException.algebra(
          ErrorKind.WOULD_CREATE_SPARSE_RANGE, "cannot remove a chunk from the middle of a range");
    }

    // common is non-empty and bounded by a, so a is non-empty too
    LocalDateTime aLast = a.get(-1);
    LocalDateTime commonLast = common.get(-1);
    if (a.start().equals(commonLast)) {
      return DatetimeRange.of(Durations.shift(a.start(), a.step(), 1), a.stop(), a.step());
    }
    if (aLast.equals(common.start())) {
      return DatetimeRange.of(a.start(), aLast, a.step());
    }

    if (!a.step().multipliedBy(2).equals(common.step())) {
      throw DatetimeRangeException.algebra(
          ErrorKind.MISALIGNED_SUBTRACTION,
          "cannot subtract ranges with different steps overlapping on more than one element"
              + " unless the subtrahend's step is twice the minuend's");
    }

    if (a.start().equals(common.start()) && aLast.equals(commonLast)) {
      return DatetimeRange.of(Durations.shift(a.start(), a.step(), 1), aLast, common.step());
    }
    if (Durations.shift(a.start(), a.step(), 1).equals(common.start())
        && aLast.equals(Durations.shift(commonLast, a.step(), 1))) {
      return DatetimeRange.of(a.start(), a.stop(), common.step());
    }
    throw DatetimeRangeException.algebra(
        ErrorKind.MISALIGNED_SUBTRACTION,
        "cannot subtract ranges with different steps when their boundaries are not aligned");
  }

  /**
   * Returns {@code (a - b) | (b - a)}.
   *
   * @param a the first range
   * @param b the second range
   * @return the elements in exactly one of the ranges
   * @throws DatetimeRangeException whatever either difference or the final union throws
   */
  public static DatetimeRange symmetricDifference(DatetimeRange a, DatetimeRange b)
      throws DatetimeRangeException {
    return union(difference(a, b), difference(b, a));
  }

  private static void requireCommensurate(DatetimeRange a, DatetimeRange b, String message)
      throws DatetimeRangeException {
    if (!Durations.areCommensurate(a.step(), b.step())) {
      throw DatetimeRangeException.algebra(ErrorKind.INCOMPATIBLE_STEP, message);
    }
  }

  private static LocalDateTime min(LocalDateTime a, LocalDateTime b) {
    return b.isBefore(a) ? b : a;
  }

  private static LocalDateTime max(LocalDateTime a, LocalDateTime b) {
    return b.isAfter(a) ? b : a;
  }
}
