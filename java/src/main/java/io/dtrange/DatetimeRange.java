package io.dtrange;

import io.dtrange.algebra.RangeAlgebra;
import io.dtrange.time.Durations;
import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An arithmetic progression of timestamps: {@code start}, {@code start + step}, {@code start + 2 *
 * step}, ... up to but excluding {@code stop}.
 *
 * <p>A range is both a sequence (indexable, iterable, reversible) and a set (membership,
 * intersection, union, difference). Set operations are only defined between ranges whose result
 * is again a single progression; other combinations fail with a {@link DatetimeRangeException}
 * describing why.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * LocalDateTime t0 = LocalDateTime.of(2026, 1, 1, 0, 0);
 * DatetimeRange morning = DatetimeRange.of(t0.withHour(6), t0.withHour(12), Duration.ofMinutes(15));
 * DatetimeRange office = DatetimeRange.of(t0.withHour(9), t0.withHour(17), Duration.ofMinutes(15));
 * DatetimeRange overlap = morning.intersect(office); // 09:00 to 12:00
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class DatetimeRange implements Iterable<LocalDateTime> {
  private final LocalDateTime start;
  private final LocalDateTime stop;
  private final Duration step;
  private final Direction direction;
  private final BigInteger count;
  private final LocalDateTime last;

  private DatetimeRange(LocalDateTime start, LocalDateTime stop, Duration step, BigInteger count) {
    this.start = start;
    this.stop = stop;
    this.step = step;
    this.direction = Direction.of(step);
    this.count = count;
    this.last = count.signum() == 0 ? start : element(count.subtract(BigInteger.ONE));
  }

  /**
   * Creates a range from {@code start} (inclusive) to {@code stop} (exclusive).
   *
   * @param start the first timestamp
   * @param stop the exclusive bound
   * @param step the distance between consecutive timestamps; negative for a descending range
   * @return the range, possibly empty
   * @throws DatetimeRangeException if {@code step} is zero
   */
  public static DatetimeRange of(LocalDateTime start, LocalDateTime stop, Duration step)
      throws DatetimeRangeException {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(stop, "stop");
    Objects.requireNonNull(step, "step");
    if (step.isZero()) {
      throw DatetimeRangeException.invalidStep();
    }
    return new DatetimeRange(start, stop, step, Durations.countSteps(start, stop, step));
  }

  /**
   * Checks whether a range could be built from the given bounds without throwing.
   *
   * @param start the first timestamp
   * @param stop the exclusive bound
   * @param step the step
   * @return true if {@link #of} would succeed
   */
  public static boolean validate(LocalDateTime start, LocalDateTime stop, Duration step) {
    try {
      of(start, stop, step);
      return true;
    } catch (DatetimeRangeException e) {
      return false;
    }
  }

  /**
   * Returns the first timestamp (inclusive bound).
   *
   * @return the start
   */
  public LocalDateTime start() {
    return start;
  }

  /**
   * Returns the exclusive bound. It is never a member of the range.
   *
   * @return the stop
   */
  public LocalDateTime stop() {
    return stop;
  }

  /**
   * Returns the distance between consecutive elements.
   *
   * @return the step, never zero
   */
  public Duration step() {
    return step;
  }

  /**
   * Returns whether the range walks forward or backward in time.
   *
   * @return the direction
   */
  public Direction direction() {
    return direction;
  }

  /**
   * Returns the number of elements, {@code max(0, floor((stop - start) / step))}.
   *
   * @return the length, zero for an empty range
   * @throws DatetimeRangeException if the count does not fit in a {@code long}; see {@link
   *     #count()}
   */
  public long length() throws DatetimeRangeException {
    try {
      return count.longValueExact();
    } catch (ArithmeticException e) {
      throw DatetimeRangeException.overflow("range has " + count + " elements", e);
    }
  }

  /**
   * Returns the exact number of elements. Nanosecond steps over a few centuries already exceed
   * {@code Long.MAX_VALUE}.
   *
   * @return the element count, never negative
   */
  public BigInteger count() {
    return count;
  }

  /**
   * Returns true if the range has no elements.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return count.signum() == 0;
  }

  /**
   * Returns the first element, or empty if the range is empty.
   *
   * @return the first element
   */
  public Optional<LocalDateTime> first() {
    return isEmpty() ? Optional.empty() : Optional.of(start);
  }

  /**
   * Returns the last element, or empty if the range is empty.
   *
   * @return the last element
   */
  public Optional<LocalDateTime> last() {
    return isEmpty() ? Optional.empty() : Optional.of(last);
  }

  /**
   * Returns the element at {@code index}. Negative indices count from the end, so {@code -1} is
   * the last element.
   *
   * @param index an index in {@code [-length, length)}
   * @return the element
   * @throws DatetimeRangeException if the index is out of range
   */
  public LocalDateTime get(long index) throws DatetimeRangeException {
    BigInteger i = BigInteger.valueOf(index);
    if (i.signum() < 0) {
      i = count.add(i);
    }
    if (i.signum() < 0 || i.compareTo(count) >= 0) {
      throw DatetimeRangeException.indexOutOfRange(index, count);
    }
    return element(i);
  }

  /**
   * Checks whether a timestamp is one of the elements. Runs in constant time.
   *
   * @param dt the timestamp to look for
   * @return true if {@code dt} is a member
   */
  public boolean contains(LocalDateTime dt) {
    return position(dt) != null;
  }

  /**
   * Returns the position of a timestamp, in the manner of {@link java.util.List#indexOf}.
   *
   * @param dt the timestamp to look for
   * @return the index of {@code dt}, or {@code -1} if it is not a member
   * @throws DatetimeRangeException if the index does not fit in a {@code long}
   */
  public long indexOf(LocalDateTime dt) throws DatetimeRangeException {
    BigInteger index = position(dt);
    if (index == null) {
      return -1;
    }
    try {
      return index.longValueExact();
    } catch (ArithmeticException e) {
      throw DatetimeRangeException.overflow(dt + " is element " + index + " of " + this, e);
    }
  }

  /**
   * Returns the same elements in the opposite order.
   *
   * @return a range starting at the last element and stepping by {@code -step}
   * @throws DatetimeRangeException if {@code start - step} falls outside the timestamp domain
   */
  public DatetimeRange reverse() throws DatetimeRangeException {
    LocalDateTime newStart = isEmpty() ? Durations.shift(stop, step, -1) : last;
    LocalDateTime newStop = Durations.shift(start, step, -1);
    return of(newStart, newStop, Durations.negate(step));
  }

  /**
   * Returns the elements common to both ranges ({@code this & other}).
   *
   * @param other the other range
   * @return the intersection, possibly empty
   * @throws DatetimeRangeException if the ranges run in opposite directions or their steps are
   *     not multiples of one another
   */
  public DatetimeRange intersect(DatetimeRange other) throws DatetimeRangeException {
    return RangeAlgebra.intersect(this, other);
  }

  /**
   * Returns the elements of either range ({@code this | other}).
   *
   * @param other the other range
   * @return the union
   * @throws DatetimeRangeException if the union is not a single progression
   */
  public DatetimeRange union(DatetimeRange other) throws DatetimeRangeException {
    return RangeAlgebra.union(this, other);
  }

  /**
   * Returns the elements of this range that are not in {@code other} ({@code this - other}).
   *
   * @param other the range to remove
   * @return the difference
   * @throws DatetimeRangeException if the result is not a single progression
   */
  public DatetimeRange difference(DatetimeRange other) throws DatetimeRangeException {
    return RangeAlgebra.difference(this, other);
  }

  /**
   * Returns the elements in exactly one of the two ranges ({@code this ^ other}).
   *
   * @param other the other range
   * @return the symmetric difference
   * @throws DatetimeRangeException if either difference or their union fails
   */
  public DatetimeRange symmetricDifference(DatetimeRange other) throws DatetimeRangeException {
    return RangeAlgebra.symmetricDifference(this, other);
  }

  /**
   * Checks whether every element of this range is in {@code other} ({@code this <= other}).
   *
   * <p>This is a partial order: ranges that cannot be merged are never subsets of one another.
   *
   * @param other the candidate superset
   * @return true if {@code this.union(other)} succeeds and equals {@code other}
   */
  public boolean isSubsetOrEqual(DatetimeRange other) {
    try {
      return union(other).equals(other);
    } catch (DatetimeRangeException e) {
      return false;
    }
  }

  /**
   * Checks whether every element of {@code other} is in this range.
   *
   * @param other the candidate subset
   * @return {@code other.isSubsetOrEqual(this)}
   */
  public boolean isSupersetOrEqual(DatetimeRange other) {
    return other.isSubsetOrEqual(this);
  }

  /**
   * Checks whether the two ranges share no element. Ranges that cannot be intersected (opposite
   * directions, unrelated steps) are reported as disjoint.
   *
   * @param other the other range
   * @return true if the intersection is empty or undefined
   */
  public boolean isDisjoint(DatetimeRange other) {
    try {
      return intersect(other).isEmpty();
    } catch (DatetimeRangeException e) {
      return true;
    }
  }

  @Override
  public Iterator<LocalDateTime> iterator() {
    return new Iterator<>() {
      private BigInteger index = BigInteger.ZERO;

      @Override
      public boolean hasNext() {
        return index.compareTo(count) < 0;
      }

      @Override
      public LocalDateTime next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        LocalDateTime next = element(index);
        index = index.add(BigInteger.ONE);
        return next;
      }
    };
  }

  /**
   * Returns a lazy stream of the elements in order.
   *
   * @return a stream of the elements
   */
  public Stream<LocalDateTime> stream() {
    int characteristics =
        Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.IMMUTABLE;
    Spliterator<LocalDateTime> spliterator =
        count.bitLength() < Long.SIZE
            ? Spliterators.spliterator(iterator(), count.longValue(), characteristics)
            : Spliterators.spliteratorUnknownSize(iterator(), characteristics);
    return StreamSupport.stream(spliterator, false);
  }

  /**
   * Compares the realized elements: all empty ranges are equal, whatever their bounds, and a
   * {@code stop} several steps past the last element is the same range as one just past it.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatetimeRange)) {
      return false;
    }
    DatetimeRange other = (DatetimeRange) o;
    if (!count.equals(other.count)) {
      return false;
    }
    if (count.signum() == 0) {
      return true;
    }
    if (count.equals(BigInteger.ONE)) {
      return start.equals(other.start);
    }
    return start.equals(other.start) && step.equals(other.step) && last.equals(other.last);
  }

  @Override
  public int hashCode() {
    if (count.signum() == 0) {
      return 0;
    }
    if (count.equals(BigInteger.ONE)) {
      return start.hashCode();
    }
    return start.hashCode() ^ last.hashCode() ^ step.hashCode();
  }

  @Override
  public String toString() {
    return "DatetimeRange(" + start + ", " + stop + ", " + step + ")";
  }

  // Callers keep index within [0, count), where the result lies between start and stop.
  private LocalDateTime element(BigInteger index) {
    return start.plus(Durations.multiply(step, index));
  }

  /** Index of {@code dt} in this range, or null if it is not a member. */
  private BigInteger position(LocalDateTime dt) {
    if (dt == null || direction.precedes(dt, start) || !direction.precedes(dt, stop)) {
      return null;
    }
    BigInteger[] qr = Durations.nanosBetween(start, dt).divideAndRemainder(Durations.toNanos(step));
    // the bounds alone admit a trailing point less than a step before stop
    return qr[1].signum() == 0 && qr[0].compareTo(count) < 0 ? qr[0] : null;
  }
}
