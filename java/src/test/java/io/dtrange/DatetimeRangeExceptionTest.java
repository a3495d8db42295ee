package io.dtrange;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for the error kinds and their factories. */
public class DatetimeRangeExceptionTest {

  @Test
  void testErrorKindValues() {
    assertEquals("invalid_step", ErrorKind.INVALID_STEP.value());
    assertEquals("index_out_of_range", ErrorKind.INDEX_OUT_OF_RANGE.value());
    assertEquals("overflow", ErrorKind.OVERFLOW.value());
    assertEquals("incompatible_direction", ErrorKind.INCOMPATIBLE_DIRECTION.value());
    assertEquals("incompatible_step", ErrorKind.INCOMPATIBLE_STEP.value());
    assertEquals("misaligned_boundaries", ErrorKind.MISALIGNED_BOUNDARIES.value());
    assertEquals("non_contiguous", ErrorKind.NON_CONTIGUOUS.value());
    assertEquals("would_create_sparse_range", ErrorKind.WOULD_CREATE_SPARSE_RANGE.value());
    assertEquals("misaligned_subtraction", ErrorKind.MISALIGNED_SUBTRACTION.value());
  }

  @Test
  void testFromValue() {
    for (ErrorKind kind : ErrorKind.values()) {
      assertEquals(kind, ErrorKind.fromValue(kind.toString()));
    }
    assertThrows(IllegalArgumentException.class, () -> ErrorKind.fromValue("lex"));
  }

  @Test
  void testInvalidStep() {
    DatetimeRangeException err = DatetimeRangeException.invalidStep();
    assertEquals(ErrorKind.INVALID_STEP, err.kind());
    assertTrue(err.index().isEmpty());
    assertNull(err.getCause());
  }

  @Test
  void testIndexOutOfRange() {
    DatetimeRangeException err = DatetimeRangeException.indexOutOfRange(-7, BigInteger.valueOf(3));
    assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, err.kind());
    assertEquals(-7L, err.index().get());
    assertTrue(err.getMessage().contains("-7"));
  }

  @Test
  void testOverflowKeepsCause() {
    ArithmeticException cause = new ArithmeticException("long overflow");
    DatetimeRangeException err = DatetimeRangeException.overflow("too far", cause);
    assertEquals(ErrorKind.OVERFLOW, err.kind());
    assertSame(cause, err.getCause());
  }

  @Test
  void testAlgebra() {
    DatetimeRangeException err =
        DatetimeRangeException.algebra(ErrorKind.NON_CONTIGUOUS, "gap between ranges");
    assertEquals(ErrorKind.NON_CONTIGUOUS, err.kind());
    assertEquals("gap between ranges", err.getMessage());
  }
}
