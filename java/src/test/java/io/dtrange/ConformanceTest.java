package io.dtrange;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode SPEC;
  private static LocalDateTime T0;

  @FunctionalInterface
  private interface RangeOperation {
    DatetimeRange apply(DatetimeRange left, DatetimeRange right) throws DatetimeRangeException;
  }

  @FunctionalInterface
  private interface RangePredicate {
    boolean test(DatetimeRange left, DatetimeRange right);
  }

  @BeforeAll
  static void loadSpec() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json not on the test classpath");
      SPEC = MAPPER.readTree(in);
    }
    T0 = LocalDateTime.parse(SPEC.get("t0").asText());
  }

  // Operations returning a range

  @TestFactory
  Stream<DynamicTest> intersectTests() {
    return operationTests("intersect", DatetimeRange::intersect);
  }

  @TestFactory
  Stream<DynamicTest> unionTests() {
    return operationTests("union", DatetimeRange::union);
  }

  @TestFactory
  Stream<DynamicTest> differenceTests() {
    return operationTests("difference", DatetimeRange::difference);
  }

  @TestFactory
  Stream<DynamicTest> symmetricDifferenceTests() {
    return operationTests("symmetric_difference", DatetimeRange::symmetricDifference);
  }

  // Predicates

  @TestFactory
  Stream<DynamicTest> subsetOrEqualTests() {
    return predicateTests("subset_or_equal", DatetimeRange::isSubsetOrEqual);
  }

  @TestFactory
  Stream<DynamicTest> disjointTests() {
    return predicateTests("disjoint", DatetimeRange::isDisjoint);
  }

  private Stream<DynamicTest> operationTests(String section, RangeOperation op) {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get(section).get("tests")) {
      String name = section + "/" + tc.get("name").asText();
      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                DatetimeRange left = parseRange(tc.get("left"));
                DatetimeRange right = parseRange(tc.get("right"));

                if (tc.has("error")) {
                  ErrorKind expected = ErrorKind.fromValue(tc.get("error").asText());
                  DatetimeRangeException err =
                      assertThrows(
                          DatetimeRangeException.class,
                          () -> op.apply(left, right),
                          "expected " + expected + " for " + name);
                  assertEquals(expected, err.kind(), name);
                  return;
                }

                DatetimeRange result = op.apply(left, right);
                assertEquals(parseRange(tc.get("expected")), result, name);
                if (tc.has("empty")) {
                  assertEquals(tc.get("empty").asBoolean(), result.isEmpty(), name + " emptiness");
                }
              }));
    }
    return tests.stream();
  }

  private Stream<DynamicTest> predicateTests(String section, RangePredicate predicate) {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get(section).get("tests")) {
      String name = section + "/" + tc.get("name").asText();
      boolean expected = tc.get("value").asBoolean();
      tests.add(
          DynamicTest.dynamicTest(
              name,
              () ->
                  assertEquals(
                      expected,
                      predicate.test(parseRange(tc.get("left")), parseRange(tc.get("right"))),
                      name)));
    }
    return tests.stream();
  }

  /** Parse a [start, stop, step] triple of seconds relative to t0. */
  private static DatetimeRange parseRange(JsonNode node) throws DatetimeRangeException {
    return DatetimeRange.of(
        T0.plusSeconds(node.get(0).asLong()),
        T0.plusSeconds(node.get(1).asLong()),
        Duration.ofSeconds(node.get(2).asLong()));
  }
}
