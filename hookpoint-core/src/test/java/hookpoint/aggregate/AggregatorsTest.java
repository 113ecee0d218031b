package hookpoint.aggregate;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorsTest {

  @Test
  void sumAddsIntegralResults() {
    assertEquals(10L, Aggregators.sum().aggregate(List.of(1, 2, 3, 4)));
  }

  @Test
  void sumOfNothingIsZero() {
    assertEquals(0L, Aggregators.sum().aggregate(List.of()));
  }

  @Test
  void sumMixesIntegerWidths() {
    assertEquals(7L, Aggregators.sum().aggregate(List.of((byte) 1, (short) 2, 3, 1L)));
  }

  @Test
  void sumWidensToDouble() {
    assertEquals(3.5, Aggregators.sum().aggregate(List.of(1, 2.5)));
  }

  @Test
  void sumStaysDoubleWhenFloatingPartIsNotFinite() {
    Number infinite = Aggregators.sum().aggregate(
        List.of(BigDecimal.ONE, Double.POSITIVE_INFINITY, 2));
    Number nan = Aggregators.sum().aggregate(List.of(BigInteger.TWO, Double.NaN));

    assertEquals(Double.POSITIVE_INFINITY, infinite);
    assertTrue(Double.isNaN((Double) nan));
  }

  @Test
  void sumWidensToBigDecimal() {
    Number total = Aggregators.sum().aggregate(List.of(1, BigInteger.TEN, new BigDecimal("0.25")));

    assertEquals(0, new BigDecimal("11.25").compareTo((BigDecimal) total));
  }

  @Test
  void sumDetectsLongOverflow() {
    assertThrows(ArithmeticException.class,
        () -> Aggregators.sum().aggregate(List.of(Long.MAX_VALUE, 1)));
  }

  @Test
  void sumRejectsNonNumericResults() {
    assertThrows(IllegalArgumentException.class,
        () -> Aggregators.sum().aggregate(List.of(1, "two")));
    assertThrows(IllegalArgumentException.class,
        () -> Aggregators.sum().aggregate(Arrays.asList(1, null)));
  }

  @Test
  void flattenSplicesCollections() {
    List<Object> results = List.of(List.of(1, 2), List.of(3, 4), 5);

    assertEquals(List.of(1, 2, 3, 4, 5), Aggregators.flatten().aggregate(results));
  }

  @Test
  void flattenKeepsScalarsNullsAndNonListCollections() {
    Set<String> set = new LinkedHashSet<>(List.of("b", "c"));
    List<Object> results = Arrays.asList("a", null, set, List.of());

    assertEquals(Arrays.asList("a", null, set), Aggregators.flatten().aggregate(results));
  }

  @Test
  void flattenKeepsSortedSetAsOneElement() {
    Set<String> tags = new TreeSet<>(List.of("y", "x"));

    assertEquals(List.of(1, tags), Aggregators.flatten().aggregate(List.of(List.of(1), tags)));
  }

  @Test
  void flattenOnlySplicesOneLevel() {
    List<Object> results = List.of(List.of(List.of(1), 2));

    assertEquals(List.of(List.of(1), 2), Aggregators.flatten().aggregate(results));
  }

  @Test
  void flattenOfNothingIsEmpty() {
    assertTrue(Aggregators.flatten().aggregate(List.of()).isEmpty());
  }

  @Test
  void mergeMapsLaterWins() {
    List<Object> results = List.of(Map.of("a", 1), Map.of("b", 2), Map.of("a", 3, "c", 4));

    assertEquals(Map.of("a", 3, "b", 2, "c", 4), Aggregators.mergeMaps().aggregate(results));
  }

  @Test
  void mergeMapsSkipsNonMaps() {
    List<Object> results = Arrays.asList(Map.of("a", 1), "ignored", null, 42, Map.of("b", 2));

    assertEquals(Map.of("a", 1, "b", 2), Aggregators.mergeMaps().aggregate(results));
  }

  @Test
  void mergeMapsOfNothingIsEmpty() {
    assertTrue(Aggregators.mergeMaps().aggregate(List.of()).isEmpty());
  }

  @Test
  void firstNonNullReturnsFalsyPresentValue() {
    List<Object> results = Arrays.asList(null, false, "value", "other");

    assertEquals(Optional.of(false), Aggregators.firstNonNull().aggregate(results));
  }

  @Test
  void firstNonNullTreatsEmptyStringAsPresent() {
    assertEquals(Optional.of(""), Aggregators.firstNonNull().aggregate(Arrays.asList(null, "", "x")));
  }

  @Test
  void firstNonNullIsEmptyWhenAllAbsent() {
    assertEquals(Optional.empty(), Aggregators.firstNonNull().aggregate(Arrays.asList(null, null, null)));
    assertEquals(Optional.empty(), Aggregators.firstNonNull().aggregate(List.of()));
  }

  @Test
  void collectAllIsIdentity() {
    List<Object> results = List.of(1, "two", Map.of("three", 3));

    assertSame(results, Aggregators.collectAll().aggregate(results));
  }

  @Test
  void resultsAreNotModified() {
    List<Object> results = Arrays.asList(List.of(1), Map.of("k", "v"), 2);
    List<Object> copy = List.copyOf(Arrays.asList(List.of(1), Map.of("k", "v"), 2));

    Aggregators.flatten().aggregate(results);
    Aggregators.mergeMaps().aggregate(results);
    Aggregators.firstNonNull().aggregate(results);

    assertEquals(copy, results);
  }
}
