package hookpoint.aggregate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in {@link Aggregator} implementations.
 *
 * <p>Aggregators that expect a particular result shape check it at runtime. {@link #sum()}
 * rejects anything that is not a number; {@link #mergeMaps()} skips anything that is not a
 * map; {@link #flatten()} treats anything but a list as a single element.
 *
 * <pre>{@code
 * Number total = dispatcher.invokeAggregate("cart.fees", Aggregators.sum(), cart);
 * Map<Object, Object> settings = dispatcher.invokeAggregate("app.settings", Aggregators.mergeMaps());
 * }</pre>
 */
public final class Aggregators {

  private static final Aggregator<Number> SUM = Aggregators::sum;
  private static final Aggregator<List<Object>> FLATTEN = Aggregators::flatten;
  private static final Aggregator<Map<Object, Object>> MERGE_MAPS = Aggregators::mergeMaps;
  private static final Aggregator<Optional<Object>> FIRST_NON_NULL = Aggregators::firstNonNull;
  private static final Aggregator<List<Object>> COLLECT_ALL = results -> results;

  private Aggregators() {}

  /**
   * Arithmetic sum of numeric results.
   *
   * <p>{@code Byte}, {@code Short}, {@code Integer} and {@code Long} values sum to a
   * {@code Long}; overflow throws {@link ArithmeticException}. A {@code Float} or
   * {@code Double} anywhere widens the result to {@code Double}; a {@code BigInteger} or
   * {@code BigDecimal} anywhere widens it to {@code BigDecimal}. The sum of no results is
   * {@code 0L}. If the floating-point part is NaN or infinite the result stays a
   * {@code Double}, since no {@code BigDecimal} can hold it.
   *
   * @throws IllegalArgumentException when applied to a {@code null} or non-numeric result
   */
  public static Aggregator<Number> sum() {
    return SUM;
  }

  /**
   * Splices {@link List} results into one list, in order; other results, including
   * {@code null} and non-list collections such as sets, are appended as single elements.
   */
  public static Aggregator<List<Object>> flatten() {
    return FLATTEN;
  }

  /**
   * Merges {@link Map} results in order; on a key collision the later result wins. Results
   * that are not maps are skipped.
   */
  public static Aggregator<Map<Object, Object>> mergeMaps() {
    return MERGE_MAPS;
  }

  /**
   * First result that is not {@code null}. Falsy values such as {@code Boolean.FALSE},
   * {@code ""} or {@code 0} count as present. Empty when every result is {@code null}.
   */
  public static Aggregator<Optional<Object>> firstNonNull() {
    return FIRST_NON_NULL;
  }

  /**
   * Identity: returns the result list unchanged.
   */
  public static Aggregator<List<Object>> collectAll() {
    return COLLECT_ALL;
  }

  private static Number sum(List<Object> results) {
    long longSum = 0L;
    double doubleSum = 0.0;
    BigDecimal decimalSum = BigDecimal.ZERO;
    boolean floating = false;
    boolean big = false;

    for (Object result : results) {
      if (result instanceof Byte || result instanceof Short
          || result instanceof Integer || result instanceof Long) {
        longSum = Math.addExact(longSum, ((Number) result).longValue());
      } else if (result instanceof Float || result instanceof Double) {
        doubleSum += ((Number) result).doubleValue();
        floating = true;
      } else if (result instanceof BigInteger bigInteger) {
        decimalSum = decimalSum.add(new BigDecimal(bigInteger));
        big = true;
      } else if (result instanceof BigDecimal bigDecimal) {
        decimalSum = decimalSum.add(bigDecimal);
        big = true;
      } else {
        throw new IllegalArgumentException("sum requires numeric results, got "
            + (result == null ? "null" : result.getClass().getName()));
      }
    }

    if (floating && !Double.isFinite(doubleSum)) {
      return doubleSum;
    }
    if (big) {
      BigDecimal total = decimalSum.add(BigDecimal.valueOf(longSum));
      return floating ? total.add(BigDecimal.valueOf(doubleSum)) : total;
    }
    if (floating) {
      return doubleSum + longSum;
    }
    return longSum;
  }

  private static List<Object> flatten(List<Object> results) {
    List<Object> flat = new ArrayList<>();
    for (Object result : results) {
      if (result instanceof List<?> list) {
        flat.addAll(list);
      } else {
        flat.add(result);
      }
    }
    return Collections.unmodifiableList(flat);
  }

  private static Map<Object, Object> mergeMaps(List<Object> results) {
    Map<Object, Object> merged = new LinkedHashMap<>();
    for (Object result : results) {
      if (result instanceof Map<?, ?> map) {
        merged.putAll(map);
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  private static Optional<Object> firstNonNull(List<Object> results) {
    for (Object result : results) {
      if (result != null) {
        return Optional.of(result);
      }
    }
    return Optional.empty();
  }
}
