package hookpoint.aggregate;

import java.util.List;

/**
 * Folds the ordered results of one hook invocation into a single value.
 *
 * <p>Aggregators are pure: they must not retain or modify the list they receive, and they
 * must accept the empty list. They may throw when results have the wrong shape; the
 * dispatcher surfaces such failures to its caller as
 * {@link hookpoint.dispatch.AggregationException}.
 *
 * @param <R> the aggregated result type
 * @see Aggregators
 */
@FunctionalInterface
public interface Aggregator<R> {

  /**
   * @param results handler results in registration order, may contain {@code null}
   * @return the aggregated value
   */
  R aggregate(List<Object> results);
}
