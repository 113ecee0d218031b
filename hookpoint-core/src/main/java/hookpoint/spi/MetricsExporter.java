package hookpoint.spi;

/**
 * Observability hook for exporting dispatch counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of hook invocations, whether or not any handler is registered.
   */
  void incrementInvocation();

  /**
   * Increments the count of handlers that returned normally.
   */
  void incrementHandlerSuccess();

  /**
   * Increments the count of handlers that threw and were skipped.
   */
  void incrementHandlerFailure();

  /**
   * Increments the count of aggregations that failed and were surfaced to the caller.
   */
  void incrementAggregationFailure();

  /**
   * Records the time spent executing one handler.
   *
   * @param durationNanos handler execution time in nanoseconds (always non-negative)
   */
  default void recordHandlerDurationNanos(long durationNanos) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementInvocation() {
    }

    @Override
    public void incrementHandlerSuccess() {
    }

    @Override
    public void incrementHandlerFailure() {
    }

    @Override
    public void incrementAggregationFailure() {
    }
  }
}
