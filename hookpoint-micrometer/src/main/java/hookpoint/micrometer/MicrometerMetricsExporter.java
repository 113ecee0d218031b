package hookpoint.micrometer;

import hookpoint.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code hookpoint.invoke}: hook invocations</li>
 *   <li>{@code hookpoint.handler.success}: handlers that returned normally</li>
 *   <li>{@code hookpoint.handler.failure}: handlers that threw and were skipped</li>
 *   <li>{@code hookpoint.aggregate.failure}: aggregations surfaced as errors</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code hookpoint.handler.duration}: time spent in each handler</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter invocations;
  private final Counter handlerSuccess;
  private final Counter handlerFailure;
  private final Counter aggregationFailure;
  private final Timer handlerDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "hookpoint"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "hookpoint");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "checkout.hooks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.invocations = Counter.builder(namePrefix + ".invoke")
        .description("Hook invocations")
        .register(registry);
    this.handlerSuccess = Counter.builder(namePrefix + ".handler.success")
        .description("Handlers that returned normally")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Handlers that threw and were skipped")
        .register(registry);
    this.aggregationFailure = Counter.builder(namePrefix + ".aggregate.failure")
        .description("Aggregations that failed")
        .register(registry);
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Time spent executing a single handler")
        .register(registry);
  }

  @Override
  public void incrementInvocation() {
    if (closed) return;
    invocations.increment();
  }

  @Override
  public void incrementHandlerSuccess() {
    if (closed) return;
    handlerSuccess.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementAggregationFailure() {
    if (closed) return;
    aggregationFailure.increment();
  }

  @Override
  public void recordHandlerDurationNanos(long durationNanos) {
    if (closed) return;
    handlerDuration.record(durationNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(invocations, handlerSuccess, handlerFailure,
        aggregationFailure, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
