package hookpoint.dispatch;

import hookpoint.HookContext;
import hookpoint.HookHandler;
import hookpoint.OwnerResolver;
import hookpoint.Registration;
import hookpoint.aggregate.Aggregator;
import hookpoint.registry.HookRegistry;
import hookpoint.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes every handler registered under a hook name and collects their results.
 *
 * <p>Each invocation reads a snapshot of the registrations from the {@link HookRegistry} and
 * calls the handlers sequentially on the calling thread, in registration order. A handler that
 * throws is logged with the hook name and owner id, contributes no result, and does not stop
 * the remaining handlers. Invoking a name with no registrations yields an empty result.
 *
 * <p>Create instances via {@link #builder()}. The dispatcher holds no per-call state and is
 * safe to share between threads.
 *
 * <pre>{@code
 * HookDispatcher dispatcher = HookDispatcher.builder()
 *     .registry(registry)
 *     .build();
 *
 * List<Object> badges = dispatcher.invoke("profile.badges", user);
 * Number fees = dispatcher.invokeAggregate("cart.fees", Aggregators.sum(), cart);
 * }</pre>
 *
 * @see HookDispatcher.Builder
 * @see HookInterceptor
 * @see hookpoint.aggregate.Aggregators
 */
public final class HookDispatcher {
  private static final Logger logger = Logger.getLogger(HookDispatcher.class.getName());

  private final HookRegistry registry;
  private final MetricsExporter metrics;
  private final List<HookInterceptor> interceptors;
  private final OwnerResolver ownerResolver;

  private HookDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.ownerResolver = builder.ownerResolver != null ? builder.ownerResolver : OwnerResolver.PACKAGE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Invokes a hook with positional arguments.
   *
   * @see #invoke(String, HookContext)
   */
  public List<Object> invoke(String hookName, Object... args) {
    return invoke(hookName, HookContext.of(args));
  }

  /**
   * Calls every handler registered under {@code hookName} and returns their results.
   *
   * @param hookName the hook to invoke
   * @param context arguments passed to every handler
   * @return unmodifiable list of results from handlers that returned normally, in
   *     registration order; may contain {@code null}; empty for an unknown hook
   */
  public List<Object> invoke(String hookName, HookContext context) {
    List<Outcome> outcomes = dispatch(hookName, context);
    List<Object> results = new ArrayList<>(outcomes.size());
    for (Outcome outcome : outcomes) {
      results.add(outcome.result());
    }
    return Collections.unmodifiableList(results);
  }

  /**
   * Invokes a hook with positional arguments and aggregates the results.
   *
   * @see #invokeAggregate(String, Aggregator, HookContext)
   */
  public <R> R invokeAggregate(String hookName, Aggregator<R> aggregator, Object... args) {
    return invokeAggregate(hookName, aggregator, HookContext.of(args));
  }

  /**
   * Invokes a hook and folds the results with {@code aggregator}.
   *
   * @param hookName the hook to invoke
   * @param aggregator folds the ordered results into one value
   * @param context arguments passed to every handler
   * @return the aggregated value
   * @throws AggregationException if the aggregator rejects the results
   */
  public <R> R invokeAggregate(String hookName, Aggregator<R> aggregator, HookContext context) {
    Objects.requireNonNull(aggregator, "aggregator");
    List<Object> results = invoke(hookName, context);
    try {
      return aggregator.aggregate(results);
    } catch (AggregationException e) {
      metrics.incrementAggregationFailure();
      throw e;
    } catch (RuntimeException e) {
      metrics.incrementAggregationFailure();
      throw new AggregationException(hookName, e);
    }
  }

  /**
   * Invokes a hook and returns results keyed by owner id.
   *
   * <p>Owners appear in the order of their first registration. If one owner registered
   * several handlers for the hook, the result of its last successful handler is kept.
   *
   * @param hookName the hook to invoke
   * @param context arguments passed to every handler
   * @return unmodifiable map of owner id to result; values may be {@code null}
   */
  public Map<String, Object> invokeByOwner(String hookName, HookContext context) {
    Map<String, Object> results = new LinkedHashMap<>();
    for (Outcome outcome : dispatch(hookName, context)) {
      results.put(outcome.registration().ownerId(), outcome.result());
    }
    return Collections.unmodifiableMap(results);
  }

  /**
   * Registers a handler on behalf of {@code ownerId}.
   *
   * @see HookRegistry#register(String, HookHandler, String)
   */
  public void registerHook(String hookName, HookHandler handler, String ownerId) {
    registry.register(hookName, handler, ownerId);
  }

  /**
   * Registers a handler under the owner id derived by the configured {@link OwnerResolver}.
   */
  public void registerHook(String hookName, HookHandler handler) {
    Objects.requireNonNull(handler, "handler");
    registry.register(hookName, handler, ownerResolver.resolve(handler));
  }

  /**
   * Returns the current registrations for {@code hookName} in registration order.
   */
  public List<Registration> getHookImplementations(String hookName) {
    return registry.hooksFor(hookName);
  }

  private List<Outcome> dispatch(String hookName, HookContext context) {
    Objects.requireNonNull(hookName, "hookName");
    Objects.requireNonNull(context, "context");
    metrics.incrementInvocation();

    List<Registration> registrations = registry.hooksFor(hookName);
    if (registrations.isEmpty()) {
      return Collections.emptyList();
    }

    List<Outcome> outcomes = new ArrayList<>(registrations.size());
    for (Registration registration : registrations) {
      HookInvocation invocation = new HookInvocation(hookName, registration, context);
      long start = System.nanoTime();
      try {
        Object result = call(invocation);
        outcomes.add(new Outcome(registration, result));
        metrics.incrementHandlerSuccess();
      } catch (Exception e) {
        metrics.incrementHandlerFailure();
        logger.log(Level.SEVERE, "Error executing hook " + hookName + " in owner "
            + registration.ownerId() + ": " + e.getMessage(), e);
      } finally {
        metrics.recordHandlerDurationNanos(Math.max(0L, System.nanoTime() - start));
      }
    }
    return outcomes;
  }

  private Object call(HookInvocation invocation) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeInvoke(invocation);
        completedBefore = i + 1;
      }

      Object result = invocation.registration().handler().handle(invocation.context());

      runAfterInvoke(invocation, result, null, completedBefore);
      return result;
    } catch (Exception e) {
      runAfterInvoke(invocation, null, e, completedBefore);
      throw e;
    }
  }

  private void runAfterInvoke(HookInvocation invocation, Object result, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterInvoke(invocation, result, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterInvoke failed for hook " + invocation.hookName(), ex);
      }
    }
  }

  private record Outcome(Registration registration, Object result) {}

  /** Builder for {@link HookDispatcher}. */
  public static final class Builder {
    private HookRegistry registry;
    private MetricsExporter metrics;
    private final List<HookInterceptor> interceptors = new ArrayList<>();
    private OwnerResolver ownerResolver;

    private Builder() {}

    /**
     * Sets the registry that maps hook names to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param registry the hook registry
     * @return this builder
     */
    public Builder registry(HookRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter for recording invocation and handler counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a single interceptor around handler calls.
     *
     * <p>Optional. Interceptors are invoked in registration order before each handler,
     * and in reverse order after it.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(HookInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends multiple interceptors around handler calls.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<HookInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Sets how owner ids are derived for {@link HookDispatcher#registerHook(String, HookHandler)}.
     *
     * <p>Optional. Defaults to {@link OwnerResolver#PACKAGE}.
     *
     * @param ownerResolver the owner resolver
     * @return this builder
     */
    public Builder ownerResolver(OwnerResolver ownerResolver) {
      this.ownerResolver = ownerResolver;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link HookDispatcher}
     * @throws NullPointerException if {@code registry} is null
     */
    public HookDispatcher build() {
      return new HookDispatcher(this);
    }
  }
}
