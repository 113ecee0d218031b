/**
 * Fan-out dispatch of hook invocations with per-handler failure isolation.
 *
 * <h2>Invocation Flow</h2>
 * <ol>
 *   <li>{@link hookpoint.dispatch.HookDispatcher} snapshots the registrations of the hook name</li>
 *   <li>Each handler is called in order on the invoking thread, wrapped by
 *       {@link hookpoint.dispatch.HookInterceptor}s</li>
 *   <li>Return values are collected; a throwing handler is logged and skipped</li>
 *   <li>Optionally, an {@linkplain hookpoint.aggregate.Aggregator aggregator} folds the results;
 *       its failures surface as {@link hookpoint.dispatch.AggregationException}</li>
 * </ol>
 *
 * <p>Handlers registered while an invocation is running are not seen by that invocation.
 *
 * @see hookpoint.dispatch.HookDispatcher
 * @see hookpoint.dispatch.HookInterceptor
 */
package hookpoint.dispatch;
