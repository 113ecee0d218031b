/**
 * Root API for hookpoint: named extension points that any number of components implement and
 * that a caller invokes once to collect every implementation's result.
 *
 * <h2>Core Design</h2>
 * <p>Components register {@link hookpoint.HookHandler handlers} under a hook name in a
 * {@linkplain hookpoint.registry.HookRegistry registry}, each tagged with an owner id. A
 * {@linkplain hookpoint.dispatch.HookDispatcher dispatcher} calls every handler of a name in
 * registration order with one shared {@link hookpoint.HookContext}. A failing handler is logged
 * and skipped; the others still contribute. {@linkplain hookpoint.aggregate.Aggregators
 * Aggregators} fold the ordered results into a single value.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>hookpoint-core</b>: registry, dispatcher, aggregators (zero external deps)</li>
 *   <li><b>hookpoint-micrometer</b>: {@linkplain hookpoint.spi.MetricsExporter metrics}
 *       bridge to Micrometer</li>
 *   <li><b>hookpoint-spring-boot-starter</b>: auto-configuration and
 *       annotation-driven registration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var registry = new DefaultHookRegistry()
 *     .register("dashboard.widgets", ctx -> List.of("orders", "revenue"), "sales")
 *     .register("dashboard.widgets", ctx -> "tickets", "support");
 *
 * var dispatcher = HookDispatcher.builder()
 *     .registry(registry)
 *     .build();
 *
 * List<Object> raw = dispatcher.invoke("dashboard.widgets");
 * List<Object> widgets = dispatcher.invokeAggregate("dashboard.widgets", Aggregators.flatten());
 * // widgets = [orders, revenue, tickets]
 * }</pre>
 *
 * @see hookpoint.HookHandler
 * @see hookpoint.HookContext
 * @see hookpoint.Registration
 * @see hookpoint.OwnerResolver
 */
package hookpoint;
