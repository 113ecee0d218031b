package hookpoint;

/**
 * One implementation of a named hook.
 *
 * <p>Components register handlers under a hook name during their own initialization; a
 * {@linkplain hookpoint.dispatch.HookDispatcher dispatcher} later calls every handler of that
 * name with the same {@link HookContext} and collects the return values.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run <b>synchronously</b> and sequentially on the invoking thread, in
 * registration order. A slow handler delays the whole invocation.
 *
 * <h2>Error Handling</h2>
 * <p>If a handler throws, the exception is logged with the hook name and owner, the handler
 * contributes no result, and the remaining handlers still run. Exceptions never reach the
 * caller of {@code invoke}.
 *
 * <h2>Identity</h2>
 * <p>Registrations are deduplicated by handler <em>identity</em>. Registering the same
 * instance twice is a no-op; two distinct lambdas with the same body are two handlers.
 *
 * <h2>Example Implementations</h2>
 * <pre>{@code
 * registry.register("menu.items", ctx -> List.of("Orders", "Invoices"), "billing");
 *
 * registry.register("order.total", ctx -> {
 *   Order order = ctx.arg(0, Order.class);
 *   return order.shippingCost();
 * }, "shipping");
 * }</pre>
 *
 * @see hookpoint.registry.HookRegistry
 * @see hookpoint.dispatch.HookDispatcher
 */
@FunctionalInterface
public interface HookHandler {

  /**
   * Handles one invocation of the hook this handler is registered under.
   *
   * @param context the arguments shared by every handler of this invocation
   * @return the handler's contribution, may be {@code null}
   * @throws Exception if handling fails; the failure is isolated to this handler
   */
  Object handle(HookContext context) throws Exception;
}
