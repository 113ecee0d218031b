package hookpoint.dispatch;

/**
 * Cross-cutting hook for observing handler calls.
 *
 * <p>Interceptors run around each handler call:
 * <ol>
 *   <li>{@link #beforeInvoke} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterInvoke} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeInvoke} throws, the handler is skipped and the call counts as a
 * failure of that handler only. {@code afterInvoke} exceptions are logged
 * but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * HookDispatcher.builder()
 *     .registry(registry)
 *     .interceptor(HookInterceptor.before(call ->
 *         audit.log(call.hookName(), call.ownerId())))
 *     .interceptor(HookInterceptor.after((call, result, error) -> {
 *         if (error != null) alerts.raise(call.ownerId(), error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface HookInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @param invocation the handler call about to happen
     * @throws Exception to skip the handler and record a failure for it
     */
    default void beforeInvoke(HookInvocation invocation) throws Exception {
    }

    /**
     * Called after the handler returned or failed (or after a beforeInvoke failure).
     *
     * @param invocation the handler call
     * @param result the handler's return value, null on failure
     * @param error null on success, the exception on failure
     */
    default void afterInvoke(HookInvocation invocation, Object result, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeInvoke hook.
     */
    static HookInterceptor before(BeforeHook hook) {
        return new HookInterceptor() {
            @Override
            public void beforeInvoke(HookInvocation invocation) throws Exception {
                hook.accept(invocation);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterInvoke hook.
     */
    static HookInterceptor after(AfterHook hook) {
        return new HookInterceptor() {
            @Override
            public void afterInvoke(HookInvocation invocation, Object result, Exception error) {
                hook.accept(invocation, result, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(HookInvocation invocation) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(HookInvocation invocation, Object result, Exception error);
    }
}
