package hookpoint.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a handler for a hook.
 *
 * <p>The annotated bean must implement {@link hookpoint.HookHandler}. It is registered once all
 * singletons are instantiated, so handlers are in place before the application starts serving.
 *
 * <pre>{@code
 * @Component
 * @HookComponent(hook = "dashboard.widgets", owner = "sales")
 * public class SalesWidgets implements HookHandler {
 *   public Object handle(HookContext context) { ... }
 * }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>An empty {@code hook} falls back to the bean name</li>
 *   <li>An empty {@code owner} is derived by the context's {@link hookpoint.OwnerResolver}</li>
 * </ul>
 *
 * @see hookpoint.HookHandler
 * @see HookComponentRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface HookComponent {

    /**
     * Hook name. Defaults to the bean name.
     */
    String hook() default "";

    /**
     * Owner id. Defaults to the value derived by the {@link hookpoint.OwnerResolver} bean.
     */
    String owner() default "";
}
