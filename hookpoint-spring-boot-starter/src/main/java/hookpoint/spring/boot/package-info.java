/**
 * Spring Boot auto-configuration and annotation-driven handler registration.
 *
 * <p>Annotate {@link hookpoint.HookHandler} beans with
 * {@link hookpoint.spring.boot.HookComponent} and inject the
 * {@link hookpoint.dispatch.HookDispatcher} wherever the hook is invoked.
 *
 * @see hookpoint.spring.boot.HookpointAutoConfiguration
 * @see hookpoint.spring.boot.HookpointProperties
 */
package hookpoint.spring.boot;
