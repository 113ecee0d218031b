package hookpoint.dispatch;

import hookpoint.HookContext;
import hookpoint.Registration;

import java.util.Objects;

/**
 * One handler call within a hook invocation, as seen by {@link HookInterceptor}s.
 *
 * @param hookName the invoked hook
 * @param registration the registration whose handler is being called
 * @param context the arguments of the invocation
 */
public record HookInvocation(String hookName, Registration registration, HookContext context) {

  public HookInvocation {
    Objects.requireNonNull(hookName, "hookName");
    Objects.requireNonNull(registration, "registration");
    Objects.requireNonNull(context, "context");
  }

  public String ownerId() {
    return registration.ownerId();
  }
}
