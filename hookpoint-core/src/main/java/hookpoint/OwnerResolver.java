package hookpoint;

/**
 * Derives an owner id for a handler registered without one.
 *
 * <p>This is a convenience layered over the registry, which itself always requires an
 * explicit owner. Components that care about stable diagnostics should pass their own id.
 *
 * @see hookpoint.dispatch.HookDispatcher#registerHook(String, HookHandler)
 */
@FunctionalInterface
public interface OwnerResolver {

  /**
   * Resolves to the package of the class that defines the handler. Lambdas and method
   * references resolve to the package of their enclosing class. Handlers declared in the
   * unnamed package resolve to their class name.
   */
  OwnerResolver PACKAGE = handler -> {
    Class<?> type = handler.getClass();
    String packageName = type.getPackageName();
    if (!packageName.isEmpty()) {
      return packageName;
    }
    String name = type.getName();
    int lambdaMarker = name.indexOf("$$Lambda");
    return lambdaMarker > 0 ? name.substring(0, lambdaMarker) : name;
  };

  /**
   * Returns the owner id for {@code handler}.
   *
   * @param handler the handler being registered
   * @return a non-empty owner id
   */
  String resolve(HookHandler handler);
}
