package hookpoint.registry;

import hookpoint.HookHandler;
import hookpoint.Registration;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table of hook handlers keyed by hook name.
 *
 * <p>The dispatcher reads this registry on every invocation. Handlers are returned in
 * registration order and executed sequentially. Registering an equal
 * {@link Registration} twice under the same name is a silent no-op.
 *
 * <h2>Lifecycle</h2>
 * <p>A registry starts empty. Components add registrations during their initialization and
 * registrations normally live as long as the registry. {@link #clear()} exists for test
 * isolation.
 *
 * @see DefaultHookRegistry
 * @see Registration
 */
public interface HookRegistry {

  /**
   * Registers a handler for a hook name on behalf of an owner.
   *
   * <p>If an equal registration (same owner id, same handler instance) already exists for
   * {@code hookName}, this call has no effect.
   *
   * @param hookName the hook name, not empty
   * @param handler the handler
   * @param ownerId identifier of the registering component, not empty
   * @return this registry, for chaining
   * @throws NullPointerException if any argument is {@code null}
   * @throws IllegalArgumentException if {@code hookName} or {@code ownerId} is empty
   */
  HookRegistry register(String hookName, HookHandler handler, String ownerId);

  /**
   * Returns the registrations for the given hook name in registration order.
   *
   * @param hookName the hook name to look up
   * @return immutable snapshot, empty for an unknown name
   */
  List<Registration> hooksFor(String hookName);

  /**
   * Returns a snapshot of the whole table. Intended for tooling and tests.
   *
   * @return immutable map of hook name to immutable registration list
   */
  Map<String, List<Registration>> all();

  /**
   * Returns the names that currently have at least one registration.
   *
   * @return immutable snapshot of hook names in first-registration order
   */
  Set<String> hookNames();

  /**
   * Removes every registration.
   */
  void clear();
}
