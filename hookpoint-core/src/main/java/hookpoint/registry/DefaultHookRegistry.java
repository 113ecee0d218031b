package hookpoint.registry;

import hookpoint.HookHandler;
import hookpoint.Registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe, in-memory {@link HookRegistry}.
 *
 * <p>Handlers under one hook name keep their registration order. Duplicate registrations
 * (same owner id and same handler instance) are ignored.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHookRegistry registry = new DefaultHookRegistry()
 *     .register("order.validators", ctx -> checkStock(ctx), "inventory")
 *     .register("order.validators", ctx -> checkCredit(ctx), "billing");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>A single read/write lock guards the table. {@code register} and {@code clear} take the
 * write lock; lookups take the read lock and return copies, so a reader never sees a
 * partially applied registration and callers cannot mutate the table through a result.
 *
 * @see HookRegistry
 */
public final class DefaultHookRegistry implements HookRegistry {
  private static final Logger logger = Logger.getLogger(DefaultHookRegistry.class.getName());

  private final Map<String, List<Registration>> hooks = new LinkedHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /**
   * Registers a handler and returns this registry for chaining.
   *
   * @see HookRegistry#register(String, HookHandler, String)
   */
  @Override
  public DefaultHookRegistry register(String hookName, HookHandler handler, String ownerId) {
    requireHookName(hookName);
    Registration registration = new Registration(ownerId, handler);

    lock.writeLock().lock();
    try {
      List<Registration> registrations = hooks.computeIfAbsent(hookName, ignored -> new ArrayList<>());
      if (registrations.contains(registration)) {
        logger.log(Level.FINE, "Ignoring duplicate registration of hook {0} by {1}",
            new Object[] {hookName, ownerId});
        return this;
      }
      registrations.add(registration);
    } finally {
      lock.writeLock().unlock();
    }
    return this;
  }

  @Override
  public List<Registration> hooksFor(String hookName) {
    lock.readLock().lock();
    try {
      List<Registration> registrations = hooks.get(hookName);
      if (registrations == null || registrations.isEmpty()) {
        return Collections.emptyList();
      }
      return List.copyOf(registrations);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Map<String, List<Registration>> all() {
    lock.readLock().lock();
    try {
      Map<String, List<Registration>> snapshot = new LinkedHashMap<>();
      hooks.forEach((name, registrations) -> snapshot.put(name, List.copyOf(registrations)));
      return Collections.unmodifiableMap(snapshot);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Set<String> hookNames() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableSet(new LinkedHashSet<>(hooks.keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void clear() {
    lock.writeLock().lock();
    try {
      hooks.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private static void requireHookName(String hookName) {
    Objects.requireNonNull(hookName, "hookName");
    if (hookName.isEmpty()) {
      throw new IllegalArgumentException("hookName cannot be empty");
    }
  }
}
