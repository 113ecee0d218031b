package hookpoint;

import java.util.Objects;

/**
 * Association of one {@link HookHandler} with the component that registered it.
 *
 * <p>Two registrations are equal when their owner ids are equal and they hold the
 * <em>same handler instance</em>. Handler {@code equals} is never consulted, so distinct
 * lambdas with identical behaviour are never duplicates of each other.
 *
 * @param ownerId identifier of the registering component, used in diagnostics
 * @param handler the handler implementation
 */
public record Registration(String ownerId, HookHandler handler) {

  public Registration {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(handler, "handler");
    if (ownerId.isEmpty()) {
      throw new IllegalArgumentException("ownerId cannot be empty");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Registration other)) return false;
    return ownerId.equals(other.ownerId) && handler == other.handler;
  }

  @Override
  public int hashCode() {
    return 31 * ownerId.hashCode() + System.identityHashCode(handler);
  }

  @Override
  public String toString() {
    return "Registration{ownerId=" + ownerId + ", handler=" + handler.getClass().getName() + '}';
  }
}
