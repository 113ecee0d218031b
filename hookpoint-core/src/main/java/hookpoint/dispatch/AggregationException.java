package hookpoint.dispatch;

/**
 * Thrown by {@link HookDispatcher#invokeAggregate} when the aggregator rejects the collected
 * results, typically because the aggregator does not fit the hook's result type.
 *
 * <p>Unlike handler failures, this is surfaced to the caller.
 */
public class AggregationException extends RuntimeException {

  private final String hookName;

  public AggregationException(String hookName, Throwable cause) {
    super("Aggregation failed for hook " + hookName + ": " + cause.getMessage(), cause);
    this.hookName = hookName;
  }

  public String hookName() {
    return hookName;
  }
}
