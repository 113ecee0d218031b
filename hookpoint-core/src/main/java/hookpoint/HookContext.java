package hookpoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable argument bundle passed to every handler of one hook invocation.
 *
 * <p>A context carries ordered positional arguments and insertion-ordered named arguments.
 * Both may hold {@code null} values; names may not be {@code null}. Each handler reads the
 * fields it needs and ignores the rest.
 *
 * <pre>{@code
 * HookContext ctx = HookContext.builder()
 *     .arg(order)
 *     .put("currency", "EUR")
 *     .build();
 *
 * Order order = ctx.arg(0, Order.class);
 * String currency = ctx.get("currency", String.class);
 * }</pre>
 *
 * @see HookHandler
 */
public final class HookContext {
  private static final HookContext EMPTY = new HookContext(Collections.emptyList(), Collections.emptyMap());

  private final List<Object> args;
  private final Map<String, Object> named;

  private HookContext(List<Object> args, Map<String, Object> named) {
    this.args = args;
    this.named = named;
  }

  /**
   * Returns the context with no arguments.
   */
  public static HookContext empty() {
    return EMPTY;
  }

  /**
   * Creates a context holding the given positional arguments.
   *
   * @param args positional arguments, may contain {@code null}
   * @return a new context, or {@link #empty()} when no arguments are given
   */
  public static HookContext of(Object... args) {
    if (args == null || args.length == 0) {
      return EMPTY;
    }
    return new HookContext(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))),
        Collections.emptyMap());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the positional arguments as an unmodifiable list.
   */
  public List<Object> args() {
    return args;
  }

  /**
   * Returns the positional argument at {@code index}.
   *
   * @throws IndexOutOfBoundsException if there is no argument at that position
   */
  public Object arg(int index) {
    return args.get(index);
  }

  /**
   * Returns the positional argument at {@code index} cast to {@code type}.
   *
   * @throws IndexOutOfBoundsException if there is no argument at that position
   * @throws IllegalArgumentException if the argument is not an instance of {@code type}
   */
  public <T> T arg(int index, Class<T> type) {
    return cast("argument " + index, args.get(index), type);
  }

  /**
   * Returns the named arguments as an unmodifiable, insertion-ordered map.
   */
  public Map<String, Object> named() {
    return named;
  }

  /**
   * Returns the named argument, or {@code null} if it is absent.
   */
  public Object get(String name) {
    return named.get(name);
  }

  /**
   * Returns the named argument cast to {@code type}, or {@code null} if it is absent.
   *
   * @throws IllegalArgumentException if the argument is not an instance of {@code type}
   */
  public <T> T get(String name, Class<T> type) {
    return cast("argument '" + name + "'", named.get(name), type);
  }

  public boolean has(String name) {
    return named.containsKey(name);
  }

  /**
   * Returns the number of positional and named arguments together.
   */
  public int size() {
    return args.size() + named.size();
  }

  private static <T> T cast(String label, Object value, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(label + " is " + value.getClass().getName()
          + ", expected " + type.getName());
    }
    return type.cast(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof HookContext other)) return false;
    return args.equals(other.args) && named.equals(other.named);
  }

  @Override
  public int hashCode() {
    return Objects.hash(args, named);
  }

  @Override
  public String toString() {
    return "HookContext{args=" + args + ", named=" + named + '}';
  }

  /** Builder for {@link HookContext}. */
  public static final class Builder {
    private final List<Object> args = new ArrayList<>();
    private final Map<String, Object> named = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Appends one positional argument.
     *
     * @param value the argument, may be {@code null}
     * @return this builder
     */
    public Builder arg(Object value) {
      args.add(value);
      return this;
    }

    /**
     * Appends several positional arguments in order.
     *
     * @param values the arguments, may contain {@code null}
     * @return this builder
     */
    public Builder args(Object... values) {
      Objects.requireNonNull(values, "values");
      args.addAll(Arrays.asList(values));
      return this;
    }

    /**
     * Sets a named argument, replacing any earlier value under the same name.
     *
     * @param name the argument name, not {@code null}
     * @param value the argument, may be {@code null}
     * @return this builder
     */
    public Builder put(String name, Object value) {
      named.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    /**
     * Copies every entry of {@code values} as named arguments.
     *
     * @param values the named arguments
     * @return this builder
     * @throws NullPointerException if {@code values} or any key is {@code null}
     */
    public Builder putAll(Map<String, ?> values) {
      Objects.requireNonNull(values, "values");
      values.forEach(this::put);
      return this;
    }

    public HookContext build() {
      if (args.isEmpty() && named.isEmpty()) {
        return EMPTY;
      }
      List<Object> argsCopy = args.isEmpty()
          ? Collections.emptyList()
          : Collections.unmodifiableList(new ArrayList<>(args));
      Map<String, Object> namedCopy = named.isEmpty()
          ? Collections.emptyMap()
          : Collections.unmodifiableMap(new LinkedHashMap<>(named));
      return new HookContext(argsCopy, namedCopy);
    }
  }
}
