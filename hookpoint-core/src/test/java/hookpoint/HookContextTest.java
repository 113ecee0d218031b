package hookpoint;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HookContextTest {

  @Test
  void emptyContextHasNoArguments() {
    HookContext ctx = HookContext.empty();

    assertTrue(ctx.args().isEmpty());
    assertTrue(ctx.named().isEmpty());
    assertEquals(0, ctx.size());
    assertSame(ctx, HookContext.of());
    assertSame(ctx, HookContext.builder().build());
  }

  @Test
  void sizeCountsPositionalAndNamedArguments() {
    HookContext ctx = HookContext.builder().arg("user").arg(null).put("locale", "en").build();

    assertEquals(3, ctx.size());
  }

  @Test
  void positionalArgumentsKeepOrderAndNulls() {
    HookContext ctx = HookContext.of("value", null, 42);

    assertEquals(Arrays.asList("value", null, 42), ctx.args());
    assertEquals("value", ctx.arg(0));
    assertNull(ctx.arg(1));
    assertEquals(42, ctx.arg(2, Integer.class));
  }

  @Test
  void typedAccessRejectsWrongType() {
    HookContext ctx = HookContext.builder().arg("text").put("count", 3).build();

    IllegalArgumentException positional = assertThrows(IllegalArgumentException.class,
        () -> ctx.arg(0, Integer.class));
    assertTrue(positional.getMessage().contains("argument 0"));

    IllegalArgumentException named = assertThrows(IllegalArgumentException.class,
        () -> ctx.get("count", String.class));
    assertTrue(named.getMessage().contains("'count'"));
  }

  @Test
  void outOfRangePositionalAccessThrows() {
    HookContext ctx = HookContext.of("only");

    assertThrows(IndexOutOfBoundsException.class, () -> ctx.arg(1));
  }

  @Test
  void namedArgumentsKeepInsertionOrder() {
    HookContext ctx = HookContext.builder()
        .put("b", 2)
        .put("a", 1)
        .put("missing", null)
        .build();

    assertEquals(List.of("b", "a", "missing"), List.copyOf(ctx.named().keySet()));
    assertEquals(1, ctx.get("a", Integer.class));
    assertTrue(ctx.has("missing"));
    assertNull(ctx.get("missing"));
    assertFalse(ctx.has("absent"));
    assertNull(ctx.get("absent", String.class));
  }

  @Test
  void builtContextIsImmutable() {
    HookContext.Builder builder = HookContext.builder().args("a", "b").putAll(Map.of("k", "v"));
    HookContext ctx = builder.build();
    builder.arg("c").put("k2", "v2");

    assertEquals(List.of("a", "b"), ctx.args());
    assertEquals(Map.of("k", "v"), ctx.named());
    assertThrows(UnsupportedOperationException.class, () -> ctx.args().add("x"));
    assertThrows(UnsupportedOperationException.class, () -> ctx.named().put("x", 1));
  }

  @Test
  void nullNameIsRejected() {
    assertThrows(NullPointerException.class, () -> HookContext.builder().put(null, 1));
  }

  @Test
  void equalityIsByValue() {
    assertEquals(HookContext.of("a", 1), HookContext.builder().args("a", 1).build());
    assertNotEquals(HookContext.of("a"), HookContext.builder().put("a", "a").build());
  }
}
