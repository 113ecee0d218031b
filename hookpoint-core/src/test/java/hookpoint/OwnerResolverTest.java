package hookpoint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OwnerResolverTest {

  @Test
  void lambdaResolvesToEnclosingPackage() {
    HookHandler handler = ctx -> "x";

    assertEquals("hookpoint", OwnerResolver.PACKAGE.resolve(handler));
  }

  @Test
  void classResolvesToItsPackage() {
    assertEquals("hookpoint", OwnerResolver.PACKAGE.resolve(new NamedHandler()));
  }

  static final class NamedHandler implements HookHandler {
    @Override
    public Object handle(HookContext context) {
      return null;
    }
  }
}
