package dev.gcr.stub;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StubHandle")
class StubHandleTest {

  private ClientStub original;
  private StubHandle handle;
  private AtomicInteger decorations;

  @BeforeEach
  void setUp() {
    original = call -> "real:" + call.getRequest();
    handle = new StubHandle("echo", original);
    decorations = new AtomicInteger();
  }

  private ClientStub decorate(ClientStub delegate) {
    decorations.incrementAndGet();
    return call -> "wrapped(" + delegate.requestResponse(call) + ")";
  }

  @Test
  @DisplayName("should call the original path when plain")
  void shouldCallOriginal() {
    assertFalse(handle.isIntercepted());
    assertEquals("real:x", handle.requestResponse("Echo", "x"));
  }

  @Test
  @DisplayName("should route calls through the interceptor")
  void shouldRouteThroughInterceptor() {
    assertTrue(handle.intercept(this::decorate));

    assertTrue(handle.isIntercepted());
    assertEquals("wrapped(real:x)", handle.requestResponse("Echo", "x"));
  }

  @Test
  @DisplayName("should install only once")
  void shouldInstallOnce() {
    assertTrue(handle.intercept(this::decorate));
    assertFalse(handle.intercept(this::decorate));

    assertEquals(1, decorations.get());
    assertEquals("wrapped(real:x)", handle.requestResponse("Echo", "x"));
  }

  @Test
  @DisplayName("should restore the exact original path")
  void shouldRestoreOriginal() {
    handle.intercept(this::decorate);

    assertTrue(handle.restore());

    assertFalse(handle.isIntercepted());
    assertSame(original, handle.getOriginal());
    assertEquals("real:x", handle.requestResponse("Echo", "x"));
  }

  @Test
  @DisplayName("should treat restoring a plain handle as a no-op")
  void shouldRestoreIdempotently() {
    assertFalse(handle.restore());

    handle.intercept(this::decorate);
    assertTrue(handle.restore());
    assertFalse(handle.restore());
  }

  @Test
  @DisplayName("should allow a new install after restore")
  void shouldReinstallAfterRestore() {
    handle.intercept(this::decorate);
    handle.restore();

    assertTrue(handle.intercept(this::decorate));
    assertEquals(2, decorations.get());
  }
}
