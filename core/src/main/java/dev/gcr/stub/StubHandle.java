package dev.gcr.stub;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * An interceptable client stub. Application code calls through the handle; GCR swaps the call path
 * behind it.
 *
 * <p>The handle keeps a reference to the original path so that {@link #restore()} undoes {@link
 * #intercept(UnaryOperator)} exactly. Both are idempotent: intercepting an intercepted handle and
 * restoring a plain one do nothing.
 *
 * <pre>{@code
 * StubHandle items = new StubHandle("items", grpcItemsStub);
 * config.addStub(items);
 *
 * gcr.withCassette("get_item", () -> items.requestResponse("/inventory.Items/Get", request));
 * }</pre>
 */
@Slf4j
public final class StubHandle implements ClientStub {

  private final String name;
  private final ClientStub original;
  private volatile ClientStub active;

  /**
   * Creates a handle around the original call path.
   *
   * @param name a label used in log messages
   * @param original the real call path
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The original stub is shared with the application")
  public StubHandle(String name, ClientStub original) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.original = Objects.requireNonNull(original, "original cannot be null");
    this.active = original;
  }

  @Override
  public Object requestResponse(RpcCall call) {
    return active.requestResponse(call);
  }

  /**
   * Installs an interceptor around the original path.
   *
   * @param decorator builds the intercepting path from the original one
   * @return true if installed, false if the handle was already intercepted
   */
  public synchronized boolean intercept(UnaryOperator<ClientStub> decorator) {
    if (active != original) {
      log.debug("Stub {} already intercepted, skipping install", name);
      return false;
    }
    active = Objects.requireNonNull(decorator.apply(original), "decorator returned null");
    log.debug("Installed interceptor on stub {}", name);
    return true;
  }

  /**
   * Restores the original path.
   *
   * @return true if an interceptor was removed, false if the handle was already plain
   */
  public synchronized boolean restore() {
    if (active == original) {
      return false;
    }
    active = original;
    log.debug("Restored original call path on stub {}", name);
    return true;
  }

  /**
   * Checks whether an interceptor is installed.
   *
   * @return true if intercepted
   */
  public boolean isIntercepted() {
    return active != original;
  }

  /**
   * Gets the original call path.
   *
   * @return the original stub
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Callers may need to bypass interception explicitly")
  public ClientStub getOriginal() {
    return original;
  }

  /**
   * Gets the handle's label.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "StubHandle{" + name + (isIntercepted() ? ", intercepted" : "") + "}";
  }
}
