package dev.gcr.stub;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Handle for a deferred call. The caller gets the handle immediately and obtains the response
 * later through {@link #execute()}.
 *
 * <p>A handle is either pending, holding the completion step that performs the call, or resolved,
 * holding a value computed earlier. GCR resolves handles during recording and playback so that
 * {@code execute()} returns the recorded value without calling the service.
 */
public final class Operation {

  private final RpcCall call;
  private State state;

  private Operation(RpcCall call, State state) {
    this.call = Objects.requireNonNull(call, "call cannot be null");
    this.state = state;
  }

  /**
   * Creates a pending operation.
   *
   * @param call the call this operation belongs to
   * @param completion performs the call and returns its response
   * @return the pending operation
   */
  public static Operation pending(RpcCall call, Supplier<?> completion) {
    return new Operation(call, new Pending(Objects.requireNonNull(completion, "completion")));
  }

  /**
   * Creates an operation whose value is already known.
   *
   * @param call the call this operation belongs to
   * @param value the value {@link #execute()} returns
   * @return the resolved operation
   */
  public static Operation resolved(RpcCall call, Object value) {
    return new Operation(call, new Resolved(value));
  }

  /**
   * Completes the operation. A pending operation runs its completion step on every invocation; a
   * resolved one returns its value.
   *
   * @return the response
   */
  public Object execute() {
    State current;
    synchronized (this) {
      current = state;
    }
    if (current instanceof Resolved resolved) {
      return resolved.value;
    }
    return ((Pending) current).completion.get();
  }

  /**
   * Completes the operation and casts the response.
   *
   * @param type the expected response type
   * @param <T> the response type
   * @return the response
   */
  public <T> T execute(Class<T> type) {
    return type.cast(execute());
  }

  /**
   * Replaces the completion step with a precomputed value.
   *
   * @param value the value {@link #execute()} returns from now on
   */
  public synchronized void resolveWith(Object value) {
    state = new Resolved(value);
  }

  /**
   * Checks whether the operation holds a precomputed value.
   *
   * @return true if resolved
   */
  public synchronized boolean isResolved() {
    return state instanceof Resolved;
  }

  /**
   * Gets the call this operation belongs to.
   *
   * @return the call
   */
  public RpcCall getCall() {
    return call;
  }

  private interface State {}

  private static final class Pending implements State {
    private final Supplier<?> completion;

    private Pending(Supplier<?> completion) {
      this.completion = completion;
    }
  }

  private static final class Resolved implements State {
    private final Object value;

    private Resolved(Object value) {
      this.value = value;
    }
  }
}
