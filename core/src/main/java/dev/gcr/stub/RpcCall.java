package dev.gcr.stub;

import java.util.Objects;
import lombok.Getter;

/** One outbound call as seen at the interception point. */
@Getter
public final class RpcCall {

  /** The fully qualified RPC method name, e.g. {@code /inventory.Items/Get}. */
  private final String method;

  /** The request message. */
  private final Object request;

  /** Options for this call. */
  private final CallOptions options;

  /**
   * Creates a call.
   *
   * @param method the RPC method name
   * @param request the request message
   * @param options the call options, or null for defaults
   */
  public RpcCall(String method, Object request, CallOptions options) {
    this.method = Objects.requireNonNull(method, "method cannot be null");
    this.request = request;
    this.options = options != null ? options : CallOptions.DEFAULT;
  }

  /**
   * Creates a call with default options.
   *
   * @param method the RPC method name
   * @param request the request message
   * @return the call
   */
  public static RpcCall of(String method, Object request) {
    return new RpcCall(method, request, CallOptions.DEFAULT);
  }

  /**
   * Creates a deferred call that returns an {@link Operation}.
   *
   * @param method the RPC method name
   * @param request the request message
   * @return the call
   */
  public static RpcCall deferred(String method, Object request) {
    return new RpcCall(method, request, CallOptions.builder().returnOperation(true).build());
  }

  /**
   * Checks whether the caller asked for an operation handle.
   *
   * @return true for deferred calls
   */
  public boolean isDeferred() {
    return options.isReturnOperation();
  }

  @Override
  public String toString() {
    return "RpcCall{method=" + method + ", deferred=" + isDeferred() + "}";
  }
}
