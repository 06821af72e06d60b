package dev.gcr.stub;

/**
 * The outbound call path of an RPC client stub.
 *
 * <p>GCR intercepts calls at this interface: recording and playback are decorators implementing it
 * around the original path.
 */
@FunctionalInterface
public interface ClientStub {

  /**
   * Issues a unary request/response call.
   *
   * <p>When {@link CallOptions#isReturnOperation()} is set the stub returns an unstarted {@link
   * Operation} instead of the response; the call happens when the operation is executed.
   *
   * @param call the call to issue
   * @return the response message, or an {@link Operation} for deferred calls
   */
  Object requestResponse(RpcCall call);

  /**
   * Issues a call with default options.
   *
   * @param method the RPC method name
   * @param request the request message
   * @return the response message
   */
  default Object requestResponse(String method, Object request) {
    return requestResponse(RpcCall.of(method, request));
  }
}
