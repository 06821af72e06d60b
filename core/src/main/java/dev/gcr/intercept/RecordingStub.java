package dev.gcr.intercept;

import dev.gcr.exceptions.NoActiveCassetteException;
import dev.gcr.model.Request;
import dev.gcr.model.Response;
import dev.gcr.stub.ClientStub;
import dev.gcr.stub.Operation;
import dev.gcr.stub.RpcCall;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Recording decorator: forwards every call to the real stub and records the (request, response)
 * pair in the active cassette. Callers get the real result unchanged.
 *
 * <p>A request that is already recorded is not appended again; the first recorded pairing wins.
 * For deferred calls the returned operation is executed immediately, the resolved value is
 * recorded, and the operation is resolved with that value before it is handed back, so that a
 * later {@code execute()} does not run the call a second time.
 */
@Slf4j
public final class RecordingStub implements ClientStub {

  private final ClientStub delegate;
  private final Supplier<CassetteSession> session;

  /**
   * Creates a recording decorator.
   *
   * @param delegate the real call path
   * @param session supplies the active session, or null when none is bound
   */
  public RecordingStub(ClientStub delegate, Supplier<CassetteSession> session) {
    this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    this.session = Objects.requireNonNull(session, "session cannot be null");
  }

  @Override
  public Object requestResponse(RpcCall call) {
    CassetteSession active = session.get();
    if (active == null) {
      throw new NoActiveCassetteException(call.getMethod());
    }

    Object result = delegate.requestResponse(call);
    active.getStatistics().recordLiveCall();

    Request request = Request.fromCall(call);
    if (active.isRecorded(request)) {
      active.getStatistics().recordDuplicate();
      log.debug("Call {} already recorded, not appending", request.getMethod());
      return result;
    }

    if (call.isDeferred()) {
      if (result instanceof Operation operation) {
        Object value = operation.execute();
        operation.resolveWith(value);
        active.record(request, Response.fromCallResult(value));
        return operation;
      }
      log.warn(
          "Deferred call {} returned {} instead of an Operation, recording it as a response",
          call.getMethod(),
          result == null ? "null" : result.getClass().getName());
    }

    active.record(request, Response.fromCallResult(result));
    return result;
  }

  ClientStub getDelegate() {
    return delegate;
  }
}
