package dev.gcr.intercept;

import dev.gcr.cassette.CassetteEntry;
import dev.gcr.exceptions.NoActiveCassetteException;
import dev.gcr.exceptions.NoRecordingFoundException;
import dev.gcr.model.Request;
import dev.gcr.stub.ClientStub;
import dev.gcr.stub.Operation;
import dev.gcr.stub.RpcCall;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Playback decorator: answers every call from the active cassette. Plain calls never reach the real
 * stub; a call without a recording fails instead of going live.
 *
 * <p>Deferred calls still ask the real stub for their (unstarted) operation handle, then resolve it
 * with the recorded value, so callers keep the two-step shape of the API.
 */
@Slf4j
public final class PlaybackStub implements ClientStub {

  private final ClientStub delegate;
  private final Supplier<CassetteSession> session;

  /**
   * Creates a playback decorator.
   *
   * @param delegate the real call path, used only to obtain deferred operation handles
   * @param session supplies the active session, or null when none is bound
   */
  public PlaybackStub(ClientStub delegate, Supplier<CassetteSession> session) {
    this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    this.session = Objects.requireNonNull(session, "session cannot be null");
  }

  @Override
  public Object requestResponse(RpcCall call) {
    CassetteSession active = session.get();
    if (active == null) {
      throw new NoActiveCassetteException(call.getMethod());
    }

    Request request = Request.fromCall(call);
    CassetteEntry entry = active.find(request);
    if (entry == null) {
      active.getStatistics().recordMiss();
      log.warn("No recording for {} in cassette {}", request, active.getCassette().getName());
      throw new NoRecordingFoundException(active.getCassette().getName(), request);
    }
    active.getStatistics().recordHit();

    Object value = entry.getResponse().toCallResult();
    if (!call.isDeferred()) {
      return value;
    }

    Object handle = delegate.requestResponse(call);
    if (handle instanceof Operation operation) {
      operation.resolveWith(value);
      return operation;
    }
    log.debug(
        "Stub returned no operation for deferred call {}, using a stand-in", call.getMethod());
    return Operation.resolved(call, value);
  }

  ClientStub getDelegate() {
    return delegate;
  }
}
