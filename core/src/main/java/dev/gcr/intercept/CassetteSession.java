package dev.gcr.intercept;

import dev.gcr.GCRMode;
import dev.gcr.cassette.Cassette;
import dev.gcr.cassette.CassetteEntry;
import dev.gcr.model.Request;
import dev.gcr.model.RequestMatcher;
import dev.gcr.model.Response;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/** The cassette bound to the engine for the duration of one recording or playing session. */
public final class CassetteSession {

  private final Cassette cassette;
  private final GCRMode mode;
  private final RequestMatcher matcher;
  private final SessionStatistics statistics = new SessionStatistics();

  /**
   * Creates a session.
   *
   * @param cassette the active cassette
   * @param mode {@link GCRMode#RECORDING} or {@link GCRMode#PLAYING}
   * @param matcher the request matching rules for this session
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The session owns the cassette it records into")
  public CassetteSession(Cassette cassette, GCRMode mode, RequestMatcher matcher) {
    if (!Objects.requireNonNull(mode, "mode cannot be null").isActive()) {
      throw new IllegalArgumentException("A session needs an active mode, got " + mode);
    }
    this.cassette = Objects.requireNonNull(cassette, "cassette cannot be null");
    this.mode = mode;
    this.matcher = Objects.requireNonNull(matcher, "matcher cannot be null");
  }

  /**
   * Finds the first recorded entry matching a request.
   *
   * @param request the incoming request
   * @return the entry, or null if none matches
   */
  public CassetteEntry find(Request request) {
    return cassette.lookup(request, matcher);
  }

  /**
   * Checks whether a matching request is already recorded.
   *
   * @param request the incoming request
   * @return true if recorded
   */
  public boolean isRecorded(Request request) {
    return find(request) != null;
  }

  /**
   * Records a pair unless a matching request is already recorded.
   *
   * @param request the normalized request
   * @param response the normalized response
   * @return true if the pair was appended
   */
  public boolean record(Request request, Response response) {
    boolean appended = cassette.appendIfAbsent(request, response, matcher);
    if (appended) {
      statistics.recordAppend();
    } else {
      statistics.recordDuplicate();
    }
    return appended;
  }

  /**
   * Gets the active cassette.
   *
   * @return the cassette
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Callers inspect the live cassette")
  public Cassette getCassette() {
    return cassette;
  }

  /**
   * Gets the session mode.
   *
   * @return the mode
   */
  public GCRMode getMode() {
    return mode;
  }

  /**
   * Gets the request matching rules.
   *
   * @return the matcher
   */
  public RequestMatcher getMatcher() {
    return matcher;
  }

  /**
   * Gets the session counters.
   *
   * @return the statistics
   */
  public SessionStatistics getStatistics() {
    return statistics;
  }
}
