package dev.gcr;

import dev.gcr.cassette.Cassette;
import dev.gcr.cassette.CassetteStore;
import dev.gcr.exceptions.RunningException;
import dev.gcr.intercept.CassetteSession;
import dev.gcr.intercept.PlaybackStub;
import dev.gcr.intercept.RecordingStub;
import dev.gcr.model.RequestMatcher;
import dev.gcr.stub.StubHandle;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Records RPC calls made through the configured stubs into cassettes and plays them back.
 *
 * <p>The engine is a small state machine over {@link GCRMode}:
 *
 * <ul>
 *   <li>{@code IDLE -> RECORDING}: bind a new cassette, install recording interceptors
 *   <li>{@code IDLE -> PLAYING}: load the cassette (failing the whole start if that fails), install
 *       playback interceptors
 *   <li>{@code RECORDING -> IDLE}: uninstall, save the cassette, unbind
 *   <li>{@code PLAYING -> IDLE}: uninstall, unbind; nothing is written
 * </ul>
 *
 * <p>Usage:
 *
 * <pre>{@code
 * GCRConfig config = new GCRConfig();
 * config.setCassetteDir(Path.of("src/test/resources/cassettes"));
 * config.addStub(itemsStub);
 * config.ignore("request_id");
 *
 * GCR gcr = new GCR(config);
 * gcr.withCassette("get_item", () -> {
 *   // recorded on the first run, replayed afterwards
 *   Item item = (Item) itemsStub.requestResponse("/inventory.Items/Get", new GetItem(1));
 * });
 * }</pre>
 */
@Slf4j
public class GCR {

  private final GCRConfig config;
  private final Object lock = new Object();
  private volatile CassetteSession session;

  /**
   * Creates an engine.
   *
   * @param config the configuration; locked while a session is bound
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The config is shared so callers can keep configuring it between sessions")
  public GCR(GCRConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  /**
   * Runs {@code body} against a cassette: plays it if it exists, otherwise records it and saves it
   * afterwards. The engine is always back to idle when this returns or throws.
   *
   * @param name the cassette name
   * @param body the code making RPC calls
   */
  public void withCassette(String name, Runnable body) {
    withCassette(name, Set.of(), body);
  }

  /**
   * Runs {@code body} against a cassette with extra fields ignored for this session only.
   *
   * <p>Nested inside a block on the same cassette, the body joins the outer session. It may only
   * ask for fields the outer session already ignores.
   *
   * @param name the cassette name
   * @param ignoredFields field names ignored in addition to the global list
   * @param body the code making RPC calls
   * @throws RunningException if another session is active, or if a nested block asks to ignore
   *     fields the active session does not
   */
  public void withCassette(String name, Collection<String> ignoredFields, Runnable body) {
    Objects.requireNonNull(body, "body cannot be null");
    boolean started;
    synchronized (lock) {
      CassetteSession previous = session;
      insert(name, ignoredFields);
      started = session != previous;
    }
    if (!started) {
      // nested block on the cassette already active; the outer block owns the session and its
      // ignore list
      body.run();
      return;
    }

    Throwable failure = null;
    try {
      body.run();
    } catch (RuntimeException | Error e) {
      failure = e;
      throw e;
    } finally {
      try {
        eject();
      } catch (RuntimeException e) {
        if (failure == null) {
          throw e;
        }
        failure.addSuppressed(e);
      }
    }
  }

  /**
   * Starts a session without a scoped block: plays the cassette if it exists, otherwise records
   * it. End it with {@link #eject()}.
   *
   * @param name the cassette name
   */
  public void insert(String name) {
    insert(name, Set.of());
  }

  /**
   * Starts an unscoped session with extra ignored fields.
   *
   * @param name the cassette name
   * @param ignoredFields field names ignored in addition to the global list
   */
  public void insert(String name, Collection<String> ignoredFields) {
    synchronized (lock) {
      if (cassetteExists(name)) {
        enterPlaying(name, ignoredFields);
      } else {
        enterRecording(name, ignoredFields);
      }
    }
  }

  /** Ends whatever session is active. Does nothing when idle. */
  public void eject() {
    synchronized (lock) {
      CassetteSession current = session;
      if (current == null) {
        return;
      }
      if (current.getMode().isRecordMode()) {
        exitRecording();
      } else {
        exitPlaying();
      }
    }
  }

  /**
   * Starts recording into a new, empty cassette. An existing cassette of that name is replaced
   * when the session ends.
   *
   * @param name the cassette name
   */
  public void enterRecording(String name) {
    enterRecording(name, Set.of());
  }

  /**
   * Starts recording with extra ignored fields.
   *
   * @param name the cassette name
   * @param ignoredFields field names ignored in addition to the global list
   */
  public void enterRecording(String name, Collection<String> ignoredFields) {
    synchronized (lock) {
      if (isAlreadyActive(name, GCRMode.RECORDING, ignoredFields)) {
        return;
      }
      // fail on missing config before binding anything
      List<StubHandle> stubs = config.getStubs();
      config.getCassetteDir();

      bind(new CassetteSession(new Cassette(name), GCRMode.RECORDING, matcher(ignoredFields)));
      int installed = 0;
      for (StubHandle stub : stubs) {
        if (stub.intercept(original -> new RecordingStub(original, this::getActiveSession))) {
          installed++;
        }
      }
      log.info("Recording cassette {} on {} stubs", name, installed);
    }
  }

  /** Stops recording, restores every stub and saves the cassette. Does nothing when idle. */
  public void exitRecording() {
    synchronized (lock) {
      CassetteSession current = session;
      if (current == null) {
        log.debug("exitRecording called while idle");
        return;
      }
      if (!current.getMode().isRecordMode()) {
        log.warn("exitRecording called while {}, ignoring", current.getMode());
        return;
      }
      try {
        restoreStubs();
        store().save(current.getCassette());
        log.info(
            "Recorded cassette {}: {}", current.getCassette().getName(), current.getStatistics());
      } finally {
        unbind();
      }
    }
  }

  /**
   * Loads a cassette and starts playing it.
   *
   * @param name the cassette name
   */
  public void enterPlaying(String name) {
    enterPlaying(name, Set.of());
  }

  /**
   * Loads a cassette and starts playing it with extra ignored fields.
   *
   * @param name the cassette name
   * @param ignoredFields field names ignored in addition to the global list
   */
  public void enterPlaying(String name, Collection<String> ignoredFields) {
    synchronized (lock) {
      if (isAlreadyActive(name, GCRMode.PLAYING, ignoredFields)) {
        return;
      }
      List<StubHandle> stubs = config.getStubs();
      Cassette cassette = store().load(name);

      bind(new CassetteSession(cassette, GCRMode.PLAYING, matcher(ignoredFields)));
      int installed = 0;
      for (StubHandle stub : stubs) {
        if (stub.intercept(original -> new PlaybackStub(original, this::getActiveSession))) {
          installed++;
        }
      }
      log.info("Playing cassette {} ({} entries) on {} stubs", name, cassette.size(), installed);
    }
  }

  /** Stops playing and restores every stub. Does nothing when idle. */
  public void exitPlaying() {
    synchronized (lock) {
      CassetteSession current = session;
      if (current == null) {
        log.debug("exitPlaying called while idle");
        return;
      }
      if (!current.getMode().isPlaybackMode()) {
        log.warn("exitPlaying called while {}, ignoring", current.getMode());
        return;
      }
      try {
        restoreStubs();
        log.info(
            "Played cassette {}: {}", current.getCassette().getName(), current.getStatistics());
      } finally {
        unbind();
      }
    }
  }

  /**
   * Checks whether a cassette has been recorded.
   *
   * @param name the cassette name
   * @return true if the cassette file exists
   */
  public boolean cassetteExists(String name) {
    return store().exists(name);
  }

  /**
   * Deletes every recorded cassette in the cassette directory.
   *
   * @return the number of cassettes deleted
   */
  public int deleteAllCassettes() {
    synchronized (lock) {
      if (session != null) {
        throw new RunningException("cannot delete cassettes while a cassette session is active");
      }
      return store().deleteAll();
    }
  }

  /**
   * Gets the current mode.
   *
   * @return the mode
   */
  public GCRMode getMode() {
    CassetteSession current = session;
    return current == null ? GCRMode.IDLE : current.getMode();
  }

  /**
   * Gets the active session.
   *
   * @return the session, or null when idle
   */
  public CassetteSession getActiveSession() {
    return session;
  }

  /**
   * Gets the active cassette.
   *
   * @return the cassette, or null when idle
   */
  public Cassette getActiveCassette() {
    CassetteSession current = session;
    return current == null ? null : current.getCassette();
  }

  /**
   * Gets the configuration.
   *
   * @return the config
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Shared configuration object")
  public GCRConfig getConfig() {
    return config;
  }

  private boolean isAlreadyActive(String name, GCRMode mode, Collection<String> ignoredFields) {
    CassetteSession current = session;
    if (current == null) {
      return false;
    }
    if (current.getMode() == mode && current.getCassette().getName().equals(name)) {
      Set<String> active = current.getMatcher().getIgnoredFields();
      if (!active.containsAll(ignoredFields)) {
        Set<String> missing = new LinkedHashSet<>(ignoredFields);
        missing.removeAll(active);
        throw new RunningException(
            String.format(
                "cassette '%s' is already %s without ignoring %s", name, mode, missing));
      }
      log.debug("Cassette {} already {}", name, mode);
      return true;
    }
    throw new RunningException(
        String.format(
            "cannot start %s cassette '%s' while cassette '%s' is %s",
            mode, name, current.getCassette().getName(), current.getMode()));
  }

  private RequestMatcher matcher(Collection<String> sessionIgnoredFields) {
    Set<String> ignored = new LinkedHashSet<>(config.getIgnoredFields());
    ignored.addAll(sessionIgnoredFields);
    return new RequestMatcher(ignored);
  }

  private CassetteStore store() {
    return new CassetteStore(config.getCassetteDir());
  }

  private void bind(CassetteSession newSession) {
    session = newSession;
    config.markRunning(true);
  }

  private void unbind() {
    session = null;
    config.markRunning(false);
  }

  private void restoreStubs() {
    for (StubHandle stub : config.getStubs()) {
      stub.restore();
    }
  }
}
