package dev.gcr;

/** Interception state of the engine and its configured stubs. */
public enum GCRMode {

  /** No session is bound and every stub uses its original call path. */
  IDLE,

  /** Calls go to the real service and are recorded into the active cassette. */
  RECORDING,

  /** Calls are answered from the active cassette. No real call is made. */
  PLAYING;

  /**
   * Checks if calls reach the real service and get recorded.
   *
   * @return true for {@link #RECORDING}
   */
  public boolean isRecordMode() {
    return this == RECORDING;
  }

  /**
   * Checks if calls are answered from a cassette.
   *
   * @return true for {@link #PLAYING}
   */
  public boolean isPlaybackMode() {
    return this == PLAYING;
  }

  /**
   * Checks if a session is bound.
   *
   * @return true unless {@link #IDLE}
   */
  public boolean isActive() {
    return this != IDLE;
  }
}
