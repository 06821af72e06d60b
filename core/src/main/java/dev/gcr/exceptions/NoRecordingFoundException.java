package dev.gcr.exceptions;

import dev.gcr.model.Request;

/**
 * Exception thrown when no recorded entry matches a call during playback.
 *
 * <p>Playback never falls back to a live call. To fix this, delete the cassette and record it
 * again, or add the differing fields to the ignore list.
 */
public class NoRecordingFoundException extends GCRException {

  private static final long serialVersionUID = 1L;

  private final transient Request request;
  private final String cassetteName;

  /**
   * Creates a new exception.
   *
   * @param cassetteName the cassette being played
   * @param request the request that had no match
   */
  public NoRecordingFoundException(String cassetteName, Request request) {
    super(
        String.format(
            "No recording found in cassette '%s' for %s%n"
                + "Delete the cassette and record again to capture this interaction",
            cassetteName, request));
    this.cassetteName = cassetteName;
    this.request = request;
  }

  /**
   * Gets the request that had no match.
   *
   * @return the unmatched request
   */
  public Request getRequest() {
    return request;
  }

  /**
   * Gets the name of the cassette being played.
   *
   * @return the cassette name
   */
  public String getCassetteName() {
    return cassetteName;
  }
}
