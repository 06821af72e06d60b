package dev.gcr.exceptions;

/**
 * Thrown when an operation conflicts with an active cassette session, such as reconfiguring GCR
 * inside a {@code withCassette} block or starting a second session.
 */
public class RunningException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   */
  public RunningException(String message) {
    super(message);
  }
}
