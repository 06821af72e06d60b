package dev.gcr.exceptions;

/**
 * Thrown while recording when a call result has a shape that cannot be rebuilt faithfully on
 * replay, such as a collection mixing element classes or an anonymous class.
 */
public class UnsupportedResultException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   */
  public UnsupportedResultException(String message) {
    super(message);
  }
}
