package dev.gcr.exceptions;

/** Thrown when stored cassette data cannot be interpreted. */
public class CorruptCassetteException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   */
  public CorruptCassetteException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   * @param cause the parse failure
   */
  public CorruptCassetteException(String message, Throwable cause) {
    super(message, cause);
  }
}
