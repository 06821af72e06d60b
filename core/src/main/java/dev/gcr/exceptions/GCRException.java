package dev.gcr.exceptions;

/** Base exception for GCR operations */
public class GCRException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new GCRException with the specified detail message.
   *
   * @param message the detail message
   */
  public GCRException(String message) {
    super(message);
  }

  /**
   * Constructs a new GCRException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public GCRException(String message, Throwable cause) {
    super(message, cause);
  }
}
