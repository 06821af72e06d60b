package dev.gcr.exceptions;

import java.io.IOException;

/** Thrown when reading or writing cassette storage fails. */
public class CassetteIOException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   * @param cause the underlying I/O failure
   */
  public CassetteIOException(String message, IOException cause) {
    super(message, cause);
  }
}
