package dev.gcr.exceptions;

/** Thrown when a required configuration value (cassette directory, stubs) is missing. */
public class ConfigException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   */
  public ConfigException(String message) {
    super(message);
  }
}
