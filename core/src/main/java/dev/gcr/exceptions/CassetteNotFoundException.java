package dev.gcr.exceptions;

/** Thrown when loading a cassette that has no file in the cassette directory. */
public class CassetteNotFoundException extends GCRException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param cassetteName the missing cassette
   * @param path the path that was checked
   */
  public CassetteNotFoundException(String cassetteName, String path) {
    super(String.format("GCR cassette '%s' not found at %s", cassetteName, path));
  }
}
