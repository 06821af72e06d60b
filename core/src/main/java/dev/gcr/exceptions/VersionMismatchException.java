package dev.gcr.exceptions;

/** Thrown when a cassette file was written with an unsupported schema version. */
public class VersionMismatchException extends GCRException {

  private static final long serialVersionUID = 1L;

  private final int foundVersion;
  private final int expectedVersion;

  /**
   * Creates a new exception.
   *
   * @param cassetteName the cassette that failed to load
   * @param foundVersion the version tag read from storage
   * @param expectedVersion the version this engine supports
   */
  public VersionMismatchException(String cassetteName, int foundVersion, int expectedVersion) {
    super(
        String.format(
            "GCR cassette '%s' version %d not supported (expected %d)",
            cassetteName, foundVersion, expectedVersion));
    this.foundVersion = foundVersion;
    this.expectedVersion = expectedVersion;
  }

  /**
   * Gets the version tag read from storage.
   *
   * @return the found version
   */
  public int getFoundVersion() {
    return foundVersion;
  }

  /**
   * Gets the version this engine supports.
   *
   * @return the expected version
   */
  public int getExpectedVersion() {
    return expectedVersion;
  }
}
