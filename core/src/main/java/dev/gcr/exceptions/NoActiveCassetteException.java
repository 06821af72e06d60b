package dev.gcr.exceptions;

/** Thrown when an intercepted call happens while no cassette session is bound. */
public class NoActiveCassetteException extends GCRException {

  private static final long serialVersionUID = 1L;

  private final String method;

  /**
   * Creates a new exception.
   *
   * @param method the RPC method that was called
   */
  public NoActiveCassetteException(String method) {
    super(String.format("No active cassette while intercepting call to '%s'", method));
    this.method = method;
  }

  /**
   * Gets the RPC method that was called.
   *
   * @return the method name
   */
  public String getMethod() {
    return method;
  }
}
