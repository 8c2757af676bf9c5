package se.alipsa.refbridge.client;

/**
 * A query the reference engine could not run: it reported an error, answered
 * with an unexpected status or returned a response that could not be decoded.
 * The engine itself is still considered reachable.
 */
public class ReferenceQueryException extends Exception {

  private static final long serialVersionUID = 1L;

  public ReferenceQueryException(String message) {
    super(message);
  }

  public ReferenceQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
