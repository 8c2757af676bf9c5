package se.alipsa.refbridge.client;

/**
 * The reference engine cannot be reached at all. Every later comparison would
 * be meaningless, so this is not caught per query.
 */
public class ReferenceConnectionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ReferenceConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
