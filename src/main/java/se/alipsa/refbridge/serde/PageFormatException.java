package se.alipsa.refbridge.serde;

import java.io.IOException;

/** Thrown when a serialized Presto page cannot be decoded. */
public class PageFormatException extends IOException {

  private static final long serialVersionUID = 1L;

  public PageFormatException(String message) {
    super(message);
  }

  public PageFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
