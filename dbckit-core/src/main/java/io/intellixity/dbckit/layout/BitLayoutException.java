package io.intellixity.dbckit.layout;

/** Raised when a signal's declared bits cannot be placed inside its message payload. */
public final class BitLayoutException extends RuntimeException {
  public BitLayoutException(String message) {
    super(message);
  }
}
