package com.xing.warren;

/** The payload could not be understood. Quarantined like any {@link QuarantinableException}. */
public class BadMessageException extends QuarantinableException {

  public BadMessageException(String message) {
    super(message);
  }

  public BadMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
