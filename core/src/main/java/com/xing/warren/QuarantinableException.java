package com.xing.warren;

/**
 * Thrown by a {@link MessageProcessor} when a message must not be retried as it is. The raw
 * message is handed to the {@link QuarantinePublisher} and the delivery rejected.
 */
public class QuarantinableException extends RuntimeException {

  public QuarantinableException(String message) {
    super(message);
  }

  public QuarantinableException(String message, Throwable cause) {
    super(message, cause);
  }
}
