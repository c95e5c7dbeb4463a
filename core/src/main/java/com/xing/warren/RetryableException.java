package com.xing.warren;

/**
 * Thrown by a {@link MessageProcessor} when processing failed but is expected to succeed on
 * redelivery. The delivery is nacked.
 */
public class RetryableException extends RuntimeException {

  public RetryableException(String message) {
    super(message);
  }

  public RetryableException(String message, Throwable cause) {
    super(message, cause);
  }
}
