package com.xing.warren;

/**
 * The delivery itself is structurally unusable, e.g. it lacks the {@code tx_id} correlation
 * header. Such deliveries are rejected without requeue and never quarantined.
 */
public class MalformedMessageException extends RuntimeException {

  public MalformedMessageException(String message) {
    super(message);
  }
}
