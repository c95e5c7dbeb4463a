package com.xing.warren;

/** The quarantine sink did not accept a message. */
public class PublishException extends Exception {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
