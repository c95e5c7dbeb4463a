package com.xing.warren;

/** The processing target could not be invoked with a payload and a transaction id. */
public class ProcessorSignatureException extends RuntimeException {

  public ProcessorSignatureException(String message, Throwable cause) {
    super(message, cause);
  }
}
