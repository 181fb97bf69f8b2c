package com.dronetrack.tracker.cot;

/** Raised when a CoT event cannot be serialized. */
public class CotEncodingException extends RuntimeException {

  public CotEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
