package com.qurse.backend.chat.stream;

/** The provider terminated the stream in a way that counts as a cancellation, not an error. */
public class GeneratorAbortException extends RuntimeException {

  public GeneratorAbortException(String message, Throwable cause) {
    super(message, cause);
  }
}
