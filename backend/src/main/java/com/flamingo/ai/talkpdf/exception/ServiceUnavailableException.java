package com.flamingo.ai.talkpdf.exception;

/** Thrown when the worker pool cannot accept more pipeline runs. */
public class ServiceUnavailableException extends RuntimeException {

  public ServiceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
