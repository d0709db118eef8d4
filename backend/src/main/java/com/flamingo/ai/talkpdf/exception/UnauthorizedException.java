package com.flamingo.ai.talkpdf.exception;

/** Thrown when no caller identity can be resolved for a request. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
