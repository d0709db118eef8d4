package com.flamingo.ai.talkpdf.service.tts;

/** A single speech provider attempt failed; {@link #getReason()} is recorded in metadata. */
public class TtsProviderException extends RuntimeException {

  public static final String TOO_SMALL = "too small";
  public static final String ERROR = "error";

  private final String reason;

  public TtsProviderException(String reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TtsProviderException(String reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /** Short failure reason: an HTTP status code, {@code too small} or {@code error}. */
  public String getReason() {
    return reason;
  }
}
