package com.flamingo.ai.talkpdf.domain.enums;

/** Container format of a synthesized audio payload. */
public enum AudioContainer {
  MP3("mp3", "audio/mpeg"),
  WAV("wav", "audio/wav");

  private final String extension;
  private final String contentType;

  AudioContainer(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String getExtension() {
    return extension;
  }

  public String getContentType() {
    return contentType;
  }
}
