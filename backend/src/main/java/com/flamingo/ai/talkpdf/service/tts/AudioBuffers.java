package com.flamingo.ai.talkpdf.service.tts;

import java.util.List;
import java.util.Objects;

/** Byte-level helpers for synthesized audio. */
public final class AudioBuffers {

  private AudioBuffers() {}

  /**
   * Concatenates buffers in order. The result's length is the sum of the inputs and buffer
   * {@code i} starts at the sum of the lengths of buffers {@code 0..i-1}.
   */
  public static byte[] concatenate(List<byte[]> buffers) {
    Objects.requireNonNull(buffers, "buffers must not be null");
    int totalSize = buffers.stream().mapToInt(buffer -> buffer.length).sum();
    byte[] result = new byte[totalSize];
    int offset = 0;
    for (byte[] buffer : buffers) {
      System.arraycopy(buffer, 0, result, offset, buffer.length);
      offset += buffer.length;
    }
    return result;
  }
}
