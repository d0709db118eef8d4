package com.flamingo.ai.talkpdf.service.tts;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Wraps headerless signed 16-bit PCM in a canonical 44-byte RIFF/WAVE header.
 *
 * <p>All header integers are little-endian.
 */
public final class WavEncoder {

  public static final int HEADER_SIZE = 44;
  private static final int BITS_PER_SAMPLE = 16;

  private WavEncoder() {}

  /**
   * Builds a WAV file around raw PCM.
   *
   * @param pcm raw PCM16LE samples
   * @param sampleRate samples per second, e.g. 24000
   * @param channels channel count, e.g. 1
   * @return header followed by the PCM payload
   */
  public static byte[] wrapPcm16(byte[] pcm, int sampleRate, int channels) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    int blockAlign = channels * BITS_PER_SAMPLE / 8;
    int byteRate = sampleRate * blockAlign;

    ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(new byte[] {'R', 'I', 'F', 'F'});
    buffer.putInt(36 + pcm.length);
    buffer.put(new byte[] {'W', 'A', 'V', 'E'});
    buffer.put(new byte[] {'f', 'm', 't', ' '});
    buffer.putInt(16);
    buffer.putShort((short) 1); // PCM
    buffer.putShort((short) channels);
    buffer.putInt(sampleRate);
    buffer.putInt(byteRate);
    buffer.putShort((short) blockAlign);
    buffer.putShort((short) BITS_PER_SAMPLE);
    buffer.put(new byte[] {'d', 'a', 't', 'a'});
    buffer.putInt(pcm.length);
    buffer.put(pcm);
    return buffer.array();
  }
}
