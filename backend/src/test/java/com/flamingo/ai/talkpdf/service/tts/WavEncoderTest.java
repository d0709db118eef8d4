package com.flamingo.ai.talkpdf.service.tts;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class WavEncoderTest {

  @Test
  void shouldWriteCanonicalHeaderForMono24kHz() {
    byte[] pcm = new byte[4800];
    Arrays.fill(pcm, (byte) 9);

    byte[] wav = WavEncoder.wrapPcm16(pcm, 24_000, 1);
    ByteBuffer header = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);

    assertThat(wav).hasSize(WavEncoder.HEADER_SIZE + pcm.length);
    assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
    assertThat(header.getInt(4)).isEqualTo(36 + pcm.length);
    assertThat(new String(wav, 8, 8, StandardCharsets.US_ASCII)).isEqualTo("WAVEfmt ");
    assertThat(header.getInt(16)).isEqualTo(16);
    assertThat(header.getShort(20)).isEqualTo((short) 1);
    assertThat(header.getShort(22)).isEqualTo((short) 1);
    assertThat(header.getInt(24)).isEqualTo(24_000);
    assertThat(header.getInt(28)).isEqualTo(48_000);
    assertThat(header.getShort(32)).isEqualTo((short) 2);
    assertThat(header.getShort(34)).isEqualTo((short) 16);
    assertThat(new String(wav, 36, 4, StandardCharsets.US_ASCII)).isEqualTo("data");
    assertThat(header.getInt(40)).isEqualTo(pcm.length);
    assertThat(Arrays.copyOfRange(wav, 44, wav.length)).isEqualTo(pcm);
  }
}
