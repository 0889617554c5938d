package com.scholary.dialect.transcriber.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes mono float samples as a minimal 16-bit PCM little-endian WAV file.
 *
 * <p>Samples outside [-1, 1] are clipped.
 */
public final class WavEncoder {

  private static final int HEADER_BYTES = 44;
  private static final short BITS_PER_SAMPLE = 16;

  private WavEncoder() {}

  public static byte[] encodeMono16(float[] samples, int sampleRate) {
    int dataSize = samples.length * 2;
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + dataSize).order(ByteOrder.LITTLE_ENDIAN);

    // RIFF header
    buffer.put(new byte[] {'R', 'I', 'F', 'F'});
    buffer.putInt(36 + dataSize);
    buffer.put(new byte[] {'W', 'A', 'V', 'E'});

    // fmt chunk: PCM, mono
    buffer.put(new byte[] {'f', 'm', 't', ' '});
    buffer.putInt(16);
    buffer.putShort((short) 1);
    buffer.putShort((short) 1);
    buffer.putInt(sampleRate);
    buffer.putInt(sampleRate * 2);
    buffer.putShort((short) 2);
    buffer.putShort(BITS_PER_SAMPLE);

    buffer.put(new byte[] {'d', 'a', 't', 'a'});
    buffer.putInt(dataSize);
    for (float sample : samples) {
      float clipped = Math.max(-1f, Math.min(1f, sample));
      buffer.putShort((short) Math.round(clipped * Short.MAX_VALUE));
    }
    return buffer.array();
  }
}
