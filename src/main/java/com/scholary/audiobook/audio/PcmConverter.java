package com.scholary.audiobook.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Conversions between backend sample formats and the canonical PCM16 representation.
 *
 * <p>All byte layouts are little-endian, matching ffmpeg's {@code s16le} and {@code f32le}.
 */
public final class PcmConverter {

  private PcmConverter() {}

  /**
   * Convert float samples in [-1.0, 1.0] to signed 16-bit.
   *
   * <p>Out-of-range samples are clipped. Scaling truncates toward zero.
   */
  public static short[] toPcm16(float[] samples) {
    short[] out = new short[samples.length];
    for (int i = 0; i < samples.length; i++) {
      float clipped = Math.max(-1.0f, Math.min(1.0f, samples[i]));
      out[i] = (short) (clipped * 32767.0f);
    }
    return out;
  }

  public static byte[] toBytes(short[] samples) {
    ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asShortBuffer().put(samples);
    return buffer.array();
  }

  /**
   * Decode s16le bytes.
   *
   * @throws IllegalArgumentException if the length is not a whole number of samples
   */
  public static short[] fromBytes(byte[] bytes) {
    if (bytes.length % 2 != 0) {
      throw new IllegalArgumentException("PCM16 data has odd length " + bytes.length);
    }
    short[] samples = new short[bytes.length / 2];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(samples);
    return samples;
  }

  /**
   * Decode f32le bytes.
   *
   * @throws IllegalArgumentException if the length is not a whole number of samples
   */
  public static float[] float32FromBytes(byte[] bytes) {
    if (bytes.length % 4 != 0) {
      throw new IllegalArgumentException(
          "Float32 data length is not a multiple of 4: " + bytes.length);
    }
    float[] samples = new float[bytes.length / 4];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(samples);
    return samples;
  }
}
