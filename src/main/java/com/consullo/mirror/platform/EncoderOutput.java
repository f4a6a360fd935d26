package com.consullo.mirror.platform;

import java.nio.ByteBuffer;

/**
 * Result of one poll of an encoder's output queue.
 *
 * @since 1.0
 */
public final class EncoderOutput {

  public enum Kind {
    TRY_AGAIN_LATER,
    FORMAT_CHANGED,
    BUFFER
  }

  private static final EncoderOutput TRY_AGAIN_LATER = new EncoderOutput(Kind.TRY_AGAIN_LATER, -1, null, false);
  private static final EncoderOutput FORMAT_CHANGED = new EncoderOutput(Kind.FORMAT_CHANGED, -1, null, false);

  private final Kind kind;
  private final int bufferIndex;
  private final ByteBuffer payload;
  private final boolean endOfStream;

  private EncoderOutput(Kind kind, int bufferIndex, ByteBuffer payload, boolean endOfStream) {
    this.kind = kind;
    this.bufferIndex = bufferIndex;
    this.payload = payload;
    this.endOfStream = endOfStream;
  }

  public static EncoderOutput tryAgainLater() {
    return TRY_AGAIN_LATER;
  }

  public static EncoderOutput formatChanged() {
    return FORMAT_CHANGED;
  }

  /**
   * Creates a buffer result.
   *
   * @param bufferIndex index to hand back through {@link VideoEncoder#releaseOutputBuffer(int)}
   * @param payload encoded bytes, positioned at the first byte and limited to the last one (may be empty)
   * @param endOfStream true when this is the last buffer the encoder will produce
   * @return buffer result
   */
  public static EncoderOutput buffer(int bufferIndex, ByteBuffer payload, boolean endOfStream) {
    if (bufferIndex < 0) {
      throw new IllegalArgumentException("bufferIndex must not be negative.");
    }
    return new EncoderOutput(Kind.BUFFER, bufferIndex, payload, endOfStream);
  }

  public Kind kind() {
    return kind;
  }

  public int bufferIndex() {
    return bufferIndex;
  }

  public ByteBuffer payload() {
    return payload;
  }

  public boolean isEndOfStream() {
    return endOfStream;
  }
}
