package com.consullo.mirror.capture;

/**
 * Receives access units drained from the encoder.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface FrameListener {

  /**
   * Called on the drain thread for every access unit, codec configuration records included.
   *
   * @param frame access unit bytes (a private copy)
   */
  void onFrame(byte[] frame);
}
