package com.consullo.mirror.client;

/**
 * Consumer of encoded access units on the client side.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface FrameHandler {

  void onFrame(byte[] data);
}
