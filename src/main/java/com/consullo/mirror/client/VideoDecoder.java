package com.consullo.mirror.client;

/**
 * Client-side decoder bound to one render surface at a time.
 *
 * @since 1.0
 */
public interface VideoDecoder {

  /**
   * Binds the decoder to a surface at the given video size.
   *
   * @param surface render target
   * @param width video width
   * @param height video height
   * @throws Exception if the decoder cannot be configured
   */
  void attach(RenderSurface surface, int width, int height) throws Exception;

  void onFrame(byte[] data);

  void detach();
}
