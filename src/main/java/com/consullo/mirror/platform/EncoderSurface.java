package com.consullo.mirror.platform;

/**
 * Drawable surface whose contents are consumed by a video encoder.
 *
 * @since 1.0
 */
public interface EncoderSurface {

  void release();
}
