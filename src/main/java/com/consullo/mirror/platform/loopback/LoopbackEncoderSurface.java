package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.EncoderSurface;

/**
 * Input surface of a {@link LoopbackVideoEncoder}; only tracks its release.
 *
 * @since 1.0
 */
public final class LoopbackEncoderSurface implements EncoderSurface {

  private volatile boolean released;

  @Override
  public void release() {
    released = true;
  }

  public boolean isReleased() {
    return released;
  }
}
