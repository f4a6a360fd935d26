package com.consullo.mirror.client;

/**
 * Target the decoder renders into.
 *
 * @since 1.0
 */
public interface RenderSurface {

  boolean isValid();
}
