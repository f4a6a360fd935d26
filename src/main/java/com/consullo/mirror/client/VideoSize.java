package com.consullo.mirror.client;

import com.consullo.mirror.capture.DisplayGeometry;

/**
 * Encoded video size as published to the renderer.
 *
 * @param width width in pixels
 * @param height height in pixels
 * @since 1.0
 */
public record VideoSize(int width, int height) {

  public static VideoSize of(DisplayGeometry geometry) {
    return new VideoSize(geometry.width(), geometry.height());
  }
}
