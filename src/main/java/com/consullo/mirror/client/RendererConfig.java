package com.consullo.mirror.client;

/**
 * Bound on how long the renderer waits for the video size after its surface appears.
 *
 * @param sizeWaitIntervalMillis length of one wait step
 * @param sizeWaitAttempts number of steps
 * @since 1.0
 */
public record RendererConfig(long sizeWaitIntervalMillis, int sizeWaitAttempts) {

  public RendererConfig {
    if (sizeWaitIntervalMillis <= 0 || sizeWaitAttempts <= 0) {
      throw new IllegalArgumentException("sizeWaitIntervalMillis and sizeWaitAttempts must be > 0.");
    }
  }

  /** 20 steps of 100 ms. */
  public static RendererConfig defaults() {
    return new RendererConfig(100L, 20);
  }

  public long maxWaitMillis() {
    return sizeWaitIntervalMillis * sizeWaitAttempts;
  }
}
