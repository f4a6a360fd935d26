package com.consullo.mirror.capture;

/**
 * Capture pipeline configuration values.
 *
 * @param mimeType encoder output type
 * @param frameRate target frame rate
 * @param iFrameIntervalSeconds intra refresh interval in seconds
 * @param defaultBitRate bit rate used when the caller does not request one, in bits per second
 * @param dequeueTimeoutMicros bounded wait of one output-queue poll
 * @param drainJoinTimeoutMillis bounded wait for the drain thread when the display is destroyed
 * @param displayNamePrefix prefix of the virtual display name
 * @since 1.0
 */
public record CapturePipelineConfig(
    String mimeType,
    int frameRate,
    int iFrameIntervalSeconds,
    int defaultBitRate,
    long dequeueTimeoutMicros,
    long drainJoinTimeoutMillis,
    String displayNamePrefix) {

  /**
   * AVC at 30 fps, one intra frame per second, 4 Mbit/s, 10 ms polls, 1 s join.
   *
   * @return default configuration
   */
  public static CapturePipelineConfig defaults() {
    return new CapturePipelineConfig("video/avc", 30, 1, 4_000_000, 10_000L, 1_000L, "MirrorVirtualDisplay");
  }
}
