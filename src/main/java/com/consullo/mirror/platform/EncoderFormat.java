package com.consullo.mirror.platform;

/**
 * Output format requested from a video encoder.
 *
 * @param mimeType compressed output type (e.g. "video/avc")
 * @param width encode width in pixels
 * @param height encode height in pixels
 * @param bitRate target bit rate in bits per second
 * @param frameRate target frame rate
 * @param iFrameIntervalSeconds interval between intra frames, in seconds
 * @since 1.0
 */
public record EncoderFormat(
    String mimeType,
    int width,
    int height,
    int bitRate,
    int frameRate,
    int iFrameIntervalSeconds) {
}
