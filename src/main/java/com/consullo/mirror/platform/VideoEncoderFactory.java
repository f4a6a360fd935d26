package com.consullo.mirror.platform;

/**
 * Creates encoders by output mime type.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface VideoEncoderFactory {

  VideoEncoder createEncoder(final String mimeType) throws HostException;
}
