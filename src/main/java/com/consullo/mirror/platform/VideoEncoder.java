package com.consullo.mirror.platform;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Hardware video encoder fed by an input surface.
 *
 * <p>The lifecycle mirrors a codec state machine: {@link #configure} then {@link #createInputSurface} then
 * {@link #start}; output is drained with {@link #dequeueOutput} until an end-of-stream buffer appears after
 * {@link #signalEndOfInputStream}; finally {@link #stop} and {@link #release}.
 *
 * <p>Output must be drained from a single thread.
 *
 * @since 1.0
 */
public interface VideoEncoder {

  /**
   * Configures the encoder for compressed output.
   *
   * @param format output format
   * @throws HostException if the encoder rejects the format
   */
  void configure(final EncoderFormat format) throws HostException;

  /**
   * Returns the surface the encoder consumes. Valid only between configure and start.
   *
   * @return input surface
   * @throws HostException if the surface cannot be created
   */
  EncoderSurface createInputSurface() throws HostException;

  void start() throws HostException;

  /**
   * Polls the output queue.
   *
   * @param timeoutMicros maximum wait in microseconds
   * @return poll result, never null
   * @throws HostException if the encoder is not in an executing state
   */
  EncoderOutput dequeueOutput(final long timeoutMicros) throws HostException;

  /**
   * Codec configuration records of the current output format (csd-0, csd-1 for AVC). Meaningful after a
   * {@link EncoderOutput.Kind#FORMAT_CHANGED} result.
   *
   * @return configuration records, possibly empty
   * @throws HostException if the output format is unavailable
   */
  List<ByteBuffer> codecConfigRecords() throws HostException;

  void releaseOutputBuffer(final int index) throws HostException;

  void signalEndOfInputStream() throws HostException;

  void stop() throws HostException;

  void release();
}
