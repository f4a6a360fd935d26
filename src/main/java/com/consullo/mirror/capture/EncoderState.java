package com.consullo.mirror.capture;

/**
 * Lifecycle of the capture encoder.
 *
 * @since 1.0
 */
public enum EncoderState {
  /** No encoder; initial state and the state after a failed setup. */
  UNINITIALIZED,
  /** Encoder configured, display bound to its surface, drain thread running. */
  CONFIGURED_RUNNING,
  /** End of stream signalled; waiting for the drain thread. */
  DRAINING,
  /** Encoder and surface released after a destroy. */
  STOPPED
}
