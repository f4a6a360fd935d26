package com.consullo.mirror.platform;

/**
 * Failure reported by a host primitive (encoder, display manager, input manager, launcher).
 *
 * @since 1.0
 */
public class HostException extends Exception {

  private static final long serialVersionUID = 1L;

  public HostException(final String message) {
    super(message);
  }

  public HostException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
