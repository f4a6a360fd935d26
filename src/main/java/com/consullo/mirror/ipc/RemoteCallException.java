package com.consullo.mirror.ipc;

/**
 * A call on a remote capability failed, typically because the process hosting it is gone.
 *
 * @since 1.0
 */
public class RemoteCallException extends Exception {

  private static final long serialVersionUID = 1L;

  public RemoteCallException(final String message) {
    super(message);
  }

  public RemoteCallException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
