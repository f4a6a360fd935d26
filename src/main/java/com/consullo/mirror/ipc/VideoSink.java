package com.consullo.mirror.ipc;

/**
 * Remote receiver of encoded access units.
 *
 * @since 1.0
 */
public interface VideoSink extends RemoteInterface {

  /**
   * Delivers one access unit (a compressed frame or a codec configuration record).
   *
   * @param data access unit bytes; ownership passes to the receiver
   * @throws RemoteCallException if the receiver is unreachable
   */
  void onVideoFrame(final byte[] data) throws RemoteCallException;
}
