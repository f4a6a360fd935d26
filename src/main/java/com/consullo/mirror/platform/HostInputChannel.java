package com.consullo.mirror.platform;

/**
 * Raw input injection primitive of the host.
 *
 * @since 1.0
 */
public interface HostInputChannel {

  /**
   * Injects a motion event.
   *
   * @param event event to inject
   * @return false if the host refused the event
   * @throws HostException if injection fails
   */
  boolean injectMotion(final MotionInput event) throws HostException;

  /**
   * Injects a key event.
   *
   * @param event event to inject
   * @return false if the host refused the event
   * @throws HostException if injection fails
   */
  boolean injectKey(final KeyInput event) throws HostException;
}
