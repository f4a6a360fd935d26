package com.consullo.mirror.platform;

/**
 * Host-side handle of a created virtual display.
 *
 * @since 1.0
 */
public interface VirtualDisplayHandle {

  /**
   * Returns the platform display id, or a value &lt;= 0 when the host did not expose one.
   *
   * @return display id
   */
  int displayId();

  void release();
}
