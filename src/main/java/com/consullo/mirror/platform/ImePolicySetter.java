package com.consullo.mirror.platform;

/**
 * Window manager policy controlling where the soft keyboard is shown.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ImePolicySetter {

  /**
   * Restricts soft-keyboard presentation to the given display.
   *
   * @param displayId display id
   * @throws HostException if the policy cannot be applied
   */
  void setLocalImePolicy(final int displayId) throws HostException;
}
