package com.consullo.mirror.platform;

/**
 * Display-related capabilities of one host generation.
 *
 * <p>The capture pipeline never branches on host versions itself; it asks the capability object selected for
 * the running host. Each host generation has exactly one implementation.
 *
 * @since 1.0
 */
public interface HostDisplayCapabilities {

  /**
   * Host API level this capability set was selected for.
   *
   * @return API level
   */
  int apiLevel();

  /**
   * Returns the flag set used when creating the mirrored virtual display.
   *
   * @return combination of {@link VirtualDisplayFlags}
   */
  int virtualDisplayFlags();

  /**
   * Selects the capability set for a host API level.
   *
   * @param apiLevel host API level
   * @return capability set
   */
  static HostDisplayCapabilities forApiLevel(final int apiLevel) {
    if (apiLevel >= Api34DisplayCapabilities.MIN_API_LEVEL) {
      return new Api34DisplayCapabilities(apiLevel);
    }
    if (apiLevel >= Api33DisplayCapabilities.MIN_API_LEVEL) {
      return new Api33DisplayCapabilities(apiLevel);
    }
    return new BaseDisplayCapabilities(apiLevel);
  }
}
