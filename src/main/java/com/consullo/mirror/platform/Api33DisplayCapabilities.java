package com.consullo.mirror.platform;

/**
 * API 33 hosts additionally accept trusted, own display group, always unlocked and touch feedback disabled.
 *
 * @since 1.0
 */
public class Api33DisplayCapabilities extends BaseDisplayCapabilities {

  static final int MIN_API_LEVEL = 33;

  static final int API33_FLAGS = VirtualDisplayFlags.TRUSTED
      | VirtualDisplayFlags.OWN_DISPLAY_GROUP
      | VirtualDisplayFlags.ALWAYS_UNLOCKED
      | VirtualDisplayFlags.TOUCH_FEEDBACK_DISABLED;

  public Api33DisplayCapabilities(int apiLevel) {
    super(apiLevel);
    if (apiLevel < MIN_API_LEVEL) {
      throw new IllegalArgumentException("apiLevel must be >= " + MIN_API_LEVEL);
    }
  }

  @Override
  public int virtualDisplayFlags() {
    return super.virtualDisplayFlags() | API33_FLAGS;
  }
}
