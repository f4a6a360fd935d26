package com.consullo.mirror.platform;

/**
 * API 34 hosts additionally give the display its own focus and place it in the device display group.
 *
 * @since 1.0
 */
public final class Api34DisplayCapabilities extends Api33DisplayCapabilities {

  static final int MIN_API_LEVEL = 34;

  public Api34DisplayCapabilities(int apiLevel) {
    super(apiLevel);
    if (apiLevel < MIN_API_LEVEL) {
      throw new IllegalArgumentException("apiLevel must be >= " + MIN_API_LEVEL);
    }
  }

  @Override
  public int virtualDisplayFlags() {
    return super.virtualDisplayFlags()
        | VirtualDisplayFlags.OWN_FOCUS
        | VirtualDisplayFlags.DEVICE_DISPLAY_GROUP;
  }
}
