package com.consullo.mirror.platform;

/**
 * Capabilities of hosts older than API 33: public, presentation, own-content-only, touch, content rotation
 * and destroy-on-removal.
 *
 * @since 1.0
 */
public class BaseDisplayCapabilities implements HostDisplayCapabilities {

  static final int BASE_FLAGS = VirtualDisplayFlags.PUBLIC
      | VirtualDisplayFlags.PRESENTATION
      | VirtualDisplayFlags.OWN_CONTENT_ONLY
      | VirtualDisplayFlags.SUPPORTS_TOUCH
      | VirtualDisplayFlags.ROTATES_WITH_CONTENT
      | VirtualDisplayFlags.DESTROY_CONTENT_ON_REMOVAL;

  private final int apiLevel;

  public BaseDisplayCapabilities(int apiLevel) {
    if (apiLevel <= 0) {
      throw new IllegalArgumentException("apiLevel must be positive.");
    }
    this.apiLevel = apiLevel;
  }

  @Override
  public int apiLevel() {
    return apiLevel;
  }

  @Override
  public int virtualDisplayFlags() {
    return BASE_FLAGS;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[apiLevel=" + apiLevel + "]";
  }
}
