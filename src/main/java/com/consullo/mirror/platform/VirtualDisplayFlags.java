package com.consullo.mirror.platform;

/**
 * Virtual display flag bits understood by the host display manager.
 *
 * @since 1.0
 */
public final class VirtualDisplayFlags {

  public static final int PUBLIC = 1;
  public static final int PRESENTATION = 1 << 1;
  public static final int OWN_CONTENT_ONLY = 1 << 3;
  public static final int SUPPORTS_TOUCH = 1 << 6;
  public static final int ROTATES_WITH_CONTENT = 1 << 7;
  public static final int DESTROY_CONTENT_ON_REMOVAL = 1 << 8;
  public static final int TRUSTED = 1 << 10;
  public static final int OWN_DISPLAY_GROUP = 1 << 11;
  public static final int ALWAYS_UNLOCKED = 1 << 12;
  public static final int TOUCH_FEEDBACK_DISABLED = 1 << 13;
  public static final int OWN_FOCUS = 1 << 14;
  public static final int DEVICE_DISPLAY_GROUP = 1 << 15;

  private VirtualDisplayFlags() {
  }

  public static boolean isSet(int flags, int flag) {
    return (flags & flag) == flag;
  }
}
