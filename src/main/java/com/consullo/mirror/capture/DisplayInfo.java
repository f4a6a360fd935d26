package com.consullo.mirror.capture;

/**
 * Immutable description of the active virtual display.
 *
 * @since 1.0
 */
public final class DisplayInfo {

  private final int displayId;
  private final String name;
  private final int width;
  private final int height;
  private final int dpi;
  private final int bitRate;
  private final int flags;

  private DisplayInfo(Builder b) {
    this.displayId = b.displayId;
    this.name = b.name;
    this.width = b.width;
    this.height = b.height;
    this.dpi = b.dpi;
    this.bitRate = b.bitRate;
    this.flags = b.flags;
  }

  public int getDisplayId() {
    return displayId;
  }

  public String getName() {
    return name;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getDpi() {
    return dpi;
  }

  public int getBitRate() {
    return bitRate;
  }

  public int getFlags() {
    return flags;
  }

  @Override
  public String toString() {
    return "DisplayInfo[id=" + displayId + ", " + width + "x" + height + ", dpi=" + dpi
        + ", bitRate=" + bitRate + ", flags=0x" + Integer.toHexString(flags) + "]";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private int displayId;
    private String name;
    private int width;
    private int height;
    private int dpi;
    private int bitRate;
    private int flags;

    private Builder() {
    }

    public Builder displayId(int displayId) {
      this.displayId = displayId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder geometry(DisplayGeometry geometry) {
      this.width = geometry.width();
      this.height = geometry.height();
      return this;
    }

    public Builder dpi(int dpi) {
      this.dpi = dpi;
      return this;
    }

    public Builder bitRate(int bitRate) {
      this.bitRate = bitRate;
      return this;
    }

    public Builder flags(int flags) {
      this.flags = flags;
      return this;
    }

    public DisplayInfo build() {
      if (displayId <= 0) {
        throw new IllegalArgumentException("displayId must be positive.");
      }
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("width/height must be positive.");
      }
      return new DisplayInfo(this);
    }
  }
}
