package com.consullo.mirror.client;

/**
 * Minimal inspection of Annex-B H.264 access units.
 *
 * @since 1.0
 */
public final class NalUnits {

  public static final int TYPE_UNKNOWN = -1;
  public static final int TYPE_SPS = 7;
  public static final int TYPE_PPS = 8;

  private NalUnits() {
  }

  /**
   * Type of the first NAL unit after the start code.
   *
   * @param data access unit
   * @return NAL unit type, or {@link #TYPE_UNKNOWN} without a start code
   */
  public static int firstNalType(byte[] data) {
    if (data == null) {
      return TYPE_UNKNOWN;
    }
    int offset;
    if (data.length > 4 && data[0] == 0 && data[1] == 0 && data[2] == 0 && data[3] == 1) {
      offset = 4;
    } else if (data.length > 3 && data[0] == 0 && data[1] == 0 && data[2] == 1) {
      offset = 3;
    } else {
      return TYPE_UNKNOWN;
    }
    return data[offset] & 0x1F;
  }

  public static boolean isCodecConfig(byte[] data) {
    int type = firstNalType(data);
    return type == TYPE_SPS || type == TYPE_PPS;
  }
}
