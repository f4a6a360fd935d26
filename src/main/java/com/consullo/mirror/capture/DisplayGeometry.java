package com.consullo.mirror.capture;

/**
 * Encode size of a virtual display.
 *
 * <p>Hardware AVC encoders commonly reject sizes that are not a multiple of 8 (some fail in configure with no
 * useful message), so each axis is rounded down to a multiple of 8 and floored at 2.
 *
 * @param width aligned width
 * @param height aligned height
 * @since 1.0
 */
public record DisplayGeometry(int width, int height) {

  static final int ALIGNMENT = 8;
  static final int MIN_DIMENSION = 2;

  /**
   * Aligns a requested size.
   *
   * @param requestedWidth requested width
   * @param requestedHeight requested height
   * @return aligned geometry
   */
  public static DisplayGeometry aligned(int requestedWidth, int requestedHeight) {
    return new DisplayGeometry(alignDimension(requestedWidth), alignDimension(requestedHeight));
  }

  static int alignDimension(int value) {
    return Math.max(MIN_DIMENSION, value & ~(ALIGNMENT - 1));
  }
}
