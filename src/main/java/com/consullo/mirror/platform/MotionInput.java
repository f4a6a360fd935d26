package com.consullo.mirror.platform;

/**
 * Single-pointer motion event addressed to a display.
 *
 * @param action pointer action
 * @param x x coordinate in display pixels
 * @param y y coordinate in display pixels
 * @param downTimeMillis uptime of the gesture's initial down event
 * @param eventTimeMillis uptime of this event
 * @param displayId target display id
 * @since 1.0
 */
public record MotionInput(
    Action action,
    float x,
    float y,
    long downTimeMillis,
    long eventTimeMillis,
    int displayId) {

  public enum Action {
    DOWN,
    MOVE,
    UP
  }
}
