package com.consullo.mirror.platform;

/**
 * Key event addressed to a display.
 *
 * @param action key action
 * @param keyCode host key code
 * @param metaState modifier state
 * @param downTimeMillis uptime of the key down event
 * @param eventTimeMillis uptime of this event
 * @param displayId target display id
 * @since 1.0
 */
public record KeyInput(
    Action action,
    int keyCode,
    int metaState,
    long downTimeMillis,
    long eventTimeMillis,
    int displayId) {

  public enum Action {
    DOWN,
    UP
  }
}
