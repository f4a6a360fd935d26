package com.consullo.mirror.input;

import com.consullo.mirror.platform.HostInputChannel;
import com.consullo.mirror.platform.KeyInput;
import com.consullo.mirror.platform.MotionInput;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates tap / swipe / touch / key commands into raw input events for the current target display.
 *
 * <p>The only state is the target display id (0 when no virtual display is active) and the down time of an
 * open touch gesture. Injection is fire-and-forget: failures are logged and never reach the caller.
 *
 * @since 1.0
 */
public final class InputInjector {

  private static final Logger LOGGER = LoggerFactory.getLogger(InputInjector.class);

  public static final int DEFAULT_DISPLAY_ID = 0;

  static final long SWIPE_STEP_MILLIS = 16L;

  private final HostInputChannel channel;
  private final LongSupplier clockMillis;

  private volatile int displayId = DEFAULT_DISPLAY_ID;
  private volatile long touchDownTime = -1L;

  public InputInjector(final HostInputChannel channel) {
    this(channel, System::currentTimeMillis);
  }

  InputInjector(final HostInputChannel channel, final LongSupplier clockMillis) {
    Validate.notNull(channel, "channel must not be null");
    Validate.notNull(clockMillis, "clockMillis must not be null");
    this.channel = channel;
    this.clockMillis = clockMillis;
  }

  public void setDisplayId(final int displayId) {
    this.displayId = displayId;
  }

  public int displayId() {
    return displayId;
  }

  public void tap(final float x, final float y) {
    final long down = clockMillis.getAsLong();
    final int target = displayId;
    sendMotion(new MotionInput(MotionInput.Action.DOWN, x, y, down, down, target));
    sendMotion(new MotionInput(MotionInput.Action.UP, x, y, down, clockMillis.getAsLong(), target));
  }

  /**
   * Injects a straight-line swipe: one down, evenly spaced moves over {@code durationMs}, one up.
   *
   * @param x1 start x
   * @param y1 start y
   * @param x2 end x
   * @param y2 end y
   * @param durationMs gesture duration; values &lt;= 0 produce a single move
   */
  public void swipe(final float x1, final float y1, final float x2, final float y2, final long durationMs) {
    final int target = displayId;
    final long duration = Math.max(0L, durationMs);
    final int steps = (int) Math.max(1L, duration / SWIPE_STEP_MILLIS);
    final long stepDelay = duration / steps;

    final long down = clockMillis.getAsLong();
    sendMotion(new MotionInput(MotionInput.Action.DOWN, x1, y1, down, down, target));
    for (int i = 1; i <= steps; i++) {
      if (stepDelay > 0 && !sleep(stepDelay)) {
        break;
      }
      final float fraction = (float) i / steps;
      final float x = x1 + (x2 - x1) * fraction;
      final float y = y1 + (y2 - y1) * fraction;
      sendMotion(new MotionInput(MotionInput.Action.MOVE, x, y, down, clockMillis.getAsLong(), target));
    }
    sendMotion(new MotionInput(MotionInput.Action.UP, x2, y2, down, clockMillis.getAsLong(), target));
  }

  public void touchDown(final float x, final float y) {
    final long down = clockMillis.getAsLong();
    touchDownTime = down;
    sendMotion(new MotionInput(MotionInput.Action.DOWN, x, y, down, down, displayId));
  }

  public void touchMove(final float x, final float y) {
    final long now = clockMillis.getAsLong();
    sendMotion(new MotionInput(MotionInput.Action.MOVE, x, y, gestureDownTime(now), now, displayId));
  }

  public void touchUp(final float x, final float y) {
    final long now = clockMillis.getAsLong();
    sendMotion(new MotionInput(MotionInput.Action.UP, x, y, gestureDownTime(now), now, displayId));
    touchDownTime = -1L;
  }

  public void injectKey(final int keyCode) {
    injectKeyWithMeta(keyCode, 0);
  }

  public void injectKeyWithMeta(final int keyCode, final int metaState) {
    final long down = clockMillis.getAsLong();
    final int target = displayId;
    sendKey(new KeyInput(KeyInput.Action.DOWN, keyCode, metaState, down, down, target));
    sendKey(new KeyInput(KeyInput.Action.UP, keyCode, metaState, down, clockMillis.getAsLong(), target));
  }

  private long gestureDownTime(final long now) {
    final long down = touchDownTime;
    return down >= 0 ? down : now;
  }

  private void sendMotion(final MotionInput event) {
    try {
      if (!channel.injectMotion(event)) {
        LOGGER.warn("Motion event rejected: {}", event);
      }
    } catch (final Exception e) {
      LOGGER.warn("Motion injection failed for {}: {}", event, e.getMessage(), e);
    }
  }

  private void sendKey(final KeyInput event) {
    try {
      if (!channel.injectKey(event)) {
        LOGGER.warn("Key event rejected: {}", event);
      }
    } catch (final Exception e) {
      LOGGER.warn("Key injection failed for {}: {}", event, e.getMessage(), e);
    }
  }

  private static boolean sleep(final long millis) {
    try {
      Thread.sleep(millis);
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
