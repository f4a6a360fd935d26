package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.HostInputChannel;
import com.consullo.mirror.platform.KeyInput;
import com.consullo.mirror.platform.MotionInput;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Input channel that records every injected event.
 *
 * @since 1.0
 */
public final class LoopbackInputChannel implements HostInputChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackInputChannel.class);

  private final List<MotionInput> motions = new CopyOnWriteArrayList<>();
  private final List<KeyInput> keys = new CopyOnWriteArrayList<>();

  @Override
  public boolean injectMotion(MotionInput event) {
    LOGGER.debug("motion {} ({}, {}) on display {}", event.action(), event.x(), event.y(), event.displayId());
    motions.add(event);
    return true;
  }

  @Override
  public boolean injectKey(KeyInput event) {
    LOGGER.debug("key {} code={} meta={} on display {}",
        event.action(), event.keyCode(), event.metaState(), event.displayId());
    keys.add(event);
    return true;
  }

  public List<MotionInput> motionEvents() {
    return List.copyOf(motions);
  }

  public List<KeyInput> keyEvents() {
    return List.copyOf(keys);
  }
}
