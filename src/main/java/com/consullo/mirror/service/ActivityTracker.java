package com.consullo.mirror.service;

import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;

/**
 * Last time any inbound command was observed. Written by command threads, read by the idle supervisor;
 * last writer wins.
 *
 * @since 1.0
 */
public final class ActivityTracker {

  private final LongSupplier clockMillis;
  private volatile long lastActivityMillis;

  public ActivityTracker() {
    this(System::currentTimeMillis);
  }

  public ActivityTracker(final LongSupplier clockMillis) {
    Validate.notNull(clockMillis, "clockMillis must not be null");
    this.clockMillis = clockMillis;
    this.lastActivityMillis = clockMillis.getAsLong();
  }

  public void markActive() {
    lastActivityMillis = clockMillis.getAsLong();
  }

  public long lastActivityMillis() {
    return lastActivityMillis;
  }

  public long millisSinceLastActivity() {
    return clockMillis.getAsLong() - lastActivityMillis;
  }
}
