package com.consullo.mirror.service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ends the session when nobody is watching: no registered sink and no command for longer than the threshold.
 *
 * <p>Protects against orphaned server processes after a client crashed without tearing down.
 *
 * @since 1.0
 */
public final class IdleSupervisor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(IdleSupervisor.class);

  private final BooleanSupplier hasSink;
  private final ActivityTracker activityTracker;
  private final long idleThresholdMillis;
  private final long tickMillis;
  private final Runnable terminator;
  private final AtomicBoolean terminated = new AtomicBoolean();

  private ScheduledExecutorService scheduler;

  /**
   * Creates a supervisor.
   *
   * @param hasSink reports whether a video sink is registered
   * @param activityTracker command activity clock
   * @param idleThresholdMillis idle time after which the terminator runs
   * @param tickMillis check interval
   * @param terminator action ending the session (the process entry point passes {@code System.exit})
   */
  public IdleSupervisor(
      final BooleanSupplier hasSink,
      final ActivityTracker activityTracker,
      final long idleThresholdMillis,
      final long tickMillis,
      final Runnable terminator) {
    Validate.notNull(hasSink, "hasSink must not be null");
    Validate.notNull(activityTracker, "activityTracker must not be null");
    Validate.isTrue(idleThresholdMillis > 0, "idleThresholdMillis must be positive");
    Validate.isTrue(tickMillis > 0, "tickMillis must be positive");
    Validate.notNull(terminator, "terminator must not be null");
    this.hasSink = hasSink;
    this.activityTracker = activityTracker;
    this.idleThresholdMillis = idleThresholdMillis;
    this.tickMillis = tickMillis;
    this.terminator = terminator;
  }

  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "IdleSupervisor");
      t.setDaemon(true);
      return t;
    });
    scheduler.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
    LOGGER.debug("Idle supervisor started: threshold={}ms tick={}ms", idleThresholdMillis, tickMillis);
  }

  /**
   * Runs one check.
   *
   * @return true if this check decided to terminate
   */
  public boolean checkIdle() {
    if (terminated.get() || hasSink.getAsBoolean()) {
      return false;
    }
    long idle = activityTracker.millisSinceLastActivity();
    if (idle <= idleThresholdMillis) {
      return false;
    }
    if (!terminated.compareAndSet(false, true)) {
      return false;
    }
    LOGGER.info("No video sink and no command for {}ms (last at {}, threshold {}ms), terminating", idle,
        activityTracker.lastActivityMillis(), idleThresholdMillis);
    terminator.run();
    return true;
  }

  public boolean isTerminated() {
    return terminated.get();
  }

  private void tick() {
    try {
      checkIdle();
    } catch (RuntimeException e) {
      LOGGER.error("Idle check failed: {}", e.getMessage(), e);
    }
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }
}
