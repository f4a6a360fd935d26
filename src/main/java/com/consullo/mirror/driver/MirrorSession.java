package com.consullo.mirror.driver;

import com.consullo.mirror.capture.CapturePipeline;
import com.consullo.mirror.service.IdleSupervisor;
import com.consullo.mirror.service.MirrorControlService;
import com.consullo.mirror.service.ScreenshotCapturer;
import com.consullo.mirror.sink.FrameSinkRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One mirroring session of this process.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>capture pipeline (virtual display + encoder)</li>
 * <li>frame sink registry</li>
 * <li>control service handed to clients</li>
 * <li>idle supervisor</li>
 * </ul>
 * The process entry point creates the session, calls {@link #start()} and holds it until exit.
 * </p>
 *
 * @since 1.0
 */
public final class MirrorSession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorSession.class);

  private enum Phase {
    CREATED,
    STARTED,
    STOPPED
  }

  private final CapturePipeline pipeline;
  private final FrameSinkRegistry sinkRegistry;
  private final MirrorControlService controlService;
  private final IdleSupervisor idleSupervisor;
  private final ScreenshotCapturer screenshotCapturer;
  private final ServiceHandoff handoff;
  private final List<String> targetPackages;

  private Phase phase = Phase.CREATED;

  MirrorSession(
      CapturePipeline pipeline,
      FrameSinkRegistry sinkRegistry,
      MirrorControlService controlService,
      IdleSupervisor idleSupervisor,
      ScreenshotCapturer screenshotCapturer,
      ServiceHandoff handoff,
      List<String> targetPackages) {
    this.pipeline = pipeline;
    this.sinkRegistry = sinkRegistry;
    this.controlService = controlService;
    this.idleSupervisor = idleSupervisor;
    this.screenshotCapturer = screenshotCapturer;
    this.handoff = handoff;
    this.targetPackages = List.copyOf(targetPackages);
  }

  /**
   * Starts the idle supervisor and hands the control service to the clients.
   */
  public synchronized void start() {
    if (phase != Phase.CREATED) {
      throw new IllegalStateException("Session already " + phase.name().toLowerCase());
    }
    phase = Phase.STARTED;
    idleSupervisor.start();
    publishService();
    LOGGER.info("Mirror session started");
  }

  /**
   * Destroys the display, drops the sink and stops background threads. Idempotent.
   */
  public synchronized void stop() {
    if (phase == Phase.STOPPED) {
      return;
    }
    phase = Phase.STOPPED;
    idleSupervisor.close();
    pipeline.destroyDisplay();
    sinkRegistry.clear();
    controlService.shutdownEndpoint();
    screenshotCapturer.close();
    LOGGER.info("Mirror session stopped");
  }

  public MirrorControlService controlService() {
    return controlService;
  }

  public CapturePipeline pipeline() {
    return pipeline;
  }

  public FrameSinkRegistry sinkRegistry() {
    return sinkRegistry;
  }

  public IdleSupervisor idleSupervisor() {
    return idleSupervisor;
  }

  public synchronized boolean isRunning() {
    return phase == Phase.STARTED;
  }

  private void publishService() {
    if (targetPackages.isEmpty()) {
      if (!deliver(null)) {
        LOGGER.warn("Control service handoff was not delivered");
      }
      return;
    }
    boolean anySent = false;
    for (String pkg : targetPackages) {
      anySent |= deliver(pkg);
    }
    if (!anySent) {
      LOGGER.warn("Control service handoff was not delivered to any of {}", targetPackages);
    }
  }

  private boolean deliver(String targetPackage) {
    try {
      boolean sent = handoff.handOff(controlService, targetPackage);
      LOGGER.info("Control service handoff to {}: {}", targetPackage == null ? "<any>" : targetPackage,
          sent ? "delivered" : "not delivered");
      return sent;
    } catch (Exception e) {
      LOGGER.warn("Control service handoff to {} failed: {}", targetPackage, e.getMessage(), e);
      return false;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
