package com.consullo.mirror.driver;

import com.consullo.mirror.capture.CapturePipeline;
import com.consullo.mirror.input.InputInjector;
import com.consullo.mirror.platform.HostPlatform;
import com.consullo.mirror.service.ActivityTracker;
import com.consullo.mirror.service.IdleSupervisor;
import com.consullo.mirror.service.MirrorControlService;
import com.consullo.mirror.service.ScreenshotCapturer;
import com.consullo.mirror.sink.FrameSinkRegistry;

/**
 * Wires a {@link MirrorSession} from a host platform and a configuration.
 *
 * <p>
 * This class centralizes:
 * <ul>
 * <li>which host primitive feeds which component</li>
 * <li>the shared activity clock between the control service and the idle supervisor</li>
 * <li>the termination action of the idle supervisor</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class MirrorSessionFactory {

  private MirrorSessionFactory() {
  }

  /**
   * Creates a session; call {@link MirrorSession#start()} to bring it up.
   *
   * @param host host primitives
   * @param config session configuration
   * @param handoff delivery of the control service to clients
   * @param terminator action run by the idle supervisor (the server passes {@code System.exit(0)})
   * @return session
   */
  public static MirrorSession createSession(
      HostPlatform host,
      MirrorSessionConfig config,
      ServiceHandoff handoff,
      Runnable terminator) {
    if (host == null || config == null || handoff == null || terminator == null) {
      throw new IllegalArgumentException("host/config/handoff/terminator must not be null.");
    }

    InputInjector inputInjector = new InputInjector(host.inputChannel());
    FrameSinkRegistry sinkRegistry = new FrameSinkRegistry();
    CapturePipeline pipeline = new CapturePipeline(
        config.pipelineConfig(),
        host.encoderFactory(),
        host.displayHost(),
        host.displayCapabilities(),
        host.imePolicySetter(),
        inputInjector,
        sinkRegistry);

    ActivityTracker activityTracker = new ActivityTracker();
    ScreenshotCapturer screenshotCapturer = new ScreenshotCapturer(
        host.shellExecutor(), config.screenshotDirectory(), config.screenshotTimeoutMillis());
    MirrorControlService controlService = new MirrorControlService(
        pipeline, sinkRegistry, inputInjector, host.packageLauncher(), screenshotCapturer, activityTracker);
    IdleSupervisor idleSupervisor = new IdleSupervisor(
        sinkRegistry::hasSink, activityTracker, config.idleThresholdMillis(), config.idleTickMillis(), terminator);

    return new MirrorSession(pipeline, sinkRegistry, controlService, idleSupervisor, screenshotCapturer, handoff,
        config.targetPackages());
  }
}
