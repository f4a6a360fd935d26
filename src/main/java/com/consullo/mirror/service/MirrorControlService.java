package com.consullo.mirror.service;

import com.consullo.mirror.capture.CapturePipeline;
import com.consullo.mirror.capture.DisplayGeometry;
import com.consullo.mirror.input.InputInjector;
import com.consullo.mirror.ipc.LocalEndpoint;
import com.consullo.mirror.ipc.RemoteEndpoint;
import com.consullo.mirror.ipc.VideoSink;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.PackageLauncher;
import com.consullo.mirror.sink.FrameSinkRegistry;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ControlService} implementation dispatching to the capture pipeline, the input injector and the frame
 * sink registry.
 *
 * <p>Every command records activity before doing anything else. Display lifecycle serialization lives in
 * {@link CapturePipeline}; input is fire-and-forget.
 *
 * @since 1.0
 */
public final class MirrorControlService implements ControlService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorControlService.class);

  private final CapturePipeline pipeline;
  private final FrameSinkRegistry sinkRegistry;
  private final InputInjector inputInjector;
  private final PackageLauncher packageLauncher;
  private final ScreenshotCapturer screenshotCapturer;
  private final ActivityTracker activityTracker;
  private final LocalEndpoint endpoint = new LocalEndpoint("control-service");

  public MirrorControlService(
      final CapturePipeline pipeline,
      final FrameSinkRegistry sinkRegistry,
      final InputInjector inputInjector,
      final PackageLauncher packageLauncher,
      final ScreenshotCapturer screenshotCapturer,
      final ActivityTracker activityTracker) {
    Validate.notNull(pipeline, "pipeline must not be null");
    Validate.notNull(sinkRegistry, "sinkRegistry must not be null");
    Validate.notNull(inputInjector, "inputInjector must not be null");
    Validate.notNull(packageLauncher, "packageLauncher must not be null");
    Validate.notNull(screenshotCapturer, "screenshotCapturer must not be null");
    Validate.notNull(activityTracker, "activityTracker must not be null");
    this.pipeline = pipeline;
    this.sinkRegistry = sinkRegistry;
    this.inputInjector = inputInjector;
    this.packageLauncher = packageLauncher;
    this.screenshotCapturer = screenshotCapturer;
    this.activityTracker = activityTracker;
  }

  @Override
  public RemoteEndpoint asEndpoint() {
    return endpoint;
  }

  /**
   * Marks the service unreachable for every client holding it.
   */
  public void shutdownEndpoint() {
    endpoint.kill();
  }

  @Override
  public void ensureDisplay(int width, int height, int dpi, int bitrateKbps) {
    activityTracker.markActive();
    pipeline.ensureDisplay(width, height, dpi, toBitRate(bitrateKbps));
  }

  static int toBitRate(int bitrateKbps) {
    if (bitrateKbps <= 0) {
      return 0;
    }
    try {
      return Math.multiplyExact(bitrateKbps, 1000);
    } catch (ArithmeticException e) {
      LOGGER.warn("ensureDisplay: {} kbps exceeds the encoder range, clamping to {} bps", bitrateKbps,
          Integer.MAX_VALUE);
      return Integer.MAX_VALUE;
    }
  }

  @Override
  public void destroyDisplay() {
    activityTracker.markActive();
    pipeline.destroyDisplay();
  }

  @Override
  public void launchApp(String packageName) {
    activityTracker.markActive();
    if (packageName == null || packageName.isBlank()) {
      LOGGER.debug("launchApp: empty package name ignored");
      return;
    }
    int displayId = pipeline.displayId();
    if (displayId == CapturePipeline.NO_DISPLAY) {
      LOGGER.info("launchApp: no virtual display, ignoring {}", packageName);
      return;
    }
    try {
      Optional<String> component = packageLauncher.resolveLaunchComponent(packageName);
      if (component.isEmpty()) {
        LOGGER.info("launchApp: no launch entry point for {}", packageName);
        return;
      }
      packageLauncher.startOnDisplay(component.get(), displayId);
      LOGGER.info("launchApp: started {} on display {}", component.get(), displayId);
    } catch (HostException | RuntimeException e) {
      LOGGER.warn("launchApp failed for {}: {}", packageName, e.getMessage(), e);
    }
  }

  @Override
  public void tap(float x, float y) {
    activityTracker.markActive();
    inputInjector.tap(x, y);
    LOGGER.debug("TAP {},{} on display {}", x, y, inputInjector.displayId());
  }

  @Override
  public void swipe(float x1, float y1, float x2, float y2, long durationMs) {
    activityTracker.markActive();
    inputInjector.swipe(x1, y1, x2, y2, durationMs);
    LOGGER.debug("SWIPE {},{} -> {},{} d={} on display {}", x1, y1, x2, y2, durationMs, inputInjector.displayId());
  }

  @Override
  public void touchDown(float x, float y) {
    activityTracker.markActive();
    inputInjector.touchDown(x, y);
  }

  @Override
  public void touchMove(float x, float y) {
    activityTracker.markActive();
    inputInjector.touchMove(x, y);
  }

  @Override
  public void touchUp(float x, float y) {
    activityTracker.markActive();
    inputInjector.touchUp(x, y);
  }

  @Override
  public void injectKey(int keyCode) {
    activityTracker.markActive();
    inputInjector.injectKey(keyCode);
    LOGGER.debug("KEY {} on display {}", keyCode, inputInjector.displayId());
  }

  @Override
  public void injectKeyWithMeta(int keyCode, int metaState) {
    activityTracker.markActive();
    inputInjector.injectKeyWithMeta(keyCode, metaState);
    LOGGER.debug("KEY {} (meta={}) on display {}", keyCode, metaState, inputInjector.displayId());
  }

  @Override
  public Optional<byte[]> requestScreenshot() {
    activityTracker.markActive();
    int displayId = pipeline.displayId();
    if (displayId == CapturePipeline.NO_DISPLAY) {
      LOGGER.info("requestScreenshot: no virtual display");
      return Optional.empty();
    }
    return screenshotCapturer.capture(displayId);
  }

  @Override
  public int getDisplayId() {
    activityTracker.markActive();
    int displayId = pipeline.displayId();
    return displayId == CapturePipeline.NO_DISPLAY ? NO_DISPLAY : displayId;
  }

  @Override
  public Optional<DisplayGeometry> getDisplaySize() {
    activityTracker.markActive();
    return pipeline.currentDisplay().map(info -> new DisplayGeometry(info.getWidth(), info.getHeight()));
  }

  @Override
  public void setVideoSink(VideoSink sink) {
    activityTracker.markActive();
    sinkRegistry.setSink(sink);
  }
}
