package com.consullo.mirror.client;

import com.consullo.mirror.capture.DisplayGeometry;
import com.consullo.mirror.ipc.LocalEndpoint;
import com.consullo.mirror.ipc.RemoteCallException;
import com.consullo.mirror.ipc.RemoteEndpoint;
import com.consullo.mirror.ipc.VideoSink;
import com.consullo.mirror.service.ControlService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side facade over the control service.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>requests the virtual display and publishes its id and the size the server actually encodes</li>
 * <li>registers its own video sink and routes frames to the installed {@link FrameHandler}</li>
 * <li>keeps the latest codec configuration and replays it to a newly installed handler</li>
 * <li>forwards input commands, reporting failures as {@code false}</li>
 * </ul>
 * </p>
 *
 * <p>The video size is published exactly once per display through a future; consumers wait on it instead of
 * polling.
 *
 * @since 1.0
 */
public final class ClientController implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClientController.class);

  public static final int NO_DISPLAY = ControlService.NO_DISPLAY;

  @FunctionalInterface
  private interface RemoteCall {
    void run(ControlService service) throws RemoteCallException;
  }

  private final ControlServiceRegistry registry;
  private final LocalEndpoint sinkEndpoint = new LocalEndpoint("client-video-sink");
  private final VideoSink sink = new ClientVideoSink();

  private final Object frameLock = new Object();

  // guarded by frameLock
  private FrameHandler frameHandler;
  // guarded by frameLock; NAL type -> latest record
  private final Map<Integer, byte[]> codecConfig = new LinkedHashMap<>();

  private volatile int displayId = NO_DISPLAY;
  private final AtomicReference<CompletableFuture<VideoSize>> videoSize =
      new AtomicReference<>(new CompletableFuture<>());

  public ClientController(ControlServiceRegistry registry) {
    Validate.notNull(registry, "registry must not be null");
    this.registry = registry;
  }

  /**
   * Asks the server for a virtual display and subscribes to its video.
   *
   * @param width requested width
   * @param height requested height
   * @param dpi display density
   * @param bitrateKbps bit rate in kbit/s; &lt;= 0 selects the server default
   * @return true if a display is active; the sink stays registered only in that case
   */
  public boolean ensureDisplay(int width, int height, int dpi, int bitrateKbps) {
    Optional<ControlService> service = registry.aliveService();
    if (service.isEmpty()) {
      LOGGER.warn("ensureDisplay: no control service available");
      return false;
    }
    ControlService remote = service.get();
    try {
      // subscribe first: codec config is emitted as soon as the encoder starts
      remote.setVideoSink(sink);
      remote.ensureDisplay(width, height, dpi, bitrateKbps);
      int id = remote.getDisplayId();
      if (id == NO_DISPLAY) {
        LOGGER.warn("ensureDisplay: server reported no display for {}x{}", width, height);
        remote.setVideoSink(null);
        return false;
      }
      Optional<DisplayGeometry> geometry = remote.getDisplaySize();
      if (geometry.isEmpty()) {
        LOGGER.warn("ensureDisplay: display {} reported no size", id);
        remote.setVideoSink(null);
        return false;
      }
      displayId = id;
      VideoSize size = VideoSize.of(geometry.get());
      if (!size.equals(VideoSize.of(DisplayGeometry.aligned(width, height)))) {
        LOGGER.info("ensureDisplay: display {} already active at {}x{}, requested {}x{}", id, size.width(),
            size.height(), width, height);
      }
      if (videoSize.get().complete(size)) {
        LOGGER.info("Display {} ready, video size {}x{}", id, size.width(), size.height());
      }
      return true;
    } catch (RemoteCallException e) {
      LOGGER.warn("ensureDisplay failed: {}", e.getMessage());
      return false;
    }
  }

  public OptionalInt getDisplayId() {
    int id = displayId;
    return id == NO_DISPLAY ? OptionalInt.empty() : OptionalInt.of(id);
  }

  /**
   * Video size, if already published.
   *
   * @return published size
   */
  public Optional<VideoSize> getVideoSize() {
    CompletableFuture<VideoSize> current = videoSize.get();
    if (current.isDone() && !current.isCompletedExceptionally()) {
      return Optional.of(current.join());
    }
    return Optional.empty();
  }

  /**
   * A future completing when the video size is published. Each call returns a fresh dependent future, so
   * callers may cancel or time it out freely.
   *
   * @return dependent future
   */
  public CompletableFuture<VideoSize> videoSizeFuture() {
    return videoSize.get().copy();
  }

  /**
   * Installs (or with {@code null} removes) the frame handler. A new handler first receives the latest codec
   * configuration records.
   *
   * @param handler handler, or null
   */
  public void setFrameHandler(FrameHandler handler) {
    synchronized (frameLock) {
      frameHandler = handler;
      if (handler == null) {
        return;
      }
      List<byte[]> replay = new ArrayList<>(codecConfig.values());
      for (byte[] record : replay) {
        deliverLocked(handler, record);
      }
      if (!replay.isEmpty()) {
        LOGGER.debug("Replayed {} codec config record(s) to new frame handler", replay.size());
      }
    }
  }

  public VideoSink videoSink() {
    return sink;
  }

  public boolean tap(float x, float y) {
    return call("tap", service -> service.tap(x, y));
  }

  public boolean swipe(float x1, float y1, float x2, float y2, long durationMs) {
    return call("swipe", service -> service.swipe(x1, y1, x2, y2, durationMs));
  }

  public boolean touchDown(float x, float y) {
    return call("touchDown", service -> service.touchDown(x, y));
  }

  public boolean touchMove(float x, float y) {
    return call("touchMove", service -> service.touchMove(x, y));
  }

  public boolean touchUp(float x, float y) {
    return call("touchUp", service -> service.touchUp(x, y));
  }

  public boolean injectKey(int keyCode) {
    return call("injectKey", service -> service.injectKey(keyCode));
  }

  public boolean injectKeyWithMeta(int keyCode, int metaState) {
    return call("injectKeyWithMeta", service -> service.injectKeyWithMeta(keyCode, metaState));
  }

  public boolean launchApp(String packageName) {
    return call("launchApp", service -> service.launchApp(packageName));
  }

  /**
   * Requests a PNG screenshot of the virtual display.
   *
   * @return PNG bytes, or empty on any failure
   */
  public Optional<byte[]> requestScreenshot() {
    Optional<ControlService> service = registry.aliveService();
    if (service.isEmpty()) {
      return Optional.empty();
    }
    try {
      return service.get().requestScreenshot();
    } catch (RemoteCallException e) {
      LOGGER.warn("requestScreenshot failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Unsubscribes the sink, destroys the display and resets the published state.
   */
  public void shutdown() {
    registry.aliveService().ifPresent(service -> {
      try {
        service.setVideoSink(null);
        service.destroyDisplay();
      } catch (RemoteCallException e) {
        LOGGER.warn("shutdown: server call failed: {}", e.getMessage());
      }
    });
    displayId = NO_DISPLAY;
    CompletableFuture<VideoSize> previous = videoSize.getAndSet(new CompletableFuture<>());
    previous.cancel(false);
    synchronized (frameLock) {
      codecConfig.clear();
    }
    LOGGER.info("Client controller shut down");
  }

  /**
   * Drops the frame handler and kills the sink endpoint, as if this client process went away.
   */
  @Override
  public void close() {
    setFrameHandler(null);
    sinkEndpoint.kill();
  }

  private boolean call(String name, RemoteCall remoteCall) {
    Optional<ControlService> service = registry.aliveService();
    if (service.isEmpty()) {
      LOGGER.debug("{}: no control service available", name);
      return false;
    }
    try {
      remoteCall.run(service.get());
      return true;
    } catch (RemoteCallException e) {
      LOGGER.warn("{} failed: {}", name, e.getMessage());
      return false;
    }
  }

  private void dispatchFrame(byte[] data) {
    synchronized (frameLock) {
      int type = NalUnits.firstNalType(data);
      if (type == NalUnits.TYPE_SPS || type == NalUnits.TYPE_PPS) {
        codecConfig.put(type, data);
      }
      FrameHandler handler = frameHandler;
      if (handler != null) {
        deliverLocked(handler, data);
      }
    }
  }

  private static void deliverLocked(FrameHandler handler, byte[] data) {
    try {
      handler.onFrame(data);
    } catch (RuntimeException e) {
      LOGGER.warn("Frame handler failed: {}", e.getMessage(), e);
    }
  }

  private final class ClientVideoSink implements VideoSink {

    @Override
    public RemoteEndpoint asEndpoint() {
      return sinkEndpoint;
    }

    @Override
    public void onVideoFrame(byte[] data) throws RemoteCallException {
      sinkEndpoint.checkAlive();
      dispatchFrame(data);
    }
  }
}
