package com.consullo.mirror.capture;

import com.consullo.mirror.input.InputInjector;
import com.consullo.mirror.platform.EncoderFormat;
import com.consullo.mirror.platform.EncoderOutput;
import com.consullo.mirror.platform.EncoderSurface;
import com.consullo.mirror.platform.HostDisplayCapabilities;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.ImePolicySetter;
import com.consullo.mirror.platform.VideoEncoder;
import com.consullo.mirror.platform.VideoEncoderFactory;
import com.consullo.mirror.platform.VirtualDisplayHandle;
import com.consullo.mirror.platform.VirtualDisplayHost;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the virtual display, the encoder input surface and the encoder, and drains encoded output.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>At most one display exists; a second {@link #ensureDisplay} is a no-op, even for a different size.</li>
 * <li>Display and encoder are created and destroyed together, under one lock.</li>
 * <li>Setup failures unwind everything created so far and are logged, never thrown.</li>
 * <li>Only the drain thread reads encoder output.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class CapturePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CapturePipeline.class);

  public static final int NO_DISPLAY = -1;

  private final CapturePipelineConfig config;
  private final VideoEncoderFactory encoderFactory;
  private final VirtualDisplayHost displayHost;
  private final HostDisplayCapabilities capabilities;
  private final ImePolicySetter imePolicySetter;
  private final InputInjector inputInjector;
  private final FrameListener frameListener;

  private final Object lifecycleLock = new Object();
  private final AtomicInteger displaySequence = new AtomicInteger();

  // guarded by lifecycleLock
  private ActiveDisplay active;

  private volatile EncoderState state = EncoderState.UNINITIALIZED;
  private volatile int displayId = NO_DISPLAY;

  /**
   * Display, encoder and drain thread that live and die together.
   */
  private static final class ActiveDisplay {
    final DisplayInfo info;
    final VirtualDisplayHandle display;
    final VideoEncoder encoder;
    final EncoderSurface surface;
    volatile boolean running = true;
    Thread drainThread;

    ActiveDisplay(DisplayInfo info, VirtualDisplayHandle display, VideoEncoder encoder, EncoderSurface surface) {
      this.info = info;
      this.display = display;
      this.encoder = encoder;
      this.surface = surface;
    }
  }

  public CapturePipeline(
      CapturePipelineConfig config,
      VideoEncoderFactory encoderFactory,
      VirtualDisplayHost displayHost,
      HostDisplayCapabilities capabilities,
      ImePolicySetter imePolicySetter,
      InputInjector inputInjector,
      FrameListener frameListener) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(encoderFactory, "encoderFactory must not be null");
    Validate.notNull(displayHost, "displayHost must not be null");
    Validate.notNull(capabilities, "capabilities must not be null");
    Validate.notNull(imePolicySetter, "imePolicySetter must not be null");
    Validate.notNull(inputInjector, "inputInjector must not be null");
    Validate.notNull(frameListener, "frameListener must not be null");
    this.config = config;
    this.encoderFactory = encoderFactory;
    this.displayHost = displayHost;
    this.capabilities = capabilities;
    this.imePolicySetter = imePolicySetter;
    this.inputInjector = inputInjector;
    this.frameListener = frameListener;
  }

  /**
   * Creates the virtual display and starts encoding, unless a display already exists.
   *
   * @param width requested width
   * @param height requested height
   * @param dpi display density
   * @param bitRate bit rate in bits per second; &lt;= 0 selects the configured default
   * @return the active display, or empty if setup failed
   */
  public Optional<DisplayInfo> ensureDisplay(int width, int height, int dpi, int bitRate) {
    synchronized (lifecycleLock) {
      if (active != null) {
        LOGGER.info("ensureDisplay: display {} already exists, ignoring {}x{}", active.info.getDisplayId(), width,
            height);
        return Optional.of(active.info);
      }

      DisplayGeometry geometry = DisplayGeometry.aligned(width, height);
      int actualBitRate = bitRate > 0 ? bitRate : config.defaultBitRate();
      LOGGER.info("ensureDisplay: requested {}x{} dpi={}, aligned {}x{} bitRate={}",
          width, height, dpi, geometry.width(), geometry.height(), actualBitRate);

      VideoEncoder encoder = null;
      EncoderSurface surface = null;
      VirtualDisplayHandle display = null;
      try {
        encoder = encoderFactory.createEncoder(config.mimeType());
        encoder.configure(new EncoderFormat(
            config.mimeType(),
            geometry.width(),
            geometry.height(),
            actualBitRate,
            config.frameRate(),
            config.iFrameIntervalSeconds()));
        surface = encoder.createInputSurface();
        encoder.start();

        int flags = capabilities.virtualDisplayFlags();
        String name = config.displayNamePrefix() + "-" + displaySequence.incrementAndGet();
        display = displayHost.createVirtualDisplay(name, geometry.width(), geometry.height(), dpi, surface, flags);
        if (display == null || display.displayId() <= 0) {
          throw new HostException("Host did not report a display id for " + name);
        }
        int id = display.displayId();
        applyLocalImePolicy(id);

        DisplayInfo info = DisplayInfo.builder()
            .displayId(id)
            .name(name)
            .geometry(geometry)
            .dpi(dpi)
            .bitRate(actualBitRate)
            .flags(flags)
            .build();

        ActiveDisplay created = new ActiveDisplay(info, display, encoder, surface);
        this.displayId = id;
        this.inputInjector.setDisplayId(id);
        this.state = EncoderState.CONFIGURED_RUNNING;
        created.drainThread = new Thread(() -> drainLoop(created), "DisplayEncoder-" + id);
        created.drainThread.start();
        this.active = created;

        LOGGER.info("Created virtual display and started encoder: {}", info);
        return Optional.of(info);
      } catch (HostException | RuntimeException e) {
        LOGGER.error("Failed to create virtual display or encoder: {}", e.getMessage(), e);
        unwind(display, encoder, surface);
        this.displayId = NO_DISPLAY;
        this.inputInjector.setDisplayId(InputInjector.DEFAULT_DISPLAY_ID);
        this.state = EncoderState.UNINITIALIZED;
        return Optional.empty();
      }
    }
  }

  /**
   * Releases the display and stops the encoder. No-op when no display exists.
   */
  public void destroyDisplay() {
    synchronized (lifecycleLock) {
      ActiveDisplay current = active;
      if (current == null) {
        LOGGER.debug("destroyDisplay: no active display");
        return;
      }
      active = null;
      LOGGER.info("Releasing virtual display {}", current.info.getDisplayId());

      try {
        current.display.release();
      } catch (RuntimeException e) {
        LOGGER.warn("Virtual display release failed: {}", e.getMessage(), e);
      }
      this.displayId = NO_DISPLAY;
      this.inputInjector.setDisplayId(InputInjector.DEFAULT_DISPLAY_ID);
      stopEncoder(current);
    }
  }

  public int displayId() {
    return displayId;
  }

  public EncoderState state() {
    return state;
  }

  public Optional<DisplayInfo> currentDisplay() {
    synchronized (lifecycleLock) {
      return active != null ? Optional.of(active.info) : Optional.empty();
    }
  }

  private void applyLocalImePolicy(int id) {
    try {
      imePolicySetter.setLocalImePolicy(id);
      LOGGER.debug("IME policy LOCAL applied for display {}", id);
    } catch (HostException | RuntimeException e) {
      LOGGER.warn("setLocalImePolicy failed for display {}: {}", id, e.getMessage(), e);
    }
  }

  private void stopEncoder(ActiveDisplay current) {
    this.state = EncoderState.DRAINING;
    current.running = false;
    try {
      current.encoder.signalEndOfInputStream();
    } catch (HostException | RuntimeException e) {
      LOGGER.warn("signalEndOfInputStream failed: {}", e.getMessage(), e);
    }

    Thread drain = current.drainThread;
    if (drain != null) {
      try {
        drain.join(config.drainJoinTimeoutMillis());
      } catch (InterruptedException e) {
        LOGGER.warn("Encoder thread join interrupted");
        Thread.currentThread().interrupt();
      }
      if (drain.isAlive()) {
        LOGGER.warn("Encoder thread {} still running after {}ms, releasing anyway", drain.getName(),
            config.drainJoinTimeoutMillis());
      }
    }

    try {
      current.encoder.stop();
    } catch (HostException | RuntimeException e) {
      LOGGER.warn("Error stopping encoder: {}", e.getMessage(), e);
    }
    current.encoder.release();
    current.surface.release();
    this.state = EncoderState.STOPPED;
    LOGGER.info("Encoder for display {} stopped", current.info.getDisplayId());
  }

  private static void unwind(VirtualDisplayHandle display, VideoEncoder encoder, EncoderSurface surface) {
    if (display != null) {
      try {
        display.release();
      } catch (RuntimeException e) {
        LOGGER.warn("Unwind: display release failed: {}", e.getMessage(), e);
      }
    }
    if (encoder != null) {
      try {
        encoder.release();
      } catch (RuntimeException e) {
        LOGGER.warn("Unwind: encoder release failed: {}", e.getMessage(), e);
      }
    }
    if (surface != null) {
      surface.release();
    }
  }

  private void drainLoop(ActiveDisplay owner) {
    VideoEncoder encoder = owner.encoder;
    long forwarded = 0;

    while (owner.running) {
      EncoderOutput output;
      try {
        output = encoder.dequeueOutput(config.dequeueTimeoutMicros());
      } catch (HostException | IllegalStateException e) {
        if (owner.running) {
          LOGGER.warn("dequeueOutput failed: {}", e.getMessage(), e);
        }
        break;
      }

      if (output.kind() == EncoderOutput.Kind.TRY_AGAIN_LATER) {
        continue;
      }

      if (output.kind() == EncoderOutput.Kind.FORMAT_CHANGED) {
        forwarded += forwardCodecConfig(encoder);
        continue;
      }

      ByteBuffer payload = output.payload();
      if (payload != null && payload.hasRemaining()) {
        byte[] data = new byte[payload.remaining()];
        payload.duplicate().get(data);
        forward(data);
        forwarded++;
      }
      try {
        encoder.releaseOutputBuffer(output.bufferIndex());
      } catch (HostException | IllegalStateException e) {
        LOGGER.warn("releaseOutputBuffer failed: {}", e.getMessage(), e);
        break;
      }
      if (output.isEndOfStream()) {
        LOGGER.debug("End of stream reached");
        break;
      }
    }
    LOGGER.info("Drain loop for display {} exited after {} access unit(s)", owner.info.getDisplayId(), forwarded);
  }

  private int forwardCodecConfig(VideoEncoder encoder) {
    List<ByteBuffer> records;
    try {
      records = encoder.codecConfigRecords();
    } catch (HostException | IllegalStateException e) {
      LOGGER.warn("Codec config unavailable after format change: {}", e.getMessage(), e);
      return 0;
    }
    int sent = 0;
    for (ByteBuffer record : records) {
      if (record == null) {
        continue;
      }
      ByteBuffer dup = record.duplicate();
      dup.position(0);
      if (!dup.hasRemaining()) {
        continue;
      }
      byte[] data = new byte[dup.remaining()];
      dup.get(data);
      forward(data);
      sent++;
    }
    LOGGER.debug("Forwarded {} codec config record(s)", sent);
    return sent;
  }

  private void forward(byte[] data) {
    try {
      frameListener.onFrame(data);
    } catch (RuntimeException e) {
      LOGGER.warn("Frame listener failed: {}", e.getMessage(), e);
    }
  }
}
