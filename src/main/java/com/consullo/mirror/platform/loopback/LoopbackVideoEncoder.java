package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.EncoderFormat;
import com.consullo.mirror.platform.EncoderOutput;
import com.consullo.mirror.platform.EncoderSurface;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.VideoEncoder;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encoder that synthesises an AVC-shaped Annex B stream at the configured frame rate.
 *
 * <p>The first poll after {@link #start()} reports a format change exposing SPS/PPS records; afterwards an IDR
 * access unit is emitted every {@code frameRate * iFrameInterval} frames and P access units in between. After
 * {@link #signalEndOfInputStream()} the next poll returns an empty end-of-stream buffer.
 *
 * @since 1.0
 */
public final class LoopbackVideoEncoder implements VideoEncoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackVideoEncoder.class);

  static final byte NAL_SPS = 0x67;
  static final byte NAL_PPS = 0x68;
  static final byte NAL_IDR = 0x65;
  static final byte NAL_NON_IDR = 0x41;

  private enum State {
    CREATED,
    CONFIGURED,
    EXECUTING,
    STOPPED,
    RELEASED
  }

  private final Object lock = new Object();
  private final AtomicLong framesProduced = new AtomicLong();

  private State state = State.CREATED;
  private EncoderFormat format;
  private LoopbackEncoderSurface inputSurface;
  private boolean formatReported;
  private boolean endOfInputSignalled;
  private boolean endOfStreamDelivered;
  private long nextFrameNanos;
  private int pendingBufferIndex = -1;
  private int nextBufferIndex;

  @Override
  public void configure(EncoderFormat format) throws HostException {
    synchronized (lock) {
      requireState(State.CREATED, "configure");
      if (format == null || format.width() <= 0 || format.height() <= 0 || format.frameRate() <= 0) {
        throw new HostException("Unsupported format: " + format);
      }
      this.format = format;
      this.state = State.CONFIGURED;
    }
  }

  @Override
  public EncoderSurface createInputSurface() throws HostException {
    synchronized (lock) {
      requireState(State.CONFIGURED, "createInputSurface");
      if (inputSurface == null) {
        inputSurface = new LoopbackEncoderSurface();
      }
      return inputSurface;
    }
  }

  @Override
  public void start() throws HostException {
    synchronized (lock) {
      requireState(State.CONFIGURED, "start");
      state = State.EXECUTING;
      nextFrameNanos = System.nanoTime();
      LOGGER.debug("Loopback encoder started: {}x{} @ {}fps", format.width(), format.height(), format.frameRate());
    }
  }

  @Override
  public EncoderOutput dequeueOutput(long timeoutMicros) throws HostException {
    long waitNanos;
    synchronized (lock) {
      requireState(State.EXECUTING, "dequeueOutput");
      if (!formatReported) {
        formatReported = true;
        return EncoderOutput.formatChanged();
      }
      if (pendingBufferIndex >= 0) {
        throw new HostException("Output buffer " + pendingBufferIndex + " was not released");
      }
      if (endOfInputSignalled) {
        if (endOfStreamDelivered) {
          return EncoderOutput.tryAgainLater();
        }
        endOfStreamDelivered = true;
        return takeBuffer(ByteBuffer.allocate(0), true);
      }
      waitNanos = nextFrameNanos - System.nanoTime();
      if (waitNanos <= 0) {
        return nextFrame();
      }
    }

    long timeoutNanos = TimeUnit.MICROSECONDS.toNanos(Math.max(0L, timeoutMicros));
    if (waitNanos > timeoutNanos) {
      sleepNanos(timeoutNanos);
      return EncoderOutput.tryAgainLater();
    }
    sleepNanos(waitNanos);
    synchronized (lock) {
      requireState(State.EXECUTING, "dequeueOutput");
      if (endOfInputSignalled || pendingBufferIndex >= 0) {
        return EncoderOutput.tryAgainLater();
      }
      return nextFrame();
    }
  }

  @Override
  public List<ByteBuffer> codecConfigRecords() throws HostException {
    synchronized (lock) {
      if (format == null) {
        throw new HostException("Encoder is not configured");
      }
      byte[] sps = {0, 0, 0, 1, NAL_SPS, 0x42, (byte) 0x80, 0x1f,
          (byte) (format.width() >> 8), (byte) format.width(), (byte) (format.height() >> 8), (byte) format.height()};
      byte[] pps = {0, 0, 0, 1, NAL_PPS, (byte) 0xce, 0x3c, (byte) 0x80};
      return List.of(ByteBuffer.wrap(sps), ByteBuffer.wrap(pps));
    }
  }

  @Override
  public void releaseOutputBuffer(int index) throws HostException {
    synchronized (lock) {
      if (index != pendingBufferIndex) {
        throw new HostException("Unknown output buffer index " + index);
      }
      pendingBufferIndex = -1;
    }
  }

  @Override
  public void signalEndOfInputStream() throws HostException {
    synchronized (lock) {
      requireState(State.EXECUTING, "signalEndOfInputStream");
      endOfInputSignalled = true;
    }
  }

  @Override
  public void stop() throws HostException {
    synchronized (lock) {
      if (state != State.EXECUTING && state != State.CONFIGURED) {
        throw new HostException("stop called in state " + state);
      }
      state = State.STOPPED;
    }
  }

  @Override
  public void release() {
    synchronized (lock) {
      state = State.RELEASED;
    }
  }

  public boolean isReleased() {
    synchronized (lock) {
      return state == State.RELEASED;
    }
  }

  /**
   * @return the surface handed out by {@link #createInputSurface()}, or {@code null} before that call
   */
  public LoopbackEncoderSurface inputSurface() {
    synchronized (lock) {
      return inputSurface;
    }
  }

  public long framesProduced() {
    return framesProduced.get();
  }

  private EncoderOutput nextFrame() {
    long frameIndex = framesProduced.getAndIncrement();
    long gop = (long) format.frameRate() * Math.max(1, format.iFrameIntervalSeconds());
    boolean keyFrame = frameIndex % gop == 0;
    // roughly bitRate / frameRate bytes per access unit, capped for the loopback
    int size = Math.max(16, Math.min(4096, format.bitRate() / 8 / format.frameRate() / (keyFrame ? 8 : 32)));
    byte[] data = new byte[size];
    data[3] = 1;
    data[4] = keyFrame ? NAL_IDR : NAL_NON_IDR;
    for (int i = 5; i < size; i++) {
      data[i] = (byte) (frameIndex + i);
    }
    nextFrameNanos += TimeUnit.SECONDS.toNanos(1) / format.frameRate();
    return takeBuffer(ByteBuffer.wrap(data), false);
  }

  private EncoderOutput takeBuffer(ByteBuffer payload, boolean endOfStream) {
    pendingBufferIndex = nextBufferIndex;
    nextBufferIndex = (nextBufferIndex + 1) % 8;
    return EncoderOutput.buffer(pendingBufferIndex, payload, endOfStream);
  }

  private void requireState(State expected, String operation) throws HostException {
    if (state != expected) {
      throw new HostException(operation + " called in state " + state);
    }
  }

  private static void sleepNanos(long nanos) throws HostException {
    if (nanos <= 0) {
      return;
    }
    try {
      TimeUnit.NANOSECONDS.sleep(nanos);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HostException("dequeueOutput interrupted", e);
    }
  }
}
