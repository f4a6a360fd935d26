package com.consullo.mirror.sink;

import com.consullo.mirror.capture.FrameListener;
import com.consullo.mirror.ipc.DeathRecipient;
import com.consullo.mirror.ipc.RemoteCallException;
import com.consullo.mirror.ipc.RemoteEndpoint;
import com.consullo.mirror.ipc.VideoSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds at most one remote {@link VideoSink} and forwards encoded frames to it.
 *
 * <p>
 * Registration, forwarding and death handling share one lock. A death notification is delivered as a message
 * carrying the registration it was made for; a notification for a registration that has since been replaced
 * is dropped, so a late death of an old sink can never clear a new one.
 * </p>
 *
 * <p>Forwarding is best-effort: a failed call invalidates the sink, nothing is retried or buffered.
 *
 * @since 1.0
 */
public final class FrameSinkRegistry implements FrameListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameSinkRegistry.class);

  private final Object lock = new Object();

  // guarded by lock
  private Registration current;

  /**
   * One installed sink together with its death subscription.
   */
  private final class Registration implements DeathRecipient {
    final VideoSink sink;
    final RemoteEndpoint endpoint;

    Registration(VideoSink sink) {
      this.sink = sink;
      this.endpoint = sink.asEndpoint();
    }

    @Override
    public void endpointDied() {
      onSinkDied(this);
    }
  }

  /**
   * Installs a sink, replacing (and unsubscribing) any previous one. {@code null} clears the registry. A sink
   * without an endpoint is ignored and the current sink stays installed.
   *
   * @param sink new sink, or null
   */
  public void setSink(VideoSink sink) {
    synchronized (lock) {
      if (sink != null && sink.asEndpoint() == null) {
        LOGGER.warn("setSink: ignoring a sink without an endpoint");
        return;
      }
      if (current != null && sink != null && current.endpoint == sink.asEndpoint()) {
        LOGGER.debug("setSink: endpoint {} already registered", current.endpoint);
        return;
      }
      clearLocked("replaced");
      if (sink == null) {
        return;
      }

      Registration registration = new Registration(sink);
      try {
        registration.endpoint.linkToDeath(registration);
      } catch (RemoteCallException e) {
        LOGGER.warn("linkToDeath for video sink failed, sink not installed: {}", e.getMessage());
        return;
      }
      current = registration;
      LOGGER.info("Video sink registered: {}", registration.endpoint);
    }
  }

  public boolean hasSink() {
    synchronized (lock) {
      return current != null;
    }
  }

  public void clear() {
    setSink(null);
  }

  /**
   * Forwards one frame to the registered sink, if any. Never throws.
   *
   * @param frame access unit bytes
   */
  public void forward(byte[] frame) {
    synchronized (lock) {
      Registration target = current;
      if (target == null) {
        return;
      }
      try {
        target.sink.onVideoFrame(frame);
      } catch (RemoteCallException | RuntimeException e) {
        LOGGER.warn("Video sink call failed, invalidating sink: {}", e.getMessage());
        if (current == target) {
          clearLocked("call failed");
        }
      }
    }
  }

  @Override
  public void onFrame(byte[] frame) {
    forward(frame);
  }

  private void onSinkDied(Registration registration) {
    synchronized (lock) {
      if (current != registration) {
        LOGGER.debug("Ignoring death notification of a replaced sink {}", registration.endpoint);
        return;
      }
      LOGGER.info("Video sink endpoint {} died, clearing sink", registration.endpoint);
      current = null;
    }
  }

  // caller holds lock
  private void clearLocked(String reason) {
    Registration previous = current;
    if (previous == null) {
      return;
    }
    current = null;
    try {
      previous.endpoint.unlinkToDeath(previous);
    } catch (RuntimeException e) {
      LOGGER.warn("unlinkToDeath of previous video sink failed: {}", e.getMessage(), e);
    }
    LOGGER.debug("Video sink {} cleared ({})", previous.endpoint, reason);
  }
}
