package com.consullo.mirror.service;

import com.consullo.mirror.capture.DisplayGeometry;
import com.consullo.mirror.ipc.RemoteCallException;
import com.consullo.mirror.ipc.RemoteInterface;
import com.consullo.mirror.ipc.VideoSink;
import java.util.Optional;

/**
 * Command surface handed to the client over IPC.
 *
 * <p>Every method may fail with {@link RemoteCallException} when called through a proxy whose host process is
 * gone; the in-process implementation never throws it.
 *
 * @since 1.0
 */
public interface ControlService extends RemoteInterface {

  /** Returned by {@link #getDisplayId()} when no virtual display is active. */
  int NO_DISPLAY = -1;

  /**
   * Creates the virtual display if none exists. A no-op while a display is active, whatever the size.
   *
   * @param width requested width, rounded down to a multiple of 8
   * @param height requested height, rounded down to a multiple of 8
   * @param dpi display density
   * @param bitrateKbps bit rate in kbit/s; &lt;= 0 selects the default
   * @throws RemoteCallException if the service is unreachable
   */
  void ensureDisplay(int width, int height, int dpi, int bitrateKbps) throws RemoteCallException;

  void destroyDisplay() throws RemoteCallException;

  /**
   * Launches a package's entry point on the active display. Ignored without a display or a launchable entry.
   *
   * @param packageName package to launch
   * @throws RemoteCallException if the service is unreachable
   */
  void launchApp(String packageName) throws RemoteCallException;

  void tap(float x, float y) throws RemoteCallException;

  void swipe(float x1, float y1, float x2, float y2, long durationMs) throws RemoteCallException;

  void touchDown(float x, float y) throws RemoteCallException;

  void touchMove(float x, float y) throws RemoteCallException;

  void touchUp(float x, float y) throws RemoteCallException;

  void injectKey(int keyCode) throws RemoteCallException;

  void injectKeyWithMeta(int keyCode, int metaState) throws RemoteCallException;

  /**
   * Captures the active display as PNG through the host screenshot utility. Independent of the video stream.
   *
   * @return image bytes, empty without a display or on any failure
   * @throws RemoteCallException if the service is unreachable
   */
  Optional<byte[]> requestScreenshot() throws RemoteCallException;

  /**
   * Returns the active display id.
   *
   * @return display id or {@link #NO_DISPLAY}
   * @throws RemoteCallException if the service is unreachable
   */
  int getDisplayId() throws RemoteCallException;

  /**
   * Returns the encode size of the active display. It can differ from the size a caller last requested,
   * because {@link #ensureDisplay} keeps an existing display.
   *
   * @return aligned size, or empty without an active display
   * @throws RemoteCallException if the service is unreachable
   */
  Optional<DisplayGeometry> getDisplaySize() throws RemoteCallException;

  /**
   * Registers the receiver of encoded frames, replacing any previous one; null unregisters.
   *
   * @param sink video sink or null
   * @throws RemoteCallException if the service is unreachable
   */
  void setVideoSink(VideoSink sink) throws RemoteCallException;
}
