package com.consullo.mirror.service;

import com.consullo.mirror.platform.CommandResult;
import com.consullo.mirror.platform.ShellExecutor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based screenshot of a display through the host {@code screencap} utility.
 *
 * <p>The capture runs on a dedicated I/O thread; the caller blocks for at most the configured timeout.
 * The temporary image file is removed after every attempt.
 *
 * @since 1.0
 */
public final class ScreenshotCapturer implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScreenshotCapturer.class);

  private final ShellExecutor shellExecutor;
  private final Path directory;
  private final long timeoutMillis;
  private final ExecutorService ioExecutor;

  public ScreenshotCapturer(ShellExecutor shellExecutor, Path directory, long timeoutMillis) {
    Validate.notNull(shellExecutor, "shellExecutor must not be null");
    Validate.notNull(directory, "directory must not be null");
    Validate.isTrue(timeoutMillis > 0, "timeoutMillis must be positive");
    this.shellExecutor = shellExecutor;
    this.directory = directory;
    this.timeoutMillis = timeoutMillis;
    this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "ScreenshotIO");
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Captures the given display.
   *
   * @param displayId display to capture
   * @return PNG bytes, empty on failure or missing/empty output
   */
  public Optional<byte[]> capture(int displayId) {
    Future<Optional<byte[]>> pending;
    try {
      pending = ioExecutor.submit(() -> captureBlocking(displayId));
    } catch (RuntimeException e) {
      LOGGER.warn("Screenshot rejected: {}", e.getMessage());
      return Optional.empty();
    }
    try {
      return pending.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn("Screenshot of display {} timed out after {}ms", displayId, timeoutMillis);
      pending.cancel(true);
      return Optional.empty();
    } catch (ExecutionException e) {
      LOGGER.warn("Screenshot of display {} failed: {}", displayId, e.getCause().getMessage(), e.getCause());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.cancel(true);
      return Optional.empty();
    }
  }

  Path screenshotPath(int displayId) {
    return directory.resolve("mirror_screenshot_" + displayId + ".png");
  }

  private Optional<byte[]> captureBlocking(int displayId) throws Exception {
    Path path = screenshotPath(displayId);
    String command = "screencap -d " + displayId + " -p " + path;
    try {
      LOGGER.debug("Screenshot executing: {}", command);
      CommandResult result = shellExecutor.execute(command);
      if (!result.isSuccess()) {
        LOGGER.warn("screencap exited with code={} output={}", result.exitCode(), result.output());
        return Optional.empty();
      }
      if (!Files.isRegularFile(path) || Files.size(path) == 0) {
        LOGGER.warn("Screenshot file missing or empty: {}", path);
        return Optional.empty();
      }
      return Optional.of(Files.readAllBytes(path));
    } finally {
      deleteQuietly(path);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.debug("Could not delete {}: {}", path, e.getMessage());
    }
  }

  @Override
  public void close() {
    ioExecutor.shutdownNow();
  }
}
