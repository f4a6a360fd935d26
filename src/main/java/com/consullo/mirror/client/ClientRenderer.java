package com.consullo.mirror.client;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a {@link VideoDecoder} to a render surface once the video size is known.
 *
 * <p>
 * All state changes run on the single UI executor. When the surface appears the renderer waits, bounded, for
 * the size; on success it attaches the decoder and only then installs the frame handler. A superseded wait
 * (surface destroyed or recreated) completes with {@code false} and touches nothing.
 * </p>
 *
 * @since 1.0
 */
public final class ClientRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClientRenderer.class);

  private final ClientController controller;
  private final VideoDecoder decoder;
  private final Executor uiExecutor;
  private final RendererConfig config;

  // confined to uiExecutor
  private CompletableFuture<VideoSize> pendingSize;
  private long generation;
  private volatile boolean attached;

  public ClientRenderer(ClientController controller, VideoDecoder decoder, Executor uiExecutor,
      RendererConfig config) {
    Validate.notNull(controller, "controller must not be null");
    Validate.notNull(decoder, "decoder must not be null");
    Validate.notNull(uiExecutor, "uiExecutor must not be null");
    Validate.notNull(config, "config must not be null");
    this.controller = controller;
    this.decoder = decoder;
    this.uiExecutor = uiExecutor;
    this.config = config;
  }

  /**
   * Surface became available.
   *
   * @param surface render target
   * @return completes with true once the decoder is attached, false on timeout, failure or supersession
   */
  public CompletableFuture<Boolean> surfaceCreated(RenderSurface surface) {
    Validate.notNull(surface, "surface must not be null");
    CompletableFuture<Boolean> result = new CompletableFuture<>();
    uiExecutor.execute(() -> beginAttach(surface, result));
    return result;
  }

  /**
   * Surface went away: cancels a pending wait, removes the frame handler and detaches the decoder.
   *
   * @return completes once done on the UI executor
   */
  public CompletableFuture<Void> surfaceDestroyed() {
    return CompletableFuture.runAsync(() -> {
      generation++;
      cancelPending();
      detachInternal();
    }, uiExecutor);
  }

  public boolean isAttached() {
    return attached;
  }

  private void beginAttach(RenderSurface surface, CompletableFuture<Boolean> result) {
    generation++;
    cancelPending();
    detachInternal();

    long gen = generation;
    CompletableFuture<VideoSize> wait = controller.videoSizeFuture()
        .orTimeout(config.maxWaitMillis(), TimeUnit.MILLISECONDS);
    pendingSize = wait;
    LOGGER.debug("Waiting up to {}ms for video size", config.maxWaitMillis());
    wait.whenCompleteAsync((size, error) -> completeAttach(gen, surface, size, error, result), uiExecutor);
  }

  private void completeAttach(long gen, RenderSurface surface, VideoSize size, Throwable error,
      CompletableFuture<Boolean> result) {
    if (gen != generation) {
      LOGGER.debug("Surface attach superseded");
      result.complete(false);
      return;
    }
    pendingSize = null;

    if (error != null) {
      Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
      if (cause instanceof TimeoutException) {
        LOGGER.error("Failed to get video size after {} attempts ({}ms)", config.sizeWaitAttempts(),
            config.maxWaitMillis());
      } else if (cause instanceof CancellationException) {
        LOGGER.info("Video size wait cancelled");
      } else {
        LOGGER.error("Video size wait failed: {}", cause.getMessage(), cause);
      }
      result.complete(false);
      return;
    }

    if (!surface.isValid()) {
      LOGGER.warn("Surface no longer valid, not attaching decoder");
      result.complete(false);
      return;
    }

    try {
      decoder.attach(surface, size.width(), size.height());
    } catch (Exception e) {
      LOGGER.error("Decoder attach failed for {}x{}: {}", size.width(), size.height(), e.getMessage(), e);
      result.complete(false);
      return;
    }
    attached = true;
    controller.setFrameHandler(decoder::onFrame);
    LOGGER.info("Decoder attached at {}x{}", size.width(), size.height());
    result.complete(true);
  }

  private void cancelPending() {
    CompletableFuture<VideoSize> pending = pendingSize;
    pendingSize = null;
    if (pending != null) {
      pending.cancel(false);
    }
  }

  private void detachInternal() {
    controller.setFrameHandler(null);
    if (attached) {
      attached = false;
      try {
        decoder.detach();
      } catch (RuntimeException e) {
        LOGGER.warn("Decoder detach failed: {}", e.getMessage(), e);
      }
      LOGGER.info("Decoder detached");
    }
  }
}
