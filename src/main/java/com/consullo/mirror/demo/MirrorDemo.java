package com.consullo.mirror.demo;

import com.consullo.mirror.client.ClientController;
import com.consullo.mirror.client.ClientRenderer;
import com.consullo.mirror.client.ControlServiceRegistry;
import com.consullo.mirror.client.NalUnits;
import com.consullo.mirror.client.RenderSurface;
import com.consullo.mirror.client.RendererConfig;
import com.consullo.mirror.client.VideoDecoder;
import com.consullo.mirror.driver.MirrorSession;
import com.consullo.mirror.driver.MirrorSessionConfig;
import com.consullo.mirror.driver.MirrorSessionFactory;
import com.consullo.mirror.platform.loopback.LoopbackHostPlatform;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs server and client in one process against the loopback host and prints what the client received.
 *
 * @since 1.0
 */
public final class MirrorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorDemo.class);

  private MirrorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final LoopbackHostPlatform host = new LoopbackHostPlatform(MirrorServer.DEFAULT_API_LEVEL);
    host.loopbackPackageLauncher().register("com.example.notes", "com.example.notes/.MainActivity");

    final ControlServiceRegistry registry = new ControlServiceRegistry();
    final ExecutorService ui = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "DemoUi");
      t.setDaemon(true);
      return t;
    });
    final CountingDecoder decoder = new CountingDecoder();

    try (MirrorSession session = MirrorSessionFactory.createSession(
        host,
        MirrorSessionConfig.defaults(),
        (service, targetPackage) -> {
          registry.setService(service);
          return true;
        },
        () -> LOGGER.info("Idle supervisor fired"))) {
      session.start();

      ClientController controller = new ClientController(registry);
      ClientRenderer renderer = new ClientRenderer(controller, decoder, ui, RendererConfig.defaults());
      CompletableFuture<Boolean> attached = renderer.surfaceCreated(() -> true);

      if (!controller.ensureDisplay(1080, 2317, 320, 4000)) {
        System.out.println("Display setup failed");
        return;
      }
      System.out.println("Renderer attached: " + attached.get(5, TimeUnit.SECONDS));
      controller.launchApp("com.example.notes");
      controller.tap(540, 1200);
      controller.swipe(540, 1800, 540, 400, 200);
      controller.injectKeyWithMeta(29, 0x1000);

      Thread.sleep(1_000);
      Optional<byte[]> screenshot = controller.requestScreenshot();

      System.out.println("=== Mirror Demo ===");
      System.out.println("Display id:        " + controller.getDisplayId().orElse(-1));
      System.out.println("Video size:        " + controller.getVideoSize().orElse(null));
      System.out.println("Decoder attach:    " + decoder.width + "x" + decoder.height);
      System.out.println("Config records:    " + decoder.configRecords.get());
      System.out.println("Frames decoded:    " + decoder.frames.get());
      System.out.println("Motion events:     " + host.loopbackInputChannel().motionEvents().size());
      System.out.println("Key events:        " + host.loopbackInputChannel().keyEvents().size());
      System.out.println("App launches:      " + host.loopbackPackageLauncher().launches());
      System.out.println("Screenshot bytes:  " + screenshot.map(b -> String.valueOf(b.length)).orElse("n/a"));

      renderer.surfaceDestroyed().get(5, TimeUnit.SECONDS);
      controller.shutdown();
      controller.close();
      LOGGER.info("Demo completed");
    } finally {
      ui.shutdownNow();
    }
  }

  private static final class CountingDecoder implements VideoDecoder {
    final AtomicInteger frames = new AtomicInteger();
    final AtomicInteger configRecords = new AtomicInteger();
    volatile int width;
    volatile int height;

    @Override
    public void attach(RenderSurface surface, int width, int height) {
      this.width = width;
      this.height = height;
    }

    @Override
    public void onFrame(byte[] data) {
      if (NalUnits.isCodecConfig(data)) {
        configRecords.incrementAndGet();
      } else {
        frames.incrementAndGet();
      }
    }

    @Override
    public void detach() {
      LOGGER.debug("Decoder detached after {} frame(s)", frames.get());
    }
  }
}
