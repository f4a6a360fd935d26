package com.consullo.mirror.capture;

import com.consullo.mirror.client.NalUnits;
import com.consullo.mirror.input.InputInjector;
import com.consullo.mirror.platform.EncoderFormat;
import com.consullo.mirror.platform.EncoderOutput;
import com.consullo.mirror.platform.EncoderSurface;
import com.consullo.mirror.platform.HostDisplayCapabilities;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.VideoEncoder;
import com.consullo.mirror.platform.VideoEncoderFactory;
import com.consullo.mirror.platform.VirtualDisplayFlags;
import com.consullo.mirror.platform.VirtualDisplayHost;
import com.consullo.mirror.platform.loopback.LoopbackDisplayHost;
import com.consullo.mirror.platform.loopback.LoopbackInputChannel;
import com.consullo.mirror.platform.loopback.LoopbackVideoEncoder;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for display and encoder lifecycle using the loopback host.
 *
 * @since 1.0
 */
public class CapturePipelineTest {

  private final List<LoopbackVideoEncoder> encoders = new CopyOnWriteArrayList<>();
  private final List<byte[]> frames = new CopyOnWriteArrayList<>();
  private final VideoEncoderFactory encoderFactory = mime -> {
    LoopbackVideoEncoder encoder = new LoopbackVideoEncoder();
    encoders.add(encoder);
    return encoder;
  };

  private LoopbackDisplayHost displayHost;
  private InputInjector injector;
  private CapturePipeline pipeline;

  @BeforeEach
  void setUp() {
    displayHost = new LoopbackDisplayHost();
    injector = new InputInjector(new LoopbackInputChannel());
    pipeline = newPipeline(encoderFactory, displayHost, HostDisplayCapabilities.forApiLevel(34));
  }

  @AfterEach
  void tearDown() {
    pipeline.destroyDisplay();
  }

  @Test
  @DisplayName("Should create an aligned display at the requested bit rate")
  void ensureDisplay_OddSize_CreatesAlignedDisplay() {
    final Optional<DisplayInfo> info = pipeline.ensureDisplay(1080, 2317, 320, 4_000_000);

    assertThat(info).isPresent();
    assertThat(info.get().getWidth()).isEqualTo(1080);
    assertThat(info.get().getHeight()).isEqualTo(2312);
    assertThat(info.get().getBitRate()).isEqualTo(4_000_000);
    assertThat(info.get().getDpi()).isEqualTo(320);
    assertThat(pipeline.displayId()).isEqualTo(info.get().getDisplayId()).isPositive();
    assertThat(pipeline.state()).isEqualTo(EncoderState.CONFIGURED_RUNNING);
    assertThat(injector.displayId()).isEqualTo(pipeline.displayId());

    final LoopbackDisplayHost.LoopbackDisplay display = displayHost.createdDisplays().get(0);
    assertThat(display.width()).isEqualTo(1080);
    assertThat(display.height()).isEqualTo(2312);
    assertThat(display.name()).startsWith("MirrorVirtualDisplay-");
  }

  @Test
  @DisplayName("Should pass the aligned size and rate to the encoder")
  void ensureDisplay_ConfiguresEncoderFormat() throws Exception {
    final VideoEncoder encoder = mock(VideoEncoder.class);
    when(encoder.createInputSurface()).thenReturn(mock(EncoderSurface.class));
    when(encoder.dequeueOutput(anyLong())).thenAnswer(invocation -> {
      Thread.sleep(1);
      return EncoderOutput.tryAgainLater();
    });
    pipeline = newPipeline(mime -> encoder, displayHost, HostDisplayCapabilities.forApiLevel(34));

    pipeline.ensureDisplay(1080, 2317, 320, 0);

    final ArgumentCaptor<EncoderFormat> format = ArgumentCaptor.forClass(EncoderFormat.class);
    verify(encoder).configure(format.capture());
    assertThat(format.getValue()).isEqualTo(new EncoderFormat("video/avc", 1080, 2312, 4_000_000, 30, 1));
    verify(encoder).start();
  }

  @Test
  @DisplayName("Should ignore a second ensureDisplay even with a different size")
  void ensureDisplay_Twice_IsNoOp() {
    final int first = pipeline.ensureDisplay(1080, 2317, 320, 4_000_000).orElseThrow().getDisplayId();

    final Optional<DisplayInfo> second = pipeline.ensureDisplay(720, 1280, 240, 2_000_000);

    assertThat(second).isPresent();
    assertThat(second.get().getDisplayId()).isEqualTo(first);
    assertThat(second.get().getWidth()).isEqualTo(1080);
    assertThat(displayHost.createdDisplays()).hasSize(1);
    assertThat(encoders).hasSize(1);
  }

  @Test
  @DisplayName("Should unwind encoder and surface when display creation fails")
  void ensureDisplay_DisplayHostFails_UnwindsEverything() throws Exception {
    final VirtualDisplayHost failingHost = mock(VirtualDisplayHost.class);
    when(failingHost.createVirtualDisplay(anyString(), anyInt(), anyInt(), anyInt(), any(), anyInt()))
        .thenThrow(new HostException("permission denied"));
    pipeline = newPipeline(encoderFactory, failingHost, HostDisplayCapabilities.forApiLevel(34));

    final Optional<DisplayInfo> info = pipeline.ensureDisplay(1080, 1920, 320, 0);

    assertThat(info).isEmpty();
    assertThat(pipeline.displayId()).isEqualTo(CapturePipeline.NO_DISPLAY);
    assertThat(pipeline.state()).isEqualTo(EncoderState.UNINITIALIZED);
    assertThat(pipeline.currentDisplay()).isEmpty();
    assertThat(encoders).hasSize(1);
    assertThat(encoders.get(0).isReleased()).isTrue();
    assertThat(injector.displayId()).isEqualTo(InputInjector.DEFAULT_DISPLAY_ID);
  }

  @Test
  @DisplayName("Should treat a non-positive display id as a setup failure")
  void ensureDisplay_NoDisplayId_Fails() throws Exception {
    final VirtualDisplayHost host = mock(VirtualDisplayHost.class);
    when(host.createVirtualDisplay(anyString(), anyInt(), anyInt(), anyInt(), any(), anyInt())).thenReturn(null);
    pipeline = newPipeline(encoderFactory, host, HostDisplayCapabilities.forApiLevel(34));

    assertThat(pipeline.ensureDisplay(1080, 1920, 320, 0)).isEmpty();
    assertThat(encoders.get(0).isReleased()).isTrue();
  }

  @Test
  @DisplayName("Should release everything on destroy and allow a new display afterwards")
  void destroyDisplay_ThenEnsure_CreatesNewDisplay() {
    final int first = pipeline.ensureDisplay(1080, 1920, 320, 0).orElseThrow().getDisplayId();

    pipeline.destroyDisplay();

    assertThat(pipeline.displayId()).isEqualTo(CapturePipeline.NO_DISPLAY);
    assertThat(pipeline.state()).isEqualTo(EncoderState.STOPPED);
    assertThat(displayHost.activeDisplayCount()).isZero();
    assertThat(encoders.get(0).isReleased()).isTrue();
    assertThat(injector.displayId()).isEqualTo(InputInjector.DEFAULT_DISPLAY_ID);

    final int second = pipeline.ensureDisplay(720, 1280, 240, 0).orElseThrow().getDisplayId();
    assertThat(second).isNotEqualTo(first);
    assertThat(displayHost.activeDisplayCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should rebuild an identical display with a fresh encoder after destroy")
  void destroyDisplay_ThenEnsureSameParams_RebuildsWithNewEncoder() {
    final DisplayInfo first = pipeline.ensureDisplay(1080, 2317, 320, 4_000_000).orElseThrow();

    pipeline.destroyDisplay();
    final DisplayInfo second = pipeline.ensureDisplay(1080, 2317, 320, 4_000_000).orElseThrow();

    assertThat(first.getWidth()).isEqualTo(1080);
    assertThat(first.getHeight()).isEqualTo(2312);
    assertThat(second.getWidth()).isEqualTo(1080);
    assertThat(second.getHeight()).isEqualTo(2312);
    assertThat(second.getDisplayId()).isNotEqualTo(first.getDisplayId());
    assertThat(encoders).hasSize(2);
    assertThat(encoders.get(1)).isNotSameAs(encoders.get(0));
    assertThat(encoders.get(0).isReleased()).isTrue();
    assertThat(encoders.get(0).inputSurface().isReleased()).isTrue();
    assertThat(encoders.get(1).isReleased()).isFalse();
    assertThat(encoders.get(1).inputSurface().isReleased()).isFalse();
    assertThat(displayHost.activeDisplayCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should treat destroy without a display as a no-op")
  void destroyDisplay_NoDisplay_NoOp() {
    pipeline.destroyDisplay();

    assertThat(pipeline.state()).isEqualTo(EncoderState.UNINITIALIZED);
  }

  @Test
  @DisplayName("Should forward codec config records before the first frame")
  void drainLoop_FormatChange_ForwardsConfigThenFrames() throws Exception {
    pipeline.ensureDisplay(640, 480, 160, 0);

    awaitCondition(() -> frames.size() >= 3, 3_000L);

    assertThat(NalUnits.firstNalType(frames.get(0))).isEqualTo(NalUnits.TYPE_SPS);
    assertThat(NalUnits.firstNalType(frames.get(1))).isEqualTo(NalUnits.TYPE_PPS);
    assertThat(NalUnits.firstNalType(frames.get(2))).isEqualTo(5);
  }

  @Test
  @DisplayName("Should stop forwarding once the display is destroyed")
  void destroyDisplay_StopsForwarding() throws Exception {
    pipeline.ensureDisplay(640, 480, 160, 0);
    awaitCondition(() -> frames.size() >= 3, 3_000L);

    pipeline.destroyDisplay();
    final int count = frames.size();
    Thread.sleep(150);

    assertThat(frames).hasSize(count);
  }

  @Test
  @DisplayName("Should create the display with the flags of the host API level")
  void ensureDisplay_UsesCapabilityFlags() {
    pipeline.ensureDisplay(640, 480, 160, 0);
    final int modernFlags = displayHost.createdDisplays().get(0).flags();
    pipeline.destroyDisplay();

    final LoopbackDisplayHost legacyHost = new LoopbackDisplayHost();
    final CapturePipeline legacy = newPipeline(encoderFactory, legacyHost, HostDisplayCapabilities.forApiLevel(30));
    legacy.ensureDisplay(640, 480, 160, 0);
    final int legacyFlags = legacyHost.createdDisplays().get(0).flags();
    legacy.destroyDisplay();

    assertThat(VirtualDisplayFlags.isSet(modernFlags, VirtualDisplayFlags.OWN_FOCUS)).isTrue();
    assertThat(VirtualDisplayFlags.isSet(legacyFlags, VirtualDisplayFlags.OWN_FOCUS)).isFalse();
    assertThat(VirtualDisplayFlags.isSet(legacyFlags, VirtualDisplayFlags.SUPPORTS_TOUCH)).isTrue();
  }

  private CapturePipeline newPipeline(VideoEncoderFactory factory, VirtualDisplayHost host,
      HostDisplayCapabilities capabilities) {
    return new CapturePipeline(CapturePipelineConfig.defaults(), factory, host, capabilities,
        displayId -> { }, injector, frames::add);
  }

  private static void awaitCondition(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + timeoutMillis;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("Condition not met within " + timeoutMillis + "ms");
      }
      Thread.sleep(10);
    }
  }
}
