package com.consullo.mirror.service;

import com.consullo.mirror.capture.CapturePipeline;
import com.consullo.mirror.capture.DisplayGeometry;
import com.consullo.mirror.capture.DisplayInfo;
import com.consullo.mirror.input.InputInjector;
import com.consullo.mirror.ipc.VideoSink;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.PackageLauncher;
import com.consullo.mirror.sink.FrameSinkRegistry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for command dispatch of the control service.
 *
 * @since 1.0
 */
@ExtendWith(MockitoExtension.class)
public class MirrorControlServiceTest {

  @Mock
  private CapturePipeline pipeline;
  @Mock
  private FrameSinkRegistry sinkRegistry;
  @Mock
  private InputInjector inputInjector;
  @Mock
  private PackageLauncher packageLauncher;
  @Mock
  private ScreenshotCapturer screenshotCapturer;

  private final AtomicLong clock = new AtomicLong(1_000L);
  private ActivityTracker activityTracker;
  private MirrorControlService service;

  @BeforeEach
  void setUp() {
    activityTracker = new ActivityTracker(clock::get);
    service = new MirrorControlService(pipeline, sinkRegistry, inputInjector, packageLauncher, screenshotCapturer,
        activityTracker);
  }

  @Test
  @DisplayName("Should convert kbit/s to bit/s when creating the display")
  void ensureDisplay_Kbps_ConvertedToBps() {
    service.ensureDisplay(1080, 2317, 320, 4000);

    verify(pipeline).ensureDisplay(1080, 2317, 320, 4_000_000);
  }

  @Test
  @DisplayName("Should select the default bit rate for non-positive kbit/s")
  void ensureDisplay_ZeroKbps_UsesDefault() {
    service.ensureDisplay(720, 1280, 240, 0);

    verify(pipeline).ensureDisplay(720, 1280, 240, 0);
  }

  @Test
  @DisplayName("Should clamp kbit/s that overflow the encoder bit rate")
  void ensureDisplay_HugeKbps_ClampedToMaxBitRate() {
    service.ensureDisplay(1080, 1920, 320, 3_000_000);

    verify(pipeline).ensureDisplay(1080, 1920, 320, Integer.MAX_VALUE);
    assertThat(MirrorControlService.toBitRate(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    assertThat(MirrorControlService.toBitRate(2_147_483)).isEqualTo(2_147_483_000);
    assertThat(MirrorControlService.toBitRate(-5)).isZero();
  }

  @Test
  @DisplayName("Should report the size of the active display, not the last request")
  void getDisplaySize_ActiveDisplay_ReturnsItsGeometry() {
    when(pipeline.currentDisplay()).thenReturn(Optional.of(DisplayInfo.builder()
        .displayId(4)
        .name("mirror")
        .geometry(new DisplayGeometry(1080, 1920))
        .dpi(320)
        .bitRate(4_000_000)
        .build()));

    service.ensureDisplay(720, 1280, 240, 0);

    assertThat(service.getDisplaySize()).contains(new DisplayGeometry(1080, 1920));
  }

  @Test
  @DisplayName("Should report no size without a display")
  void getDisplaySize_NoDisplay_Empty() {
    when(pipeline.currentDisplay()).thenReturn(Optional.empty());

    assertThat(service.getDisplaySize()).isEmpty();
  }

  @Test
  @DisplayName("Should record activity on every command")
  void commands_MarkActivity() {
    clock.set(5_000L);
    service.tap(1f, 2f);
    assertThat(activityTracker.lastActivityMillis()).isEqualTo(5_000L);

    clock.set(6_000L);
    service.getDisplayId();
    assertThat(activityTracker.lastActivityMillis()).isEqualTo(6_000L);

    clock.set(7_000L);
    service.setVideoSink(null);
    assertThat(activityTracker.lastActivityMillis()).isEqualTo(7_000L);
  }

  @Test
  @DisplayName("Should delegate input commands to the injector")
  void inputCommands_Delegated() {
    service.tap(1f, 2f);
    service.swipe(1f, 2f, 3f, 4f, 300L);
    service.touchDown(1f, 1f);
    service.touchMove(2f, 2f);
    service.touchUp(3f, 3f);
    service.injectKey(4);
    service.injectKeyWithMeta(29, 0x1000);

    verify(inputInjector).tap(1f, 2f);
    verify(inputInjector).swipe(1f, 2f, 3f, 4f, 300L);
    verify(inputInjector).touchDown(1f, 1f);
    verify(inputInjector).touchMove(2f, 2f);
    verify(inputInjector).touchUp(3f, 3f);
    verify(inputInjector).injectKey(4);
    verify(inputInjector).injectKeyWithMeta(29, 0x1000);
  }

  @Test
  @DisplayName("Should report NO_DISPLAY without a virtual display")
  void getDisplayId_NoDisplay_ReturnsSentinel() {
    when(pipeline.displayId()).thenReturn(CapturePipeline.NO_DISPLAY);

    assertThat(service.getDisplayId()).isEqualTo(ControlService.NO_DISPLAY);
  }

  @Test
  @DisplayName("Should launch a resolved package on the virtual display")
  void launchApp_Resolved_StartsOnDisplay() throws Exception {
    when(pipeline.displayId()).thenReturn(4);
    when(packageLauncher.resolveLaunchComponent("com.example")).thenReturn(Optional.of("com.example/.Main"));

    service.launchApp("com.example");

    verify(packageLauncher).startOnDisplay("com.example/.Main", 4);
  }

  @Test
  @DisplayName("Should ignore launches without a display, a package or an entry point")
  void launchApp_Unlaunchable_Ignored() throws Exception {
    service.launchApp("  ");

    when(pipeline.displayId()).thenReturn(CapturePipeline.NO_DISPLAY);
    service.launchApp("com.example");

    when(pipeline.displayId()).thenReturn(4);
    when(packageLauncher.resolveLaunchComponent("com.unknown")).thenReturn(Optional.empty());
    service.launchApp("com.unknown");

    verify(packageLauncher, never()).startOnDisplay(anyString(), anyInt());
  }

  @Test
  @DisplayName("Should swallow launch failures")
  void launchApp_HostFails_DoesNotThrow() throws Exception {
    when(pipeline.displayId()).thenReturn(4);
    when(packageLauncher.resolveLaunchComponent("com.example")).thenReturn(Optional.of("com.example/.Main"));
    doThrow(new HostException("denied")).when(packageLauncher).startOnDisplay("com.example/.Main", 4);

    assertThatCode(() -> service.launchApp("com.example")).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Should capture the active display and skip without one")
  void requestScreenshot_DelegatesForActiveDisplay() {
    when(pipeline.displayId()).thenReturn(CapturePipeline.NO_DISPLAY);
    assertThat(service.requestScreenshot()).isEmpty();
    verifyNoInteractions(screenshotCapturer);

    final byte[] png = {1, 2, 3};
    when(pipeline.displayId()).thenReturn(9);
    when(screenshotCapturer.capture(9)).thenReturn(Optional.of(png));
    assertThat(service.requestScreenshot()).containsSame(png);
  }

  @Test
  @DisplayName("Should register the sink and kill the endpoint on shutdown")
  void setVideoSink_AndShutdownEndpoint() {
    final VideoSink sink = mock(VideoSink.class);

    service.setVideoSink(sink);
    service.destroyDisplay();
    service.shutdownEndpoint();

    verify(sinkRegistry).setSink(sink);
    verify(pipeline).destroyDisplay();
    assertThat(service.asEndpoint().isAlive()).isFalse();
  }
}
