package com.consullo.mirror.sink;

import com.consullo.mirror.ipc.DeathRecipient;
import com.consullo.mirror.ipc.LocalEndpoint;
import com.consullo.mirror.ipc.RemoteCallException;
import com.consullo.mirror.ipc.RemoteEndpoint;
import com.consullo.mirror.ipc.VideoSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for single-sink registration, forwarding and death handling.
 *
 * @since 1.0
 */
public class FrameSinkRegistryTest {

  private FrameSinkRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new FrameSinkRegistry();
  }

  @Test
  @DisplayName("Should forward frames to the registered sink")
  void forward_RegisteredSink_ReceivesFrames() {
    final RecordingSink sink = new RecordingSink("a");
    registry.setSink(sink);

    registry.forward(new byte[] {1});
    registry.onFrame(new byte[] {2});

    assertThat(sink.frames).hasSize(2);
    assertThat(registry.hasSink()).isTrue();
    assertThat(sink.endpoint.linkedRecipientCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should drop frames without a sink")
  void forward_NoSink_NoOp() {
    registry.forward(new byte[] {1});

    assertThat(registry.hasSink()).isFalse();
  }

  @Test
  @DisplayName("Should unsubscribe the previous sink when replaced")
  void setSink_Replacement_UnlinksOldSink() {
    final RecordingSink first = new RecordingSink("first");
    final RecordingSink second = new RecordingSink("second");
    registry.setSink(first);

    registry.setSink(second);
    registry.forward(new byte[] {1});

    assertThat(first.endpoint.linkedRecipientCount()).isZero();
    assertThat(second.endpoint.linkedRecipientCount()).isEqualTo(1);
    assertThat(first.frames).isEmpty();
    assertThat(second.frames).hasSize(1);
  }

  @Test
  @DisplayName("Should keep a single subscription when the same sink registers twice")
  void setSink_SameSinkTwice_NoOp() {
    final RecordingSink sink = new RecordingSink("a");

    registry.setSink(sink);
    registry.setSink(sink);

    assertThat(sink.endpoint.linkedRecipientCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should clear the sink when its endpoint dies")
  void endpointDied_ClearsSink() {
    final RecordingSink sink = new RecordingSink("a");
    registry.setSink(sink);

    sink.endpoint.kill();
    registry.forward(new byte[] {1});

    assertThat(registry.hasSink()).isFalse();
    assertThat(sink.frames).isEmpty();
  }

  @Test
  @DisplayName("Should ignore a late death notification of a replaced sink")
  void endpointDied_StaleRegistration_Ignored() throws Exception {
    final RemoteEndpoint oldEndpoint = mock(RemoteEndpoint.class);
    final VideoSink oldSink = mock(VideoSink.class);
    when(oldSink.asEndpoint()).thenReturn(oldEndpoint);
    registry.setSink(oldSink);
    final ArgumentCaptor<DeathRecipient> recipient = ArgumentCaptor.forClass(DeathRecipient.class);
    verify(oldEndpoint).linkToDeath(recipient.capture());

    final RecordingSink current = new RecordingSink("current");
    registry.setSink(current);
    recipient.getValue().endpointDied();
    registry.forward(new byte[] {1});

    assertThat(registry.hasSink()).isTrue();
    assertThat(current.frames).hasSize(1);
    verify(oldEndpoint).unlinkToDeath(recipient.getValue());
  }

  @Test
  @DisplayName("Should invalidate the sink after a failed call")
  void forward_CallFails_ClearsSink() throws Exception {
    final LocalEndpoint endpoint = new LocalEndpoint("failing");
    final VideoSink sink = mock(VideoSink.class);
    when(sink.asEndpoint()).thenReturn(endpoint);
    doThrow(new RemoteCallException("gone")).when(sink).onVideoFrame(any());
    registry.setSink(sink);

    registry.forward(new byte[] {1});
    registry.forward(new byte[] {2});

    assertThat(registry.hasSink()).isFalse();
    verify(sink, times(1)).onVideoFrame(any());
    assertThat(endpoint.linkedRecipientCount()).isZero();
  }

  @Test
  @DisplayName("Should not install a sink whose endpoint is already dead")
  void setSink_DeadEndpoint_NotInstalled() {
    final RecordingSink sink = new RecordingSink("dead");
    sink.endpoint.kill();

    registry.setSink(sink);

    assertThat(registry.hasSink()).isFalse();
  }

  @Test
  @DisplayName("Should keep the current sink when a sink without an endpoint registers")
  void setSink_NoEndpoint_KeepsCurrentSink() {
    final RecordingSink sink = new RecordingSink("a");
    final VideoSink detached = mock(VideoSink.class);
    registry.setSink(sink);

    assertThatCode(() -> registry.setSink(detached)).doesNotThrowAnyException();
    registry.forward(new byte[] {1});

    assertThat(registry.hasSink()).isTrue();
    assertThat(sink.endpoint.linkedRecipientCount()).isEqualTo(1);
    assertThat(sink.frames).hasSize(1);
  }

  @Test
  @DisplayName("Should clear the sink on null")
  void setSink_Null_Clears() {
    final RecordingSink sink = new RecordingSink("a");
    registry.setSink(sink);

    registry.setSink(null);

    assertThat(registry.hasSink()).isFalse();
    assertThat(sink.endpoint.linkedRecipientCount()).isZero();
  }

  private static final class RecordingSink implements VideoSink {
    final LocalEndpoint endpoint;
    final List<byte[]> frames = new CopyOnWriteArrayList<>();

    RecordingSink(String name) {
      this.endpoint = new LocalEndpoint(name);
    }

    @Override
    public RemoteEndpoint asEndpoint() {
      return endpoint;
    }

    @Override
    public void onVideoFrame(byte[] data) throws RemoteCallException {
      endpoint.checkAlive();
      frames.add(data);
    }
  }
}
