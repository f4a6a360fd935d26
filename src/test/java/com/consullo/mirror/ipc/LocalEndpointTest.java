package com.consullo.mirror.ipc;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for in-process endpoint death notification.
 *
 * @since 1.0
 */
public class LocalEndpointTest {

  @Test
  @DisplayName("Should notify each linked recipient exactly once")
  void kill_NotifiesRecipientsOnce() throws Exception {
    final LocalEndpoint endpoint = new LocalEndpoint("test");
    final AtomicInteger deaths = new AtomicInteger();
    endpoint.linkToDeath(deaths::incrementAndGet);
    endpoint.linkToDeath(deaths::incrementAndGet);

    endpoint.kill();
    endpoint.kill();

    assertThat(deaths.get()).isEqualTo(2);
    assertThat(endpoint.isAlive()).isFalse();
    assertThat(endpoint.linkedRecipientCount()).isZero();
  }

  @Test
  @DisplayName("Should not notify an unlinked recipient")
  void unlinkToDeath_RemovesRecipient() throws Exception {
    final LocalEndpoint endpoint = new LocalEndpoint("test");
    final AtomicInteger deaths = new AtomicInteger();
    final DeathRecipient recipient = deaths::incrementAndGet;
    endpoint.linkToDeath(recipient);

    assertThat(endpoint.unlinkToDeath(recipient)).isTrue();
    assertThat(endpoint.unlinkToDeath(recipient)).isFalse();
    endpoint.kill();

    assertThat(deaths.get()).isZero();
  }

  @Test
  @DisplayName("Should refuse links and calls once dead")
  void linkToDeath_DeadEndpoint_Throws() {
    final LocalEndpoint endpoint = new LocalEndpoint("test");
    endpoint.kill();

    assertThatThrownBy(() -> endpoint.linkToDeath(() -> { })).isInstanceOf(RemoteCallException.class);
    assertThatThrownBy(endpoint::checkAlive).isInstanceOf(RemoteCallException.class);
  }

  @Test
  @DisplayName("Should keep notifying when one recipient fails")
  void kill_FailingRecipient_OthersStillNotified() throws Exception {
    final LocalEndpoint endpoint = new LocalEndpoint("test");
    final AtomicInteger deaths = new AtomicInteger();
    endpoint.linkToDeath(() -> {
      throw new IllegalStateException("boom");
    });
    endpoint.linkToDeath(deaths::incrementAndGet);

    endpoint.kill();

    assertThat(deaths.get()).isEqualTo(1);
  }
}
