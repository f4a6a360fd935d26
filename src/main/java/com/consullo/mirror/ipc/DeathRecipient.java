package com.consullo.mirror.ipc;

/**
 * Liveness callback attached to a {@link RemoteEndpoint}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DeathRecipient {

  /**
   * Called at most once, from an arbitrary thread, when the endpoint becomes unreachable.
   */
  void endpointDied();
}
