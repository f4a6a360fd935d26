package com.consullo.mirror.ipc;

/**
 * Identity and liveness of a remote object capability.
 *
 * <p>Two proxies for the same remote object share one endpoint, so endpoints are compared by identity.
 *
 * @since 1.0
 */
public interface RemoteEndpoint {

  boolean isAlive();

  /**
   * Subscribes to the endpoint's death. The recipient fires exactly once.
   *
   * @param recipient recipient to notify
   * @throws RemoteCallException if the endpoint is already dead
   */
  void linkToDeath(final DeathRecipient recipient) throws RemoteCallException;

  /**
   * Revokes a subscription made with {@link #linkToDeath(DeathRecipient)}.
   *
   * @param recipient recipient to remove
   * @return true if the recipient was subscribed
   */
  boolean unlinkToDeath(final DeathRecipient recipient);
}
