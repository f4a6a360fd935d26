package com.consullo.mirror.ipc;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link RemoteEndpoint}.
 *
 * <p>{@link #kill()} plays the part of the hosting process going away: the endpoint turns dead, every linked
 * recipient fires once, and further links are refused.
 *
 * @since 1.0
 */
public final class LocalEndpoint implements RemoteEndpoint {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalEndpoint.class);

  private final Object lock = new Object();
  private final String description;
  private final List<DeathRecipient> recipients = new ArrayList<>();
  private boolean alive = true;

  public LocalEndpoint(final String description) {
    this.description = description;
  }

  @Override
  public boolean isAlive() {
    synchronized (lock) {
      return alive;
    }
  }

  @Override
  public void linkToDeath(final DeathRecipient recipient) throws RemoteCallException {
    if (recipient == null) {
      throw new IllegalArgumentException("recipient must not be null.");
    }
    synchronized (lock) {
      if (!alive) {
        throw new RemoteCallException("Endpoint " + description + " is dead");
      }
      recipients.add(recipient);
    }
  }

  @Override
  public boolean unlinkToDeath(final DeathRecipient recipient) {
    synchronized (lock) {
      for (int i = 0; i < recipients.size(); i++) {
        if (recipients.get(i) == recipient) {
          recipients.remove(i);
          return true;
        }
      }
      return false;
    }
  }

  /**
   * Throws if the endpoint is dead; call at the start of every remote method.
   *
   * @throws RemoteCallException if the endpoint is dead
   */
  public void checkAlive() throws RemoteCallException {
    if (!isAlive()) {
      throw new RemoteCallException("Endpoint " + description + " is dead");
    }
  }

  /**
   * Marks the endpoint dead and notifies every linked recipient. Recipients run on the calling thread, outside
   * the endpoint lock.
   */
  public void kill() {
    final List<DeathRecipient> toNotify;
    synchronized (lock) {
      if (!alive) {
        return;
      }
      alive = false;
      toNotify = new ArrayList<>(recipients);
      recipients.clear();
    }
    LOGGER.debug("Endpoint {} died, notifying {} recipient(s)", description, toNotify.size());
    for (DeathRecipient recipient : toNotify) {
      try {
        recipient.endpointDied();
      } catch (RuntimeException e) {
        LOGGER.warn("Death recipient of {} failed: {}", description, e.getMessage(), e);
      }
    }
  }

  public int linkedRecipientCount() {
    synchronized (lock) {
      return recipients.size();
    }
  }

  @Override
  public String toString() {
    return "LocalEndpoint[" + description + (isAlive() ? "" : ", dead") + "]";
  }
}
