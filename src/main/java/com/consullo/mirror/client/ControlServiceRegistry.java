package com.consullo.mirror.client;

import com.consullo.mirror.service.ControlService;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side holder of the control service received from the server.
 *
 * @since 1.0
 */
public final class ControlServiceRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ControlServiceRegistry.class);

  private volatile ControlService service;

  public void setService(ControlService service) {
    this.service = service;
    LOGGER.info("Control service {}", service == null ? "cleared" : "received: " + service.asEndpoint());
  }

  public Optional<ControlService> getService() {
    return Optional.ofNullable(service);
  }

  /**
   * The held service, if its endpoint is still alive.
   *
   * @return alive service
   */
  public Optional<ControlService> aliveService() {
    ControlService current = service;
    if (current == null || current.asEndpoint() == null || !current.asEndpoint().isAlive()) {
      return Optional.empty();
    }
    return Optional.of(current);
  }

  public boolean hasAliveService() {
    return aliveService().isPresent();
  }
}
