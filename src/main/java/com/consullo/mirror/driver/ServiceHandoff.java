package com.consullo.mirror.driver;

import com.consullo.mirror.service.ControlService;

/**
 * Delivers the control service capability to client processes.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ServiceHandoff {

  /**
   * Hands the service to one client package, or to any listener when {@code targetPackage} is null.
   *
   * @param service service capability
   * @param targetPackage receiving package, or null
   * @return true if the handoff was delivered
   * @throws Exception if delivery failed
   */
  boolean handOff(ControlService service, String targetPackage) throws Exception;
}
