package com.consullo.mirror.demo;

import com.consullo.mirror.driver.MirrorSession;
import com.consullo.mirror.driver.MirrorSessionConfig;
import com.consullo.mirror.driver.MirrorSessionFactory;
import com.consullo.mirror.driver.ServiceHandoff;
import com.consullo.mirror.platform.HostPlatform;
import com.consullo.mirror.platform.loopback.LoopbackHostPlatform;
import java.util.List;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point of the mirror server.
 *
 * <p>
 * Usage: {@code MirrorServer [pkg1,pkg2,...]}. The host platform and the service handoff are looked up with
 * {@link ServiceLoader}; without providers the loopback host is used and the handoff only logs. The host API
 * level comes from {@code -Dmirror.apiLevel} (default 34). The process ends when the idle supervisor fires.
 * </p>
 *
 * @since 1.0
 */
public final class MirrorServer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorServer.class);

  static final int DEFAULT_API_LEVEL = 34;

  private MirrorServer() {
  }

  public static void main(final String[] args) throws InterruptedException {
    List<String> targets = MirrorSessionConfig.parseTargetPackages(args.length > 0 ? args[0] : null);
    LOGGER.info("Starting mirror server, target packages: {}", targets.isEmpty() ? "<any>" : targets);

    HostPlatform host = loadHost(Integer.getInteger("mirror.apiLevel", DEFAULT_API_LEVEL));
    LOGGER.info("Host platform: {} (API {})", host.name(), host.displayCapabilities().apiLevel());

    MirrorSessionConfig config = MirrorSessionConfig.defaults().withTargetPackages(targets);
    MirrorSession session = MirrorSessionFactory.createSession(host, config, loadHandoff(), () -> {
      LOGGER.info("Idle timeout reached, exiting");
      System.exit(0);
    });
    Runtime.getRuntime().addShutdownHook(new Thread(session::stop, "MirrorShutdown"));
    session.start();

    // the idle supervisor ends the process
    Thread.currentThread().join();
  }

  static HostPlatform loadHost(int apiLevel) {
    for (HostPlatform provided : ServiceLoader.load(HostPlatform.class)) {
      return provided;
    }
    LOGGER.info("No HostPlatform provider found, using loopback host");
    return new LoopbackHostPlatform(apiLevel);
  }

  static ServiceHandoff loadHandoff() {
    for (ServiceHandoff provided : ServiceLoader.load(ServiceHandoff.class)) {
      return provided;
    }
    return (service, targetPackage) -> {
      LOGGER.info("No transport for handoff to {}, control service endpoint {} stays local",
          targetPackage == null ? "<any>" : targetPackage, service.asEndpoint());
      return false;
    };
  }
}
