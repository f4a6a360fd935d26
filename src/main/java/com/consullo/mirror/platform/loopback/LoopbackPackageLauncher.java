package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.PackageLauncher;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Launcher backed by a fixed table of package to launch component.
 *
 * @since 1.0
 */
public final class LoopbackPackageLauncher implements PackageLauncher {

  private final Map<String, String> launchComponents = new ConcurrentHashMap<>();
  private final List<Launch> launches = new CopyOnWriteArrayList<>();

  public LoopbackPackageLauncher register(String packageName, String component) {
    launchComponents.put(packageName, component);
    return this;
  }

  @Override
  public Optional<String> resolveLaunchComponent(String packageName) {
    return Optional.ofNullable(launchComponents.get(packageName));
  }

  @Override
  public void startOnDisplay(String component, int displayId) {
    launches.add(new Launch(component, displayId));
  }

  public List<Launch> launches() {
    return List.copyOf(launches);
  }

  /**
   * One recorded start request.
   *
   * @param component started component
   * @param displayId display it was placed on
   */
  public record Launch(String component, int displayId) {
  }
}
