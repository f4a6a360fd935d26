package com.consullo.mirror.platform;

import java.util.Optional;

/**
 * Host launcher: resolves a package's launchable entry point and starts it on a display.
 *
 * @since 1.0
 */
public interface PackageLauncher {

  /**
   * Resolves the launch component of a package.
   *
   * @param packageName package name
   * @return launch component, empty if the package has no launchable entry point
   * @throws HostException if the package manager cannot be queried
   */
  Optional<String> resolveLaunchComponent(final String packageName) throws HostException;

  /**
   * Starts a component in a new task on the given display.
   *
   * @param component component returned by {@link #resolveLaunchComponent(String)}
   * @param displayId target display id
   * @throws HostException if the activity manager refuses the start
   */
  void startOnDisplay(final String component, final int displayId) throws HostException;
}
