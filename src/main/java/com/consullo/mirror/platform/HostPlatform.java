package com.consullo.mirror.platform;

/**
 * Bundle of host primitives a mirror session runs against.
 *
 * <p>Device hosts are discovered through {@link java.util.ServiceLoader}; the loopback host is the fallback.
 *
 * @since 1.0
 */
public interface HostPlatform {

  String name();

  VideoEncoderFactory encoderFactory();

  VirtualDisplayHost displayHost();

  HostDisplayCapabilities displayCapabilities();

  HostInputChannel inputChannel();

  PackageLauncher packageLauncher();

  ImePolicySetter imePolicySetter();

  ShellExecutor shellExecutor();
}
