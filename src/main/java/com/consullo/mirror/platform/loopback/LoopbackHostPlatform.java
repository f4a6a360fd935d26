package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.HostDisplayCapabilities;
import com.consullo.mirror.platform.HostInputChannel;
import com.consullo.mirror.platform.HostPlatform;
import com.consullo.mirror.platform.ImePolicySetter;
import com.consullo.mirror.platform.PackageLauncher;
import com.consullo.mirror.platform.ProcessShellExecutor;
import com.consullo.mirror.platform.ShellExecutor;
import com.consullo.mirror.platform.VideoEncoderFactory;
import com.consullo.mirror.platform.VirtualDisplayHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process host: synthetic encoder, recording display manager, recording input channel.
 *
 * <p>Shell commands still run for real through {@link ProcessShellExecutor}.
 *
 * @since 1.0
 */
public final class LoopbackHostPlatform implements HostPlatform {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackHostPlatform.class);

  private final HostDisplayCapabilities capabilities;
  private final LoopbackDisplayHost displayHost = new LoopbackDisplayHost();
  private final LoopbackInputChannel inputChannel = new LoopbackInputChannel();
  private final LoopbackPackageLauncher packageLauncher = new LoopbackPackageLauncher();
  private final ShellExecutor shellExecutor;

  public LoopbackHostPlatform(int apiLevel) {
    this(apiLevel, new ProcessShellExecutor("sh", 10_000L));
  }

  public LoopbackHostPlatform(int apiLevel, ShellExecutor shellExecutor) {
    this.capabilities = HostDisplayCapabilities.forApiLevel(apiLevel);
    this.shellExecutor = shellExecutor;
  }

  @Override
  public String name() {
    return "loopback";
  }

  @Override
  public VideoEncoderFactory encoderFactory() {
    return mimeType -> new LoopbackVideoEncoder();
  }

  @Override
  public VirtualDisplayHost displayHost() {
    return displayHost;
  }

  @Override
  public HostDisplayCapabilities displayCapabilities() {
    return capabilities;
  }

  @Override
  public HostInputChannel inputChannel() {
    return inputChannel;
  }

  @Override
  public PackageLauncher packageLauncher() {
    return packageLauncher;
  }

  @Override
  public ImePolicySetter imePolicySetter() {
    return displayId -> LOGGER.debug("IME policy LOCAL for display {}", displayId);
  }

  @Override
  public ShellExecutor shellExecutor() {
    return shellExecutor;
  }

  public LoopbackDisplayHost loopbackDisplayHost() {
    return displayHost;
  }

  public LoopbackInputChannel loopbackInputChannel() {
    return inputChannel;
  }

  public LoopbackPackageLauncher loopbackPackageLauncher() {
    return packageLauncher;
  }
}
