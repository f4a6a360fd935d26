package com.consullo.mirror.driver;

import com.consullo.mirror.capture.CapturePipelineConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a mirror session.
 *
 * @param pipelineConfig capture pipeline settings
 * @param idleThresholdMillis idle time without sink and commands after which the session terminates
 * @param idleTickMillis idle check interval
 * @param screenshotDirectory directory for temporary screenshot files
 * @param screenshotTimeoutMillis bounded wait for one screenshot
 * @param targetPackages client packages the control service is handed to (empty: any listener)
 * @since 1.0
 */
public record MirrorSessionConfig(
    CapturePipelineConfig pipelineConfig,
    long idleThresholdMillis,
    long idleTickMillis,
    Path screenshotDirectory,
    long screenshotTimeoutMillis,
    List<String> targetPackages) {

  public MirrorSessionConfig {
    targetPackages = targetPackages == null ? List.of() : List.copyOf(targetPackages);
  }

  /**
   * 15 s idle threshold checked every second, screenshots under {@code java.io.tmpdir} with a 5 s bound.
   *
   * @return default configuration
   */
  public static MirrorSessionConfig defaults() {
    return new MirrorSessionConfig(
        CapturePipelineConfig.defaults(),
        15_000L,
        1_000L,
        Path.of(System.getProperty("java.io.tmpdir")),
        5_000L,
        List.of());
  }

  public MirrorSessionConfig withTargetPackages(List<String> packages) {
    return new MirrorSessionConfig(pipelineConfig, idleThresholdMillis, idleTickMillis, screenshotDirectory,
        screenshotTimeoutMillis, packages);
  }

  /**
   * Parses a comma separated package list; blanks are skipped and duplicates removed, order kept.
   *
   * @param raw raw list, may be null
   * @return package names
   */
  public static List<String> parseTargetPackages(String raw) {
    List<String> packages = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return packages;
    }
    for (String part : raw.split(",")) {
      String pkg = part.trim();
      if (!pkg.isEmpty() && !packages.contains(pkg)) {
        packages.add(pkg);
      }
    }
    return packages;
  }
}
