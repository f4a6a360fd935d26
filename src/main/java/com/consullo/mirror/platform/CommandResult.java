package com.consullo.mirror.platform;

/**
 * Outcome of a shell command.
 *
 * @param exitCode process exit code
 * @param output combined stdout/stderr text
 * @since 1.0
 */
public record CommandResult(int exitCode, String output) {

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
