package com.consullo.mirror.platform;

/**
 * Executes shell commands with whatever identity the host grants this process.
 *
 * <p>Permission selection (app, shell, root) belongs to the implementation; callers only see the result.
 *
 * @since 1.0
 */
public interface ShellExecutor {

  /**
   * Runs a command line through the shell and waits for it to finish.
   *
   * @param commandLine command line passed to {@code sh -c}
   * @return command result
   * @throws Exception if the process cannot be started, times out or the wait is interrupted
   */
  CommandResult execute(final String commandLine) throws Exception;
}
