package com.consullo.mirror.platform;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ShellExecutor} that spawns {@code sh -c <command>} as a child process of this one.
 *
 * <p>Output is collected by a reader thread so the child never blocks on a full pipe; the caller waits for the
 * exit with a bound and the child is killed on timeout.
 *
 * @since 1.0
 */
public final class ProcessShellExecutor implements ShellExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessShellExecutor.class);

  private final String shell;
  private final long timeoutMillis;

  /**
   * Creates an executor.
   *
   * @param shell shell binary (e.g. "sh")
   * @param timeoutMillis maximum run time of one command
   */
  public ProcessShellExecutor(final String shell, final long timeoutMillis) {
    Validate.notBlank(shell, "shell must not be blank");
    Validate.isTrue(timeoutMillis > 0, "timeoutMillis must be positive");
    this.shell = shell;
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public CommandResult execute(final String commandLine) throws Exception {
    Validate.notBlank(commandLine, "commandLine must not be blank");

    final ProcessBuilder builder = new ProcessBuilder(List.of(this.shell, "-c", commandLine));
    builder.redirectErrorStream(true);

    LOGGER.debug("execute: {}", commandLine);
    final Process process = builder.start();
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    final Thread reader = startOutputReaderThread(process.getInputStream(), output);
    try {
      if (!process.waitFor(this.timeoutMillis, TimeUnit.MILLISECONDS)) {
        throw new TimeoutException("Command did not finish within " + this.timeoutMillis + "ms: " + commandLine);
      }
      reader.join(this.timeoutMillis);
      final String text;
      synchronized (output) {
        text = output.toString(StandardCharsets.UTF_8);
      }
      return new CommandResult(process.exitValue(), text);
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  private static Thread startOutputReaderThread(final InputStream in, final ByteArrayOutputStream sink) {
    final Thread reader = new Thread(() -> {
      final byte[] buffer = new byte[4096];
      try (InputStream stream = in) {
        int n;
        while ((n = stream.read(buffer)) >= 0) {
          synchronized (sink) {
            sink.write(buffer, 0, n);
          }
        }
      } catch (final Exception e) {
        LOGGER.debug("Shell output reader stopped: {}", e.getMessage());
      }
    }, "ShellOutputReader");
    reader.setDaemon(true);
    reader.start();
    return reader;
  }
}
