package com.consullo.process.control;

import com.consullo.process.command.CommandDescriptor;
import java.io.IOException;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for launching command descriptors under a {@link ProcessController}.
 *
 * <p>
 * This class centralizes the translation of a descriptor into a {@link ProcessBuilder}:
 * <ul>
 * <li>argument vector, path first</li>
 * <li>working directory (inherited when absent)</li>
 * <li>complete replacement of the child environment</li>
 * <li>stream redirects; caller-supplied streams become pipes that the controller pumps</li>
 * </ul>
 * </p>
 */
public final class ProcessControllerFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessControllerFactory.class);

  private ProcessControllerFactory() {
  }

  /**
   * Launch the process and return its controller. On failure no process or background thread
   * exists.
   *
   * @param command what to launch
   * @return controller for the running process
   * @throws ProcessLaunchException if the OS refused to create the process
   */
  public static ProcessController start(final CommandDescriptor command) throws ProcessLaunchException {
    Validate.notNull(command, "command must not be null");

    final Process process;
    try {
      final ProcessBuilder builder = newProcessBuilder(command);
      process = builder.start();
    } catch (final IOException | SecurityException | UnsupportedOperationException
        | IllegalArgumentException e) {
      LOGGER.warn("Launch of {} failed: {}", command.commandLine(), e.getMessage());
      throw new ProcessLaunchException(command.commandLine(), e);
    }

    LOGGER.info("Started pid {}: {}", process.pid(), command.commandLine());
    return new JdkProcessController(command, process);
  }

  /**
   * Start the command and wait for it.
   *
   * @param command what to run
   * @param deadline kill the process if it is still running at this point
   * @throws ProcessControlException on launch failure or abnormal exit
   */
  public static void run(final CommandDescriptor command, final Deadline deadline) throws ProcessControlException {
    Validate.notNull(deadline, "deadline must not be null");
    start(command).waitFor(deadline);
  }

  static ProcessBuilder newProcessBuilder(final CommandDescriptor command) {
    final ProcessBuilder builder = new ProcessBuilder(command.commandLine());
    if (command.workingDirectory() != null) {
      builder.directory(command.workingDirectory().toFile());
    }

    final Map<String, String> env = builder.environment();
    env.clear();
    env.putAll(command.environmentMap());

    builder.redirectInput(command.stdin().redirect());
    builder.redirectOutput(command.stdout().redirect());
    builder.redirectError(command.stderr().redirect());
    return builder;
  }
}
