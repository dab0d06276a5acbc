package com.consullo.process.control;

import java.util.List;

/**
 * The OS refused to create the process. No controller exists.
 *
 * @since 1.0
 */
public final class ProcessLaunchException extends ProcessControlException {

  private static final long serialVersionUID = 1L;

  private final List<String> commandLine;

  public ProcessLaunchException(final List<String> commandLine, final Throwable cause) {
    super("Failed to launch " + commandLine + ": " + cause.getMessage(), cause);
    this.commandLine = List.copyOf(commandLine);
  }

  public List<String> commandLine() {
    return this.commandLine;
  }
}
