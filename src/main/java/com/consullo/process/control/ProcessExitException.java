package com.consullo.process.control;

/**
 * The process ended with a status that is neither success nor the result of a signal this
 * controller sent.
 *
 * @since 1.0
 */
public final class ProcessExitException extends ProcessControlException {

  private static final long serialVersionUID = 1L;

  private final transient ExitStatus status;

  public ProcessExitException(final ExitStatus status) {
    super("Process " + status.pid() + " ended abnormally: " + status.describe());
    this.status = status;
  }

  public ExitStatus status() {
    return this.status;
  }

  public int exitCode() {
    return this.status.exitCode();
  }
}
