package com.consullo.process.control;

import org.apache.commons.lang3.SystemUtils;

/**
 * Signal classes a controller can send to end its process.
 *
 * @since 1.0
 */
public enum TerminationSignal {

  /** Cooperative request the process may catch or ignore. {@link Process#destroy()}, SIGTERM. */
  INTERRUPT(15, "terminated"),

  /** Enforced by the OS. {@link Process#destroyForcibly()}, SIGKILL. */
  KILL(9, "killed");

  // POSIX shells and the JDK both report death-by-signal n as exit code 128 + n.
  static final int SIGNAL_EXIT_BASE = 128;

  // TerminateProcess exit code used by the JDK on Windows.
  private static final int WINDOWS_FORCED_EXIT = 1;

  private final int number;
  private final String description;

  TerminationSignal(final int number, final String description) {
    this.number = number;
    this.description = description;
  }

  public int number() {
    return this.number;
  }

  public String description() {
    return this.description;
  }

  /**
   * Whether the exit is what this signal is expected to produce.
   *
   * @param status terminal exit status
   * @return true if the process died from this signal
   */
  public boolean matches(final ExitStatus status) {
    if (status == null) {
      return false;
    }
    if (SystemUtils.IS_OS_WINDOWS) {
      return this == KILL && status.exitCode() == WINDOWS_FORCED_EXIT;
    }
    return status.exitCode() == SIGNAL_EXIT_BASE + this.number;
  }

  /**
   * Look up the signal class for a raw POSIX signal number.
   *
   * @param number signal number
   * @return matching signal, or {@code null}
   */
  static TerminationSignal ofNumber(final int number) {
    for (final TerminationSignal s : values()) {
      if (s.number == number) {
        return s;
      }
    }
    return null;
  }
}
