package com.consullo.process.control;

import org.apache.commons.lang3.SystemUtils;

/**
 * Terminal result reported by the OS for one process.
 *
 * @param pid process id
 * @param exitCode exit code; on POSIX, 128 + n when killed by signal n
 * @since 1.0
 */
public record ExitStatus(long pid, int exitCode) {

  public boolean isSuccess() {
    return this.exitCode == 0;
  }

  /**
   * Human readable summary, e.g. {@code "exit status 7"} or {@code "signal: killed"}.
   *
   * @return description
   */
  public String describe() {
    if (!SystemUtils.IS_OS_WINDOWS && this.exitCode > TerminationSignal.SIGNAL_EXIT_BASE) {
      final int signal = this.exitCode - TerminationSignal.SIGNAL_EXIT_BASE;
      final TerminationSignal known = TerminationSignal.ofNumber(signal);
      if (known != null) {
        return "signal: " + known.description();
      }
    }
    return "exit status " + this.exitCode;
  }
}
