package com.consullo.process.control;

/**
 * A termination signal could not be delivered to a live process.
 *
 * @since 1.0
 */
public final class SignalDeliveryException extends ProcessControlException {

  private static final long serialVersionUID = 1L;

  private final long pid;
  private final TerminationSignal signal;

  public SignalDeliveryException(final long pid, final TerminationSignal signal, final Throwable cause) {
    super("Failed to deliver " + signal + " to pid " + pid
        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    this.pid = pid;
    this.signal = signal;
  }

  public long pid() {
    return this.pid;
  }

  public TerminationSignal signal() {
    return this.signal;
  }
}
