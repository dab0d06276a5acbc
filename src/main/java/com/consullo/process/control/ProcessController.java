package com.consullo.process.control;

import com.consullo.process.command.CommandDescriptor;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle controller for exactly one launched OS process.
 *
 * <p>Implementations must provide:
 * - a single background reaper that reports the exit exactly once
 * - waiting with a deadline, where expiry kills the process
 * - stop (interrupt, then kill) and kill, sharing one run-once guard
 * - restart into a fresh, independent controller
 *
 * <p>A controller is never reused for a second process.
 *
 * @since 1.0
 */
public interface ProcessController extends AutoCloseable {

  long pid();

  boolean isAlive();

  /** Descriptor this process was launched from. */
  CommandDescriptor command();

  ProcessState state();

  /** Strongest signal this controller has sent, empty if it never signalled. */
  Optional<TerminationSignal> requestedSignal();

  /**
   * Completes with the terminal status once the reaper reports it. Completing or cancelling
   * the returned future has no effect on the controller.
   */
  CompletableFuture<ExitStatus> onExit();

  /**
   * Block until the process exits or the deadline expires. On expiry the process is killed and
   * the kill's outcome is returned instead. Exits caused by this controller's own signals count
   * as clean.
   *
   * @param deadline when to give up and kill
   * @throws ProcessExitException if the process exited abnormally on its own
   * @throws ProcessControlException if the kill after expiry failed
   */
  void waitFor(Deadline deadline) throws ProcessControlException;

  default void waitFor() throws ProcessControlException {
    waitFor(Deadline.none());
  }

  /**
   * Ask the process to terminate, escalating to kill if the request cannot be sent or the
   * deadline expires first. Runs at most once per controller together with {@link #kill()}; all
   * callers see the outcome of the first run.
   *
   * @param deadline how long to wait for a cooperative exit
   * @throws ProcessControlException if the process could not be signalled or exited abnormally
   */
  void stop(Deadline deadline) throws ProcessControlException;

  /**
   * Forcefully terminate the process and wait for it, with no timeout. Shares the run-once guard
   * with {@link #stop(Deadline)}.
   *
   * @throws ProcessControlException if the kill could not be delivered
   */
  void kill() throws ProcessControlException;

  /**
   * Stop this process and launch the same command again.
   *
   * @param deadline deadline for the stop
   * @return a new controller; this one is left drained
   * @throws ProcessControlException if stop failed (nothing is launched) or the launch failed
   */
  ProcessController restart(Deadline deadline) throws ProcessControlException;

  /** Same as {@link #kill()}. */
  @Override
  void close() throws ProcessControlException;
}
