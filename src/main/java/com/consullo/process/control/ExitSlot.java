package com.consullo.process.control;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot delivery cell for a process's terminal status.
 *
 * <p>The reaper deposits once without blocking, whether or not anyone ever reads. Readers may
 * come any number of times and all see the same value; the first read marks the slot drained.
 */
final class ExitSlot {

  private final CompletableFuture<ExitStatus> result = new CompletableFuture<>();
  private final AtomicBoolean drained = new AtomicBoolean();

  /**
   * @return false if a value was already deposited
   */
  boolean deposit(final ExitStatus status) {
    return this.result.complete(status);
  }

  /**
   * Record that exit monitoring itself broke. Readers get the cause wrapped in a
   * {@link ProcessControlException}.
   */
  boolean fail(final Throwable cause) {
    return this.result.completeExceptionally(cause);
  }

  boolean isFilled() {
    return this.result.isDone();
  }

  boolean isDrained() {
    return this.drained.get();
  }

  /**
   * Wait for the status or the deadline, whichever comes first. An interrupt of the calling
   * thread counts as the deadline; the interrupt flag is preserved.
   *
   * @return the status, or {@code null} if the deadline won
   */
  ExitStatus await(final Deadline deadline) throws ProcessControlException {
    if (!this.result.isDone() && !deadline.isExpired()) {
      try {
        if (deadline.isUnbounded()) {
          this.result.get();
        } else {
          CompletableFuture.anyOf(this.result, deadline.expiry()).get();
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (final ExecutionException e) {
        // Monitoring failure; surfaced by take().
      }
    }
    if (!this.result.isDone()) {
      return null;
    }
    return take();
  }

  /**
   * Wait with no bound, ignoring interrupts.
   */
  ExitStatus awaitUninterruptibly() throws ProcessControlException {
    return take();
  }

  /** Read-only view for {@link ProcessController#onExit()}. */
  CompletableFuture<ExitStatus> view() {
    return this.result.copy();
  }

  private ExitStatus take() throws ProcessControlException {
    try {
      final ExitStatus status = this.result.join();
      this.drained.set(true);
      return status;
    } catch (final CompletionException e) {
      this.drained.set(true);
      throw new ProcessControlException("Exit monitoring failed", e.getCause());
    }
  }
}
