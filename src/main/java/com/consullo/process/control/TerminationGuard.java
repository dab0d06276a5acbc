package com.consullo.process.control;

/**
 * Runs a termination body at most once and replays its outcome to every caller.
 *
 * <p>Callers arriving while the body is running block until it finishes. A body that throws
 * has still run; later callers receive the same exception instance.
 */
final class TerminationGuard {

  @FunctionalInterface
  interface Body {
    void run() throws ProcessControlException;
  }

  private final Object lock = new Object();

  private boolean ran;
  private ProcessControlException failure;
  private RuntimeException unexpected;
  private Error fatal;

  void run(final Body body) throws ProcessControlException {
    synchronized (this.lock) {
      if (!this.ran) {
        this.ran = true;
        try {
          body.run();
        } catch (final ProcessControlException e) {
          this.failure = e;
        } catch (final RuntimeException e) {
          this.unexpected = e;
        } catch (final Error e) {
          this.fatal = e;
        }
      }
      if (this.failure != null) {
        throw this.failure;
      }
      if (this.unexpected != null) {
        throw this.unexpected;
      }
      if (this.fatal != null) {
        throw this.fatal;
      }
    }
  }

  boolean hasRun() {
    synchronized (this.lock) {
      return this.ran;
    }
  }
}
