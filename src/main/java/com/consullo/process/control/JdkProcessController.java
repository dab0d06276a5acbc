package com.consullo.process.control;

import com.consullo.process.command.CommandDescriptor;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process controller built on {@link java.lang.Process}.
 *
 * <p>Construction starts one daemon reaper thread, the only caller of {@link Process#waitFor()}.
 * It waits for the process, lets any output pumps drain for up to the descriptor's drain
 * timeout, then deposits the status into the exit slot. Wait, stop and kill only read or race
 * that slot.
 *
 * <p>{@link Process#destroy()} is the interrupt-class signal (SIGTERM on POSIX) and
 * {@link Process#destroyForcibly()} the kill-class one (SIGKILL).
 *
 * @since 1.0
 */
public final class JdkProcessController implements ProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdkProcessController.class);

  private final CommandDescriptor command;
  private final Process process;
  private final long pid;
  private final ExitSlot exitSlot = new ExitSlot();
  private final TerminationGuard terminationGuard = new TerminationGuard();

  // Signals sent so far; an exit caused by any of them is expected.
  private final Set<TerminationSignal> sentSignals = EnumSet.noneOf(TerminationSignal.class);

  /**
   * Takes ownership of an already started process.
   *
   * @param command descriptor the process was launched from
   * @param process live process
   */
  JdkProcessController(final CommandDescriptor command, final Process process) {
    Validate.notNull(command, "command must not be null");
    Validate.notNull(process, "process must not be null");
    this.command = command;
    this.process = process;
    this.pid = process.pid();

    final List<Thread> pumps = startPumps();
    startReaperThread(pumps);
  }

  @Override
  public long pid() {
    return this.pid;
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public CommandDescriptor command() {
    return this.command;
  }

  @Override
  public ProcessState state() {
    if (this.exitSlot.isDrained()) {
      return ProcessState.DRAINED;
    }
    return this.exitSlot.isFilled() ? ProcessState.EXITED : ProcessState.LAUNCHED;
  }

  @Override
  public Optional<TerminationSignal> requestedSignal() {
    synchronized (this.sentSignals) {
      if (this.sentSignals.contains(TerminationSignal.KILL)) {
        return Optional.of(TerminationSignal.KILL);
      }
      return this.sentSignals.isEmpty() ? Optional.empty() : Optional.of(TerminationSignal.INTERRUPT);
    }
  }

  @Override
  public CompletableFuture<ExitStatus> onExit() {
    return this.exitSlot.view();
  }

  @Override
  public void waitFor(final Deadline deadline) throws ProcessControlException {
    Validate.notNull(deadline, "deadline must not be null");

    final ExitStatus status = this.exitSlot.await(deadline);
    if (status == null) {
      LOGGER.debug("Wait on pid {} gave up at {}, killing", this.pid, deadline);
      kill();
      return;
    }
    checkExit(status);
  }

  @Override
  public void stop(final Deadline deadline) throws ProcessControlException {
    Validate.notNull(deadline, "deadline must not be null");
    this.terminationGuard.run(() -> stopOnce(deadline));
  }

  @Override
  public void kill() throws ProcessControlException {
    this.terminationGuard.run(this::killOnce);
  }

  @Override
  public ProcessController restart(final Deadline deadline) throws ProcessControlException {
    stop(deadline);
    LOGGER.info("Restarting {} (previous pid {})", this.command.commandLine(), this.pid);
    return ProcessControllerFactory.start(this.command);
  }

  @Override
  public void close() throws ProcessControlException {
    kill();
  }

  @Override
  public String toString() {
    return "JdkProcessController[pid=" + this.pid + ", state=" + state() + "]";
  }

  private void stopOnce(final Deadline deadline) throws ProcessControlException {
    boolean delivered;
    try {
      delivered = signal(TerminationSignal.INTERRUPT);
    } catch (final SignalDeliveryException e) {
      LOGGER.warn("Interrupt for pid {} failed, escalating to kill: {}", this.pid, e.getMessage());
      delivered = signal(TerminationSignal.KILL);
    }
    if (!delivered) {
      LOGGER.debug("Stop: pid {} already exited", this.pid);
      return;
    }

    final ExitStatus status = this.exitSlot.await(deadline);
    if (status == null) {
      LOGGER.debug("Stop of pid {} ran past {}, escalating to kill", this.pid, deadline);
      killOnce();
      return;
    }
    checkExit(status);
  }

  private void killOnce() throws ProcessControlException {
    if (!signal(TerminationSignal.KILL)) {
      LOGGER.debug("Kill: pid {} already exited", this.pid);
      return;
    }
    checkExit(this.exitSlot.awaitUninterruptibly());
  }

  /**
   * @return false if the process was already gone, so nothing was sent
   */
  private boolean signal(final TerminationSignal signal) throws SignalDeliveryException {
    if (!this.process.isAlive()) {
      return false;
    }
    synchronized (this.sentSignals) {
      this.sentSignals.add(signal);
    }
    try {
      if (signal == TerminationSignal.INTERRUPT) {
        if (!this.process.supportsNormalTermination()) {
          throw new UnsupportedOperationException("platform has no cooperative termination");
        }
        this.process.destroy();
      } else {
        this.process.destroyForcibly();
      }
    } catch (final RuntimeException e) {
      throw new SignalDeliveryException(this.pid, signal, e);
    }
    LOGGER.debug("Sent {} to pid {}", signal, this.pid);
    return true;
  }

  private void checkExit(final ExitStatus status) throws ProcessExitException {
    if (status.isSuccess() || isInduced(status)) {
      return;
    }
    throw new ProcessExitException(status);
  }

  private boolean isInduced(final ExitStatus status) {
    synchronized (this.sentSignals) {
      for (final TerminationSignal s : this.sentSignals) {
        if (s.matches(status)) {
          return true;
        }
      }
      return false;
    }
  }

  private List<Thread> startPumps() {
    final List<Thread> pumps = new ArrayList<>(2);
    this.command.stdout().stream().ifPresent(
        sink -> pumps.add(StreamPump.output(this.pid, "stdout", this.process.getInputStream(), sink)));
    this.command.stderr().stream().ifPresent(
        sink -> pumps.add(StreamPump.output(this.pid, "stderr", this.process.getErrorStream(), sink)));
    // The feeder is not joined: a child may legitimately exit without reading all of its input.
    this.command.stdin().stream().ifPresent(
        source -> StreamPump.input(this.pid, this.process::isAlive, source, this.process.getOutputStream()));
    return pumps;
  }

  /**
   * Starts the reaper thread that reports the process exit into the exit slot.
   *
   * @param pumps output pumps to drain before reporting
   */
  private void startReaperThread(final List<Thread> pumps) {
    final Thread reaper = new Thread(() -> {
      try {
        final int code = waitForExit();
        drainPumps(pumps);
        LOGGER.debug("Pid {} exited with code {}", this.pid, code);
        this.exitSlot.deposit(new ExitStatus(this.pid, code));
      } catch (final RuntimeException e) {
        LOGGER.warn("Exit monitoring for pid {} failed: {}", this.pid, e.getMessage(), e);
        this.exitSlot.fail(e);
      }
    }, "ProcessReaper-" + this.pid);
    reaper.setDaemon(true);
    reaper.start();
  }

  private int waitForExit() {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return this.process.waitFor();
        } catch (final InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void drainPumps(final List<Thread> pumps) {
    final long drainUntil = System.nanoTime() + this.command.drainTimeout().toNanos();
    for (final Thread pump : pumps) {
      final long remainingMillis = TimeUnit.NANOSECONDS.toMillis(drainUntil - System.nanoTime());
      if (remainingMillis > 0) {
        try {
          pump.join(remainingMillis);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
      }
      if (pump.isAlive()) {
        LOGGER.warn("{} still open after {}; reporting exit of pid {} without it",
            pump.getName(), this.command.drainTimeout(), this.pid);
      }
    }
  }
}
