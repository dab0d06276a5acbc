package com.consullo.process.demo;

import com.consullo.process.command.CommandBuilder;
import com.consullo.process.command.CommandDescriptor;
import com.consullo.process.command.OutputSink;
import com.consullo.process.control.Deadline;
import com.consullo.process.control.ProcessController;
import com.consullo.process.control.ProcessControllerFactory;
import java.io.PrintStream;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that walks one command through start, wait and restart, then stops a process
 * that ignores SIGTERM so the kill escalation can be observed.
 *
 * <p>Requires a POSIX {@code /bin/sh}.
 *
 * @since 1.0
 */
public final class ProcessControlDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessControlDemo.class);

  private ProcessControlDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    run(System.out);
  }

  /**
   * Run the demo, writing child output to {@code out}.
   *
   * @param out destination for the children's stdout
   * @throws Exception if any step fails
   */
  public static void run(final PrintStream out) throws Exception {
    final CommandBuilder commands = CommandBuilder.create(null)
        .stdout(OutputSink.to(out))
        .stderr(OutputSink.discard());

    final CommandDescriptor hello = commands.command("/bin/sh", "-c", "echo \"demo: hello from $$\"");
    final ProcessController first = ProcessControllerFactory.start(hello);
    first.waitFor(Deadline.after(Duration.ofSeconds(10)));
    LOGGER.info("First run of pid {} finished in state {}", first.pid(), first.state());

    final ProcessController second = first.restart(Deadline.after(Duration.ofSeconds(1)));
    second.waitFor(Deadline.after(Duration.ofSeconds(10)));
    LOGGER.info("Restarted run of pid {} finished in state {}", second.pid(), second.state());

    // Ignores the cooperative signal, so only the kill escalation can end it.
    final CommandDescriptor stubborn = commands
        .stdout(OutputSink.discard())
        .command("/bin/sh", "-c", "trap '' TERM; while :; do sleep 0.1; done");
    final ProcessController holdout = ProcessControllerFactory.start(stubborn);
    final long started = System.nanoTime();
    holdout.stop(Deadline.after(Duration.ofMillis(200)));
    LOGGER.info("Stopped pid {} with {} after {} ms",
        holdout.pid(),
        holdout.requestedSignal().orElse(null),
        Duration.ofNanos(System.nanoTime() - started).toMillis());
    out.println("demo: done");
    out.flush();
  }
}
