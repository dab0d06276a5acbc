package com.consullo.process.command;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Immutable launch parameters for one OS process.
 *
 * <p>{@code arguments} holds only what follows argument zero; argument zero is always
 * {@code path}. Restarting a process therefore re-sends {@code arguments} unchanged.
 *
 * @param path executable to launch
 * @param arguments arguments after argument zero
 * @param workingDirectory working directory, or {@code null} to inherit the JVM's
 * @param environment complete child environment as {@code KEY=VALUE} entries, in order
 * @param stdin standard input source
 * @param stdout standard output sink
 * @param stderr standard error sink
 * @param drainTimeout how long to wait for piped output to finish copying after exit
 * @since 1.0
 */
public record CommandDescriptor(
    String path,
    List<String> arguments,
    Path workingDirectory,
    List<String> environment,
    InputSource stdin,
    OutputSink stdout,
    OutputSink stderr,
    Duration drainTimeout) {

  public CommandDescriptor {
    Validate.notBlank(path, "path must not be blank");
    Validate.notNull(arguments, "arguments must not be null");
    Validate.noNullElements(arguments, "arguments must not contain null elements");
    Validate.notNull(environment, "environment must not be null");
    for (final String entry : environment) {
      Validate.isTrue(entry != null && entry.indexOf('=') > 0,
          "environment entries must be KEY=VALUE: %s", entry);
    }
    Validate.notNull(stdin, "stdin must not be null");
    Validate.notNull(stdout, "stdout must not be null");
    Validate.notNull(stderr, "stderr must not be null");
    Validate.notNull(drainTimeout, "drainTimeout must not be null");
    Validate.isTrue(!drainTimeout.isNegative(), "drainTimeout must not be negative");

    arguments = List.copyOf(arguments);
    environment = List.copyOf(environment);
  }

  /**
   * Full argument vector handed to the OS, argument zero first.
   *
   * @return path followed by arguments
   */
  public List<String> commandLine() {
    final List<String> line = new ArrayList<>(this.arguments.size() + 1);
    line.add(this.path);
    line.addAll(this.arguments);
    return line;
  }

  /**
   * Environment as a map. Later duplicates of a key win.
   *
   * @return ordered key/value view
   */
  public Map<String, String> environmentMap() {
    final Map<String, String> env = new LinkedHashMap<>(this.environment.size() * 2);
    for (final String entry : this.environment) {
      final int eq = entry.indexOf('=');
      env.put(entry.substring(0, eq), entry.substring(eq + 1));
    }
    return env;
  }
}
