package com.consullo.process.command;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Holds process-wide launch defaults and stamps them onto each new {@link CommandDescriptor}.
 *
 * <p>Defaults on creation:
 * <ul>
 * <li>working directory as given ({@code null} inherits the JVM's)</li>
 * <li>environment copied from {@link System#getenv()}</li>
 * <li>stdin, stdout and stderr inherited</li>
 * <li>a two second output drain timeout</li>
 * </ul>
 *
 * <p>Changing a default affects only descriptors produced afterwards.
 */
public final class CommandBuilder implements Commands {

  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(2);

  private Path workingDirectory;
  private List<String> environment;
  private InputSource stdin = InputSource.inherit();
  private OutputSink stdout = OutputSink.inherit();
  private OutputSink stderr = OutputSink.inherit();
  private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;

  private CommandBuilder(final Path workingDirectory) {
    this.workingDirectory = workingDirectory;
    this.environment = inheritedEnvironment();
  }

  /**
   * Create a builder seeded with the JVM's environment and standard streams.
   *
   * @param workingDirectory default working directory, or {@code null} to inherit
   * @return builder
   */
  public static CommandBuilder create(final Path workingDirectory) {
    return new CommandBuilder(workingDirectory);
  }

  public CommandBuilder workingDirectory(final Path dir) {
    this.workingDirectory = dir;
    return this;
  }

  /**
   * Replace the whole environment.
   *
   * @param env {@code KEY=VALUE} entries
   * @return this builder
   */
  public CommandBuilder environment(final List<String> env) {
    Validate.notNull(env, "env must not be null");
    this.environment = new ArrayList<>(env);
    return this;
  }

  public CommandBuilder addEnvironment(final String key, final String value) {
    Validate.notBlank(key, "key must not be blank");
    Validate.isTrue(key.indexOf('=') < 0, "key must not contain '=': %s", key);
    Validate.notNull(value, "value must not be null");
    this.environment.add(key + "=" + value);
    return this;
  }

  public CommandBuilder stdin(final InputSource source) {
    this.stdin = Validate.notNull(source, "source must not be null");
    return this;
  }

  public CommandBuilder stdout(final OutputSink sink) {
    this.stdout = Validate.notNull(sink, "sink must not be null");
    return this;
  }

  public CommandBuilder stderr(final OutputSink sink) {
    this.stderr = Validate.notNull(sink, "sink must not be null");
    return this;
  }

  public CommandBuilder drainTimeout(final Duration timeout) {
    Validate.notNull(timeout, "timeout must not be null");
    Validate.isTrue(!timeout.isNegative(), "timeout must not be negative");
    this.drainTimeout = timeout;
    return this;
  }

  public List<String> environment() {
    return List.copyOf(this.environment);
  }

  @Override
  public CommandDescriptor command(final String name, final List<String> args) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(args, "args must not be null");
    return new CommandDescriptor(
        name,
        args,
        this.workingDirectory,
        this.environment,
        this.stdin,
        this.stdout,
        this.stderr,
        this.drainTimeout);
  }

  private static List<String> inheritedEnvironment() {
    final Map<String, String> env = System.getenv();
    final List<String> out = new ArrayList<>(env.size());
    for (final Map.Entry<String, String> e : env.entrySet()) {
      // Windows carries pseudo-variables such as "=C:"; they are not KEY=VALUE pairs.
      if (e.getKey().isEmpty() || e.getKey().indexOf('=') >= 0) {
        continue;
      }
      out.add(e.getKey() + "=" + e.getValue());
    }
    return out;
  }
}
