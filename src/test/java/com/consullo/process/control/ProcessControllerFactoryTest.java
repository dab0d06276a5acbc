package com.consullo.process.control;

import com.consullo.process.command.CommandBuilder;
import com.consullo.process.command.CommandDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Launch failures reported by the factory before any controller exists.
 *
 * @since 1.0
 */
public class ProcessControllerFactoryTest {

  @Test
  @DisplayName("Should report an environment value the platform rejects as a launch failure")
  void start_NulInEnvironmentValue_ProcessLaunchException() throws Exception {
    final CommandDescriptor cmd = CommandBuilder.create(null)
        .addEnvironment("A", "b\u0000c")
        .command("fake-binary", "x");

    assertThatThrownBy(() -> ProcessControllerFactory.start(cmd))
        .isInstanceOfSatisfying(ProcessLaunchException.class, e -> {
          assertThat(e.commandLine()).containsExactly("fake-binary", "x");
          assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
        });
  }

  @Test
  @DisplayName("Should report a rejected environment value from run as a launch failure")
  void run_NulInEnvironmentValue_ProcessLaunchException() throws Exception {
    final CommandDescriptor cmd = CommandBuilder.create(null)
        .addEnvironment("A", "b\u0000c")
        .command("fake-binary");

    assertThatThrownBy(() -> ProcessControllerFactory.run(cmd, Deadline.none()))
        .isInstanceOf(ProcessLaunchException.class);
  }
}
