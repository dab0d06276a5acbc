package com.consullo.process.command;

import java.util.List;

/**
 * Produces command descriptors populated with process-wide defaults.
 *
 * @since 1.0
 */
public interface Commands {

  CommandDescriptor command(String name, List<String> args);

  default CommandDescriptor command(final String name, final String... args) {
    return command(name, List.of(args));
  }
}
