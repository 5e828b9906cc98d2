package io.hubuum.shell.core.command;

import java.util.List;
import java.util.Optional;

/**
 * Result of walking words through a {@link CommandTree}.
 *
 * @param scope deepest scope reached
 * @param scopePath names of the scopes descended into, outermost first
 * @param command the resolved command, or {@code null} if the walk ended without one
 * @param commandName name of the resolved command, or {@code null}
 * @param consumed number of leading words matched by the walk (scopes plus the command)
 */
public record CommandPath(
    CommandTree scope, List<String> scopePath, Command command, String commandName, int consumed) {

  public CommandPath {
    scopePath = List.copyOf(scopePath);
  }

  public boolean isResolved() {
    return command != null;
  }

  public Optional<Command> resolvedCommand() {
    return Optional.ofNullable(command);
  }
}
