package io.hubuum.shell.core.command;

import io.hubuum.shell.core.LineSink;
import java.util.List;

/**
 * What a command sees while it runs.
 *
 * @param client the collaborator client supplied by the host, opaque to the core
 * @param out line sink for command output
 * @param scopePath scopes the command was reached through
 * @param tree the sealed command tree
 */
public record CommandContext(Object client, LineSink out, List<String> scopePath, CommandTree tree) {

  public CommandContext {
    scopePath = List.copyOf(scopePath);
  }

  /**
   * Returns the client as {@code type}.
   *
   * @throws IllegalStateException if no client is set or it is not a {@code type}
   */
  public <T> T client(Class<T> type) {
    if (!type.isInstance(client)) {
      throw new IllegalStateException(
          "Client is "
              + (client == null ? "not set" : client.getClass().getName())
              + ", expected "
              + type.getName());
    }
    return type.cast(client);
  }
}
