package io.hubuum.shell.core;

/**
 * What the host hands to each {@link CommandModule} while it registers.
 *
 * @param client the collaborator client, also passed to commands at run time; may be null
 * @param remoteCompletion whether autocomplete sources may contact the server
 */
public record ModuleContext(Object client, boolean remoteCompletion) {

  /** Typed access to the client. */
  public <T> T client(Class<T> type) {
    if (!type.isInstance(client)) {
      throw new IllegalStateException("Client is not a " + type.getName());
    }
    return type.cast(client);
  }
}
