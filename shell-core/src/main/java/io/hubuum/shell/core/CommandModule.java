package io.hubuum.shell.core;

import io.hubuum.shell.core.command.CommandTree;

/**
 * Service Provider Interface (SPI) for command modules. A module contributes scopes and commands
 * to the shell's command tree during start-up, before the tree is sealed.
 *
 * <p>Modules are discovered via {@link java.util.ServiceLoader}.
 */
public interface CommandModule {

  /** Unique identifier for this module (e.g., "classes", "namespaces"). */
  String getId();

  /** Human-readable name for this module. */
  String getDisplayName();

  /**
   * Registers this module's scopes and commands.
   *
   * @param root the root of the command tree, still open for registration
   * @param context client and settings supplied by the host
   */
  void register(CommandTree root, ModuleContext context);

  /**
   * Returns the priority of this module. Modules register in descending priority order, so a
   * lower-priority module registering the same command name replaces the earlier one.
   *
   * @return priority value (default 0)
   */
  default int getPriority() {
    return 0;
  }

  /** Called when the module is loaded, before {@link #register}. */
  default void initialize() {}

  /** Called when the shell is shutting down. */
  default void shutdown() {}
}
