package io.hubuum.shell.core.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One node of the command hierarchy: named commands plus named child scopes. The root node has no
 * name. Children keep their registration order.
 *
 * <p>A tree is built once during start-up and then {@linkplain #seal() sealed}; after that it is
 * read-only and may be shared freely. A name is either a command or a scope at any one level,
 * never both.
 */
public final class CommandTree {
  private static final Logger LOG = LoggerFactory.getLogger(CommandTree.class);

  private final Map<String, Command> commands = new LinkedHashMap<>();
  private final Map<String, CommandTree> scopes = new LinkedHashMap<>();
  private boolean sealed;

  /**
   * Registers a command at this level. Registering the same name again replaces the previous
   * command.
   *
   * @return this node, for chaining
   * @throws IllegalArgumentException if {@code name} is already a scope at this level
   * @throws IllegalStateException if the tree is sealed
   */
  public CommandTree addCommand(String name, Command command) {
    checkOpen();
    checkName(name);
    if (scopes.containsKey(name)) {
      throw new IllegalArgumentException("'" + name + "' is already registered as a scope");
    }
    Command previous = commands.put(name, command);
    if (previous != null) {
      LOG.debug("Replaced command '{}'", name);
    } else {
      LOG.debug("Registered command '{}'", name);
    }
    return this;
  }

  /** Registers a command under its own {@link Command#name()}. */
  public CommandTree addCommand(Command command) {
    return addCommand(command.name(), command);
  }

  /**
   * Returns the child scope {@code name}, creating it if absent.
   *
   * @throws IllegalArgumentException if {@code name} is already a command at this level
   * @throws IllegalStateException if the tree is sealed and the scope does not exist
   */
  public CommandTree addScope(String name) {
    CommandTree existing = scopes.get(name);
    if (existing != null) {
      return existing;
    }
    checkOpen();
    checkName(name);
    if (commands.containsKey(name)) {
      throw new IllegalArgumentException("'" + name + "' is already registered as a command");
    }
    CommandTree scope = new CommandTree();
    scopes.put(name, scope);
    LOG.debug("Registered scope '{}'", name);
    return scope;
  }

  public Optional<Command> getCommand(String name) {
    return Optional.ofNullable(commands.get(name));
  }

  public Optional<CommandTree> getScope(String name) {
    return Optional.ofNullable(scopes.get(name));
  }

  public Set<String> commandNames() {
    return Collections.unmodifiableSet(commands.keySet());
  }

  public Set<String> scopeNames() {
    return Collections.unmodifiableSet(scopes.keySet());
  }

  /** Names of child commands and scopes starting with {@code prefix}, commands first. */
  public List<String> completions(String prefix) {
    List<String> result = new ArrayList<>();
    for (String name : commands.keySet()) {
      if (name.startsWith(prefix)) {
        result.add(name);
      }
    }
    for (String name : scopes.keySet()) {
      if (name.startsWith(prefix)) {
        result.add(name);
      }
    }
    return result;
  }

  /**
   * Walks {@code words} from this node: a scope name descends, a command name resolves and ends
   * the walk, any other word ends it unresolved.
   */
  public CommandPath resolve(List<String> words) {
    CommandTree current = this;
    List<String> path = new ArrayList<>();
    for (int i = 0; i < words.size(); i++) {
      String word = words.get(i);
      CommandTree scope = current.scopes.get(word);
      if (scope != null) {
        current = scope;
        path.add(word);
        continue;
      }
      Command command = current.commands.get(word);
      if (command != null) {
        LOG.trace("Resolved {} to command '{}'", path, word);
        return new CommandPath(current, path, command, word, i + 1);
      }
      break;
    }
    return new CommandPath(current, path, null, null, path.size());
  }

  /** Ends registration for this node and every scope below it. */
  public void seal() {
    sealed = true;
    scopes.values().forEach(CommandTree::seal);
  }

  public boolean isSealed() {
    return sealed;
  }

  /** Renders the hierarchy below this node, commands before scopes. */
  public String showTree() {
    StringBuilder sb = new StringBuilder();
    render(sb, "");
    return sb.toString();
  }

  private void render(StringBuilder sb, String indent) {
    int total = commands.size() + scopes.size();
    int index = 0;
    for (String name : commands.keySet()) {
      boolean last = ++index == total;
      sb.append(indent).append(last ? "└─ " : "├─ ").append(name).append('\n');
    }
    for (Map.Entry<String, CommandTree> e : scopes.entrySet()) {
      boolean last = ++index == total;
      sb.append(indent).append(last ? "└─ " : "├─ ").append(e.getKey()).append('\n');
      e.getValue().render(sb, indent + (last ? "   " : "│  "));
    }
  }

  private void checkOpen() {
    if (sealed) {
      throw new IllegalStateException("Command tree is sealed");
    }
  }

  private static void checkName(String name) {
    if (name == null || name.isBlank() || name.startsWith("-")) {
      throw new IllegalArgumentException("Invalid command or scope name: " + name);
    }
  }

  @Override
  public String toString() {
    return "Commands: "
        + String.join(", ", commands.keySet())
        + ". Scopes: "
        + String.join(", ", scopes.keySet())
        + ".";
  }
}
