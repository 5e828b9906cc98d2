package io.hubuum.shell.core.command;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import io.hubuum.shell.core.tokenizer.CommandTokenizer;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import io.hubuum.shell.core.tokenizer.ShellSplitter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs submitted lines: resolves the command in the tree, tokenizes the line, then either prints
 * the command's help (when {@code -h}/{@code --help} is given) or validates the tokens and
 * executes the command.
 *
 * <p>Every failure reaches the caller as a {@link ShellException}; nothing is printed here.
 */
public final class CommandDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

  private final CommandTree tree;
  private final CommandTokenizer tokenizer;
  private final Object client;

  /**
   * @param tree the sealed command tree
   * @param tokenizer tokenizer carrying the value resolver for option substitution
   * @param client collaborator handed to commands through {@link CommandContext}, may be null
   */
  public CommandDispatcher(CommandTree tree, CommandTokenizer tokenizer, Object client) {
    this.tree = tree;
    this.tokenizer = tokenizer;
    this.client = client;
  }

  /**
   * Dispatches one line. A blank line is a no-op.
   *
   * @param line the raw input line
   * @param out sink for help and command output
   * @throws ShellException if the line cannot be split, names no command, fails validation or the
   *     command fails
   */
  public void dispatch(String line, LineSink out) throws ShellException {
    List<String> words = ShellSplitter.split(line);
    if (words.isEmpty()) {
      return;
    }

    CommandPath path = tree.resolve(words);
    if (!path.isResolved()) {
      String what =
          path.consumed() < words.size()
              ? words.get(path.consumed())
              : String.join(" ", words);
      throw ShellException.commandNotFound(what);
    }
    Command command = path.command();
    String name = path.commandName();
    LOG.debug("Dispatching {} {}", path.scopePath(), name);

    ParsedTokens tokens = tokenizer.tokenize(line, path.scopePath(), name, command.options());
    if (tokens.hasOption("h", "help")) {
      command.help(name, path.scopePath(), out);
      return;
    }
    checkKnownKeys(command.options(), tokens, name);
    command.validate(tokens);

    CommandContext context = new CommandContext(client, out, path.scopePath(), tree);
    try {
      command.execute(context, tokens);
    } catch (RuntimeException e) {
      LOG.debug("Command {} failed", name, e);
      throw ShellException.commandFailed(name, e);
    }
  }

  private static void checkKnownKeys(
      List<OptionDescriptor> options, ParsedTokens tokens, String commandName)
      throws ShellException {
    for (String key : tokens.getOptions().keySet()) {
      if (OptionTable.findByKey(options, key).isEmpty()) {
        throw ShellException.invalidOption(
            "unknown option '" + key + "' for command '" + commandName + "'");
      }
    }
  }
}
