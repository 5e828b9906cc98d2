package io.hubuum.shell.core.command;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionValidator;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import java.util.List;
import java.util.Optional;

/**
 * A leaf of the command tree. Implementations declare their options once, usually in a static
 * {@link io.hubuum.shell.core.option.OptionTable}, and receive tokens that already passed {@link
 * #validate}.
 */
public interface Command {

  /** The option table, including the implicit help option. */
  List<OptionDescriptor> options();

  /** Name under which the command is usually registered. */
  String name();

  /** One-line description shown in help headlines. */
  default Optional<String> about() {
    return Optional.empty();
  }

  default Optional<String> longAbout() {
    return Optional.empty();
  }

  /** Example argument lines, one per line, without the command name. */
  default Optional<String> examples() {
    return Optional.empty();
  }

  /**
   * Runs the command.
   *
   * @param context client, output sink and position in the tree
   * @param tokens validated tokens
   * @throws ShellException if the command fails in an expected way
   */
  void execute(CommandContext context, ParsedTokens tokens) throws ShellException;

  /**
   * Checks {@code tokens} against {@link #options()}. Commands with cross-option rules override
   * this and call the default first.
   */
  default void validate(ParsedTokens tokens) throws ShellException {
    OptionValidator.validate(options(), tokens);
  }

  /**
   * Writes this command's help text.
   *
   * @param commandName name the command is registered under
   * @param scopePath scopes leading to the command
   * @param out destination
   */
  default void help(String commandName, List<String> scopePath, LineSink out) {
    out.appendLines(CommandHelp.render(this, commandName, scopePath));
  }
}
