package io.hubuum.shell.builtin;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.command.Command;
import io.hubuum.shell.core.command.CommandContext;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import java.util.List;
import java.util.Optional;

/** Lists the top-level scopes and commands, or with {@code --tree} the whole command tree. */
public final class HelpCommand implements Command {

  public static final String NAME = "help";

  private static final List<OptionDescriptor> OPTIONS =
      OptionTable.of(
          OptionDescriptor.builder("tree")
              .shortAlias("t")
              .longAlias("tree")
              .help("Command tree")
              .flag()
              .build());

  @Override
  public List<OptionDescriptor> options() {
    return OPTIONS;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<String> about() {
    return Optional.of("Show available commands");
  }

  @Override
  public Optional<String> examples() {
    return Optional.of("--tree");
  }

  @Override
  public void execute(CommandContext context, ParsedTokens tokens) {
    LineSink out = context.out();
    CommandTree tree = context.tree();
    if (tokens.hasOption("t", "tree")) {
      out.appendLines(tree.showTree());
      return;
    }

    if (!tree.scopeNames().isEmpty()) {
      out.appendLine("Scopes:");
      tree.scopeNames().forEach(name -> out.appendLine("  " + name));
      out.appendLine("");
    }
    out.appendLine("Commands:");
    tree.commandNames().forEach(name -> out.appendLine("  " + name));
    out.appendLine("  exit|quit");
    out.appendLine("");
    out.appendLine("Use '<scope> <command> --help' for options, 'help --tree' for every command.");
  }
}
