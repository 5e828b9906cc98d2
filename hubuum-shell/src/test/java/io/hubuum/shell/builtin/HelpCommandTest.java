package io.hubuum.shell.builtin;

import static org.junit.jupiter.api.Assertions.*;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.command.Command;
import io.hubuum.shell.core.command.CommandContext;
import io.hubuum.shell.core.command.CommandDispatcher;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import io.hubuum.shell.core.tokenizer.CommandTokenizer;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import io.hubuum.shell.core.tokenizer.ValueResolver;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HelpCommandTest {

  CommandDispatcher dispatcher;
  List<String> out;

  @BeforeEach
  void setUp() {
    CommandTree root = new CommandTree();
    root.addCommand(HelpCommand.NAME, new HelpCommand());
    CommandTree classes = root.addScope("class");
    classes.addCommand("list", new NoopCommand("list"));
    classes.addCommand("info", new NoopCommand("info"));
    root.seal();
    dispatcher = new CommandDispatcher(root, new CommandTokenizer(ValueResolver.identity()), null);
    out = new ArrayList<>();
  }

  @Test
  void listsScopesAndCommands() throws Exception {
    dispatcher.dispatch("help", LineSink.collecting(out));
    assertEquals(
        List.of("Scopes:", "  class", "", "Commands:", "  help", "  exit|quit", ""),
        out.subList(0, 7));
  }

  @Test
  void treeOptionShowsWholeTree() throws Exception {
    dispatcher.dispatch("help --tree", LineSink.collecting(out));
    assertEquals(List.of("├─ help", "└─ class", "   ├─ list", "   └─ info"), out);
  }

  @Test
  void shortTreeAlias() throws Exception {
    dispatcher.dispatch("help -t", LineSink.collecting(out));
    assertEquals("├─ help", out.get(0));
  }

  @Test
  void ownHelp() throws Exception {
    dispatcher.dispatch("help --help", LineSink.collecting(out));
    assertEquals("help - Show available commands", out.get(0));
    assertEquals("  help --tree", out.get(out.size() - 1));
  }

  static final class NoopCommand implements Command {
    private final String name;

    NoopCommand(String name) {
      this.name = name;
    }

    @Override
    public List<OptionDescriptor> options() {
      return OptionTable.of();
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void execute(CommandContext context, ParsedTokens tokens) {}
  }
}
