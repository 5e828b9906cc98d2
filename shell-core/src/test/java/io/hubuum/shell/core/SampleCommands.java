package io.hubuum.shell.core;

import io.hubuum.shell.core.command.Command;
import io.hubuum.shell.core.command.CommandContext;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import io.hubuum.shell.core.option.OptionType;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command tree shared by the core tests: {@code help} at the root, {@code class {info, create}}
 * and {@code namespace list}.
 */
public final class SampleCommands {

  private SampleCommands() {}

  /** A command that records the tokens it was executed with. */
  public static class RecordingCommand implements Command {
    private final String name;
    private final List<OptionDescriptor> options;
    private final String about;
    private final String examples;
    public final List<ParsedTokens> executions = new ArrayList<>();

    public RecordingCommand(String name, List<OptionDescriptor> options) {
      this(name, options, null, null);
    }

    public RecordingCommand(
        String name, List<OptionDescriptor> options, String about, String examples) {
      this.name = name;
      this.options = options;
      this.about = about;
      this.examples = examples;
    }

    @Override
    public List<OptionDescriptor> options() {
      return options;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Optional<String> about() {
      return Optional.ofNullable(about);
    }

    @Override
    public Optional<String> examples() {
      return Optional.ofNullable(examples);
    }

    @Override
    public void execute(CommandContext context, ParsedTokens tokens) {
      executions.add(tokens);
      context.out().appendLine("ran " + name);
    }
  }

  public static OptionDescriptor nameOption() {
    return OptionDescriptor.builder("name")
        .shortAlias("n")
        .longAlias("name")
        .help("Name of the class")
        .autocomplete((tree, prefix, words) -> List.of("acme", "acme2"))
        .build();
  }

  public static OptionDescriptor jsonFlag() {
    return OptionDescriptor.builder("json")
        .shortAlias("j")
        .longAlias("json")
        .help("Output as JSON")
        .flag()
        .build();
  }

  public static RecordingCommand info() {
    return new RecordingCommand(
        "info",
        OptionTable.of(nameOption(), jsonFlag()),
        "Show class details",
        "-n acme\n--name acme --json");
  }

  public static RecordingCommand create() {
    return new RecordingCommand(
        "create",
        OptionTable.of(
            OptionDescriptor.builder("name").shortAlias("n").longAlias("name").build(),
            OptionDescriptor.builder("namespace_id")
                .shortAlias("i")
                .longAlias("namespace-id")
                .type(OptionType.INT)
                .help("Namespace the class belongs to")
                .build(),
            OptionDescriptor.builder("description")
                .shortAlias("d")
                .longAlias("description")
                .type(OptionType.optional(OptionType.STRING))
                .build()));
  }

  public static CommandTree tree() {
    CommandTree root = new CommandTree();
    root.addCommand("help", new RecordingCommand("help", OptionTable.of()));
    root.addScope("class").addCommand("info", info()).addCommand("create", create());
    root.addScope("namespace").addCommand("list", new RecordingCommand("list", OptionTable.of()));
    return root;
  }
}
