package io.hubuum.shell;

import io.hubuum.shell.builtin.HelpCommand;
import io.hubuum.shell.core.CommandModule;
import io.hubuum.shell.core.ModuleContext;
import io.hubuum.shell.core.command.CommandDispatcher;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.completion.CompletionEngine;
import io.hubuum.shell.core.tokenizer.CommandTokenizer;
import io.hubuum.shell.core.tokenizer.UriValueResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive shell: reads lines with JLine, dispatches them through the command tree built from
 * the discovered {@link CommandModule}s and prints the buffered output after each line.
 */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final ShellConfig config;
  private final Terminal terminal;
  private final LineReader lineReader;
  private final DefaultHistory history;
  private final List<CommandModule> modules;
  private final OutputBuffer buffer = new OutputBuffer();
  private final LineProcessor processor;
  private boolean running = true;

  /**
   * @param config shell settings
   * @param client collaborator handed to modules and commands, may be null
   */
  public Shell(ShellConfig config, Object client) throws IOException {
    this.config = config;
    this.terminal = TerminalBuilder.builder().system(true).build();
    this.modules = loadModules();

    ModuleContext moduleContext = new ModuleContext(client, !config.apiCompletionDisabled());
    CommandTree tree = buildTree(modules, moduleContext);
    CommandTokenizer tokenizer =
        new CommandTokenizer(
            new UriValueResolver(Duration.ofSeconds(config.httpTimeoutSeconds())));
    this.processor = new LineProcessor(new CommandDispatcher(tree, tokenizer, client), buffer);

    Path histPath = config.historyFile().toAbsolutePath();
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      LOG.warn("Cannot create history directory for {}: {}", histPath, e.getMessage());
    }
    this.history = new DefaultHistory();

    DefaultParser parser = new DefaultParser();
    parser.setEofOnUnclosedQuote(false);

    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.HISTORY_FILE, histPath)
            .history(history)
            .completer(new ShellCompleter(new CompletionEngine(tree, config.padding())))
            .parser(parser)
            .build();
  }

  static List<CommandModule> loadModules() {
    List<CommandModule> loaded = new ArrayList<>();
    ServiceLoader<CommandModule> loader = ServiceLoader.load(CommandModule.class);
    for (CommandModule module : loader) {
      try {
        module.initialize();
        loaded.add(module);
        LOG.info("Loaded module: {} ({})", module.getDisplayName(), module.getId());
      } catch (Exception e) {
        LOG.error("Failed to initialize module: {}", module.getId(), e);
      }
    }

    // Sort by priority (highest first)
    loaded.sort(Comparator.comparingInt(CommandModule::getPriority).reversed());
    return loaded;
  }

  /** Builds and seals the command tree: the built-in commands, then every module's. */
  static CommandTree buildTree(List<CommandModule> modules, ModuleContext context) {
    CommandTree root = new CommandTree();
    root.addCommand(HelpCommand.NAME, new HelpCommand());
    for (CommandModule module : modules) {
      try {
        module.register(root, context);
      } catch (RuntimeException e) {
        LOG.error("Failed to register module: {}", module.getId(), e);
      }
    }
    root.seal();
    LOG.debug("Command tree:\n{}", root.showTree());
    return root;
  }

  public void run(boolean banner) {
    if (banner) {
      printBanner();
    }

    while (running) {
      try {
        String input = lineReader.readLine(config.prompt());
        if (input == null || input.isBlank()) {
          continue;
        }
        input = input.trim();

        if ("exit".equalsIgnoreCase(input) || "quit".equalsIgnoreCase(input)) {
          running = false;
          continue;
        }
        processor.process(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
      } catch (EndOfFileException e) {
        terminal.writer().println();
        running = false;
      }
      buffer.flush(terminal.writer()::println);
      terminal.flush();
    }
  }

  private void printBanner() {
    terminal.writer().println("Hubuum shell. Type 'help' for commands, 'exit' to quit.");
    terminal.writer().println();
    terminal.flush();
  }

  @Override
  public void close() throws Exception {
    try {
      history.save();
    } catch (IOException e) {
      LOG.warn("Failed to save history: {}", e.getMessage());
    }

    for (CommandModule module : modules) {
      try {
        module.shutdown();
      } catch (Exception e) {
        LOG.error("Error shutting down module: {}", module.getId(), e);
      }
    }

    terminal.close();
  }
}
