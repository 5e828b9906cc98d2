package io.hubuum.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "hubuum-shell",
    description = "Interactive command shell for Hubuum",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Configuration file (default: ~/.hubuum-shell/shell.properties)")
  private Path config;

  @CommandLine.Option(
      names = "--completion-api-disable",
      arity = "1",
      description = "Disable autocomplete that queries the server (true/false)")
  private Boolean completionApiDisable;

  @CommandLine.Option(
      names = "--padding",
      description = "Spaces between the columns of option completions")
  private Integer padding;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner")
  private boolean quiet;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    if (config != null && !Files.exists(config)) {
      System.err.println("Error: Config file not found: " + config);
      return 1;
    }
    try (Shell shell = new Shell(resolveConfig(), null)) {
      shell.run(!quiet);
      return 0;
    }
  }

  /** Loads the configuration file, then applies command-line overrides. */
  ShellConfig resolveConfig() throws IOException {
    ShellConfig cfg = config != null ? ShellConfig.load(config) : ShellConfig.load();
    if (padding != null) {
      cfg = cfg.withPadding(padding);
    }
    if (completionApiDisable != null) {
      cfg = cfg.withApiCompletionDisabled(completionApiDisable);
    }
    return cfg;
  }
}
