package io.hubuum.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.hubuum.shell.core.CommandModule;
import io.hubuum.shell.core.ModuleContext;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.completion.Candidate;
import io.hubuum.shell.core.completion.CompletionEngine;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ShellTest {

  @Test
  void discoversModulesThroughServiceLoader() {
    List<CommandModule> modules = Shell.loadModules();
    assertTrue(modules.stream().anyMatch(m -> m.getId().equals("sample")));
  }

  @Test
  void treeHasBuiltinsAndModuleCommandsAndIsSealed() {
    CommandTree tree = Shell.buildTree(List.of(new SampleModule()), new ModuleContext(null, true));
    assertTrue(tree.isSealed());
    assertTrue(tree.getCommand("help").isPresent());
    CommandTree classes = tree.getScope("class").orElseThrow();
    assertEquals(List.of("list", "info"), List.copyOf(classes.commandNames()));
  }

  @Test
  void failingModuleDoesNotStopStartup() {
    CommandModule broken =
        new CommandModule() {
          @Override
          public String getId() {
            return "broken";
          }

          @Override
          public String getDisplayName() {
            return "Broken";
          }

          @Override
          public void register(CommandTree root, ModuleContext context) {
            throw new IllegalStateException("no server");
          }
        };
    CommandTree tree =
        Shell.buildTree(List.of(broken, new SampleModule()), new ModuleContext(null, true));
    assertTrue(tree.getScope("class").isPresent());
    assertTrue(tree.isSealed());
  }

  @Test
  void disabledRemoteCompletionSuggestsNoValues() {
    String line = "class info --name a";
    CommandTree enabled =
        Shell.buildTree(List.of(new SampleModule()), new ModuleContext(null, true));
    CommandTree disabled =
        Shell.buildTree(List.of(new SampleModule()), new ModuleContext(null, false));

    List<String> values =
        new CompletionEngine(enabled).complete(line, line.length()).candidates().stream()
            .map(Candidate::replacement)
            .collect(Collectors.toList());
    assertEquals(List.of("acme", "acme2"), values);
    assertTrue(new CompletionEngine(disabled).complete(line, line.length()).isEmpty());
  }
}
