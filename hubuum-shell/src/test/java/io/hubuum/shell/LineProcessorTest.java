package io.hubuum.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.ModuleContext;
import io.hubuum.shell.core.command.CommandDispatcher;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.tokenizer.CommandTokenizer;
import io.hubuum.shell.core.tokenizer.ValueResolver;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LineProcessorTest {

  OutputBuffer buffer;
  LineProcessor processor;

  @BeforeEach
  void setUp() {
    CommandTree tree = Shell.buildTree(List.of(new SampleModule()), new ModuleContext(null, true));
    buffer = new OutputBuffer();
    processor =
        new LineProcessor(
            new CommandDispatcher(tree, new CommandTokenizer(ValueResolver.identity()), null),
            buffer);
  }

  List<String> run(String line) {
    processor.process(line);
    List<String> out = new ArrayList<>();
    buffer.flush(LineSink.collecting(out));
    return out;
  }

  @Test
  void runsCommand() {
    assertEquals(List.of("acme", "acme2", "hosts"), run("class list"));
  }

  @Test
  void filterKeepsMatchingLines() {
    assertEquals(List.of("acme", "acme2"), run("class list | acme"));
    assertEquals(List.of("hosts"), run("class list | !acme"));
    assertEquals(List.of("acme2"), run("class list |2$"));
  }

  @Test
  void filterIsClearedByNextLine() {
    run("class list | hosts");
    assertEquals(List.of("acme", "acme2", "hosts"), run("class list"));
  }

  @Test
  void quotedPipeIsNotAFilter() {
    assertEquals(List.of("Name: a|b"), run("class info --name 'a|b'"));
  }

  @Test
  void invalidFilterIsAnError() {
    List<String> out = run("class list | [");
    assertEquals(1, out.size());
    assertTrue(out.get(0).startsWith("Error: Invalid filter '['"), out.get(0));
  }

  @Test
  void scopeWithoutCommandWarns() {
    assertEquals(List.of("Warning: Command not found: class"), run("class"));
  }

  @Test
  void validationFailureIsError() {
    assertEquals(List.of("Error: Missing required options: [name]"), run("class info"));
  }

  @Test
  void findPipeSkipsQuotes() {
    assertEquals(-1, LineProcessor.findPipe("a '|' b"));
    assertEquals(-1, LineProcessor.findPipe("a \\| b"));
    assertEquals(10, LineProcessor.findPipe("a \"x\\\"|y\" | z"));
  }
}
