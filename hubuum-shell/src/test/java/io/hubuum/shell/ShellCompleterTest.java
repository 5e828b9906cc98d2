package io.hubuum.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.hubuum.shell.core.ModuleContext;
import io.hubuum.shell.core.completion.CompletionEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShellCompleterTest {

  static class SimpleParsedLine implements ParsedLine {
    private final String line;
    private final List<String> words;
    private final int wordIndex;

    SimpleParsedLine(String line) {
      this.line = line;
      List<String> w = new ArrayList<>(Arrays.asList(line.stripLeading().split("\\s+")));
      if (line.endsWith(" ")) {
        w.add("");
      }
      this.words = Collections.unmodifiableList(w);
      this.wordIndex = words.size() - 1;
    }

    @Override
    public String word() {
      return words.get(wordIndex);
    }

    @Override
    public int wordCursor() {
      return word().length();
    }

    @Override
    public int wordIndex() {
      return wordIndex;
    }

    @Override
    public List<String> words() {
      return words;
    }

    @Override
    public String line() {
      return line;
    }

    @Override
    public int cursor() {
      return line.length();
    }
  }

  ShellCompleter completer;

  @BeforeEach
  void setUp() {
    completer =
        new ShellCompleter(
            new CompletionEngine(
                Shell.buildTree(List.of(new SampleModule()), new ModuleContext(null, true))));
  }

  List<Candidate> complete(String line) {
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(null, new SimpleParsedLine(line), candidates);
    return candidates;
  }

  static List<String> values(List<Candidate> candidates) {
    List<String> out = new ArrayList<>();
    for (Candidate c : candidates) {
      out.add(c.value());
    }
    return out;
  }

  @Test
  void completesTopLevel() {
    assertEquals(List.of("class"), values(complete("cl")));
    assertEquals(List.of("help"), values(complete("he")));
  }

  @Test
  void completesOptionValues() {
    assertEquals(List.of("acme", "acme2"), values(complete("class info --name ac")));
  }

  @Test
  void optionCandidatesShowLabels() {
    List<Candidate> candidates = complete("class info --n");
    assertEquals(1, candidates.size());
    Candidate name = candidates.get(0);
    assertEquals("--name", name.value());
    assertTrue(name.displ().contains("<string>"), name.displ());
    assertTrue(name.displ().endsWith("Name of the class"), name.displ());
    assertTrue(name.complete());
  }

  List<Candidate> completeWithReaderWord(String line, String readerWord) {
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(
        null,
        new SimpleParsedLine(line) {
          @Override
          public String word() {
            return readerWord;
          }

          @Override
          public int wordCursor() {
            return readerWord.length();
          }
        },
        candidates);
    return candidates;
  }

  @Test
  void readerWordPrefixIsKeptInFrontOfReplacement() {
    assertEquals(
        List.of("x acme", "x acme2"),
        values(completeWithReaderWord("class info --name ac", "x ac")));
  }

  @Test
  void readerWordNotEndingWithCompletionWordCompletesNothing() {
    assertTrue(completeWithReaderWord("class info --name ac", "zz").isEmpty());
  }

  @Test
  void shortAliasIsReplacedByLongAlias() {
    assertEquals(List.of("--name"), values(complete("class info -n")));
  }

  @Test
  void nothingAfterFilter() {
    assertTrue(complete("class list | ac").isEmpty());
  }

  @Test
  void unterminatedQuoteCompletesNothing() {
    assertTrue(complete("class info --name \"ac").isEmpty());
  }
}
