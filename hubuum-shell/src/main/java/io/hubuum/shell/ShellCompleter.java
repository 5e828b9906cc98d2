package io.hubuum.shell;

import io.hubuum.shell.core.completion.CompletionEngine;
import io.hubuum.shell.core.completion.CompletionResult;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JLine adapter for the {@link CompletionEngine}. Works on the raw line buffer, so quoting follows
 * the shell's own splitting rules. Nothing is completed after an output filter ({@code |}).
 *
 * <p>JLine replaces the word its own parser found, not the engine's {@code [start, cursor)} range.
 * Candidates are therefore offered only when JLine's word ends with the engine's word, and any
 * part of JLine's word before that is kept in front of each replacement. JLine still filters the
 * candidates against the typed word, so a short alias such as {@code -n} only expands to {@code
 * --name} while the reader's typo matching is enabled, which is its default.
 */
public final class ShellCompleter implements Completer {
  private static final Logger LOG = LoggerFactory.getLogger(ShellCompleter.class);

  private final CompletionEngine engine;

  public ShellCompleter(CompletionEngine engine) {
    this.engine = engine;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String buffer = line.line();
    int cursor = Math.min(line.cursor(), buffer.length());
    if (LineProcessor.findPipe(buffer.substring(0, cursor)) >= 0) {
      return;
    }

    CompletionResult result = engine.complete(buffer, cursor);
    if (result.isEmpty()) {
      return;
    }
    String word = buffer.substring(result.start(), cursor);
    String typed = line.word().substring(0, Math.min(line.wordCursor(), line.word().length()));
    if (!typed.endsWith(word)) {
      LOG.debug("Reader word '{}' does not end with completion word '{}'", typed, word);
      return;
    }
    String lead = typed.substring(0, typed.length() - word.length());
    for (io.hubuum.shell.core.completion.Candidate c : result.candidates()) {
      candidates.add(
          new Candidate(lead + c.replacement(), c.display(), null, null, null, null, true));
    }
  }
}
