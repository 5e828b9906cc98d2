package io.hubuum.shell.core.completion;

import io.hubuum.shell.core.command.Command;
import io.hubuum.shell.core.command.CommandPath;
import io.hubuum.shell.core.command.CommandTree;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import io.hubuum.shell.core.tokenizer.ShellSplitter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context-aware tab completion over a {@link CommandTree}.
 *
 * <p>Before a command is resolved, candidates are the child commands and scopes of the deepest
 * scope reached. After it, candidates are the command's options not yet given, or the values an
 * option's {@link AutocompleteSource} suggests when that option's alias precedes the cursor.
 *
 * <p>Completion never fails: unsplittable input, unknown words and failing autocomplete sources
 * all end in an empty or partial candidate list.
 */
public final class CompletionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(CompletionEngine.class);

  private final CommandTree tree;
  private final OptionCandidateFormatter formatter;

  public CompletionEngine(CommandTree tree) {
    this(tree, OptionCandidateFormatter.DEFAULT_PADDING);
  }

  /**
   * @param tree the command tree
   * @param padding spaces between the columns of option candidate labels
   */
  public CompletionEngine(CommandTree tree, int padding) {
    this.tree = tree;
    this.formatter = new OptionCandidateFormatter(padding);
  }

  /**
   * Computes candidates for the word ending at {@code cursor}.
   *
   * @param line the full line buffer
   * @param cursor cursor position as a char index into {@code line}
   * @return the offset where the current word starts and the candidates replacing it
   */
  public CompletionResult complete(String line, int cursor) {
    int pos = Math.max(0, Math.min(cursor, line.length()));
    String head = line.substring(0, pos);
    int start = wordStart(head);
    String word = head.substring(start);

    if (ShellSplitter.trySplit(head).isEmpty()) {
      LOG.trace("Unsplittable input, no completion: {}", head);
      return CompletionResult.empty(pos);
    }
    Optional<List<String>> before = ShellSplitter.trySplit(head.substring(0, start));
    if (before.isEmpty()) {
      return CompletionResult.empty(pos);
    }

    try {
      return new CompletionResult(start, candidates(before.get(), word, head));
    } catch (RuntimeException e) {
      LOG.warn("Completion failed for '{}'", head, e);
      return CompletionResult.empty(start);
    }
  }

  private List<Candidate> candidates(List<String> done, String word, String head) {
    CommandPath path = tree.resolve(done);
    if (!path.isResolved()) {
      List<Candidate> result = new ArrayList<>();
      for (String name : path.scope().completions(word)) {
        result.add(Candidate.of(name));
      }
      return result;
    }

    Command command = path.command();
    List<OptionDescriptor> options = command.options();
    List<String> afterCommand = done.subList(path.consumed(), done.size());
    List<OptionDescriptor> unseen = unseen(options, afterCommand);

    if (word.startsWith("-") || afterCommand.isEmpty()) {
      return formatter.format(matching(unseen, word));
    }
    String previous = afterCommand.get(afterCommand.size() - 1);
    Optional<OptionDescriptor> previousOption = OptionTable.findByAlias(options, previous);
    if (previousOption.isEmpty() || previousOption.get().isFlag()) {
      return formatter.format(matching(unseen, word));
    }

    Optional<AutocompleteSource> source = previousOption.get().autocomplete();
    if (source.isEmpty()) {
      return List.of();
    }
    List<String> words = ShellSplitter.trySplit(head).orElse(done);
    List<String> values = suggest(source.get(), previousOption.get(), word, words);
    if (!word.isEmpty() && values.contains(word)) {
      return formatter.format(matching(unseen, word));
    }
    List<Candidate> result = new ArrayList<>();
    for (String value : values) {
      if (value.startsWith(word)) {
        result.add(Candidate.of(value));
      }
    }
    return result;
  }

  private List<String> suggest(
      AutocompleteSource source, OptionDescriptor option, String word, List<String> words) {
    try {
      List<String> values = source.suggest(tree, word, words);
      return values == null ? List.of() : values;
    } catch (RuntimeException e) {
      LOG.warn("Autocomplete for option '{}' failed: {}", option.name(), e.toString());
      LOG.debug("Autocomplete failure", e);
      return List.of();
    }
  }

  private static List<OptionDescriptor> unseen(
      List<OptionDescriptor> options, List<String> afterCommand) {
    Set<String> seen = new HashSet<>(afterCommand);
    List<OptionDescriptor> result = new ArrayList<>();
    for (OptionDescriptor opt : options) {
      boolean given =
          opt.shortAlias().map(seen::contains).orElse(false)
              || opt.longAlias().map(seen::contains).orElse(false);
      if (!given) {
        result.add(opt);
      }
    }
    return result;
  }

  private static List<OptionDescriptor> matching(List<OptionDescriptor> options, String word) {
    List<OptionDescriptor> result = new ArrayList<>();
    for (OptionDescriptor opt : options) {
      if (opt.shortAlias().map(s -> s.startsWith(word)).orElse(false)
          || opt.longAlias().map(l -> l.startsWith(word)).orElse(false)) {
        result.add(opt);
      }
    }
    return result;
  }

  private static int wordStart(String head) {
    for (int i = head.length() - 1; i >= 0; i--) {
      char c = head.charAt(i);
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        return i + 1;
      }
    }
    return 0;
  }
}
