package io.hubuum.shell.core.tokenizer;

import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a submitted line, whose scope path and command the caller has already resolved against
 * the command tree, into {@link ParsedTokens}.
 *
 * <p>The leading words are the resolved scope path and command name and are taken as given. After
 * the command, a key-shaped word ({@code -x} or {@code --xx}) names an option. A key of a value
 * option always takes the next word as its value, whatever its shape, so {@code --description
 * '-x marks the spot'} works. A key of a flag, or a key the command does not know, takes the next
 * word only if it is not key-shaped itself; otherwise the value is empty. A dash followed by a
 * digit ({@code -5}) is a value, not a key. Every other word is positional.
 *
 * <p>Option values go through the {@link ValueResolver} once, as they are stored. Positionals are
 * never substituted.
 */
public final class CommandTokenizer {
  private static final Logger LOG = LoggerFactory.getLogger(CommandTokenizer.class);

  private final ValueResolver resolver;

  public CommandTokenizer(ValueResolver resolver) {
    this.resolver = resolver;
  }

  /**
   * Tokenizes a line.
   *
   * @param line the raw input line
   * @param scopePath scopes the tree walk descended into, outermost first
   * @param commandName name of the command the line resolved to
   * @param options descriptors of that command, used to tell flags from value options
   * @return the parsed tokens
   * @throws ShellException {@code INVALID_INPUT} if the line cannot be split, {@code
   *     INVALID_OPTION} for a malformed key, {@code HTTP_ERROR}/{@code IO_ERROR} if a value
   *     substitution fails
   * @throws IllegalArgumentException if the line does not start with the scope path and command
   */
  public ParsedTokens tokenize(
      String line, List<String> scopePath, String commandName, List<OptionDescriptor> options)
      throws ShellException {
    List<String> words = ShellSplitter.split(line);
    LOG.trace("Tokenizing {} for {} {}", words, scopePath, commandName);

    int consumed = scopePath.size() + 1;
    if (words.size() < consumed
        || !words.subList(0, scopePath.size()).equals(scopePath)
        || !words.get(scopePath.size()).equals(commandName)) {
      throw new IllegalArgumentException(
          "Line '" + line + "' does not start with " + scopePath + " " + commandName);
    }

    Map<String, String> values = new LinkedHashMap<>();
    List<String> positionals = new ArrayList<>();
    int i = consumed;
    while (i < words.size()) {
      String word = words.get(i);
      if (isKeyShaped(word)) {
        String key = stripDashes(word);
        String value = "";
        if (i + 1 < words.size() && takesValue(options, key, words.get(i + 1))) {
          value = words.get(i + 1);
          i++;
        }
        values.put(key, resolver.resolve(value));
      } else {
        positionals.add(word);
      }
      i++;
    }

    return new ParsedTokens(scopePath, commandName, values, positionals);
  }

  private static boolean takesValue(List<OptionDescriptor> options, String key, String next) {
    boolean valueOption = OptionTable.findByKey(options, key).map(o -> !o.isFlag()).orElse(false);
    return valueOption || !isKeyShaped(next);
  }

  /** True if {@code word} looks like an option key rather than a value. */
  public static boolean isKeyShaped(String word) {
    return word.startsWith("-") && !(word.length() > 1 && Character.isDigit(word.charAt(1)));
  }

  private static String stripDashes(String word) throws ShellException {
    String key = word.startsWith("--") ? word.substring(2) : word.substring(1);
    if (key.isEmpty() || key.startsWith("-")) {
      throw ShellException.invalidOption(word);
    }
    return key;
  }
}
