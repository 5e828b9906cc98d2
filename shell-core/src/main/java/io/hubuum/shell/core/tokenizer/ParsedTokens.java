package io.hubuum.shell.core.tokenizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured form of one submitted line: the scope path, the command name, the option values keyed
 * by dash-stripped alias, and the positional words in order.
 *
 * @param scopePath scopes leading to the command, outermost first
 * @param commandName the resolved command
 * @param options option key (alias without dashes) to value; flags map to an empty string
 * @param positionals words that are neither keys nor option values
 */
public record ParsedTokens(
    List<String> scopePath,
    String commandName,
    Map<String, String> options,
    List<String> positionals) {

  public ParsedTokens {
    scopePath = List.copyOf(scopePath);
    options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    positionals = List.copyOf(positionals);
  }

  /** Dash-stripped option key to value. */
  public Map<String, String> getOptions() {
    return options;
  }

  public List<String> getPositionals() {
    return positionals;
  }

  /** Value of the first of {@code keys} that was supplied. */
  public Optional<String> option(String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  /** True if any of {@code keys} was supplied. */
  public boolean hasOption(String... keys) {
    return option(keys).isPresent();
  }

  public Optional<String> positional(int index) {
    return index >= 0 && index < positionals.size()
        ? Optional.of(positionals.get(index))
        : Optional.empty();
  }
}
