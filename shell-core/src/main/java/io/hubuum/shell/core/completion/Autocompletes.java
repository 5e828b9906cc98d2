package io.hubuum.shell.core.completion;

import io.hubuum.shell.core.ModuleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reusable {@link AutocompleteSource}s and helpers for writing them. */
public final class Autocompletes {
  private static final Logger LOG = LoggerFactory.getLogger(Autocompletes.class);

  private Autocompletes() {}

  /** Suggests {@code true} and {@code false}. */
  public static AutocompleteSource bool() {
    return fixed("true", "false");
  }

  /** Suggests the given values that start with the prefix. */
  public static AutocompleteSource fixed(String... values) {
    List<String> all = List.of(values);
    return (tree, prefix, words) -> {
      List<String> result = new ArrayList<>();
      for (String v : all) {
        if (v.startsWith(prefix)) {
          result.add(v);
        }
      }
      return result;
    };
  }

  /** Suggests the constants of an enum, by name. */
  public static <E extends Enum<E>> AutocompleteSource enumValues(Class<E> type) {
    E[] constants = type.getEnumConstants();
    String[] names = new String[constants.length];
    for (int i = 0; i < constants.length; i++) {
      names[i] = constants[i].name();
    }
    return fixed(names);
  }

  /**
   * Returns the word following the first occurrence of any of {@code aliases} in {@code words}.
   * Lets a source narrow its suggestions by an option typed earlier on the line, e.g. objects of
   * the class given with {@code --class}.
   */
  public static Optional<String> valueAfter(List<String> words, String... aliases) {
    List<String> keys = List.of(aliases);
    for (int i = 0; i + 1 < words.size(); i++) {
      if (keys.contains(words.get(i))) {
        return Optional.of(words.get(i + 1));
      }
    }
    return Optional.empty();
  }

  /** Lookup keyed by the value of an earlier option. */
  @FunctionalInterface
  public interface DependentLookup {
    List<String> find(String dependency, String prefix);
  }

  /**
   * Source that only suggests once another option has a value: {@code lookup} receives that value
   * and the prefix. Nothing is suggested while the other option is missing.
   */
  public static AutocompleteSource dependentOn(DependentLookup lookup, String... aliases) {
    return (tree, prefix, words) ->
        valueAfter(words, aliases)
            .map(dependency -> lookup.find(dependency, prefix))
            .orElse(List.of());
  }

  /**
   * Wraps a source that talks to the server. The wrapper suggests nothing when the host disabled
   * remote completion, and turns failures into an empty list with a warning.
   */
  public static AutocompleteSource remote(ModuleContext context, AutocompleteSource source) {
    if (!context.remoteCompletion()) {
      return (tree, prefix, words) -> List.of();
    }
    return (tree, prefix, words) -> {
      try {
        List<String> values = source.suggest(tree, prefix, words);
        return values == null ? List.of() : values;
      } catch (RuntimeException e) {
        LOG.warn("Remote autocomplete failed: {}", e.getMessage());
        return List.of();
      }
    };
  }
}
