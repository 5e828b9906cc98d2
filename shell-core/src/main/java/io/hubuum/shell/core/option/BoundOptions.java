package io.hubuum.shell.core.option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/** Typed option values of one invocation, keyed by option name. Produced by {@link OptionBinder}. */
public final class BoundOptions {

  private final Map<String, Object> values;

  BoundOptions(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /** True if the option was supplied. */
  public boolean has(String name) {
    return values.containsKey(name);
  }

  /** True if the named flag was supplied. */
  public boolean flag(String name) {
    return Boolean.TRUE.equals(values.get(name));
  }

  /**
   * Returns the typed value of an option.
   *
   * @throws ClassCastException if the option's type does not match {@code type}
   */
  public <T> Optional<T> get(String name, Class<T> type) {
    return Optional.ofNullable(values.get(name)).map(type::cast);
  }

  public Optional<String> string(String name) {
    return get(name, String.class);
  }

  /**
   * Returns the value of an option that validation guarantees is present.
   *
   * @throws NoSuchElementException if the option was not supplied
   */
  public <T> T require(String name, Class<T> type) {
    return get(name, type)
        .orElseThrow(() -> new NoSuchElementException("Option not supplied: " + name));
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "BoundOptions" + values;
  }
}
