package io.hubuum.shell.core.tokenizer;

import io.hubuum.shell.core.ShellException;

/**
 * Substitutes option values that point at remote or local content. Implementations return values
 * without a recognised prefix unchanged.
 */
@FunctionalInterface
public interface ValueResolver {

  /**
   * Resolves one option value.
   *
   * @param value the value as typed
   * @return the substituted value
   * @throws ShellException of kind {@code HTTP_ERROR} or {@code IO_ERROR} if fetching fails
   */
  String resolve(String value) throws ShellException;

  /** A resolver that never substitutes. */
  static ValueResolver identity() {
    return value -> value;
  }
}
