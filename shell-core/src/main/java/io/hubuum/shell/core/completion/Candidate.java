package io.hubuum.shell.core.completion;

/**
 * One completion suggestion.
 *
 * @param display what the user sees in the candidate list
 * @param replacement the text that replaces the current word when chosen
 */
public record Candidate(String display, String replacement) {

  /** A candidate whose display and replacement are the same text. */
  public static Candidate of(String value) {
    return new Candidate(value, value);
  }
}
