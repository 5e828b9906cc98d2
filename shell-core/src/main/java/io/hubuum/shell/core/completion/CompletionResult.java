package io.hubuum.shell.core.completion;

import java.util.List;

/**
 * Completion answer for one request.
 *
 * @param start offset in the line where the replaced word begins
 * @param candidates suggestions, possibly empty
 */
public record CompletionResult(int start, List<Candidate> candidates) {

  public CompletionResult {
    candidates = List.copyOf(candidates);
  }

  public static CompletionResult empty(int start) {
    return new CompletionResult(start, List.of());
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
