package io.hubuum.shell.core.completion;

import io.hubuum.shell.core.command.CommandTree;
import java.util.List;

/**
 * Supplies candidate values for one option. Registered on a value-type option descriptor and
 * consulted only when that option's alias immediately precedes the word being completed.
 *
 * <p>Sources that do I/O must turn failures into an empty list and enforce their own time limits;
 * the completion engine neither retries nor times them out.
 */
@FunctionalInterface
public interface AutocompleteSource {

  /**
   * Suggests values for the word being typed.
   *
   * @param tree the command tree
   * @param prefix the partial value typed so far, possibly empty
   * @param words every word of the line up to the cursor, as split by the shell splitter
   * @return candidate values, never {@code null}
   */
  List<String> suggest(CommandTree tree, String prefix, List<String> words);
}
