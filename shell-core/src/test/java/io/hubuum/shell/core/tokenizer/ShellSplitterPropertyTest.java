package io.hubuum.shell.core.tokenizer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.PropertyDefaults;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

/** Quoting words and splitting the joined line gives the words back. */
@PropertyDefaults(tries = 500)
class ShellSplitterPropertyTest {

  @Property
  void joinThenSplitIsIdentity(@ForAll @Size(max = 8) List<@StringLength(max = 16) String> words)
      throws Exception {
    assertEquals(words, ShellSplitter.split(ShellSplitter.join(words)));
  }

  @Property
  void quotedWordIsOneWord(@ForAll @StringLength(max = 24) String word) throws Exception {
    assertEquals(List.of(word), ShellSplitter.split(ShellSplitter.quote(word)));
  }
}
