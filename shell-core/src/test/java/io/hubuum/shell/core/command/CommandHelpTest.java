package io.hubuum.shell.core.command;

import static org.junit.jupiter.api.Assertions.*;

import io.hubuum.shell.core.LineSink;
import io.hubuum.shell.core.SampleCommands;
import io.hubuum.shell.core.SampleCommands.RecordingCommand;
import io.hubuum.shell.core.option.OptionDescriptor;
import io.hubuum.shell.core.option.OptionTable;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandHelpTest {

  @Test
  void rendersHeadlineOptionsAndExamples() {
    List<String> lines = new ArrayList<>();
    SampleCommands.info().help("info", List.of("class"), LineSink.collecting(lines));
    assertEquals(
        List.of(
            "class info - Show class details",
            "",
            "Options:",
            "  -n, --name, <string> Name of the class",
            "  -j, --json, <bool>   Output as JSON (flag)",
            "  -h, --help, <bool>   Prints help information (flag)",
            "",
            "Examples:",
            "  class info -n acme",
            "  class info --name acme --json"),
        lines);
  }

  @Test
  void missingAliasLeavesColumnEmpty() {
    RecordingCommand cmd =
        new RecordingCommand(
            "status",
            OptionTable.of(
                OptionDescriptor.builder("verbose").longAlias("verbose").flag().help("More").build()));
    List<String> lines = new ArrayList<>();
    cmd.help("status", List.of(), LineSink.collecting(lines));
    assertEquals("status", lines.get(0));
    assertEquals("Options:", lines.get(1));
    assertEquals("      --verbose, <bool> More (flag)", lines.get(2));
  }
}
