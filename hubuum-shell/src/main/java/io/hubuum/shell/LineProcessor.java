package io.hubuum.shell;

import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.command.CommandDispatcher;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one submitted line into the {@link OutputBuffer}. A line of the form {@code command |
 * pattern} keeps only output lines matching the regex; {@code command | !pattern} keeps the lines
 * that do not match. Failures become warnings or errors in the buffer.
 */
final class LineProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(LineProcessor.class);

  private final CommandDispatcher dispatcher;
  private final OutputBuffer buffer;

  LineProcessor(CommandDispatcher dispatcher, OutputBuffer buffer) {
    this.dispatcher = dispatcher;
    this.buffer = buffer;
  }

  void process(String line) {
    String command = line;
    int pipe = findPipe(line);
    if (pipe >= 0) {
      command = line.substring(0, pipe).trim();
      String filter = line.substring(pipe + 1).trim();
      boolean invert = filter.startsWith("!");
      String pattern = invert ? filter.substring(1).trim() : filter;
      try {
        buffer.setFilter(pattern, invert);
      } catch (PatternSyntaxException e) {
        buffer.clearFilter();
        buffer.addError("Invalid filter '" + pattern + "': " + e.getDescription());
        return;
      }
    } else {
      buffer.clearFilter();
    }

    try {
      dispatcher.dispatch(command, buffer);
    } catch (ShellException e) {
      LOG.debug("Line failed: {}", line, e);
      if (e.getKind() == ShellException.Kind.COMMAND_NOT_FOUND) {
        buffer.addWarning(e.getMessage());
      } else {
        buffer.addError(e.getMessage());
      }
    }
  }

  /** Index of the first {@code |} outside quotes, or -1. */
  static int findPipe(String line) {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else if (c == '\\' && quote == '"') {
          i++;
        }
      } else if (c == '\\') {
        i++;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '|') {
        return i;
      }
    }
    return -1;
  }
}
