package io.hubuum.shell;

import io.hubuum.shell.core.LineSink;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the output of one line and writes it out afterwards. Warnings and errors are always
 * written, before regular lines; regular lines pass through the line filter if one is set.
 */
public final class OutputBuffer implements LineSink {
  private static final Logger LOG = LoggerFactory.getLogger(OutputBuffer.class);

  private final List<String> lines = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> errors = new ArrayList<>();
  private Pattern filter;
  private boolean invert;

  @Override
  public void appendLine(String line) {
    lines.add(line);
  }

  public void addWarning(String message) {
    warnings.add(message);
  }

  public void addError(String message) {
    errors.add(message);
  }

  /**
   * Keeps only lines matching {@code pattern} (or, when {@code invert} is set, lines not matching
   * it) on the next flush.
   *
   * @throws java.util.regex.PatternSyntaxException if the pattern is not a valid regex
   */
  public void setFilter(String pattern, boolean invert) {
    LOG.debug("Setting filter: pattern='{}', invert={}", pattern, invert);
    this.filter = Pattern.compile(pattern);
    this.invert = invert;
  }

  public void clearFilter() {
    this.filter = null;
    this.invert = false;
  }

  /** Writes everything buffered to {@code out} and empties the buffer. The filter is kept. */
  public void flush(LineSink out) {
    LOG.debug("Flushing output buffer ({} lines)", lines.size());
    for (String warning : warnings) {
      out.appendLine("Warning: " + warning);
    }
    for (String error : errors) {
      out.appendLine("Error: " + error);
    }
    for (String line : lines) {
      if (filter == null || filter.matcher(line).find() != invert) {
        out.appendLine(line);
      }
    }
    warnings.clear();
    errors.clear();
    lines.clear();
  }
}
