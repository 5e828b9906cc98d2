package io.hubuum.shell.core;

import java.io.PrintStream;
import java.util.List;

/**
 * Append-only, line-oriented output destination. Help text and other command output is written
 * through a sink that the host passes in; the core never writes to the console on its own.
 */
@FunctionalInterface
public interface LineSink {

  /** Appends one line of output. */
  void appendLine(String line);

  /** Appends every line of a multi-line block. */
  default void appendLines(String block) {
    block.lines().forEach(this::appendLine);
  }

  /** Creates a sink that writes to the given PrintStream. */
  static LineSink forPrintStream(PrintStream out) {
    return out::println;
  }

  /** Creates a sink collecting lines into the given list. */
  static LineSink collecting(List<String> lines) {
    return lines::add;
  }
}
