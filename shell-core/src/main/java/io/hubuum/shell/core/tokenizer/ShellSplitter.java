package io.hubuum.shell.core.tokenizer;

import io.hubuum.shell.core.ShellException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * POSIX-style word splitting shared by dispatch and completion.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>Space, tab, CR and LF separate words.
 *   <li>Single quotes preserve everything up to the closing quote.
 *   <li>Inside double quotes a backslash escapes {@code $ ` " \} and newline; before any other
 *       character it is kept literally.
 *   <li>Outside quotes a backslash escapes the next character; backslash-newline is dropped.
 *   <li>{@code #} at the start of a word comments out the rest of the line.
 * </ul>
 *
 * <p>An unterminated quote or a trailing backslash makes the line unsplittable.
 */
public final class ShellSplitter {

  private ShellSplitter() {}

  /**
   * Splits a line into words.
   *
   * @throws ShellException of kind {@code INVALID_INPUT} if the line cannot be split
   */
  public static List<String> split(String line) throws ShellException {
    return trySplit(line).orElseThrow(() -> ShellException.invalidInput(line));
  }

  /** Splits a line into words, or returns empty if the line cannot be split. */
  public static Optional<List<String>> trySplit(String line) {
    List<String> words = new ArrayList<>();
    StringBuilder word = new StringBuilder();
    boolean inWord = false;
    int len = line.length();
    int pos = 0;

    while (pos < len) {
      char c = line.charAt(pos);
      if (isSeparator(c)) {
        if (inWord) {
          words.add(word.toString());
          word.setLength(0);
          inWord = false;
        }
        pos++;
      } else if (c == '#' && !inWord) {
        int eol = line.indexOf('\n', pos);
        pos = eol < 0 ? len : eol;
      } else if (c == '\\') {
        if (pos + 1 >= len) {
          return Optional.empty();
        }
        char next = line.charAt(pos + 1);
        if (next != '\n') {
          word.append(next);
          inWord = true;
        }
        pos += 2;
      } else if (c == '\'') {
        int close = line.indexOf('\'', pos + 1);
        if (close < 0) {
          return Optional.empty();
        }
        word.append(line, pos + 1, close);
        inWord = true;
        pos = close + 1;
      } else if (c == '"') {
        pos = readDoubleQuoted(line, pos + 1, word);
        if (pos < 0) {
          return Optional.empty();
        }
        inWord = true;
      } else {
        word.append(c);
        inWord = true;
        pos++;
      }
    }
    if (inWord) {
      words.add(word.toString());
    }
    return Optional.of(words);
  }

  // Returns the position after the closing quote, or -1 if the quote is never closed.
  private static int readDoubleQuoted(String line, int pos, StringBuilder word) {
    int len = line.length();
    while (pos < len) {
      char c = line.charAt(pos);
      if (c == '"') {
        return pos + 1;
      }
      if (c == '\\') {
        if (pos + 1 >= len) {
          return -1;
        }
        char next = line.charAt(pos + 1);
        switch (next) {
          case '$', '`', '"', '\\' -> word.append(next);
          case '\n' -> {}
          default -> word.append(c).append(next);
        }
        pos += 2;
      } else {
        word.append(c);
        pos++;
      }
    }
    return -1;
  }

  static boolean isSeparator(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  /**
   * Quotes a word so that {@link #split} reads it back unchanged. Words made only of safe characters
   * are returned as they are.
   */
  public static String quote(String word) {
    if (word.isEmpty()) {
      return "''";
    }
    boolean safe = true;
    for (int i = 0; i < word.length() && safe; i++) {
      safe = isSafe(word.charAt(i));
    }
    if (safe) {
      return word;
    }
    return "'" + word.replace("'", "'\\''") + "'";
  }

  /** Joins words into a line, quoting each as needed. */
  public static String join(List<String> words) {
    StringBuilder sb = new StringBuilder();
    for (String w : words) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(quote(w));
    }
    return sb.toString();
  }

  private static boolean isSafe(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || "_-.,/:@%+=".indexOf(c) >= 0;
  }
}
