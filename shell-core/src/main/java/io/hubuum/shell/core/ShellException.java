package io.hubuum.shell.core;

import java.util.List;

/**
 * Exception raised by the dispatch path (tokenizing, validation, coercion, tree walk). Carries a
 * {@link Kind} plus the context needed to render it, so the host decides how errors are shown.
 *
 * <p>The completion path never raises this exception.
 */
public class ShellException extends Exception {

  /** The category of failure. */
  public enum Kind {
    /** The line could not be split (unterminated quote, dangling escape). */
    INVALID_INPUT,
    /** An option key is malformed. */
    INVALID_OPTION,
    /** One or more required options were not supplied. */
    MISSING_OPTIONS,
    /** Both the short and long alias of an option were supplied. */
    DUPLICATE_OPTIONS,
    /** A flag option was given a value. */
    POPULATED_FLAG_OPTIONS,
    /** An option value could not be converted to the option's type. */
    PARSE_ERROR,
    /** Fetching an {@code http(s)://} option value failed. */
    HTTP_ERROR,
    /** Reading a {@code file://} option value failed. */
    IO_ERROR,
    /** The line did not resolve to a registered command. */
    COMMAND_NOT_FOUND,
    /** A command body failed unexpectedly. */
    COMMAND_FAILED
  }

  private final Kind kind;
  private final List<String> names;
  private final String value;
  private final String expectedType;

  private ShellException(
      Kind kind,
      String message,
      List<String> names,
      String value,
      String expectedType,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.names = List.copyOf(names);
    this.value = value;
    this.expectedType = expectedType;
  }

  /**
   * Creates an exception without list context.
   *
   * @param kind the failure category
   * @param message the detail message
   */
  public ShellException(Kind kind, String message) {
    this(kind, message, List.of(), null, null, null);
  }

  /**
   * Creates an exception without list context, wrapping a cause.
   *
   * @param kind the failure category
   * @param message the detail message
   * @param cause the underlying failure
   */
  public ShellException(Kind kind, String message, Throwable cause) {
    this(kind, message, List.of(), null, null, cause);
  }

  public static ShellException invalidInput(String line) {
    return new ShellException(Kind.INVALID_INPUT, "Invalid input: " + line);
  }

  public static ShellException invalidOption(String detail) {
    return new ShellException(Kind.INVALID_OPTION, "Invalid option: " + detail);
  }

  public static ShellException missingOptions(List<String> names) {
    return new ShellException(
        Kind.MISSING_OPTIONS, "Missing required options: " + names, names, null, null, null);
  }

  public static ShellException duplicateOptions(List<String> names) {
    return new ShellException(
        Kind.DUPLICATE_OPTIONS, "Duplicate options: " + names, names, null, null, null);
  }

  public static ShellException populatedFlagOptions(List<String> names) {
    return new ShellException(
        Kind.POPULATED_FLAG_OPTIONS,
        "Boolean flag options with value: " + names,
        names,
        null,
        null,
        null);
  }

  /**
   * Creates a coercion failure for one option.
   *
   * @param key the option key as typed, without dashes
   * @param value the supplied value
   * @param expectedType lowercase display name of the expected type
   * @return the exception
   */
  public static ShellException parseError(String key, String value, String expectedType) {
    return new ShellException(
        Kind.PARSE_ERROR,
        String.format(
            "Error parsing arguments: Option '%s' has value '%s' (expected type: %s)",
            key, value, expectedType),
        List.of(key),
        value,
        expectedType,
        null);
  }

  public static ShellException httpError(String url, String detail, Throwable cause) {
    return new ShellException(Kind.HTTP_ERROR, "HTTP Error: " + url + ": " + detail, cause);
  }

  public static ShellException ioError(String path, Throwable cause) {
    return new ShellException(
        Kind.IO_ERROR, "IO error: " + path + ": " + cause.getMessage(), cause);
  }

  public static ShellException commandNotFound(String what) {
    return new ShellException(Kind.COMMAND_NOT_FOUND, "Command not found: " + what);
  }

  public static ShellException commandFailed(String command, Throwable cause) {
    return new ShellException(
        Kind.COMMAND_FAILED, "Error executing command " + command + ": " + cause, cause);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Option names (or keys) the failure refers to. Empty for kinds that carry no list.
   *
   * @return immutable list of names
   */
  public List<String> names() {
    return names;
  }

  /** The offending value for {@link Kind#PARSE_ERROR}, otherwise {@code null}. */
  public String value() {
    return value;
  }

  /** The expected type display name for {@link Kind#PARSE_ERROR}, otherwise {@code null}. */
  public String expectedType() {
    return expectedType;
  }
}
