package io.hubuum.shell.core.option;

import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks run on parsed tokens before a command body executes.
 *
 * <p>{@link #validate} runs the checks in a fixed order and fails with the first failing check's
 * complete list: missing required options, then options given by both aliases, then flags given a
 * value.
 */
public final class OptionValidator {
  private static final Logger LOG = LoggerFactory.getLogger(OptionValidator.class);

  private OptionValidator() {}

  public static void validate(List<OptionDescriptor> options, ParsedTokens tokens)
      throws ShellException {
    checkMissing(options, tokens);
    checkDuplicates(options, tokens);
    checkPopulatedFlags(options, tokens);
  }

  /** Fails with every required option for which neither alias was supplied. */
  public static void checkMissing(List<OptionDescriptor> options, ParsedTokens tokens)
      throws ShellException {
    Map<String, String> given = tokens.getOptions();
    List<String> missing = new ArrayList<>();
    for (OptionDescriptor opt : options) {
      if (!opt.isRequired()) {
        continue;
      }
      if (isPresent(opt.shortWithoutDash(), given) || isPresent(opt.longWithoutDashes(), given)) {
        continue;
      }
      LOG.trace("Required option not found: {}", opt.name());
      missing.add(opt.name());
    }
    if (!missing.isEmpty()) {
      throw ShellException.missingOptions(missing);
    }
  }

  /** Fails with every option supplied under both its short and its long alias. */
  public static void checkDuplicates(List<OptionDescriptor> options, ParsedTokens tokens)
      throws ShellException {
    Map<String, String> given = tokens.getOptions();
    List<String> duplicates = new ArrayList<>();
    for (OptionDescriptor opt : options) {
      if (isPresent(opt.shortWithoutDash(), given) && isPresent(opt.longWithoutDashes(), given)) {
        duplicates.add(opt.name());
      }
    }
    if (!duplicates.isEmpty()) {
      throw ShellException.duplicateOptions(duplicates);
    }
  }

  /**
   * Fails with every flag key that carries a value. The tokenizer records a bare flag as a key with
   * an empty value, so anything else means the user passed one.
   */
  public static void checkPopulatedFlags(List<OptionDescriptor> options, ParsedTokens tokens)
      throws ShellException {
    Map<String, String> given = tokens.getOptions();
    List<String> populated = new ArrayList<>();
    for (OptionDescriptor opt : options) {
      if (!opt.isFlag()) {
        continue;
      }
      for (Optional<String> key : List.of(opt.shortWithoutDash(), opt.longWithoutDashes())) {
        if (key.isPresent()) {
          String value = given.get(key.get());
          if (value != null && !value.isEmpty()) {
            populated.add(key.get());
          }
        }
      }
    }
    if (!populated.isEmpty()) {
      throw ShellException.populatedFlagOptions(populated);
    }
  }

  private static boolean isPresent(Optional<String> key, Map<String, String> given) {
    return key.isPresent() && given.containsKey(key.get());
  }
}
