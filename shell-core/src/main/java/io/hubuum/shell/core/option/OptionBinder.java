package io.hubuum.shell.core.option;

import io.hubuum.shell.core.ShellException;
import io.hubuum.shell.core.tokenizer.ParsedTokens;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Populates typed option values from parsed tokens. Validation runs first; then each supplied value
 * is converted with its descriptor's {@link OptionType}. Flags bind to {@code true}.
 */
public final class OptionBinder {

  private OptionBinder() {}

  public static BoundOptions bind(List<OptionDescriptor> options, ParsedTokens tokens)
      throws ShellException {
    OptionValidator.validate(options, tokens);

    Map<String, String> given = tokens.getOptions();
    Map<String, Object> bound = new LinkedHashMap<>();
    for (OptionDescriptor opt : options) {
      Optional<String> key = suppliedKey(opt, given);
      if (key.isEmpty()) {
        continue;
      }
      if (opt.isFlag()) {
        bound.put(opt.name(), Boolean.TRUE);
        continue;
      }
      String raw = given.get(key.get());
      try {
        bound.put(opt.name(), opt.type().parse(raw));
      } catch (RuntimeException e) {
        throw ShellException.parseError(key.get(), raw, opt.typeHint());
      }
    }
    return new BoundOptions(bound);
  }

  private static Optional<String> suppliedKey(OptionDescriptor opt, Map<String, String> given) {
    Optional<String> shortKey = opt.shortWithoutDash().filter(given::containsKey);
    return shortKey.isPresent() ? shortKey : opt.longWithoutDashes().filter(given::containsKey);
  }
}
