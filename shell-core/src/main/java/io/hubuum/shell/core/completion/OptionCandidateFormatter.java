package io.hubuum.shell.core.completion;

import io.hubuum.shell.core.option.OptionDescriptor;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns option descriptors into completion candidates. Labels are aligned in four columns (short
 * alias, long alias, type hint, help); the replacement is the long alias, or the short alias when
 * there is no long one.
 */
final class OptionCandidateFormatter {

  static final int DEFAULT_PADDING = 2;

  private final int padding;

  OptionCandidateFormatter(int padding) {
    this.padding = Math.max(1, padding);
  }

  List<Candidate> format(List<OptionDescriptor> options) {
    int shortWidth = 0;
    int longWidth = 0;
    int typeWidth = 0;
    for (OptionDescriptor opt : options) {
      shortWidth = Math.max(shortWidth, shortColumn(opt).length());
      longWidth = Math.max(longWidth, opt.longAlias().orElse("").length());
      typeWidth = Math.max(typeWidth, typeColumn(opt).length());
    }

    List<Candidate> result = new ArrayList<>(options.size());
    for (OptionDescriptor opt : options) {
      StringBuilder label = new StringBuilder();
      label.append(pad(shortColumn(opt), shortWidth + 1));
      label.append(pad(opt.longAlias().orElse(""), longWidth + padding));
      label.append(pad(typeColumn(opt), typeWidth + padding));
      label.append(opt.help());
      result.add(new Candidate(label.toString().stripTrailing(), opt.preferredAlias()));
    }
    return result;
  }

  private static String shortColumn(OptionDescriptor opt) {
    return opt.shortAlias().map(s -> opt.longAlias().isPresent() ? s + "," : s).orElse("");
  }

  private static String typeColumn(OptionDescriptor opt) {
    return "<" + opt.typeHint() + ">";
  }

  private static String pad(String s, int width) {
    return s.length() >= width ? s : s + " ".repeat(width - s.length());
  }
}
