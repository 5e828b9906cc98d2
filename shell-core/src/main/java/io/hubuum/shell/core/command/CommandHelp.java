package io.hubuum.shell.core.command;

import io.hubuum.shell.core.option.OptionDescriptor;
import java.util.ArrayList;
import java.util.List;

/** Renders the help text of a command. */
final class CommandHelp {

  private CommandHelp() {}

  static String render(Command command, String commandName, List<String> scopePath) {
    String fqName =
        scopePath.isEmpty() ? commandName : String.join(" ", scopePath) + " " + commandName;
    List<String> lines = new ArrayList<>();

    if (command.about().isPresent()) {
      lines.add(fqName + " - " + command.about().get());
      lines.add("");
    } else {
      lines.add(fqName);
    }
    command
        .longAbout()
        .ifPresent(
            text -> {
              lines.addAll(text.lines().toList());
              lines.add("");
            });

    List<OptionDescriptor> options = command.options();
    if (!options.isEmpty()) {
      lines.add("Options:");
      int shortWidth = 0;
      int longWidth = 0;
      int typeWidth = 0;
      for (OptionDescriptor opt : options) {
        shortWidth = Math.max(shortWidth, shortColumn(opt).length());
        longWidth = Math.max(longWidth, longColumn(opt).length());
        typeWidth = Math.max(typeWidth, typeColumn(opt).length());
      }
      for (OptionDescriptor opt : options) {
        StringBuilder sb = new StringBuilder("  ");
        sb.append(pad(shortColumn(opt), shortWidth)).append(' ');
        sb.append(pad(longColumn(opt), longWidth)).append(' ');
        sb.append(pad(typeColumn(opt), typeWidth)).append(' ');
        sb.append(opt.help());
        if (opt.isFlag()) {
          sb.append(" (flag)");
        }
        lines.add(sb.toString().stripTrailing());
      }
      lines.add("");
    }

    command
        .examples()
        .ifPresent(
            text -> {
              lines.add("Examples:");
              text.lines().forEach(line -> lines.add("  " + fqName + " " + line));
            });

    return String.join("\n", lines);
  }

  private static String shortColumn(OptionDescriptor opt) {
    return opt.shortAlias().map(s -> s + ",").orElse("");
  }

  private static String longColumn(OptionDescriptor opt) {
    return opt.longAlias().map(l -> l + ",").orElse("");
  }

  private static String typeColumn(OptionDescriptor opt) {
    return "<" + opt.typeHint() + ">";
  }

  static String pad(String s, int width) {
    if (s.length() >= width) {
      return s;
    }
    return s + " ".repeat(width - s.length());
  }
}
