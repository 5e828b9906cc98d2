package io.hubuum.shell.core.option;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static registration table of a command's options. Every table ends with the implicit
 * {@link #HELP} option; names and aliases are unique within a table.
 *
 * <pre>{@code
 * List<OptionDescriptor> options =
 *     OptionTable.builder()
 *         .add(OptionDescriptor.builder("name").shortAlias("n").longAlias("name").build())
 *         .add(OptionDescriptor.builder("json").shortAlias("j").longAlias("json").flag().build())
 *         .build();
 * }</pre>
 */
public final class OptionTable {

  /** The {@code -h}/{@code --help} flag every command accepts. */
  public static final OptionDescriptor HELP =
      OptionDescriptor.builder("help")
          .shortAlias("h")
          .longAlias("help")
          .help("Prints help information")
          .flag()
          .build();

  private OptionTable() {}

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a table from the given descriptors, appending {@link #HELP}. */
  public static List<OptionDescriptor> of(OptionDescriptor... descriptors) {
    Builder b = builder();
    for (OptionDescriptor d : descriptors) {
      b.add(d);
    }
    return b.build();
  }

  /** Finds the descriptor whose short or long alias is exactly {@code alias}. */
  public static Optional<OptionDescriptor> findByAlias(
      List<OptionDescriptor> options, String alias) {
    return options.stream().filter(o -> o.matchesAlias(alias)).findFirst();
  }

  /** Finds the descriptor answering to a dash-stripped option key. */
  public static Optional<OptionDescriptor> findByKey(List<OptionDescriptor> options, String key) {
    return options.stream().filter(o -> o.matchesKey(key)).findFirst();
  }

  /** Builder rejecting duplicate names and aliases. */
  public static final class Builder {
    private final List<OptionDescriptor> descriptors = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final Set<String> aliases = new HashSet<>();

    private Builder() {}

    public Builder add(OptionDescriptor descriptor) {
      if (!names.add(descriptor.name())) {
        throw new IllegalArgumentException("Duplicate option name: " + descriptor.name());
      }
      descriptor.shortAlias().ifPresent(this::claimAlias);
      descriptor.longAlias().ifPresent(this::claimAlias);
      descriptors.add(descriptor);
      return this;
    }

    private void claimAlias(String alias) {
      if (!aliases.add(alias)) {
        throw new IllegalArgumentException("Duplicate option alias: " + alias);
      }
    }

    /** Returns the immutable table, with the help option last. */
    public List<OptionDescriptor> build() {
      List<OptionDescriptor> result = new ArrayList<>(descriptors);
      if (!names.contains(HELP.name())) {
        if (aliases.contains("-h") || aliases.contains("--help")) {
          throw new IllegalArgumentException("Aliases -h and --help are reserved for help");
        }
        result.add(HELP);
      }
      return List.copyOf(result);
    }
  }
}
