package io.hubuum.shell.core.option;

import io.hubuum.shell.core.completion.AutocompleteSource;
import java.util.Objects;
import java.util.Optional;

/**
 * Static metadata for one option of a command: its aliases, help text, whether it is required,
 * whether it is a flag, its value type and an optional autocomplete source.
 *
 * <p>Aliases are kept with their dashes ({@code -n}, {@code --name}); the tokenizer stores option
 * keys without them, see {@link #shortWithoutDash()} and {@link #longWithoutDashes()}.
 *
 * <p>Instances are immutable and built once per command.
 */
public final class OptionDescriptor {

  private final String name;
  private final String shortAlias;
  private final String longAlias;
  private final String help;
  private final boolean required;
  private final boolean flag;
  private final OptionType<?> type;
  private final AutocompleteSource autocomplete;

  private OptionDescriptor(Builder b) {
    this.name = b.name;
    this.shortAlias = b.shortAlias;
    this.longAlias = b.longAlias;
    this.help = b.help;
    this.flag = b.flag;
    this.type = b.flag ? OptionType.BOOL : b.type;
    this.required = b.required != null ? b.required : !(b.flag || b.type.isOptional());
    this.autocomplete = b.autocomplete;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public Optional<String> shortAlias() {
    return Optional.ofNullable(shortAlias);
  }

  public Optional<String> longAlias() {
    return Optional.ofNullable(longAlias);
  }

  /** Short alias as it appears as an option key, e.g. {@code n} for {@code -n}. */
  public Optional<String> shortWithoutDash() {
    return shortAlias().map(s -> s.substring(1));
  }

  /** Long alias as it appears as an option key, e.g. {@code name} for {@code --name}. */
  public Optional<String> longWithoutDashes() {
    return longAlias().map(l -> l.substring(2));
  }

  public String help() {
    return help;
  }

  public boolean isRequired() {
    return required;
  }

  public boolean isFlag() {
    return flag;
  }

  public OptionType<?> type() {
    return type;
  }

  /** Lowercase type name shown in help and completion. */
  public String typeHint() {
    return type.displayName();
  }

  public Optional<AutocompleteSource> autocomplete() {
    return Optional.ofNullable(autocomplete);
  }

  /** True if {@code word} is exactly this option's short or long alias, dashes included. */
  public boolean matchesAlias(String word) {
    return word.equals(shortAlias) || word.equals(longAlias);
  }

  /** True if {@code key} is this option's short or long alias with the dashes stripped. */
  public boolean matchesKey(String key) {
    return shortWithoutDash().map(key::equals).orElse(false)
        || longWithoutDashes().map(key::equals).orElse(false);
  }

  /** Alias inserted by completion: the long alias, or the short one if there is no long alias. */
  public String preferredAlias() {
    return longAlias != null ? longAlias : shortAlias;
  }

  @Override
  public String toString() {
    return "OptionDescriptor{" + name + ", " + shortAlias + ", " + longAlias + ", " + type + "}";
  }

  /** Builder for {@link OptionDescriptor}. */
  public static final class Builder {
    private final String name;
    private String shortAlias;
    private String longAlias;
    private String help = "";
    private Boolean required;
    private boolean flag;
    private OptionType<?> type = OptionType.STRING;
    private AutocompleteSource autocomplete;

    private Builder(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Option name must not be blank");
      }
      this.name = name;
    }

    /** Short alias, with or without the leading dash ({@code "n"} or {@code "-n"}). */
    public Builder shortAlias(String alias) {
      String bare = alias.startsWith("-") ? alias.substring(1) : alias;
      if (bare.isEmpty() || bare.startsWith("-") || Character.isDigit(bare.charAt(0))) {
        throw new IllegalArgumentException("Invalid short alias for " + name + ": " + alias);
      }
      this.shortAlias = "-" + bare;
      return this;
    }

    /** Long alias, with or without the leading dashes ({@code "name"} or {@code "--name"}). */
    public Builder longAlias(String alias) {
      String bare = alias.startsWith("--") ? alias.substring(2) : alias;
      if (bare.isEmpty() || bare.startsWith("-") || Character.isDigit(bare.charAt(0))) {
        throw new IllegalArgumentException("Invalid long alias for " + name + ": " + alias);
      }
      this.longAlias = "--" + bare;
      return this;
    }

    public Builder help(String help) {
      this.help = Objects.requireNonNull(help, "help");
      return this;
    }

    /** Overrides the required default (required unless the type is optional or this is a flag). */
    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    /** Marks this option as a flag: present or absent, never given a value. Flags are bools. */
    public Builder flag() {
      this.flag = true;
      return this;
    }

    public Builder type(OptionType<?> type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    public Builder autocomplete(AutocompleteSource autocomplete) {
      this.autocomplete = autocomplete;
      return this;
    }

    public OptionDescriptor build() {
      if (shortAlias == null && longAlias == null) {
        throw new IllegalArgumentException("Option " + name + " needs a short or long alias");
      }
      return new OptionDescriptor(this);
    }
  }
}
