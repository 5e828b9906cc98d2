package io.hubuum.shell.core.option;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Semantic type of an option value: a lowercase display name (shown as the type hint in help and
 * completion) and a parser from the raw string.
 *
 * <p>Parsers signal bad input by throwing any {@link RuntimeException}; the binder turns that into
 * a parse error naming the option, the value and {@link #displayName()}.
 *
 * @param <T> the parsed value type
 */
public final class OptionType<T> {

  private static final Gson GSON = new Gson();

  public static final OptionType<String> STRING = new OptionType<>("string", v -> v, false);
  public static final OptionType<Integer> INT = new OptionType<>("int", Integer::valueOf, false);
  public static final OptionType<Long> LONG = new OptionType<>("long", Long::valueOf, false);
  public static final OptionType<Double> DOUBLE =
      new OptionType<>("double", Double::valueOf, false);
  public static final OptionType<Boolean> BOOL =
      new OptionType<>("bool", OptionType::parseBool, false);
  public static final OptionType<JsonElement> JSON =
      new OptionType<>("json", OptionType::parseJson, false);

  private final String displayName;
  private final Function<String, T> parser;
  private final boolean optional;

  private OptionType(String displayName, Function<String, T> parser, boolean optional) {
    this.displayName = displayName;
    this.parser = parser;
    this.optional = optional;
  }

  /**
   * Defines a custom type.
   *
   * @param displayName name shown as the type hint, lowercased
   * @param parser converts the raw value, throwing a runtime exception on bad input
   */
  public static <T> OptionType<T> of(String displayName, Function<String, T> parser) {
    Objects.requireNonNull(parser, "parser");
    return new OptionType<>(displayName.toLowerCase(Locale.ROOT), parser, false);
  }

  /**
   * Wraps a type as optional. Descriptors of an optional type are not required unless the
   * descriptor says otherwise.
   */
  public static <T> OptionType<T> optional(OptionType<T> inner) {
    if (inner.optional) {
      return inner;
    }
    return new OptionType<>("option<" + inner.displayName + ">", inner.parser, true);
  }

  public String displayName() {
    return displayName;
  }

  public boolean isOptional() {
    return optional;
  }

  /**
   * Parses a raw option value.
   *
   * @throws RuntimeException if the value is not valid for this type
   */
  public T parse(String raw) {
    return parser.apply(raw);
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static Boolean parseBool(String raw) {
    if ("true".equalsIgnoreCase(raw)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(raw)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("not a boolean: " + raw);
  }

  private static JsonElement parseJson(String raw) {
    try (JsonReader reader = new JsonReader(new StringReader(raw))) {
      reader.setStrictness(Strictness.STRICT);
      JsonElement element = GSON.getAdapter(JsonElement.class).read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new IllegalArgumentException("trailing data after JSON value");
      }
      return element;
    } catch (IOException e) {
      throw new IllegalArgumentException("not valid JSON: " + e.getMessage(), e);
    }
  }
}
