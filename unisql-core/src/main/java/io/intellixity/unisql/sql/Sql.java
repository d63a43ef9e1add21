package io.intellixity.unisql.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameter-carrying SQL value.
 * <p>
 * Holds {@code n + 1} text fragments around {@code n} values. A {@code Sql} passed as a value is
 * spliced in: its fragments join the surrounding text and its values join the parameter list, so
 * fragments compose without ever concatenating user values into SQL text.
 * <p>
 * Rendering is purely lexical (one placeholder per value) and memoised per {@link PlaceholderStyle}.
 */
public final class Sql {
  private static final Sql EMPTY = new Sql(List.of(""), List.of());

  private final List<String> strings;
  private final List<Object> values;
  private final String[] rendered = new String[PlaceholderStyle.values().length];

  private Sql(List<String> rawStrings, List<?> rawValues) {
    Objects.requireNonNull(rawStrings, "strings");
    Objects.requireNonNull(rawValues, "values");
    if (rawStrings.isEmpty()) throw new IllegalArgumentException("Expected at least 1 string");
    if (rawStrings.size() - 1 != rawValues.size()) {
      throw new IllegalArgumentException("Expected " + rawStrings.size() + " strings to have "
          + (rawStrings.size() - 1) + " values, got " + rawValues.size());
    }

    List<String> outStrings = new ArrayList<>(rawStrings.size());
    List<Object> outValues = new ArrayList<>(rawValues.size());
    StringBuilder current = new StringBuilder(Objects.requireNonNull(rawStrings.get(0), "strings[0]"));

    for (int i = 0; i < rawValues.size(); i++) {
      Object child = rawValues.get(i);
      String following = Objects.requireNonNull(rawStrings.get(i + 1), "strings[" + (i + 1) + "]");
      if (child instanceof Sql nested) {
        current.append(nested.strings.get(0));
        for (int c = 0; c < nested.values.size(); c++) {
          outStrings.add(current.toString());
          outValues.add(nested.values.get(c));
          current = new StringBuilder(nested.strings.get(c + 1));
        }
        current.append(following);
      } else {
        outStrings.add(current.toString());
        outValues.add(child);
        current = new StringBuilder(following);
      }
    }
    outStrings.add(current.toString());

    this.strings = Collections.unmodifiableList(outStrings);
    this.values = Collections.unmodifiableList(outValues);
  }

  /** Fragments around values; {@code strings.size()} must be {@code values.size() + 1}. */
  public static Sql of(List<String> strings, List<?> values) {
    return new Sql(strings, values);
  }

  /** Text with no parameters. Never pass user input here. */
  public static Sql raw(String text) {
    return new Sql(List.of(Objects.requireNonNull(text, "text")), List.of());
  }

  /** A single placeholder bound to {@code value}. */
  public static Sql param(Object value) {
    return new Sql(List.of("", ""), Collections.singletonList(value));
  }

  public static Sql empty() { return EMPTY; }

  public static Sql join(List<Sql> parts, String separator) {
    return join(parts, separator, "", "");
  }

  public static Sql join(List<Sql> parts, String separator, String prefix, String suffix) {
    Objects.requireNonNull(parts, "parts");
    String sep = (separator == null) ? "," : separator;
    String pre = (prefix == null) ? "" : prefix;
    String suf = (suffix == null) ? "" : suffix;
    if (parts.isEmpty()) return raw(pre + suf);

    List<String> s = new ArrayList<>(parts.size() + 1);
    s.add(pre);
    for (int i = 1; i < parts.size(); i++) s.add(sep);
    s.add(suf);
    return new Sql(s, parts);
  }

  public static Builder builder() { return new Builder(); }

  public List<String> strings() { return strings; }

  public List<Object> values() { return values; }

  public boolean isEmpty() {
    return values.isEmpty() && strings.get(0).isEmpty();
  }

  /** Renders the statement text; cached per style. */
  public String toStatement(PlaceholderStyle style) {
    Objects.requireNonNull(style, "style");
    String cached = rendered[style.ordinal()];
    if (cached != null) return cached;

    String out;
    if (strings.size() == 1) {
      out = strings.get(0);
    } else {
      StringBuilder sb = new StringBuilder(strings.get(0));
      for (int i = 1; i < strings.size(); i++) {
        sb.append(style.placeholder(i)).append(strings.get(i));
      }
      out = sb.toString();
    }
    rendered[style.ordinal()] = out;
    return out;
  }

  @Override
  public String toString() {
    return toStatement(PlaceholderStyle.QUESTION);
  }

  /** Fluent alternative to building fragment/value lists by hand. */
  public static final class Builder {
    private final List<String> strings = new ArrayList<>();
    private final List<Object> values = new ArrayList<>();
    private StringBuilder current = new StringBuilder();

    private Builder() {}

    public Builder append(String text) {
      current.append(Objects.requireNonNull(text, "text"));
      return this;
    }

    public Builder append(Sql fragment) {
      Objects.requireNonNull(fragment, "fragment");
      current.append(fragment.strings.get(0));
      for (int i = 0; i < fragment.values.size(); i++) {
        strings.add(current.toString());
        values.add(fragment.values.get(i));
        current = new StringBuilder(fragment.strings.get(i + 1));
      }
      return this;
    }

    public Builder param(Object value) {
      if (value instanceof Sql nested) return append(nested);
      strings.add(current.toString());
      values.add(value);
      current = new StringBuilder();
      return this;
    }

    public Builder params(Object... vs) {
      List<Object> list = (vs == null) ? List.of() : Arrays.asList(vs);
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) append(", ");
        param(list.get(i));
      }
      return this;
    }

    public Sql build() {
      List<String> s = new ArrayList<>(strings);
      s.add(current.toString());
      return new Sql(s, values);
    }
  }
}
