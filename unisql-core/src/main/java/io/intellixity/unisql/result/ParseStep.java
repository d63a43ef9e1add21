package io.intellixity.unisql.result;

/** Continuation handed to a {@link ResultParser} hook: the rest of the chain. */
@FunctionalInterface
public interface ParseStep<K> {
  Object apply(Object value, K key);

  static <K> ParseStep<K> identity() {
    return (value, key) -> value;
  }
}
