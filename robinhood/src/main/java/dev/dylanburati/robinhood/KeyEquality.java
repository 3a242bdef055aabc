package dev.dylanburati.robinhood;

import java.util.Objects;

/** Decides whether two keys are the same key. Must be consistent with the table's {@link Hasher}. */
@FunctionalInterface
public interface KeyEquality<K> {
  boolean equal(K a, K b);

  static <K> KeyEquality<K> standard() {
    return Objects::equals;
  }
}
