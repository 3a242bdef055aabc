package dev.dylanburati.robinhood;

/**
 * Computes hashes for insertion to robin hood tables. The rules of {@link Object#hashCode}
 * also apply here. The result is treated as an unsigned 64-bit value.
 */
@FunctionalInterface
public interface Hasher<K> {
  long hash(K key);

  static <K> Hasher<K> standard() {
    return DefaultHasher.instance();
  }
}
