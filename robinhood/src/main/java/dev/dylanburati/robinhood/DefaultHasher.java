package dev.dylanburati.robinhood;

/* package-private */ class DefaultHasher implements Hasher<Object> {
  private static final DefaultHasher INSTANCE = new DefaultHasher();

  private DefaultHasher() {}

  @SuppressWarnings("unchecked")
  static <K> Hasher<K> instance() {
    return (Hasher<K>) INSTANCE;
  }

  @Override
  public long hash(Object key) {
    return mix(key.hashCode());
  }

  static long mix(int hashCode) {
    // murmur3 fmix64, so sequential hashCodes don't land in sequential slots
    long h = hashCode & 0xFFFF_FFFFL;
    h ^= h >>> 33;
    h *= 0xff51afd7ed558ccdL;
    h ^= h >>> 33;
    h *= 0xc4ceb9fe1a85ec53L;
    h ^= h >>> 33;
    return h;
  }
}
