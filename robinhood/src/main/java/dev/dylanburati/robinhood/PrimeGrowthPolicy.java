package dev.dylanburati.robinhood;

import java.util.Arrays;

/**
 * Steps through a fixed table of primes, each roughly double the last. Prime
 * capacities avoid sharing small factors with poorly distributed hashes, at
 * the cost of a division per probe.
 */
public final class PrimeGrowthPolicy implements GrowthPolicy {
  // INVARIANT: strictly ascending, every entry fits in an array length
  static final int[] PRIMES = {
    1, 5, 17, 29, 37, 53, 67, 79, 97, 131, 193, 257, 389, 521, 769, 1031, 1543,
    2053, 3079, 6151, 12289, 24593, 49157, 98317, 196613, 393241, 786433,
    1572869, 3145739, 6291469, 12582917, 25165843, 50331653, 100663319,
    201326611, 402653189, 805306457, 1610612741
  };
  private static final PrimeGrowthPolicy INSTANCE = new PrimeGrowthPolicy();

  private PrimeGrowthPolicy() {}

  public static PrimeGrowthPolicy instance() {
    return INSTANCE;
  }

  @Override
  public int next(int current) {
    int i = Arrays.binarySearch(PRIMES, current);
    // smallest entry strictly greater than current
    int idx = i >= 0 ? i + 1 : -i - 1;
    if (idx >= PRIMES.length) {
      return current;
    }
    return PRIMES[idx];
  }

  @Override
  public String toString() {
    return "PrimeGrowthPolicy";
  }
}
