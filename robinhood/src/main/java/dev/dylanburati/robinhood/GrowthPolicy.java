package dev.dylanburati.robinhood;

/**
 * Computes the next backing store capacity from the current one. Implementations
 * must be pure functions of {@code current}. Returning {@code current} unchanged
 * signals that the policy can't grow any further.
 */
@FunctionalInterface
public interface GrowthPolicy {
  int next(int current);

  static GrowthPolicy powerOfTwo() {
    return PowerOfTwoGrowthPolicy.instance();
  }

  static GrowthPolicy primes() {
    return PrimeGrowthPolicy.instance();
  }
}
