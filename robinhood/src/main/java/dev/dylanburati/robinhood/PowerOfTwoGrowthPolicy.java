package dev.dylanburati.robinhood;

/** Doubles the capacity, starting from 1. */
public final class PowerOfTwoGrowthPolicy implements GrowthPolicy {
  // largest power of two that fits in an array length
  static final int MAX_CAPACITY = 1 << 30;
  private static final PowerOfTwoGrowthPolicy INSTANCE = new PowerOfTwoGrowthPolicy();

  private PowerOfTwoGrowthPolicy() {}

  public static PowerOfTwoGrowthPolicy instance() {
    return INSTANCE;
  }

  @Override
  public int next(int current) {
    if (current >= MAX_CAPACITY) {
      return current;
    }
    if (current > MAX_CAPACITY / 2) {
      return MAX_CAPACITY;
    }
    return Math.max(current * 2, 1);
  }

  @Override
  public String toString() {
    return "PowerOfTwoGrowthPolicy";
  }
}
