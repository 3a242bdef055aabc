package dev.dylanburati.robinhood;

/**
 * Thrown when the table's {@link GrowthPolicy} cannot produce a capacity large
 * enough for a reservation or a rehash.
 */
public class CapacityExhaustedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int capacity;
  private final long requested;

  public CapacityExhaustedException(int capacity, long requested) {
    super(String.format("growth policy stopped at capacity %d, need more than %d", capacity, requested));
    this.capacity = capacity;
    this.requested = requested;
  }

  /** The last capacity the growth policy produced. */
  public int getCapacity() {
    return this.capacity;
  }

  public long getRequested() {
    return this.requested;
  }
}
