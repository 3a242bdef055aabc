package dev.dylanburati.robinhood;

/**
 * Memory strategy for a table's slots and the values stored in them.
 *
 * <p>{@link #construct} is called whenever a value enters a slot (insertion,
 * update, or copying a table) and may throw; the table rolls back whatever it
 * had started and rethrows. {@link #destroy} is called exactly once for every
 * value that was constructed, when it leaves the table. Moving a value between
 * slots during displacement, backward shift or rehashing constructs nothing.
 */
public interface Allocator<T> {
  /** Returns an array of {@code capacity} unset (null) slot references. */
  Slot<T>[] allocate(int capacity);

  /** Releases an array previously returned by {@link #allocate}. */
  void deallocate(Slot<T>[] slots);

  /** Returns the instance to store for {@code value}. */
  T construct(T value);

  void destroy(T value);

  static <T> Allocator<T> standard() {
    return StandardAllocator.instance();
  }
}
