package dev.dylanburati.robinhood;

/**
 * Fixed-capacity array of slots owned by a single {@link HashTable}. Resizing
 * is positional: slot {@code i} of the old array becomes slot {@code i} of the
 * new one. Rehashing is the table's job.
 */
/* package-private */ final class BackingStore<T> {
  private static final Slot<?>[] RELEASED = new Slot<?>[0];

  private final Allocator<T> allocator;
  // INVARIANT: every element is a distinct, non-null Slot
  private Slot<T>[] slots;

  BackingStore(int capacity, Allocator<T> allocator) {
    if (capacity < 0) {
      throw new IllegalArgumentException("expected non-negative capacity");
    }
    this.allocator = allocator;
    this.slots = emptySlots(allocator, capacity);
  }

  /**
   * Copies every occupied slot of {@code src}, constructing each value with the
   * allocator. If a construction throws, the values constructed so far are
   * destroyed and the new array is released before the exception propagates.
   */
  BackingStore(final BackingStore<T> src) {
    this.allocator = src.allocator;
    Slot<T>[] copy = emptySlots(this.allocator, src.slots.length);
    int i = 0;
    try {
      for (; i < copy.length; i++) {
        Slot<T> from = src.slots[i];
        if (!from.isEmpty()) {
          copy[i].set(from.hash(), from.value(), this.allocator);
        }
      }
    } catch (RuntimeException | Error e) {
      for (int j = 0; j < i; j++) {
        copy[j].clear(this.allocator);
      }
      this.allocator.deallocate(copy);
      throw e;
    }
    this.slots = copy;
  }

  private static <T> Slot<T>[] emptySlots(Allocator<T> allocator, int capacity) {
    Slot<T>[] result = allocator.allocate(capacity);
    if (result.length != capacity) {
      throw new IllegalStateException(String.format("allocator returned %d slots, expected %d", result.length, capacity));
    }
    for (int i = 0; i < capacity; i++) {
      result[i] = new Slot<>();
    }
    return result;
  }

  int capacity() {
    return this.slots.length;
  }

  Slot<T> get(int index) {
    assert index >= 0 && index < this.slots.length : "slot index out of range: " + index;
    return this.slots[index];
  }

  /**
   * Moves slots positionally into a fresh array of {@code newCapacity}. Values
   * in slots past a smaller capacity are destroyed. If allocating the new array
   * fails, this store is left as it was.
   */
  void resize(int newCapacity) {
    if (newCapacity < 0) {
      throw new IllegalArgumentException("expected non-negative capacity");
    }
    Slot<T>[] next = emptySlots(this.allocator, newCapacity);
    int shared = Math.min(newCapacity, this.slots.length);
    for (int i = 0; i < shared; i++) {
      next[i].moveFrom(this.slots[i]);
    }
    for (int i = shared; i < this.slots.length; i++) {
      this.slots[i].clear(this.allocator);
    }
    Slot<T>[] prev = this.slots;
    this.slots = next;
    this.allocator.deallocate(prev);
  }

  /** Destroys every value, keeping the capacity. */
  void clear() {
    for (Slot<T> slot : this.slots) {
      slot.clear(this.allocator);
    }
  }

  /** Releases the array. Values still in it are not destroyed, they must have been moved out. */
  void release() {
    this.allocator.deallocate(this.slots);
    this.slots = released();
  }

  @SuppressWarnings("unchecked")
  private static <T> Slot<T>[] released() {
    return (Slot<T>[]) RELEASED;
  }

  /** Index of the first occupied slot in {@code [from, limit)}, or {@link #capacity()} if none. */
  int nextOccupied(int from, int limit) {
    for (int i = from; i < limit; i++) {
      if (!this.slots[i].isEmpty()) {
        return i;
      }
    }
    return this.slots.length;
  }

  /** Index of the last occupied slot in {@code [0, from]}, or -1 if none. */
  int previousOccupied(int from) {
    for (int i = from; i >= 0; i--) {
      if (!this.slots[i].isEmpty()) {
        return i;
      }
    }
    return -1;
  }
}
