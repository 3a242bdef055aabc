package dev.dylanburati.robinhood;

import java.util.Arrays;

/* package-private */ class StandardAllocator implements Allocator<Object> {
  private static final StandardAllocator INSTANCE = new StandardAllocator();

  private StandardAllocator() {}

  @SuppressWarnings("unchecked")
  static <T> Allocator<T> instance() {
    return (Allocator<T>) INSTANCE;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Slot<Object>[] allocate(int capacity) {
    return (Slot<Object>[]) new Slot<?>[capacity];
  }

  @Override
  public void deallocate(Slot<Object>[] slots) {
    // drop references so a retained array doesn't pin values
    Arrays.fill(slots, null);
  }

  @Override
  public Object construct(Object value) {
    return value;
  }

  @Override
  public void destroy(Object value) {
  }
}
