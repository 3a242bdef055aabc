package dev.dylanburati.robinhood;

/**
 * One cell of a table's backing store: an occupancy flag, the cached hash of
 * the stored value's key, and the value itself.
 */
public final class Slot<T> {
  // INVARIANT: occupied == false implies hash == 0 and value == null
  private boolean occupied;
  private long hash;
  private T value;

  Slot() {
    this.occupied = false;
    this.hash = 0L;
    this.value = null;
  }

  public boolean isEmpty() {
    return !this.occupied;
  }

  public long hash() {
    return this.hash;
  }

  public T value() {
    assert this.occupied : "value() on empty slot";
    return this.value;
  }

  /** Constructs {@code value} into this slot. On failure the slot is left empty. */
  void set(long hash, T value, Allocator<T> allocator) {
    T constructed;
    try {
      constructed = allocator.construct(value);
    } catch (RuntimeException | Error e) {
      this.clear(allocator);
      throw e;
    }
    this.clear(allocator);
    this.occupied = true;
    this.hash = hash;
    this.value = constructed;
  }

  /** Like {@link #set}, but keeps the old value if construction fails. */
  T replaceValue(T value, Allocator<T> allocator) {
    assert this.occupied : "replaceValue() on empty slot";
    T constructed = allocator.construct(value);
    T prev = this.value;
    this.value = constructed;
    allocator.destroy(prev);
    return prev;
  }

  void clear(Allocator<T> allocator) {
    if (this.occupied) {
      T prev = this.value;
      this.occupied = false;
      this.hash = 0L;
      this.value = null;
      allocator.destroy(prev);
    }
  }

  void swap(Slot<T> other) {
    boolean tmpOccupied = this.occupied;
    long tmpHash = this.hash;
    T tmpValue = this.value;
    this.occupied = other.occupied;
    this.hash = other.hash;
    this.value = other.value;
    other.occupied = tmpOccupied;
    other.hash = tmpHash;
    other.value = tmpValue;
  }

  /** Takes over the contents of {@code src} without constructing or destroying anything. */
  void moveFrom(Slot<T> src) {
    assert this.occupied == false : "moveFrom() into occupied slot";
    this.occupied = src.occupied;
    this.hash = src.hash;
    this.value = src.value;
    src.occupied = false;
    src.hash = 0L;
    src.value = null;
  }

  @Override
  public String toString() {
    return this.occupied ? String.format("Slot(%016x, %s)", this.hash, this.value) : "Slot(empty)";
  }
}
