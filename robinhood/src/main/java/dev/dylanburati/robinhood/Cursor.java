package dev.dylanburati.robinhood;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;

/**
 * Immutable position in a {@link HashTable}'s backing store. Stepping skips
 * empty slots; stepping forward past the last entry gives the end cursor,
 * whose index is the table's capacity.
 *
 * A cursor is tied to the table state it was created from: after any insertion
 * of a new key, removal, rehash, clear or swap that didn't go through this
 * cursor, using it throws {@link ConcurrentModificationException}. Replacing
 * the value of an existing key doesn't invalidate cursors.
 */
public final class Cursor<T> {
  private final HashTable<?, T> owner;
  private final int index;
  // forward scans stop here; below capacity after a removal that pulled visited entries into the tail
  private final int limit;
  private final int end;
  private final int expectedModCount;

  Cursor(final HashTable<?, T> owner, int index, int limit) {
    this.owner = owner;
    this.index = index;
    this.limit = limit;
    this.end = owner.capacity();
    this.expectedModCount = owner.modCount();
  }

  /** Slot index of this cursor, equal to the table's capacity at the end. */
  public int index() {
    return this.index;
  }

  public boolean isEnd() {
    return this.index == this.end;
  }

  /** The value at this position. */
  public T get() {
    this.checkForComodification();
    if (this.isEnd()) {
      throw new NoSuchElementException("get() on end cursor");
    }
    return this.owner.slotAt(this.index).value();
  }

  /** Cursor at the next entry in slot order, or the end cursor. */
  public Cursor<T> next() {
    this.checkForComodification();
    if (this.isEnd()) {
      throw new NoSuchElementException("next() on end cursor");
    }
    return new Cursor<>(this.owner, this.owner.nextOccupied(this.index + 1, this.limit), this.limit);
  }

  /** Cursor at the previous entry in slot order. Works from the end cursor too. */
  public Cursor<T> previous() {
    this.checkForComodification();
    int idx = this.owner.previousOccupied(this.index - 1);
    if (idx < 0) {
      throw new NoSuchElementException("previous() on first entry");
    }
    return new Cursor<>(this.owner, idx, this.limit);
  }

  HashTable<?, T> owner() {
    return this.owner;
  }

  int limit() {
    return this.limit;
  }

  void checkForComodification() {
    if (this.owner.modCount() != this.expectedModCount) {
      throw new ConcurrentModificationException();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Cursor<?>)) {
      return false;
    }
    Cursor<?> other = (Cursor<?>) o;
    return this.owner == other.owner && this.index == other.index;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(this.owner) + this.index;
  }

  @Override
  public String toString() {
    return this.isEnd() ? "Cursor(end)" : "Cursor(" + this.index + ")";
  }
}
