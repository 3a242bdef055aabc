package dev.dylanburati.robinhood;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.function.Function;

/** Hash set backed by a {@link HashTable} whose values are their own keys. Null elements are not supported. */
public class RobinHoodSet<E> extends AbstractSet<E> {
  private final HashTable<E, E> table;

  public RobinHoodSet() {
    this(0);
  }

  public RobinHoodSet(int initialCapacity) {
    this(initialCapacity, Hasher.standard(), KeyEquality.standard(), GrowthPolicy.powerOfTwo(), Allocator.standard());
  }

  public RobinHoodSet(
      int initialCapacity,
      final Hasher<? super E> hasher,
      final KeyEquality<? super E> equality,
      final GrowthPolicy growthPolicy,
      final Allocator<E> allocator) {
    this(new HashTable<E, E>(initialCapacity, Function.identity(), hasher, equality, growthPolicy, allocator));
  }

  private RobinHoodSet(final HashTable<E, E> table) {
    this.table = table;
  }

  @SuppressWarnings("unchecked")
  private static <T> T castUnsafe(Object v) {
    return (T) v;
  }

  @Override
  public int size() {
    return this.table.size();
  }

  @Override
  public boolean isEmpty() {
    return this.table.isEmpty();
  }

  @Override
  public boolean contains(Object o) {
    return this.table.contains(castUnsafe(o));
  }

  @Override
  public boolean add(E e) {
    return this.table.insertIfAbsent(e) == null;
  }

  @Override
  public boolean remove(Object o) {
    E e = castUnsafe(o);
    return this.table.erase(e) == 1;
  }

  @Override
  public void clear() {
    this.table.clear();
  }

  @Override
  public Iterator<E> iterator() {
    return this.table.iterator();
  }

  /** See {@link HashTable#reserve}. */
  public void reserve(int capacity) {
    this.table.reserve(capacity);
  }

  public int capacity() {
    return this.table.capacity();
  }

  public float maxLoadFactor() {
    return this.table.maxLoadFactor();
  }

  public void maxLoadFactor(float loadFactor) {
    this.table.maxLoadFactor(loadFactor);
  }

  /** Exchanges the contents of two sets. */
  public void swap(RobinHoodSet<E> other) {
    this.table.swap(other.table);
  }

  /**
   * Copies this set slot for slot. Each element goes through the allocator's
   * {@link Allocator#construct}; if one throws, the partial copy is destroyed
   * and this set is unchanged.
   */
  public RobinHoodSet<E> copy() {
    return new RobinHoodSet<>(new HashTable<>(this.table));
  }
}
