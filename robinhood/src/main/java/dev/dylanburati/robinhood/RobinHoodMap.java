package dev.dylanburati.robinhood;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Hash map backed by a {@link HashTable} of entry nodes. Null keys are not
 * supported; null values are.
 *
 * Entries returned by {@link #entrySet()} are the nodes stored in the table,
 * so {@link Map.Entry#setValue} writes through, and stays valid across rehashes.
 */
public class RobinHoodMap<K, V> extends AbstractMap<K, V> {
  private final HashTable<K, Node<K, V>> table;

  public RobinHoodMap() {
    this(0);
  }

  public RobinHoodMap(int initialCapacity) {
    this(initialCapacity, Hasher.standard(), KeyEquality.standard(), GrowthPolicy.powerOfTwo());
  }

  public RobinHoodMap(int initialCapacity, final Hasher<? super K> hasher, final KeyEquality<? super K> equality, final GrowthPolicy growthPolicy) {
    this(new HashTable<K, Node<K, V>>(initialCapacity, Node::getKey, hasher, equality, growthPolicy, Allocator.standard()));
  }

  private RobinHoodMap(final HashTable<K, Node<K, V>> table) {
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
  public boolean containsKey(Object key) {
    return this.table.contains(castUnsafe(key));
  }

  @Override
  public V get(Object key) {
    return this.getOrDefault(key, null);
  }

  @Override
  public V getOrDefault(Object key, V defaultValue) {
    Node<K, V> node = this.table.get(castUnsafe(key));
    if (node == null) {
      return defaultValue;
    }
    return node.value;
  }

  /**
   * Returns the value mapped to {@code key}.
   *
   * @throws NoSuchElementException if the key is not present
   */
  public V at(K key) {
    Node<K, V> node = this.table.get(key);
    if (node == null) {
      throw new NoSuchElementException("key not present: " + key);
    }
    return node.value;
  }

  @Override
  public V put(K key, V value) {
    Node<K, V> existing = this.table.insertIfAbsent(new Node<>(key, value));
    if (existing == null) {
      return null;
    }
    return existing.setValue(value);
  }

  @Override
  public V putIfAbsent(K key, V value) {
    Node<K, V> existing = this.table.insertIfAbsent(new Node<>(key, value));
    if (existing == null) {
      return null;
    }
    if (existing.value == null) {
      existing.value = value;
      return null;
    }
    return existing.value;
  }

  @Override
  public V remove(Object key) {
    Node<K, V> node = this.table.remove(castUnsafe(key));
    if (node == null) {
      return null;
    }
    return node.value;
  }

  @Override
  public void clear() {
    this.table.clear();
  }

  @Override
  public Set<K> keySet() {
    return new KeySet<>(this);
  }

  @Override
  public Set<Entry<K, V>> entrySet() {
    return new EntrySet<>(this);
  }

  /** See {@link HashTable#reserve}. */
  public void reserve(int capacity) {
    this.table.reserve(capacity);
  }

  public int capacity() {
    return this.table.capacity();
  }

  public float loadFactor() {
    return this.table.loadFactor();
  }

  public float maxLoadFactor() {
    return this.table.maxLoadFactor();
  }

  public void maxLoadFactor(float loadFactor) {
    this.table.maxLoadFactor(loadFactor);
  }

  /** Exchanges the contents of two maps. */
  public void swap(RobinHoodMap<K, V> other) {
    this.table.swap(other.table);
  }

  /**
   * Creates a shallow copy of this map, with separate entry nodes and the same
   * capacity, hasher, equality and growth policy.
   */
  public RobinHoodMap<K, V> copy() {
    HashTable<K, Node<K, V>> tableCopy = new HashTable<K, Node<K, V>>(
        this.table.capacity(), Node::getKey, this.table.hasher(), this.table.equality(), this.table.growthPolicy(), Allocator.standard());
    tableCopy.maxLoadFactor(this.table.maxLoadFactor());
    for (Node<K, V> node : this.table) {
      tableCopy.insert(new Node<>(node.key, node.value));
    }
    return new RobinHoodMap<>(tableCopy);
  }

  protected static final class Node<K, V> implements Map.Entry<K, V> {
    private final K key;
    private V value;

    Node(K key, V value) {
      this.key = key;
      this.value = value;
    }

    @Override
    public K getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return this.value;
    }

    @Override
    public V setValue(V value) {
      V prev = this.value;
      this.value = value;
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
    }

    @Override
    public String toString() {
      return this.key + "=" + this.value;
    }
  }

  protected static class KeySet<K> extends AbstractSet<K> {
    private final RobinHoodMap<K, ?> owner;
    protected KeySet(final RobinHoodMap<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner.table.iterator());
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      K k = castUnsafe(key);
      return owner.table.erase(k) == 1;
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final RobinHoodMap<K, V> owner;
    protected EntrySet(final RobinHoodMap<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      // Node<K, V> is a Map.Entry<K, V>, and the iterator never accepts elements
      return castUnsafe(owner.table.iterator());
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      Node<K, V> node = owner.table.get(castUnsafe(e.getKey()));
      return node != null && Objects.equals(node.value, e.getValue());
    }
    public final boolean remove(Object o) {
      if (this.contains(o)) {
        K key = castUnsafe(((Map.Entry<?, ?>) o).getKey());
        return owner.table.erase(key) == 1;
      }
      return false;
    }
  }

  protected static class KeyIterator<K> implements Iterator<K> {
    private final Iterator<? extends Node<K, ?>> inner;

    protected KeyIterator(final Iterator<? extends Node<K, ?>> inner) {
      this.inner = inner;
    }

    public final boolean hasNext() {
      return this.inner.hasNext();
    }

    public final K next() {
      return this.inner.next().getKey();
    }

    public final void remove() {
      this.inner.remove();
    }
  }
}
