package dev.dylanburati.robinhood;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open-addressing hash table using Robin Hood displacement and backward-shift
 * deletion. Stores values of type {@code T}, each of which carries its own key
 * of type {@code K} (extracted with the key selector). {@link RobinHoodMap} and
 * {@link RobinHoodSet} are thin adapters over this class.
 *
 * Every value sits at some probe distance from its home slot
 * {@code hash mod capacity}. On insertion an incoming value takes the slot of
 * any resident that is closer to its own home than the incoming value is, and
 * the resident continues probing in its place. This keeps probe distances
 * short and lets lookups stop as soon as they pass a resident closer to home
 * than the key being looked for. Deletion pulls the following displaced
 * residents back by one slot, so there are no tombstones.
 *
 * Not thread-safe.
 */
public class HashTable<K, T> implements Iterable<T> {
  private static final Logger log = LoggerFactory.getLogger(HashTable.class);

  static final float DEFAULT_MAX_LOAD_FACTOR = 0.5f;
  // below this, even a table of 2^30 slots can't hold one entry
  static final float MIN_MAX_LOAD_FACTOR = 1f / (1 << 30);

  private Function<? super T, ? extends K> keySelector;
  private Hasher<? super K> hasher;
  private KeyEquality<? super K> equality;
  private GrowthPolicy growthPolicy;
  private Allocator<T> allocator;
  private float maxLoadFactor;

  // INVARIANT 0: size == count [s | s in store, !s.isEmpty()] <= store.capacity()
  // INVARIANT 1: for each occupied slot i, the slots from home(i) up to i
  //   (circularly) are all occupied, and if next(i) is occupied then
  //   distance(next(i)) <= distance(i) + 1
  private BackingStore<T> store;
  private int size;
  // incremented on every change that moves or removes slots
  private int modCount;

  public HashTable(final Function<? super T, ? extends K> keySelector) {
    this(0, keySelector);
  }

  public HashTable(int initialCapacity, final Function<? super T, ? extends K> keySelector) {
    this(initialCapacity, keySelector, Hasher.standard(), KeyEquality.standard(), GrowthPolicy.powerOfTwo(), Allocator.standard());
  }

  public HashTable(
      int initialCapacity,
      final Function<? super T, ? extends K> keySelector,
      final Hasher<? super K> hasher,
      final KeyEquality<? super K> equality,
      final GrowthPolicy growthPolicy,
      final Allocator<T> allocator) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("expected non-negative initialCapacity");
    }
    this.keySelector = Objects.requireNonNull(keySelector);
    this.hasher = Objects.requireNonNull(hasher);
    this.equality = Objects.requireNonNull(equality);
    this.growthPolicy = Objects.requireNonNull(growthPolicy);
    this.allocator = Objects.requireNonNull(allocator);
    this.maxLoadFactor = DEFAULT_MAX_LOAD_FACTOR;
    // INVARIANT 0, 1 upheld, all slots empty
    this.store = new BackingStore<>(initialCapacity, allocator);
    this.size = 0;
    this.modCount = 0;
  }

  /**
   * Copies {@code other}, constructing every value with its allocator. If a
   * construction throws, nothing is leaked and {@code other} is untouched.
   */
  public HashTable(final HashTable<K, T> other) {
    this.keySelector = other.keySelector;
    this.hasher = other.hasher;
    this.equality = other.equality;
    this.growthPolicy = other.growthPolicy;
    this.allocator = other.allocator;
    this.maxLoadFactor = other.maxLoadFactor;
    // INVARIANTS upheld: same slots at the same indices
    this.store = new BackingStore<>(other.store);
    this.size = other.size;
    this.modCount = 0;
  }

  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.size == 0;
  }

  public int capacity() {
    return this.store.capacity();
  }

  public float loadFactor() {
    int cap = this.store.capacity();
    return cap == 0 ? 0f : (float) this.size / cap;
  }

  public float maxLoadFactor() {
    return this.maxLoadFactor;
  }

  /**
   * Sets the load factor that triggers growth. Values above 1 are clamped to 1.
   *
   * @throws IllegalArgumentException if {@code loadFactor} is NaN, not positive,
   *     or below {@code 2^-30}
   */
  public void maxLoadFactor(float loadFactor) {
    if (!(loadFactor > 0f)) {
      throw new IllegalArgumentException("expected positive loadFactor");
    }
    if (loadFactor < MIN_MAX_LOAD_FACTOR) {
      throw new IllegalArgumentException("expected loadFactor of at least 2^-30, got " + loadFactor);
    }
    this.maxLoadFactor = Math.min(1f, loadFactor);
  }

  public Hasher<? super K> hasher() {
    return this.hasher;
  }

  public KeyEquality<? super K> equality() {
    return this.equality;
  }

  public GrowthPolicy growthPolicy() {
    return this.growthPolicy;
  }

  public boolean contains(K key) {
    return this.readIndex(key) >= 0;
  }

  /** Returns 1 if the key is present, otherwise 0. */
  public int count(K key) {
    return this.readIndex(key) >= 0 ? 1 : 0;
  }

  /** Returns the value stored under {@code key}, or null. */
  public T get(K key) {
    int idx = this.readIndex(key);
    if (idx < 0) {
      return null;
    }
    return this.store.get(idx).value();
  }

  /** Returns a cursor at the value stored under {@code key}, or {@link #end()}. */
  public Cursor<T> find(K key) {
    int idx = this.readIndex(key);
    if (idx < 0) {
      return this.end();
    }
    return new Cursor<>(this, idx, this.store.capacity());
  }

  /**
   * Inserts {@code value}, replacing any value with an equal key.
   *
   * @return the replaced value (already passed to {@link Allocator#destroy}), or null
   */
  public T insert(T value) {
    return this.insertImpl(value, true);
  }

  /**
   * Inserts {@code value} unless a value with an equal key is present.
   *
   * @return the value already present, or null if {@code value} was inserted
   */
  public T insertIfAbsent(T value) {
    return this.insertImpl(value, false);
  }

  private T insertImpl(T value, boolean shouldReplace) {
    K key = Objects.requireNonNull(this.keySelector.apply(value), "null keys are not supported");
    long hash = this.hasher.hash(key);
    int idx = this.readIndex(hash, key);
    if (idx >= 0) {
      Slot<T> slot = this.store.get(idx);
      if (shouldReplace) {
        return slot.replaceValue(value, this.allocator);
      }
      return slot.value();
    }

    // construct before touching the store, so a failure leaves it unchanged
    Slot<T> candidate = new Slot<>();
    candidate.set(hash, value, this.allocator);
    if (this.shouldGrow()) {
      try {
        this.growTo(this.grownCapacity(this.store.capacity(), (long) this.size + 1, true));
      } catch (RuntimeException | Error e) {
        candidate.clear(this.allocator);
        throw e;
      }
      idx = this.readIndex(hash, key);
    }
    // INVARIANT 0 upheld: shouldGrow() is false, so size < capacity and an empty slot exists
    this.displace(this.store, candidate, -idx - 1);
    this.size++;
    this.modCount++;
    return null;
  }

  /** Removes the value stored under {@code key}. Returns 1 if it was present, otherwise 0. */
  public int erase(K key) {
    int idx = this.readIndex(key);
    if (idx < 0) {
      return 0;
    }
    this.eraseAt(idx);
    return 1;
  }

  /**
   * Removes the value stored under {@code key}.
   *
   * @return the removed value (already passed to {@link Allocator#destroy}), or null
   */
  public T remove(K key) {
    int idx = this.readIndex(key);
    if (idx < 0) {
      return null;
    }
    T result = this.store.get(idx).value();
    this.eraseAt(idx);
    return result;
  }

  /**
   * Removes the value at {@code position}.
   *
   * @return a cursor at the entry that followed the removed one in iteration order
   */
  public Cursor<T> erase(Cursor<T> position) {
    if (position.owner() != this) {
      throw new IllegalArgumentException("cursor belongs to a different table");
    }
    position.checkForComodification();
    if (position.isEnd()) {
      return position;
    }
    int at = position.index();
    int limit = position.limit();
    int vacated = this.eraseAt(at);
    // A shift that wraps around, or that reaches the tail past the limit,
    // pulls already-visited entries back by one slot.
    if (vacated < at || vacated >= limit) {
      limit--;
    }
    // the slot at `at` may now hold the unvisited successor
    return new Cursor<>(this, this.store.nextOccupied(at, limit), limit);
  }

  /**
   * Removes the values from {@code first} up to, but not including, {@code last}.
   * Both cursors must be current and belong to this table, and {@code last}
   * must be reachable from {@code first} by stepping forward.
   *
   * @return a cursor at the entry {@code last} pointed to, or {@link #end()}
   */
  public Cursor<T> erase(Cursor<T> first, Cursor<T> last) {
    if (first.owner() != this || last.owner() != this) {
      throw new IllegalArgumentException("cursor belongs to a different table");
    }
    first.checkForComodification();
    last.checkForComodification();
    int count = 0;
    for (Cursor<T> it = first; !it.equals(last); it = it.next()) {
      if (it.isEnd()) {
        throw new IllegalArgumentException("last is not reachable from first");
      }
      count++;
    }
    // each erase hands back the next unvisited entry, so the same count of
    // steps lands on last's entry even after shifts move it
    Cursor<T> it = first;
    for (int i = 0; i < count; i++) {
      it = this.erase(it);
    }
    return it;
  }

  /** Destroys every value. The capacity is kept. */
  public void clear() {
    this.store.clear();
    this.size = 0;
    this.modCount++;
  }

  /**
   * Grows the backing store, by repeated application of the growth policy, to a
   * capacity greater than {@code capacity}.
   *
   * @throws CapacityExhaustedException if the growth policy can't get there
   */
  public void reserve(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("expected non-negative capacity");
    }
    int next = this.grownCapacity(this.store.capacity(), capacity, false);
    if (next > this.store.capacity()) {
      this.growTo(next);
    }
  }

  /** Same as {@link #reserve}. */
  public void rehash(int capacity) {
    this.reserve(capacity);
  }

  /** Exchanges the entire contents and configuration of two tables. */
  public void swap(HashTable<K, T> other) {
    Function<? super T, ? extends K> tmpKeySelector = this.keySelector;
    Hasher<? super K> tmpHasher = this.hasher;
    KeyEquality<? super K> tmpEquality = this.equality;
    GrowthPolicy tmpGrowthPolicy = this.growthPolicy;
    Allocator<T> tmpAllocator = this.allocator;
    float tmpMaxLoadFactor = this.maxLoadFactor;
    BackingStore<T> tmpStore = this.store;
    int tmpSize = this.size;

    this.keySelector = other.keySelector;
    this.hasher = other.hasher;
    this.equality = other.equality;
    this.growthPolicy = other.growthPolicy;
    this.allocator = other.allocator;
    this.maxLoadFactor = other.maxLoadFactor;
    this.store = other.store;
    this.size = other.size;

    other.keySelector = tmpKeySelector;
    other.hasher = tmpHasher;
    other.equality = tmpEquality;
    other.growthPolicy = tmpGrowthPolicy;
    other.allocator = tmpAllocator;
    other.maxLoadFactor = tmpMaxLoadFactor;
    other.store = tmpStore;
    other.size = tmpSize;

    this.modCount++;
    other.modCount++;
  }

  /** Cursor at the first entry in slot order, or {@link #end()} if empty. */
  public Cursor<T> begin() {
    int cap = this.store.capacity();
    return new Cursor<>(this, this.store.nextOccupied(0, cap), cap);
  }

  public Cursor<T> end() {
    int cap = this.store.capacity();
    return new Cursor<>(this, cap, cap);
  }

  /** Cursor at the last entry in slot order, or {@link #end()} if empty. */
  public Cursor<T> last() {
    int cap = this.store.capacity();
    int idx = this.store.previousOccupied(cap - 1);
    return new Cursor<>(this, idx < 0 ? cap : idx, cap);
  }

  @Override
  public Iterator<T> iterator() {
    return new HashIterator();
  }

  @Override
  public String toString() {
    StringBuilder bldr = new StringBuilder("[");
    for (T value : this) {
      if (bldr.length() > 1) {
        bldr.append(", ");
      }
      bldr.append(value);
    }
    return bldr.append(']').toString();
  }

  // start of section used by Cursor and by tests

  int modCount() {
    return this.modCount;
  }

  Slot<T> slotAt(int index) {
    return this.store.get(index);
  }

  int nextOccupied(int from, int limit) {
    return this.store.nextOccupied(from, limit);
  }

  int previousOccupied(int from) {
    return this.store.previousOccupied(from);
  }

  int homeIndex(long hash) {
    return home(hash, this.store.capacity());
  }

  /** Probe distance of the occupied slot at {@code index}. */
  int distance(int index) {
    return probeDistance(index, this.store.get(index).hash(), this.store.capacity());
  }

  // end of section used by Cursor and by tests

  private static int home(long hash, int capacity) {
    return (int) Long.remainderUnsigned(hash, Math.max(capacity, 1));
  }

  private static int probeDistance(int index, long hash, int capacity) {
    int home = home(hash, capacity);
    return index >= home ? index - home : capacity - home + index;
  }

  private int readIndex(K key) {
    if (key == null) {
      return -1;
    }
    return this.readIndex(this.hasher.hash(key), key);
  }

  /**
   * Linear probe from the key's home slot, stopping early at the first resident
   * that is closer to its own home than the key would be.
   *
   * Returns:
   * <ul>
   * <li> {@code index} when key found
   * <li> {@code -index - 1} when not found; the index is where the key would be inserted
   */
  private int readIndex(long hash, K key) {
    int cap = this.store.capacity();
    if (cap == 0) {
      return -1;
    }
    int idx = home(hash, cap);
    int distance = 0;
    while (true) {
      Slot<T> slot = this.store.get(idx);
      // by INVARIANT 1 this ends within cap steps: distance reaches cap, which exceeds any resident's
      if (slot.isEmpty() || distance > probeDistance(idx, slot.hash(), cap)) {
        return -idx - 1;
      }
      if (slot.hash() == hash && this.equality.equal(this.keySelector.apply(slot.value()), key)) {
        return idx;
      }
      idx = idx + 1 == cap ? 0 : idx + 1;
      distance++;
    }
  }

  /**
   * Places {@code candidate} at or after {@code idx} in {@code target}, moving
   * residents forward whenever they are closer to home than the value being
   * carried. Leaves {@code candidate} empty.
   *
   * {@code target} must have an empty slot.
   */
  private void displace(BackingStore<T> target, Slot<T> candidate, int idx) {
    int cap = target.capacity();
    int distance = probeDistance(idx, candidate.hash(), cap);
    Slot<T> slot = target.get(idx);
    while (!slot.isEmpty()) {
      int residentDistance = probeDistance(idx, slot.hash(), cap);
      if (residentDistance < distance) {
        slot.swap(candidate);
        distance = residentDistance;
      }
      idx = idx + 1 == cap ? 0 : idx + 1;
      distance++;
      slot = target.get(idx);
    }
    slot.swap(candidate);
  }

  /**
   * Clears the slot at {@code idx}, then pulls each following displaced
   * resident back by one, stopping at an empty slot or a resident already at
   * its home. INVARIANT 1 upheld: relative order within the run is unchanged
   * and every moved resident's distance drops by exactly one.
   *
   * @return the index of the slot left empty
   */
  private int eraseAt(int idx) {
    int cap = this.store.capacity();
    int prev = idx;
    this.store.get(prev).clear(this.allocator);
    int next = prev + 1 == cap ? 0 : prev + 1;
    while (!this.store.get(next).isEmpty() && this.distance(next) > 0) {
      this.store.get(prev).moveFrom(this.store.get(next));
      prev = next;
      next = next + 1 == cap ? 0 : next + 1;
    }
    this.size--;
    this.modCount++;
    return prev;
  }

  private boolean shouldGrow() {
    int cap = this.store.capacity();
    return cap == 0 || this.size >= this.threshold(cap);
  }

  private long threshold(int capacity) {
    return (long) ((double) this.maxLoadFactor * capacity);
  }

  /**
   * Applies the growth policy starting from {@code capacity} until the result
   * exceeds {@code minimum} and, if {@code withinLoadFactor}, can also hold
   * {@code minimum} entries without passing the max load factor.
   */
  private int grownCapacity(int capacity, long minimum, boolean withinLoadFactor) {
    int current = capacity;
    while (current <= minimum || (withinLoadFactor && this.threshold(current) < minimum)) {
      int next = this.growthPolicy.next(current);
      if (next <= current) {
        log.warn("{} can't grow past capacity {} (need more than {})", this.growthPolicy, current, minimum);
        throw new CapacityExhaustedException(current, minimum);
      }
      current = next;
    }
    return current;
  }

  /**
   * Moves every value into a fresh store of {@code newCapacity}, visiting the
   * old store in index order. The fresh store is allocated first; if that
   * fails, the table is unchanged.
   */
  private void growTo(int newCapacity) {
    int oldCapacity = this.store.capacity();
    BackingStore<T> fresh = new BackingStore<>(newCapacity, this.allocator);
    BackingStore<T> old = this.store;
    Slot<T> carry = new Slot<>();
    for (int src = 0; src < oldCapacity; src++) {
      Slot<T> slot = old.get(src);
      if (!slot.isEmpty()) {
        carry.moveFrom(slot);
        this.displace(fresh, carry, home(carry.hash(), newCapacity));
      }
    }
    this.store = fresh;
    old.release();
    this.modCount++;
    log.debug("rehash capacity {} -> {} (size={})", oldCapacity, newCapacity, this.size);
  }

  private final class HashIterator implements Iterator<T> {
    private Cursor<T> next;
    private Cursor<T> lastReturned;

    HashIterator() {
      this.next = HashTable.this.begin();
      this.lastReturned = null;
    }

    @Override
    public boolean hasNext() {
      return !this.next.isEnd();
    }

    @Override
    public T next() {
      if (this.next.isEnd()) {
        throw new NoSuchElementException();
      }
      T result = this.next.get();
      this.lastReturned = this.next;
      this.next = this.next.next();
      return result;
    }

    @Override
    public void remove() {
      if (this.lastReturned == null) {
        throw new IllegalStateException();
      }
      this.next = HashTable.this.erase(this.lastReturned);
      this.lastReturned = null;
    }
  }
}
