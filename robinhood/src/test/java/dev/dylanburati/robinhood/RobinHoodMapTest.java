package dev.dylanburati.robinhood;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static dev.dylanburati.robinhood.Helpers.*;

class RobinHoodMapTest {
  // 32 values, indexed by key
  private static final List<List<Integer>> VALUES = IntStream.range(0, 32)
      .mapToObj(i -> List.of(i * 101, i % 7, -i))
      .collect(Collectors.toList());

  private static RobinHoodMap<String, List<Integer>> filled(int initialCapacity) {
    RobinHoodMap<String, List<Integer>> m = new RobinHoodMap<>(initialCapacity);
    for (List<Integer> v : VALUES) {
      String k = Integer.toString(m.size());
      assertNull(m.put(k, v));
    }
    assertEquals(32, m.size());
    return m;
  }

  @Test void testCreateNegativeCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new RobinHoodMap<String, Integer>(-1));
  }

  // zero capacity still allows inserts
  @Test void testCreateZeroCapacity() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>(0);
    assertEquals(0, m.capacity());
    assertNull(m.put("", 7));
    assertTrue(m.containsKey(""));
    assertFalse(m.containsKey("x"));
    assertTrue(m.capacity() > 0);
  }

  @Test void testPut() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertEquals(0, m.size());
    assertNull(m.put("a", 1));
    assertEquals(1, m.size());
    assertNull(m.put("b", 2));
    assertEquals(1, m.get("a"));
    assertEquals(2, m.get("b"));
    assertNull(m.get("c"));
    assertNull(m.get(17));
  }

  @Test void testPutAll() {
    Map<String, Integer> m = new RobinHoodMap<>();
    m.put("a", 1);
    m.put("b", 2);
    Map<String, Integer> m2 = new RobinHoodMap<>();
    m2.putAll(m);
    assertEquals(2, m2.size());
    assertEquals(1, m2.get("a"));
    assertEquals(2, m2.get("b"));
  }

  @Test void testStringKeys() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>();
    for (int i = 0; i < 100; i++) {
      assertNull(m.put(Integer.toString(i), i));
    }
    assertEquals(100, m.size());
    assertEquals(42, m.at("42"));
    for (int i = 0; i < 100; i++) {
      assertEquals(i, m.remove(Integer.toString(i)));
    }
    assertTrue(m.isEmpty());
    assertFalse(m.containsKey("42"));
  }

  @ParameterizedTest
  @ValueSource(ints = {8, 512, 4096})
  void testLotsOfInsertions(int initialCapacity) {
    IntFunction<List<Integer>> toValue = v -> List.of(v, v * v);
    List<RobinHoodMap<String, List<Integer>>> maps = List.of(
        new RobinHoodMap<String, List<Integer>>(initialCapacity),
        new RobinHoodMap<String, List<Integer>>(initialCapacity, Hasher.standard(), KeyEquality.standard(), GrowthPolicy.primes()));
    for (RobinHoodMap<String, List<Integer>> m : maps) {
      for (int loop = 0; loop < 4; loop++) {
        assertTrue(m.isEmpty());

        int count = 201;
        for (int i = 1; i < count; i++) {
          assertNull(m.put(Integer.toString(i), toValue.apply(i)));
          for (int j = 1; j <= i; j++) {
            assertEquals(toValue.apply(j), m.get(Integer.toString(j)));
          }
          for (int j = i + 1; j < count; j++) {
            assertNull(m.get(Integer.toString(j)));
          }
        }

        // remove in a scattered order
        for (int step = 0; step < count - 1; step++) {
          int i = 1 + (step * 73) % (count - 1);
          assertEquals(toValue.apply(i), m.remove(Integer.toString(i)));
          assertFalse(m.containsKey(Integer.toString(i)));
          assertEquals(count - 2 - step, m.size());
        }
      }
      assertTrue(m.capacity() >= initialCapacity);
    }
  }

  @Test void testCollisions() {
    // every key of the same length collides
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>(0, k -> k.length(), KeyEquality.standard(), GrowthPolicy.powerOfTwo());
    for (String k : List.of("a", "b", "c", "dd", "ee", "fff")) {
      assertNull(m.put(k, k.hashCode()));
    }
    assertEquals(6, m.size());
    assertEquals("b".hashCode(), m.get("b"));
    assertEquals("b".hashCode(), m.remove("b"));
    assertEquals("c".hashCode(), m.get("c"));
    assertEquals("a".hashCode(), m.get("a"));
    assertEquals("ee".hashCode(), m.get("ee"));
    assertNull(m.put("b", 0));
    assertEquals(0, m.get("b"));
  }

  @Test void testCustomEquality() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>(
        0, k -> k.toLowerCase().hashCode(), (a, b) -> a.equalsIgnoreCase(b), GrowthPolicy.powerOfTwo());
    m.put("Key", 1);
    assertEquals(1, m.put("KEY", 2));
    assertEquals(1, m.size());
    assertEquals(2, m.get("key"));
  }

  @Test void testInsertOverwrite() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertNull(m.put("a", 1));
    assertEquals(1, m.put("a", 2));
    assertEquals(2, m.get("a"));
    assertEquals(1, m.size());
  }

  @Test void testPutIfAbsent() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertNull(m.putIfAbsent("a", 1));
    assertEquals(1, m.putIfAbsent("a", 2));
    assertEquals(1, m.get("a"));

    m.put("b", null);
    assertTrue(m.containsKey("b"));
    assertNull(m.putIfAbsent("b", 3));
    assertEquals(3, m.get("b"));
  }

  @Test void testNullValues() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertNull(m.put("a", null));
    assertTrue(m.containsKey("a"));
    assertNull(m.getOrDefault("a", 5));
    assertEquals(5, m.getOrDefault("b", 5));
    assertTrue(m.containsValue(null));
  }

  @Test void testNullKeys() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertThrows(NullPointerException.class, () -> m.put(null, 1));
    assertFalse(m.containsKey(null));
    assertNull(m.get(null));
    assertNull(m.remove(null));
    assertTrue(m.isEmpty());
  }

  @Test void testAt() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>();
    m.put("a", 1);
    assertEquals(1, m.at("a"));
    NoSuchElementException e = assertThrows(NoSuchElementException.class, () -> m.at("b"));
    assertEquals("key not present: b", e.getMessage());
  }

  @Test void testReplace() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertNull(m.replace("a", 1));
    assertFalse(m.containsKey("a"));
    m.put("a", 1);
    assertEquals(1, m.replace("a", 2));
    assertEquals(2, m.get("a"));
  }

  @Test void testIsEmpty() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertTrue(m.isEmpty());
    m.put("a", 1);
    assertFalse(m.isEmpty());
    assertEquals(1, m.remove("a"));
    assertTrue(m.isEmpty());
  }

  @Test void testClearKeepsCapacity() {
    RobinHoodMap<String, List<Integer>> m = filled(8);
    int capacity = m.capacity();
    m.clear();
    assertTrue(m.isEmpty());
    assertEquals(capacity, m.capacity());
    assertNull(m.get("3"));
  }

  @Test void testEmptyIterators() {
    Map<String, Integer> m = new RobinHoodMap<>();
    assertFalse(m.keySet().iterator().hasNext());
    assertFalse(m.values().iterator().hasNext());
    assertFalse(m.entrySet().iterator().hasNext());
  }

  @Test void testEntryIterator() {
    RobinHoodMap<String, List<Integer>> m = filled(8);
    long observed = 0;
    for (Entry<String, List<Integer>> e : m.entrySet()) {
      int k = Integer.parseInt(e.getKey());
      assertEquals(VALUES.get(k), e.getValue());
      long mask = 1L << k;
      assertEquals(0L, observed & mask, String.format("unexpected second occurence of %s", e.getKey()));
      observed |= mask;
    }
    assertEquals(0xFFFF_FFFFL, observed);
  }

  @Test void testEntryIteratorMutating() {
    RobinHoodMap<String, List<Integer>> m = filled(8);
    for (Iterator<Entry<String, List<Integer>>> it = m.entrySet().iterator(); it.hasNext(); ) {
      Entry<String, List<Integer>> e = it.next();
      if (Integer.parseInt(e.getKey()) % 2 == 0) {
        it.remove();
      }
    }
    assertEquals(16, m.size());

    long observed = 0;
    for (Entry<String, List<Integer>> e : m.entrySet()) {
      int k = Integer.parseInt(e.getKey());
      long mask = 1L << k;
      assertEquals(0L, observed & mask, String.format("unexpected second occurence of %s", e.getKey()));
      observed |= mask;
      e.setValue(reversed(e.getValue()));
    }
    assertEquals(0xAAAA_AAAAL, observed);

    for (int k = 1; k < 32; k += 2) {
      assertEquals(reversed(VALUES.get(k)), m.get(Integer.toString(k)));
    }
  }

  @Test void testKeySet() {
    RobinHoodMap<String, List<Integer>> m = filled(0);
    assertEquals(32, m.keySet().size());
    assertTrue(m.keySet().contains("31"));
    assertFalse(m.keySet().contains("32"));
    assertTrue(m.keySet().remove("31"));
    assertFalse(m.keySet().remove("31"));
    assertFalse(m.containsKey("31"));

    for (Iterator<String> it = m.keySet().iterator(); it.hasNext(); ) {
      if (it.next().length() == 2) {
        it.remove();
      }
    }
    assertEquals(10, m.size());
    m.keySet().clear();
    assertTrue(m.isEmpty());
  }

  @Test void testKeyIterator() {
    RobinHoodMap<String, List<Integer>> m = filled(8);
    long observed = 0;
    for (String k : m.keySet()) {
      long mask = 1L << Integer.parseInt(k);
      assertEquals(0L, observed & mask, String.format("unexpected second occurence of %s", k));
      observed |= mask;
    }
    assertEquals(0xFFFF_FFFFL, observed);
  }

  @Test void testEntrySet() {
    RobinHoodMap<String, List<Integer>> m = filled(0);
    assertTrue(m.entrySet().contains(Map.entry("5", VALUES.get(5))));
    assertFalse(m.entrySet().contains(Map.entry("5", VALUES.get(6))));
    assertFalse(m.entrySet().contains("5"));
    assertFalse(m.entrySet().remove(Map.entry("5", VALUES.get(6))));
    assertTrue(m.entrySet().remove(Map.entry("5", VALUES.get(5))));
    assertEquals(31, m.entrySet().size());
  }

  @Test void testReplaceAll() {
    RobinHoodMap<String, List<Integer>> m = filled(8);
    m.replaceAll((_k, v) -> reversed(v));
    for (int k = 0; k < 32; k++) {
      assertEquals(reversed(VALUES.get(k)), m.get(Integer.toString(k)));
    }
  }

  @Test void testRemoveEntry() {
    Map<String, Integer> m = new RobinHoodMap<>();
    m.put("a", 1);
    assertFalse(m.remove("a", 2));
    assertTrue(m.remove("a", 1));
    assertNull(m.get("a"));
  }

  @Test void testReplaceEntry() {
    Map<String, Integer> m = new RobinHoodMap<>();
    m.put("a", 1);
    assertFalse(m.replace("a", 2, 3));
    assertTrue(m.replace("a", 1, 3));
    assertEquals(3, m.get("a"));
  }

  @Test void testEquals() {
    Map<String, Integer> m = new RobinHoodMap<>();
    Map<String, Integer> m2 = new RobinHoodMap<>(64);
    assertFalse(m.equals(null));
    m.put("a", 1);
    m.put("bb", 2);
    m.put("ccc", 3);
    m2.put("ccc", 3);
    m2.put("a", 1);
    assertFalse(m.equals(m2));
    m2.put("bb", 2);
    assertTrue(m.equals(m2));
    assertEquals(m.hashCode(), m2.hashCode());
    assertEquals(new HashMap<>(m), m);
    assertEquals(m, new HashMap<>(m));
  }

  @Test void testComputeIfs() {
    Map<String, Integer> m = new RobinHoodMap<>(8);
    m.putAll(Map.of("a", 1, "bb", 2, "ccc", 3, "dddd", 4));

    // update
    Integer computed = m.computeIfPresent("a", (k, v) -> {
      assertEquals("a", k);
      assertEquals(1, v);
      return 10;
    });
    assertEquals(10, computed);
    assertEquals(10, m.get("a"));

    // removal
    computed = m.computeIfPresent("bb", (k, v) -> null);
    assertNull(computed);
    assertFalse(m.containsKey("bb"));
    assertEquals(3, m.size());

    // present, so the function isn't called
    computed = m.computeIfAbsent("ccc", (k) -> {
      fail("unreachable");
      return 30;
    });
    assertEquals(3, computed);
    assertEquals(3, m.size());

    computed = m.computeIfPresent("eeeee", (_k, _v) -> {
      fail("unreachable");
      return 50;
    });
    assertNull(computed);

    // null result isn't inserted
    assertNull(m.computeIfAbsent("eeeee", (k) -> null));
    assertFalse(m.containsKey("eeeee"));

    assertEquals(5, m.computeIfAbsent("eeeee", String::length));
    assertEquals(5, m.get("eeeee"));
    assertEquals(4, m.size());
  }

  @Test void testCompute() {
    Map<String, Integer> m = new RobinHoodMap<>(8);
    m.putAll(Map.of("a", 1, "bb", 2));

    assertEquals(2, m.compute("a", (k, v) -> v + 1));
    assertNull(m.compute("bb", (k, v) -> null));
    assertFalse(m.containsKey("bb"));
    assertNull(m.compute("ccc", (k, v) -> {
      assertNull(v);
      return null;
    }));
    assertFalse(m.containsKey("ccc"));
    assertEquals(3, m.compute("ccc", (k, v) -> k.length()));
    assertEquals(2, m.size());
  }

  @Test void testMerge() {
    Map<String, Integer> m = new RobinHoodMap<>(8);
    m.putAll(Map.of("a", 1, "bb", 2));
    BiFunction<Integer, Integer, Integer> sum = (v1, v2) -> v1 + v2;

    assertEquals(11, m.merge("a", 10, sum));
    assertEquals(12, m.merge("bb", 10, sum));
    assertEquals(10, m.merge("ccc", 10, (_v1, _v2) -> {
      fail("unreachable");
      return 0;
    }));
    assertEquals(3, m.size());
    assertNull(m.merge("a", 10, (_v1, _v2) -> null));
    assertEquals(2, m.size());
  }

  @Test void testReserve() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>();
    m.put("a", 1);
    m.reserve(1000);
    assertEquals(1024, m.capacity());
    assertEquals(1, m.get("a"));
    assertEquals(1f / 1024, m.loadFactor());
  }

  @Test void testMaxLoadFactor() {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>(8);
    m.maxLoadFactor(1.0f);
    assertEquals(1.0f, m.maxLoadFactor());
    for (int i = 0; i < 8; i++) {
      m.put(Integer.toString(i), i);
    }
    assertEquals(8, m.capacity());
    m.put("8", 8);
    assertEquals(16, m.capacity());
    assertThrows(IllegalArgumentException.class, () -> m.maxLoadFactor(0f));
  }

  @Test void testCopy() {
    RobinHoodMap<String, List<Integer>> m = filled(0);
    m.maxLoadFactor(0.75f);
    RobinHoodMap<String, List<Integer>> copy = m.copy();
    assertEquals(m, copy);
    assertEquals(m.capacity(), copy.capacity());
    assertEquals(0.75f, copy.maxLoadFactor());

    copy.put("0", List.of());
    copy.remove("1");
    assertEquals(VALUES.get(0), m.get("0"));
    assertTrue(m.containsKey("1"));
  }

  @Test void testSwap() {
    RobinHoodMap<String, Integer> a = new RobinHoodMap<>();
    RobinHoodMap<String, Integer> b = new RobinHoodMap<>();
    a.put("a", 1);
    b.put("b", 2);
    b.put("c", 3);
    a.swap(b);
    assertEquals(Map.of("b", 2, "c", 3), a);
    assertEquals(Map.of("a", 1), b);
  }
}
