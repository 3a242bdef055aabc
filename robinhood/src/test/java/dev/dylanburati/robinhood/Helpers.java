package dev.dylanburati.robinhood;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  /** Hasher that looks keys up in a fixed table, for forcing collisions. */
  public static <K> Hasher<K> fixedHasher(Map<K, Long> hashes) {
    return key -> {
      Long h = hashes.get(key);
      assertNotNull(h, "no hash for " + key);
      return h;
    };
  }

  /**
   * Checks the table's slot invariants: size matches occupancy, no gaps
   * between a value and its home slot, distances grow by at most one from
   * slot to slot, and every stored key is found by lookup.
   */
  public static <K, T> void assertInvariants(HashTable<K, T> table, Function<T, K> keySelector) {
    int cap = table.capacity();
    int occupied = 0;
    for (int i = 0; i < cap; i++) {
      Slot<T> slot = table.slotAt(i);
      if (slot.isEmpty()) {
        continue;
      }
      occupied++;
      int d = table.distance(i);
      assertTrue(d >= 0 && d < cap, String.format("slot %d has distance %d, capacity %d", i, d, cap));
      for (int j = table.homeIndex(slot.hash()); j != i; j = (j + 1) % cap) {
        assertFalse(table.slotAt(j).isEmpty(), String.format("gap at %d before slot %d", j, i));
      }
      int next = (i + 1) % cap;
      if (next != i && !table.slotAt(next).isEmpty()) {
        assertTrue(table.distance(next) <= d + 1, String.format("distance jumps from %d to %d at slot %d", d, table.distance(next), next));
      }
      K key = keySelector.apply(slot.value());
      assertEquals(i, table.find(key).index(), "lookup of " + key);
    }
    assertEquals(table.size(), occupied);
    assertTrue(table.size() <= cap);
  }
}
