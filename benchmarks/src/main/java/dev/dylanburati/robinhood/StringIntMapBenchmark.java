package dev.dylanburati.robinhood;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

@State(Scope.Benchmark)
public class StringIntMapBenchmark {
  @Param({"10000000"})
  public int wordCount;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedRobinHoodMap(Blackhole bh) {
    bh.consume(wordcountSimulated(new RobinHoodMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedRobinHoodMapPrimes(Blackhole bh) {
    bh.consume(wordcountSimulated(new RobinHoodMap<>(0, Hasher.standard(), KeyEquality.standard(), GrowthPolicy.primes())));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedHashMap(Blackhole bh) {
    bh.consume(wordcountSimulated(new HashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedObject2IntMap(Blackhole bh) {
    bh.consume(wordcountSimulated(new Object2IntOpenHashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void insertThenEraseRobinHoodMap(Blackhole bh) {
    RobinHoodMap<String, Integer> m = new RobinHoodMap<>();
    m.maxLoadFactor(0.9f);
    bh.consume(insertThenErase(m));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void insertThenEraseHashMap(Blackhole bh) {
    bh.consume(insertThenErase(new HashMap<>()));
  }

  // heavy-tailed ids, so a few words repeat often and most are rare
  private static int wordId(Random r) {
    double id = Math.pow(1.0 - r.nextDouble(), -1.0 / 0.35);
    return (int) Math.min(id, 1 << 27);
  }

  public int wordcountSimulated(Map<String, Integer> m) {
    Random r = new Random(0L);
    for (int i = 0; i < this.wordCount; i++) {
      String word = Integer.toString(wordId(r), 36);
      m.merge(word, 1, (v1, v2) -> v1 + v2);
    }
    return m.size();
  }

  // exercises backward-shift deletion, which the word count never does
  public int insertThenErase(Map<String, Integer> m) {
    int n = this.wordCount / 10;
    for (int i = 0; i < n; i++) {
      m.put(Integer.toString(i), i);
    }
    int removed = 0;
    for (int i = 0; i < n; i += 2) {
      if (m.remove(Integer.toString(i)) != null) {
        removed++;
      }
    }
    return removed + m.size();
  }
}
