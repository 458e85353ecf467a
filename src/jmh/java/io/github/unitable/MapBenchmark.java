package io.github.unitable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(
    value=1,
    jvmArgsAppend = {
//        "-Xms1g",
//        "-Xmx1g",
//        "-XX:+AlwaysPreTouch",
    }
)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	private static final Value DUMMY = Value.ofInt32(42);

	/**
	 * Half string keys, half integer keys.
	 */
	private static Key randomKey(Random rnd) {
		return rnd.nextBoolean()
			? Key.of(new UUID(rnd.nextLong(), rnd.nextLong()).toString())
			: Key.of(rnd.nextInt());
	}

	/**
	 * Generates keys and miss-keys such that:
	 * - keys are unique
	 * - misses are unique
	 * - misses never overlap with keys
	 */
	private static void generateKeysAndMisses(Random rnd, Key[] keys, Key[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		int size = keys.length;
		var set = new HashSet<Key>(size * 4);
		for (int i = 0; i < size; i++) {
			Key k;
			do { k = randomKey(rnd); } while (!set.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < size; i++) {
			Key miss;
			do { miss = randomKey(rnd); } while (!set.add(miss));
			misses[i] = miss;
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "12000", "48000", "196000", "784000" }) // load factor equals to 74.x% (right before resizing)
		int size;

		UniversalHashTable table;
		Object2ObjectOpenHashMap<Key, Value> fastutil;
		UnifiedMap<Key, Value> unified;
		HashMap<Key, Value> jdk;
		Key[] keys;
		Key[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			keys = new Key[size];
			misses = new Key[size];
			generateKeysAndMisses(new Random(123), keys, misses);
			nextKeyIndex = 0;
			nextMissIndex = 0;
			table = new UniversalHashTable();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.insert(keys[i], DUMMY);
				fastutil.put(keys[i], DUMMY);
				unified.put(keys[i], DUMMY);
				jdk.put(keys[i], DUMMY);
			}
		}

		@TearDown(Level.Trial)
		public void tearDown() {
			table.destroy();
		}

		Key nextHitKey() {
			var k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}

		Key nextMissingKey() {
			var k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	@State(Scope.Thread)
	public static class PutHitState {
		@Param({ "12000", "48000", "196000", "784000" })
		int size;

		int idx;
		Key[] keys;
		Key[] misses;
		UniversalHashTable table;
		Object2ObjectOpenHashMap<Key, Value> fastutil;
		UnifiedMap<Key, Value> unified;
		HashMap<Key, Value> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			keys = new Key[size];
			misses = new Key[size];
			generateKeysAndMisses(new Random(456), keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			idx = 0;
			table = new UniversalHashTable();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.insert(keys[i], DUMMY);
				fastutil.put(keys[i], DUMMY);
				unified.put(keys[i], DUMMY);
				jdk.put(keys[i], DUMMY);
			}
		}

		Key nextHitKey() {
			var k = keys[idx];
			idx = (idx + 1) % keys.length;
			return k;
		}
	}

	/**
	 * Keeps entry count constant at n by doing the compensating remove
	 * in {@code @Setup(Level.Invocation)} (excluded from measurement).
	 */
	@State(Scope.Thread)
	public static class PutMissState {
		@Param({ "12000", "48000", "196000", "784000" })
		int size;

		int idx;
		Key[] keys;   // keys currently present in the maps
		Key[] misses; // keys currently absent from the maps
		Key nextKey;

		UniversalHashTable table;
		Object2ObjectOpenHashMap<Key, Value> fastutil;
		UnifiedMap<Key, Value> unified;
		HashMap<Key, Value> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			keys = new Key[size];
			misses = new Key[size];
			generateKeysAndMisses(new Random(456), keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			idx = 0;
			table = new UniversalHashTable();
			fastutil = new Object2ObjectOpenHashMap<>();
			unified = new UnifiedMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				table.insert(keys[i], DUMMY);
				fastutil.put(keys[i], DUMMY);
				unified.put(keys[i], DUMMY);
				jdk.put(keys[i], DUMMY);
			}
		}

		/**
		 * Removes one present key and swaps it with a missing one, so the next
		 * invocation inserts into a table of n-1 entries.
		 */
		@Setup(Level.Invocation)
		public void beforeInvocation() {
			Key evictKey = keys[idx];
			table.delete(evictKey);
			fastutil.remove(evictKey);
			unified.remove(evictKey);
			jdk.remove(evictKey);

			nextKey = misses[idx];
			keys[idx] = nextKey;
			misses[idx] = evictKey;

			idx = (idx + 1) % keys.length;
		}

		Key nextMissKey() { return nextKey; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public void tableGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.table.lookup(s.nextHitKey()));
	}

	@Benchmark
	public void fastutilGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextHitKey()));
	}

	@Benchmark
	public void unifiedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.unified.get(s.nextHitKey()));
	}

	@Benchmark
	public void jdkGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextHitKey()));
	}

	@Benchmark
	public void tableGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.table.lookup(s.nextMissingKey()));
	}

	@Benchmark
	public void fastutilGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextMissingKey()));
	}

//	@Benchmark
	public void unifiedGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.unified.get(s.nextMissingKey()));
	}

	@Benchmark
	public void jdkGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextMissingKey()));
	}

	// ------- mutating: put hit/miss -------
	@Benchmark
	public void tablePutHit(PutHitState s, Blackhole bh) {
		bh.consume(s.table.insert(s.nextHitKey(), DUMMY));
	}

	@Benchmark
	public void jdkPutHit(PutHitState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextHitKey(), DUMMY));
	}

	@Benchmark
	public void tablePutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.table.insert(s.nextMissKey(), DUMMY));
	}

	@Benchmark
	public void fastutilPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.fastutil.put(s.nextMissKey(), DUMMY));
	}

	@Benchmark
	public void unifiedPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.unified.put(s.nextMissKey(), DUMMY));
	}

	@Benchmark
	public void jdkPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextMissKey(), DUMMY));
	}

	@Benchmark
	public void tableIterate(ReadState s, Blackhole bh) {
		for (var e : s.table.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}

	@Benchmark
	public void jdkIterate(ReadState s, Blackhole bh) {
		for (var e : s.jdk.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}
}
