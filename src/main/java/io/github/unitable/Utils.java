package io.github.unitable;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared utilities for open-addressed structures.
 */
final class Utils {
	private Utils() {}

	/**
	 * Largest entry count with {@code count / cap <= loadFactor}. Always below {@code cap}
	 * because the load factor is below one.
	 */
	static int calcMaxLoad(int cap, double loadFactor) {
		return (int) (cap * loadFactor);
	}

	static boolean isPowerOfTwo(int x) {
		return x > 0 && (x & (x - 1)) == 0;
	}

	/** True when {@code entries / cap} is strictly below {@code loadFactor}. */
	static boolean belowLoad(int entries, int cap, double loadFactor) {
		return (double) entries / cap < loadFactor;
	}

	static void validateCapacity(String name, int capacity) {
		if (!isPowerOfTwo(capacity)) {
			throw new IllegalArgumentException(name + " must be a positive power of two: " + capacity);
		}
		if (capacity > Hashing.MAX_TABLE_SIZE) {
			throw new IllegalArgumentException(name + " must not exceed " + Hashing.MAX_TABLE_SIZE + ": " + capacity);
		}
	}

	static void validateLoadFactors(double maxLoadFactor, double minLoadFactor) {
		if (!(maxLoadFactor > 0.0d && maxLoadFactor < 1.0d)) {
			throw new IllegalArgumentException("maxLoadFactor must be in (0,1): " + maxLoadFactor);
		}
		if (!(minLoadFactor > 0.0d && minLoadFactor < maxLoadFactor)) {
			throw new IllegalArgumentException(
				"minLoadFactor must be in (0," + maxLoadFactor + "): " + minLoadFactor);
		}
	}

	/**
	 * (start, step) generator to visit every slot in a power-of-two table.
	 */
	static class RandomCycle {
		final int start;
		final int step;
		final int mask;

		RandomCycle(int capacity) {
			if (!isPowerOfTwo(capacity)) {
				throw new IllegalArgumentException("capacity must be a power of two");
			}
			this.mask = capacity - 1;
			ThreadLocalRandom r = ThreadLocalRandom.current();
			this.start = r.nextInt() & mask;
			this.step = r.nextInt() | 1; // odd step → full-cycle walk
		}

		int indexAt(int iteration) {
			return (start + (iteration * step)) & mask;
		}
	}
}
