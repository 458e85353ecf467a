package io.github.unitable;

/**
 * Digest functions for table keys and the digest-to-bucket mapping.
 * Every digest is a pure function of the key's logical value.
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Knuth multiplicative constant: nearest odd integer to 2^32 / golden ratio
	 * (2654435769).
	 */
	static final int KNUTH_MULTIPLIER = 0x9E3779B9;

	/* DJB2 seed (Dan Bernstein). */
	static final long DJB2_SEED = 5381L;

	/*
	 * Upper bound to keep table size as a power of two.
	 * Matches Guava's Ints.MAX_POWER_OF_TWO (1 << 30).
	 */
	static final int MAX_TABLE_SIZE = 1 << 30;

	/**
	 * 32-bit Knuth multiplicative hash, widened to an unsigned digest.
	 * Sequential keys land in distinct buckets for any power-of-two table.
	 */
	static long knuth(int key) {
		return Integer.toUnsignedLong(key * KNUTH_MULTIPLIER);
	}

	/**
	 * DJB2 over every byte of the input: {@code h = h * 33 + b}, bytes taken unsigned.
	 */
	static long djb2(byte[] data) {
		long h = DJB2_SEED;
		for (byte b : data) {
			h = ((h << 5) + h) + (b & 0xFF);
		}
		return h;
	}

	/**
	 * Maps a digest to a bucket of a power-of-two table.
	 */
	static int bucket(long digest, int capacity) {
		return (int) (digest & (capacity - 1));
	}
}
