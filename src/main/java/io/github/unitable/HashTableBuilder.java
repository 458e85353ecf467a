package io.github.unitable;

/**
 * Configures and creates a {@link UniversalHashTable}.
 * Obtain one with {@link UniversalHashTable#builder()}; settings are validated by {@link #build()}.
 */
public final class HashTableBuilder {

	private int initialCapacity = UniversalHashTable.DEFAULT_INITIAL_CAPACITY;
	private double maxLoadFactor = UniversalHashTable.DEFAULT_MAX_LOAD_FACTOR;
	private double minLoadFactor = UniversalHashTable.DEFAULT_MIN_LOAD_FACTOR;
	private int maximumCapacity = UniversalHashTable.DEFAULT_MAXIMUM_CAPACITY;

	HashTableBuilder() {}

	/**
	 * Starting capacity, also the floor that shrinking and {@link UniversalHashTable#clear()}
	 * return to. Must be a power of two. Defaults to 16.
	 */
	public HashTableBuilder initialCapacity(int initialCapacity) {
		this.initialCapacity = initialCapacity;
		return this;
	}

	/** Growth threshold for {@code size / capacity}, in (0, 1). Defaults to 0.75. */
	public HashTableBuilder maxLoadFactor(double maxLoadFactor) {
		this.maxLoadFactor = maxLoadFactor;
		return this;
	}

	/** Shrink threshold for {@code size / capacity}, in (0, maxLoadFactor). Defaults to 0.25. */
	public HashTableBuilder minLoadFactor(double minLoadFactor) {
		this.minLoadFactor = minLoadFactor;
		return this;
	}

	/**
	 * Largest capacity the table may grow to. Must be a power of two, at least the initial
	 * capacity and at most {@code 1 << 30} (the default).
	 */
	public HashTableBuilder maximumCapacity(int maximumCapacity) {
		this.maximumCapacity = maximumCapacity;
		return this;
	}

	/**
	 * @throws IllegalArgumentException if any setting is out of range
	 */
	public UniversalHashTable build() {
		return new UniversalHashTable(initialCapacity, maxLoadFactor, minLoadFactor, maximumCapacity);
	}
}
