package io.github.unitable;

import java.util.AbstractMap;

import org.jspecify.annotations.Nullable;

/**
 * Shared array-backed Map boilerplate: capacity bookkeeping and load thresholds.
 */
abstract class AbstractArrayMap<K, V> extends AbstractMap<K, V> {

	protected final int initialCapacity;
	protected final double maxLoadFactor;
	protected final double minLoadFactor;

	protected int capacity;
	protected int size;
	protected int maxLoad;

	protected AbstractArrayMap(int initialCapacity, double maxLoadFactor, double minLoadFactor) {
		Utils.validateCapacity("initialCapacity", initialCapacity);
		Utils.validateLoadFactors(maxLoadFactor, minLoadFactor);
		this.initialCapacity = initialCapacity;
		this.maxLoadFactor = maxLoadFactor;
		this.minLoadFactor = minLoadFactor;
		init(initialCapacity);
	}

	@Override
	public boolean containsKey(Object key) {
		return findIndex(key) >= 0;
	}

	@Override
	public @Nullable V get(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? valueAt(idx) : null;
	}

	/* Hooks for subclasses */
	protected abstract void init(int initialCapacity);
	protected abstract int findIndex(Object key);
	protected abstract V valueAt(int idx);

	/* Common utilities */
	protected int calcMaxLoad(int cap) {
		return Utils.calcMaxLoad(cap, maxLoadFactor);
	}

	/**
	 * (start, step) generator to visit every slot in a power-of-two table.
	 */
	protected static final class RandomCycle extends Utils.RandomCycle {
		RandomCycle(int capacity) { super(capacity); }
	}
}
