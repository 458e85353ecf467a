package io.github.unitable;

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open-addressing hash table from {@link Key}s to {@link Value}s
 * (null keys and null values NOT allowed).
 * Linear probing, null-sentinel empty slots, backward-shift deletion without tombstones.
 *
 * <p>Capacity is always a power of two and never drops below the initial capacity.
 * The table doubles before an insert of a new key would push {@code size / capacity}
 * above the max load factor, and halves after a removal leaves it below the min load
 * factor.
 *
 * <p>Not thread-safe: every operation, reads included, must be serialized by the caller.
 * No operation hands out slot indexes or internal arrays.
 */
public class UniversalHashTable extends AbstractArrayMap<Key, Value> implements AutoCloseable {

	private static final Logger LOG = LoggerFactory.getLogger(UniversalHashTable.class);

	/* Defaults */
	static final int DEFAULT_INITIAL_CAPACITY = 16;
	static final double DEFAULT_MAX_LOAD_FACTOR = 0.75d;
	static final double DEFAULT_MIN_LOAD_FACTOR = 0.25d;
	static final int DEFAULT_MAXIMUM_CAPACITY = Hashing.MAX_TABLE_SIZE;

	/* Storage: keys[i] == null marks an empty slot */
	private Key[] keys;
	private Value[] vals;

	private final int maximumCapacity;
	private boolean destroyed;

	public UniversalHashTable() {
		this(DEFAULT_INITIAL_CAPACITY);
	}

	public UniversalHashTable(int initialCapacity) {
		this(initialCapacity, DEFAULT_MAX_LOAD_FACTOR);
	}

	public UniversalHashTable(int initialCapacity, double maxLoadFactor) {
		this(initialCapacity, maxLoadFactor, Math.min(DEFAULT_MIN_LOAD_FACTOR, maxLoadFactor / 3));
	}

	public UniversalHashTable(int initialCapacity, double maxLoadFactor, double minLoadFactor) {
		this(initialCapacity, maxLoadFactor, minLoadFactor, DEFAULT_MAXIMUM_CAPACITY);
	}

	UniversalHashTable(int initialCapacity, double maxLoadFactor, double minLoadFactor, int maximumCapacity) {
		super(initialCapacity, maxLoadFactor, minLoadFactor);
		Utils.validateCapacity("maximumCapacity", maximumCapacity);
		if (maximumCapacity < initialCapacity) {
			throw new IllegalArgumentException(
				"maximumCapacity " + maximumCapacity + " is below initialCapacity " + initialCapacity);
		}
		this.maximumCapacity = maximumCapacity;
	}

	public static UniversalHashTable create() {
		return new UniversalHashTable();
	}

	public static UniversalHashTable create(int initialCapacity, double maxLoadFactor, double minLoadFactor) {
		return new UniversalHashTable(initialCapacity, maxLoadFactor, minLoadFactor);
	}

	public static HashTableBuilder builder() {
		return new HashTableBuilder();
	}

	@Override
	protected void init(int initialCapacity) {
		this.keys = allocateKeys(initialCapacity);
		this.vals = allocateValues(initialCapacity);
		this.capacity = initialCapacity;
		this.size = 0;
		this.maxLoad = calcMaxLoad(initialCapacity);
	}

	/* ------------ Insert / lookup / remove ------------ */

	/**
	 * Associates {@code value} with {@code key}, replacing and returning the previous value
	 * when the key is already present. A new key may first grow the table.
	 *
	 * @return the replaced value, or {@code null} if the key was absent
	 * @throws NullPointerException if {@code key} or {@code value} is null
	 * @throws CapacityOverflowException if the table is full at its maximum capacity
	 * @throws TableAllocationException if the grown bucket arrays cannot be allocated
	 */
	public @Nullable Value insert(Key key, Value value) {
		ensureOpen();
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");

		int idx = probe(key);
		if (keys[idx] != null) {
			Value old = vals[idx];
			vals[idx] = value.retain();
			return old;
		}
		if (size + 1 > maxLoad) {
			grow();
			idx = probe(key);
		}
		keys[idx] = key;
		vals[idx] = value.retain();
		size++;
		return null;
	}

	@Override
	public @Nullable Value put(Key key, Value value) {
		return insert(key, value);
	}

	/**
	 * Stored value for {@code key}, or {@code null} if absent.
	 */
	public @Nullable Value lookup(Key key) {
		return get(Objects.requireNonNull(key, "key"));
	}

	@Override
	public @Nullable Value remove(Object key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		Value old = vals[idx];
		deleteAt(idx);
		maybeShrink();
		return old;
	}

	/**
	 * Removes {@code key}.
	 *
	 * @return {@code false} if the key was absent
	 */
	public boolean delete(Key key) {
		return remove(Objects.requireNonNull(key, "key")) != null;
	}

	@Override
	public boolean containsValue(Object value) {
		ensureOpen();
		if (!(value instanceof Value)) return false;
		for (int i = 0; i < capacity; i++) {
			if (keys[i] != null && vals[i].equals(value)) return true;
		}
		return false;
	}

	/**
	 * Drops every entry and resets capacity to the initial capacity.
	 */
	@Override
	public void clear() {
		ensureOpen();
		if (capacity != initialCapacity) {
			Key[] freshKeys = allocateKeys(initialCapacity);
			Value[] freshVals = allocateValues(initialCapacity);
			LOG.debug("Clear resets capacity {} -> {}", capacity, initialCapacity);
			this.keys = freshKeys;
			this.vals = freshVals;
			this.capacity = initialCapacity;
			this.maxLoad = calcMaxLoad(initialCapacity);
		} else {
			Arrays.fill(keys, null);
			Arrays.fill(vals, null);
		}
		size = 0;
	}

	/**
	 * Releases the bucket arrays. Every later operation fails with
	 * {@link IllegalStateException}. Calling it again has no effect.
	 */
	public void destroy() {
		if (destroyed) return;
		LOG.debug("Destroying table with capacity {} and {} entries", capacity, size);
		keys = null;
		vals = null;
		size = 0;
		capacity = 0;
		maxLoad = 0;
		destroyed = true;
	}

	@Override
	public void close() {
		destroy();
	}

	public boolean isDestroyed() {
		return destroyed;
	}

	@Override
	public int size() {
		ensureOpen();
		return size;
	}

	@Override
	public boolean isEmpty() {
		ensureOpen();
		return size == 0;
	}

	@Override
	public Set<Map.Entry<Key, Value>> entrySet() {
		ensureOpen();
		return new EntrySet();
	}

	/* ------------ Introspection ------------ */

	public int capacity() {
		ensureOpen();
		return capacity;
	}

	public int initialCapacity() {
		ensureOpen();
		return initialCapacity;
	}

	public int maximumCapacity() {
		ensureOpen();
		return maximumCapacity;
	}

	public double maxLoadFactor() {
		ensureOpen();
		return maxLoadFactor;
	}

	public double minLoadFactor() {
		ensureOpen();
		return minLoadFactor;
	}

	/** Current {@code size / capacity}. */
	public double loadFactor() {
		ensureOpen();
		return (double) size / capacity;
	}

	/* ------------ Probing ------------ */

	/**
	 * Slot holding {@code key}, or the first empty slot of its probe chain.
	 * Terminates because the table always keeps at least one empty slot.
	 */
	private int probe(Key key) {
		int mask = capacity - 1;
		int idx = Hashing.bucket(key.digest(), capacity);
		for (;;) {
			Key k = keys[idx];
			if (k == null || k.equals(key)) return idx;
			idx = (idx + 1) & mask;
		}
	}

	@Override
	protected int findIndex(Object key) {
		ensureOpen();
		if (key == null) throw new NullPointerException("Null keys not supported");
		if (!(key instanceof Key k)) return -1;
		int idx = probe(k);
		return keys[idx] != null ? idx : -1;
	}

	@Override
	protected Value valueAt(int idx) {
		return vals[idx];
	}

	/**
	 * Empties {@code idx}, then re-places every entry of the run that follows it so no
	 * probe chain crosses the new hole.
	 */
	private void deleteAt(int idx) {
		int mask = capacity - 1;
		keys[idx] = null;
		vals[idx] = null;
		size--;

		int cur = (idx + 1) & mask;
		while (keys[cur] != null) {
			Key k = keys[cur];
			Value v = vals[cur];
			keys[cur] = null;
			vals[cur] = null;

			int slot = Hashing.bucket(k.digest(), capacity);
			while (keys[slot] != null) {
				slot = (slot + 1) & mask;
			}
			keys[slot] = k;
			vals[slot] = v;
			cur = (cur + 1) & mask;
		}
	}

	/* ------------ Resize / rehash ------------ */

	/**
	 * Doubles capacity until {@code size + 1} entries fit under the max load factor,
	 * then rehashes once.
	 */
	private void grow() {
		int newCapacity = capacity;
		while (size + 1 > calcMaxLoad(newCapacity)) {
			if (newCapacity >= maximumCapacity) {
				LOG.warn("Cannot grow table past maximum capacity {} (size {})", maximumCapacity, size);
				throw new CapacityOverflowException(maximumCapacity);
			}
			newCapacity <<= 1;
		}
		LOG.debug("Growing table {} -> {} at size {}", capacity, newCapacity, size);
		rehash(newCapacity);
	}

	private void maybeShrink() {
		if (capacity <= initialCapacity || !Utils.belowLoad(size, capacity, minLoadFactor)) return;
		int newCapacity = capacity >>> 1;
		if (size > calcMaxLoad(newCapacity)) {
			LOG.debug("Skipping shrink {} -> {}: {} entries would exceed max load", capacity, newCapacity, size);
			return;
		}
		LOG.debug("Shrinking table {} -> {} at size {}", capacity, newCapacity, size);
		try {
			rehash(newCapacity);
		} catch (TableAllocationException e) {
			LOG.warn("Shrink {} -> {} failed, keeping current capacity", capacity, newCapacity, e);
		}
	}

	/**
	 * Moves every live entry, in old slot order, into fresh arrays of {@code newCapacity}.
	 * The old arrays stay installed until the move is complete.
	 */
	private void rehash(int newCapacity) {
		Key[] newKeys = allocateKeys(newCapacity);
		Value[] newVals = allocateValues(newCapacity);
		int mask = newCapacity - 1;

		for (int i = 0; i < keys.length; i++) {
			Key k = keys[i];
			if (k == null) continue;
			int idx = Hashing.bucket(k.digest(), newCapacity);
			while (newKeys[idx] != null) {
				idx = (idx + 1) & mask;
			}
			newKeys[idx] = k;
			newVals[idx] = vals[i];
		}

		this.keys = newKeys;
		this.vals = newVals;
		this.capacity = newCapacity;
		this.maxLoad = calcMaxLoad(newCapacity);
	}

	/** Allocation hook for the key slots. */
	Key[] newKeyArray(int capacity) {
		return new Key[capacity];
	}

	/** Allocation hook for the value slots. */
	Value[] newValueArray(int capacity) {
		return new Value[capacity];
	}

	private Key[] allocateKeys(int capacity) {
		try {
			return newKeyArray(capacity);
		} catch (OutOfMemoryError e) {
			LOG.warn("Failed to allocate {} key slots", capacity);
			throw new TableAllocationException(capacity, e);
		}
	}

	private Value[] allocateValues(int capacity) {
		try {
			return newValueArray(capacity);
		} catch (OutOfMemoryError e) {
			LOG.warn("Failed to allocate {} value slots", capacity);
			throw new TableAllocationException(capacity, e);
		}
	}

	private void ensureOpen() {
		if (destroyed) throw new IllegalStateException("table has been destroyed");
	}

	/* ------------ EntrySet / Iterator ------------ */

	/**
	 * Live keys in a scrambled slot order.
	 */
	private Key[] snapshotKeys() {
		Key[] out = new Key[size];
		RandomCycle cycle = new RandomCycle(capacity);
		int n = 0;
		for (int i = 0; i < capacity; i++) {
			Key k = keys[cycle.indexAt(i)];
			if (k != null) out[n++] = k;
		}
		return out;
	}

	private final class EntrySet extends AbstractSet<Map.Entry<Key, Value>> {
		@Override
		public int size() {
			return UniversalHashTable.this.size;
		}

		@Override
		public void clear() {
			UniversalHashTable.this.clear();
		}

		@Override
		public Iterator<Map.Entry<Key, Value>> iterator() {
			return new EntryIterator();
		}
	}

	/**
	 * Walks the keys present at creation, so backward shifts and shrinks caused by
	 * {@link #remove()} cannot skip or repeat entries.
	 */
	private final class EntryIterator implements Iterator<Map.Entry<Key, Value>> {
		private final Key[] snapshot;
		private int pos;
		private @Nullable Key lastKey;

		EntryIterator() {
			ensureOpen();
			this.snapshot = snapshotKeys();
		}

		@Override
		public boolean hasNext() {
			return pos < snapshot.length;
		}

		@Override
		public Map.Entry<Key, Value> next() {
			if (pos >= snapshot.length) throw new NoSuchElementException();
			lastKey = snapshot[pos++];
			return new EntryView(lastKey);
		}

		@Override
		public void remove() {
			Key key = lastKey;
			if (key == null) throw new IllegalStateException();
			UniversalHashTable.this.remove(key);
			lastKey = null;
		}
	}

	private final class EntryView implements Map.Entry<Key, Value> {
		private final Key key;
		// value seen on the last read; reported once the key has been removed
		private @Nullable Value last;

		EntryView(Key key) {
			this.key = key;
			this.last = UniversalHashTable.this.get(key);
		}

		@Override
		public Key getKey() {
			return key;
		}

		@Override
		public @Nullable Value getValue() {
			Value v = UniversalHashTable.this.get(key);
			if (v != null) last = v;
			return last;
		}

		@Override
		public @Nullable Value setValue(Value value) {
			Value old = UniversalHashTable.this.insert(key, value);
			last = value;
			return old;
		}

		@Override
		public int hashCode() {
			Value v = getValue();
			return key.hashCode() ^ (v == null ? 0 : v.hashCode());
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return key.equals(e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}
}
