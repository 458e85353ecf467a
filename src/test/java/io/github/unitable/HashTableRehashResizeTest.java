package io.github.unitable;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashTableRehashResizeTest {

	/** Table whose bucket allocation can be made to fail on demand. */
	static final class FailingAllocationTable extends UniversalHashTable {
		boolean failing;

		FailingAllocationTable() {
			super(16);
		}

		@Override
		Key[] newKeyArray(int capacity) {
			if (failing) throw new OutOfMemoryError("Java heap space");
			return super.newKeyArray(capacity);
		}
	}

	@Test
	void overMaxLoadRehashDoesResize() {
		var m = new UniversalHashTable(16);
		int cap0 = m.capacity;
		int maxLoad0 = m.maxLoad;

		// Fill up to maxLoad; the next new key grows the table before it is placed.
		for (int i = 0; i < maxLoad0; i++) m.insert(Key.of(i), Value.ofInt32(i));
		assertEquals(cap0, m.capacity);
		m.insert(Key.of(maxLoad0), Value.ofInt32(maxLoad0));

		assertEquals(cap0 * 2, m.capacity, "capacity should double when exceeding maxLoad");
		assertEquals(maxLoad0 + 1, m.size());
		for (int i = 0; i <= maxLoad0; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));
	}

	@Test
	void replacingAtThresholdDoesNotResize() {
		var m = new UniversalHashTable(16);
		for (int i = 0; i < m.maxLoad; i++) m.insert(Key.of(i), Value.ofInt32(i));

		m.insert(Key.of(0), Value.ofInt32(-1));

		assertEquals(16, m.capacity);
		assertEquals(Value.ofInt32(-1), m.get(Key.of(0)));
	}

	@Test
	void loadFactorNeverExceedsMaxAfterInsert() {
		var m = new UniversalHashTable(16, 0.5d, 0.1d);
		for (int i = 0; i < 10_000; i++) {
			m.insert(Key.of("key-" + i), Value.ofInt64(i));
			assertTrue(m.loadFactor() <= 0.5d, "load factor above max after insert " + i);
			assertEquals(0, m.capacity & (m.capacity - 1), "capacity must stay a power of two");
		}
	}

	@Test
	void growthPreservesEveryEntry() {
		var m = new UniversalHashTable(16);
		int n = 1_000;
		for (int i = 0; i < n; i++) m.insert(Key.of("s" + i), Value.ofString("v" + i));

		assertEquals(2048, m.capacity);
		assertEquals(n, m.size());
		for (int i = 0; i < n; i++) assertEquals(Value.ofString("v" + i), m.get(Key.of("s" + i)));
		assertNull(m.get(Key.of("s" + n)));
	}

	@Test
	void underMinLoadRemovalShrinks() {
		var m = new UniversalHashTable(16);
		for (int i = 0; i < 13; i++) m.insert(Key.of(i), Value.ofInt32(i));
		assertEquals(32, m.capacity);

		// 8 / 32 sits exactly at the min load factor; 7 / 32 falls below it
		for (int i = 0; i < 5; i++) m.remove(Key.of(i));
		assertEquals(32, m.capacity);
		m.remove(Key.of(5));

		assertEquals(16, m.capacity);
		assertEquals(7, m.size());
		for (int i = 0; i < 6; i++) assertNull(m.get(Key.of(i)));
		for (int i = 6; i < 13; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));
	}

	@Test
	void shrinkStopsAtInitialCapacity() {
		var m = new UniversalHashTable(16);
		for (int i = 0; i < 200; i++) m.insert(Key.of(i), Value.ofInt32(i));
		for (int i = 0; i < 200; i++) m.remove(Key.of(i));

		assertEquals(0, m.size());
		assertEquals(16, m.capacity);
	}

	@Test
	void shrinkIsSkippedWhenHalvedTableWouldOverflowMaxLoad() {
		var m = new UniversalHashTable(16, 0.5d, 0.45d);
		for (int i = 0; i < 15; i++) m.insert(Key.of(i), Value.ofInt32(i));
		assertEquals(32, m.capacity);

		// 14 / 32 is below 0.45, but 14 / 16 would be above 0.5
		m.remove(Key.of(0));

		assertEquals(32, m.capacity);
		assertEquals(14, m.size());
	}

	@Test
	void growthBeyondMaximumCapacityFailsAndKeepsEntries() {
		var m = UniversalHashTable.builder()
			.initialCapacity(16)
			.maximumCapacity(32)
			.build();
		for (int i = 0; i < 24; i++) m.insert(Key.of(i), Value.ofInt32(i));
		assertEquals(32, m.capacity);

		var e = assertThrows(CapacityOverflowException.class, () -> m.insert(Key.of(24), Value.ofInt32(24)));

		assertEquals(32, e.maximumCapacity());
		assertEquals(32, m.capacity);
		assertEquals(24, m.size());
		assertNull(m.get(Key.of(24)));
		for (int i = 0; i < 24; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));

		// replacing still works at the limit
		m.insert(Key.of(3), Value.ofInt32(33));
		assertEquals(Value.ofInt32(33), m.get(Key.of(3)));
	}

	@Test
	void builderAppliesSettings() {
		var m = UniversalHashTable.builder()
			.initialCapacity(64)
			.maxLoadFactor(0.5d)
			.minLoadFactor(0.125d)
			.maximumCapacity(1 << 20)
			.build();

		assertEquals(64, m.capacity());
		assertEquals(64, m.initialCapacity());
		assertEquals(0.5d, m.maxLoadFactor());
		assertEquals(0.125d, m.minLoadFactor());
		assertEquals(1 << 20, m.maximumCapacity());
		assertEquals(32, m.maxLoad);
	}

	@Test
	void lowMaxLoadFactorGrowsSeveralStepsAtOnce() {
		var m = new UniversalHashTable(16, 0.01d, 0.005d);

		m.insert(Key.of(1), Value.ofInt32(1));
		assertTrue(m.loadFactor() <= m.maxLoadFactor(), "load factor " + m.loadFactor());
		assertEquals(128, m.capacity);

		for (int i = 2; i <= 50; i++) {
			m.insert(Key.of(i), Value.ofInt32(i));
			assertTrue(m.loadFactor() <= m.maxLoadFactor(), "load factor above max after insert " + i);
		}
		assertEquals(8192, m.capacity);
		for (int i = 1; i <= 50; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));
	}

	@Test
	void multiStepGrowthStopsAtMaximumCapacity() {
		var m = UniversalHashTable.builder()
			.initialCapacity(16)
			.maxLoadFactor(0.01d)
			.minLoadFactor(0.005d)
			.maximumCapacity(64)
			.build();

		assertThrows(CapacityOverflowException.class, () -> m.insert(Key.of(1), Value.ofInt32(1)));

		assertEquals(16, m.capacity);
		assertTrue(m.isEmpty());
	}

	@Test
	void failedGrowthAllocationKeepsTableIntact() {
		var m = new FailingAllocationTable();
		for (int i = 0; i < 12; i++) m.insert(Key.of(i), Value.ofInt32(i));
		m.failing = true;

		var e = assertThrows(TableAllocationException.class, () -> m.insert(Key.of(12), Value.ofInt32(12)));

		assertEquals(32, e.requestedCapacity());
		assertInstanceOf(OutOfMemoryError.class, e.getCause());
		assertEquals(16, m.capacity);
		assertEquals(12, m.size());
		assertNull(m.get(Key.of(12)));
		for (int i = 0; i < 12; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));

		m.failing = false;
		m.insert(Key.of(12), Value.ofInt32(12));
		assertEquals(32, m.capacity);
		assertEquals(13, m.size());
	}

	@Test
	void failedShrinkAllocationStillRemoves() {
		var m = new FailingAllocationTable();
		for (int i = 0; i < 13; i++) m.insert(Key.of(i), Value.ofInt32(i));
		assertEquals(32, m.capacity);
		m.failing = true;

		for (int i = 0; i < 5; i++) m.remove(Key.of(i));
		// 7 / 32 is below the min load factor, but the halved arrays cannot be allocated
		assertEquals(Value.ofInt32(5), m.remove(Key.of(5)));

		assertEquals(32, m.capacity);
		assertEquals(7, m.size());
		assertNull(m.get(Key.of(5)));
		for (int i = 6; i < 13; i++) assertEquals(Value.ofInt32(i), m.get(Key.of(i)));

		m.failing = false;
		m.remove(Key.of(6));
		assertEquals(16, m.capacity);
	}
}
