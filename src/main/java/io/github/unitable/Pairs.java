package io.github.unitable;

import java.util.Objects;

/**
 * Builds keys and values from plain arguments and feeds them to
 * {@link UniversalHashTable#insert(Key, Value)}.
 *
 * <pre>{@code
 * Pairs.add(table,
 *     1, 10,
 *     "apple", 10,
 *     "banana", 2.5d);
 * }</pre>
 */
public final class Pairs {

	private Pairs() {}

	/**
	 * Inserts alternating key/value arguments. Every argument is classified before the
	 * table is touched, so a bad argument leaves the table unchanged.
	 *
	 * @throws IllegalArgumentException on an odd argument count or an unsupported argument type
	 * @throws NullPointerException if any argument is null
	 */
	public static void add(UniversalHashTable table, Object... keysAndValues) {
		Objects.requireNonNull(table, "table");
		if (keysAndValues.length % 2 != 0) {
			throw new IllegalArgumentException(
				"odd number of arguments (" + keysAndValues.length + "): keys and values must be paired");
		}
		int pairs = keysAndValues.length / 2;
		Key[] keys = new Key[pairs];
		Value[] values = new Value[pairs];
		for (int i = 0; i < pairs; i++) {
			keys[i] = key(keysAndValues[2 * i]);
			values[i] = value(keysAndValues[2 * i + 1]);
		}
		for (int i = 0; i < pairs; i++) {
			table.insert(keys[i], values[i]);
		}
	}

	/**
	 * {@code Integer}, {@code Short} and {@code Byte} become integer keys, {@code String}
	 * becomes a string key, a {@link Key} passes through.
	 */
	public static Key key(Object raw) {
		Objects.requireNonNull(raw, "key");
		if (raw instanceof Key k) return k;
		if (raw instanceof Integer i) return Key.of(i.intValue());
		if (raw instanceof Short s) return Key.of(s.intValue());
		if (raw instanceof Byte b) return Key.of(b.intValue());
		if (raw instanceof String s) return Key.of(s);
		throw new IllegalArgumentException("unsupported key type: " + raw.getClass().getName());
	}

	/**
	 * Boxed primitives map to their signed kind of equal width, {@code Character} to
	 * {@link ValueType#CHAR}, {@code String} to {@link ValueType#STRING}, {@code byte[]} to a
	 * by-copy blob; a {@link Value} passes through.
	 */
	public static Value value(Object raw) {
		Objects.requireNonNull(raw, "value");
		if (raw instanceof Value v) return v;
		if (raw instanceof Byte b) return Value.ofInt8(b);
		if (raw instanceof Short s) return Value.ofInt16(s);
		if (raw instanceof Integer i) return Value.ofInt32(i);
		if (raw instanceof Long l) return Value.ofInt64(l);
		if (raw instanceof Float f) return Value.ofFloat(f);
		if (raw instanceof Double d) return Value.ofDouble(d);
		if (raw instanceof Character c) return Value.ofChar(c);
		if (raw instanceof String s) return Value.ofString(s);
		if (raw instanceof byte[] bytes) return Value.ofBlob(bytes);
		throw new IllegalArgumentException("unsupported value type: " + raw.getClass().getName());
	}
}
