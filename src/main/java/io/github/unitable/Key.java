package io.github.unitable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Table key: either a 32-bit integer or a string.
 *
 * <p>Keys are immutable. A string key owns a private UTF-8 copy of the text it was
 * built from, so the caller's buffer is never aliased by a table. Two keys are equal
 * only when their variants match and their logical values match.
 */
public sealed interface Key permits Key.Int, Key.Str {

	KeyType type();

	/**
	 * Digest of the key's logical value: Knuth multiplicative hash for integers,
	 * DJB2 over the UTF-8 bytes for strings.
	 */
	long digest();

	static Key of(int value) {
		return new Int(value);
	}

	static Key of(String value) {
		return new Str(Objects.requireNonNull(value, "key").getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * String key over raw UTF-8 content; the array is copied.
	 */
	static Key ofUtf8(byte[] utf8) {
		return new Str(Objects.requireNonNull(utf8, "key").clone());
	}

	/**
	 * Builds a key from an explicit type tag and an untyped payload.
	 *
	 * @throws NullPointerException if the tag or payload is null
	 * @throws IllegalArgumentException if the payload does not fit the tag
	 */
	static Key of(KeyType type, Object payload) {
		Objects.requireNonNull(type, "key type");
		Objects.requireNonNull(payload, "key");
		switch (type) {
			case INT:
				if (payload instanceof Integer i) return of(i.intValue());
				break;
			case STRING:
				if (payload instanceof String s) return of(s);
				if (payload instanceof byte[] b) return ofUtf8(b);
				break;
		}
		throw new IllegalArgumentException(
			"payload of type " + payload.getClass().getName() + " does not match key type " + type);
	}

	/** Integer key. */
	record Int(int value) implements Key {

		@Override
		public KeyType type() {
			return KeyType.INT;
		}

		@Override
		public long digest() {
			return Hashing.knuth(value);
		}

		@Override
		public int hashCode() {
			return Long.hashCode(digest());
		}

		@Override
		public String toString() {
			return Integer.toString(value);
		}
	}

	/** String key backed by its own UTF-8 bytes. */
	final class Str implements Key {
		private final byte[] utf8;
		private final long digest;

		private Str(byte[] utf8) {
			this.utf8 = utf8;
			this.digest = Hashing.djb2(utf8);
		}

		@Override
		public KeyType type() {
			return KeyType.STRING;
		}

		@Override
		public long digest() {
			return digest;
		}

		public String value() {
			return new String(utf8, StandardCharsets.UTF_8);
		}

		/** Copy of the key's UTF-8 content. */
		public byte[] bytes() {
			return utf8.clone();
		}

		public int byteLength() {
			return utf8.length;
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj) return true;
			if (!(obj instanceof Str other)) return false;
			return digest == other.digest && Arrays.equals(utf8, other.utf8);
		}

		@Override
		public int hashCode() {
			return Long.hashCode(digest);
		}

		@Override
		public String toString() {
			return '"' + value() + '"';
		}
	}
}
