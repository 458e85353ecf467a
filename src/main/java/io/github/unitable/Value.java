package io.github.unitable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Table value: a fixed-width scalar, a string, or an opaque byte blob.
 *
 * <p>Values compare by kind and content; the pass method does not take part in
 * equality. Only blobs distinguish {@link PassMethod#BY_COPY} from
 * {@link PassMethod#BY_REFERENCE}: scalars and strings are immutable, so the table
 * always holds them as its own.
 */
public sealed interface Value permits Value.Scalar, Value.Text, Value.Blob {

	ValueType type();

	PassMethod passMethod();

	/** Payload length in bytes. */
	int byteLength();

	/**
	 * The form a table stores: a private duplicate for by-copy blobs, this value otherwise.
	 */
	Value retain();

	/* Integer kinds */

	static Value ofInt8(byte v) { return new Scalar(ValueType.INT8, v); }
	static Value ofInt16(short v) { return new Scalar(ValueType.INT16, v); }
	static Value ofInt32(int v) { return new Scalar(ValueType.INT32, v); }
	static Value ofInt64(long v) { return new Scalar(ValueType.INT64, v); }
	static Value ofUInt8(int v) { return new Scalar(ValueType.UINT8, v); }
	static Value ofUInt16(int v) { return new Scalar(ValueType.UINT16, v); }
	static Value ofUInt32(long v) { return new Scalar(ValueType.UINT32, v); }
	/** Unsigned 64-bit value given as its two's-complement bit pattern. */
	static Value ofUInt64(long bits) { return new Scalar(ValueType.UINT64, bits); }
	static Value ofShort(short v) { return new Scalar(ValueType.SHORT, v); }
	static Value ofUShort(int v) { return new Scalar(ValueType.USHORT, v); }
	static Value ofInt(int v) { return new Scalar(ValueType.INT, v); }
	static Value ofUInt(long v) { return new Scalar(ValueType.UINT, v); }
	static Value ofLong(long v) { return new Scalar(ValueType.LONG, v); }
	static Value ofULong(long bits) { return new Scalar(ValueType.ULONG, bits); }
	static Value ofLongLong(long v) { return new Scalar(ValueType.LONG_LONG, v); }
	static Value ofULongLong(long bits) { return new Scalar(ValueType.ULONG_LONG, bits); }

	/* Floating point and character kinds */

	static Value ofFloat(float v) {
		return new Scalar(ValueType.FLOAT, Integer.toUnsignedLong(Float.floatToRawIntBits(v)));
	}

	static Value ofDouble(double v) {
		return new Scalar(ValueType.DOUBLE, Double.doubleToRawLongBits(v));
	}

	static Value ofLongDouble(double v) {
		return new Scalar(ValueType.LONG_DOUBLE, Double.doubleToRawLongBits(v));
	}

	static Value ofChar(char v) {
		return new Scalar(ValueType.CHAR, v);
	}

	/* Variable-width kinds */

	static Value ofString(String v) {
		return new Text(Objects.requireNonNull(v, "value"));
	}

	/** Blob passed by copy. */
	static Value ofBlob(byte[] bytes) {
		return ofBlob(bytes, PassMethod.BY_COPY);
	}

	static Value ofBlob(byte[] bytes, PassMethod passMethod) {
		return new Blob(bytes, passMethod);
	}

	/**
	 * Builds a fixed-width value from an explicit type tag and its raw 64-bit pattern.
	 *
	 * @throws NullPointerException if the tag is null
	 * @throws IllegalArgumentException if the tag is variable width or the bits are out of range
	 */
	static Value of(ValueType type, long bits) {
		return new Scalar(type, bits);
	}

	/**
	 * Any fixed-width kind. {@code bits} holds integers sign-extended (signed kinds) or
	 * zero-extended (unsigned kinds), characters as their UTF-16 code unit, and floating
	 * point values as their raw IEEE 754 bits.
	 */
	record Scalar(ValueType type, long bits) implements Value {

		public Scalar {
			Objects.requireNonNull(type, "value type");
			if (type.isVariableWidth()) {
				throw new IllegalArgumentException(type + " is not a fixed-width value type");
			}
			if (!fits(type, bits)) {
				throw new IllegalArgumentException("value " + bits + " out of range for " + type);
			}
		}

		private static boolean fits(ValueType type, long bits) {
			int width = type.byteWidth();
			switch (type.category()) {
				case SIGNED: {
					if (width >= Long.BYTES) return true;
					long bound = 1L << (width * 8 - 1);
					return bits >= -bound && bits < bound;
				}
				case UNSIGNED:
					return width >= Long.BYTES || (bits >>> (width * 8)) == 0;
				case CHARACTER:
					return bits >= Character.MIN_VALUE && bits <= Character.MAX_VALUE;
				case FLOATING:
					return type != ValueType.FLOAT || (bits >>> 32) == 0;
				default:
					return false;
			}
		}

		@Override
		public PassMethod passMethod() {
			return PassMethod.BY_COPY;
		}

		@Override
		public int byteLength() {
			return type.byteWidth();
		}

		@Override
		public Value retain() {
			return this;
		}

		public long longValue() {
			if (type.category() == ValueType.Category.FLOATING) {
				return (long) doubleValue();
			}
			return bits;
		}

		public double doubleValue() {
			switch (type) {
				case FLOAT:
					return Float.intBitsToFloat((int) bits);
				case DOUBLE:
				case LONG_DOUBLE:
					return Double.longBitsToDouble(bits);
				default:
					if (type.category() == ValueType.Category.UNSIGNED && bits < 0) {
						// top bit set on a 64-bit unsigned kind
						return (double) (bits >>> 1) * 2.0d + (bits & 1L);
					}
					return bits;
			}
		}

		public char charValue() {
			if (type != ValueType.CHAR) {
				throw new IllegalStateException(type + " is not a character value");
			}
			return (char) bits;
		}

		@Override
		public String toString() {
			switch (type.category()) {
				case UNSIGNED:
					return Long.toUnsignedString(bits);
				case FLOATING:
					return type == ValueType.FLOAT
						? Float.toString(Float.intBitsToFloat((int) bits))
						: Double.toString(Double.longBitsToDouble(bits));
				case CHARACTER:
					return "'" + (char) bits + "'";
				default:
					return Long.toString(bits);
			}
		}
	}

	/** String value. */
	record Text(String text) implements Value {

		public Text {
			Objects.requireNonNull(text, "value");
		}

		@Override
		public ValueType type() {
			return ValueType.STRING;
		}

		@Override
		public PassMethod passMethod() {
			return PassMethod.BY_COPY;
		}

		@Override
		public int byteLength() {
			return text.getBytes(StandardCharsets.UTF_8).length;
		}

		@Override
		public Value retain() {
			return this;
		}

		@Override
		public String toString() {
			return '"' + text + '"';
		}
	}

	/** Opaque byte payload. */
	final class Blob implements Value {
		private final byte[] bytes;
		private final PassMethod passMethod;

		private Blob(byte[] bytes, PassMethod passMethod) {
			this.bytes = Objects.requireNonNull(bytes, "value");
			this.passMethod = Objects.requireNonNull(passMethod, "pass method");
		}

		@Override
		public ValueType type() {
			return ValueType.BLOB;
		}

		@Override
		public PassMethod passMethod() {
			return passMethod;
		}

		@Override
		public int byteLength() {
			return bytes.length;
		}

		@Override
		public Value retain() {
			return passMethod == PassMethod.BY_COPY ? new Blob(bytes.clone(), passMethod) : this;
		}

		/**
		 * The payload. By-reference blobs return the caller's array itself; by-copy blobs
		 * return a fresh copy so stored bytes cannot be changed from outside.
		 */
		public byte[] bytes() {
			return passMethod == PassMethod.BY_REFERENCE ? bytes : bytes.clone();
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj) return true;
			if (!(obj instanceof Blob other)) return false;
			return Arrays.equals(bytes, other.bytes);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(bytes);
		}

		@Override
		public String toString() {
			return "Blob[" + bytes.length + " bytes, " + passMethod + "]";
		}
	}
}
