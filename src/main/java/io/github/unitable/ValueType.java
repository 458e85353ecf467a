package io.github.unitable;

/**
 * Closed set of value kinds a table stores, each with its byte width.
 * {@link #STRING} and {@link #BLOB} are variable width.
 */
public enum ValueType {
	UINT8(1, Category.UNSIGNED),
	UINT16(2, Category.UNSIGNED),
	UINT32(4, Category.UNSIGNED),
	UINT64(8, Category.UNSIGNED),
	INT8(1, Category.SIGNED),
	INT16(2, Category.SIGNED),
	INT32(4, Category.SIGNED),
	INT64(8, Category.SIGNED),
	USHORT(Short.BYTES, Category.UNSIGNED),
	SHORT(Short.BYTES, Category.SIGNED),
	UINT(Integer.BYTES, Category.UNSIGNED),
	INT(Integer.BYTES, Category.SIGNED),
	ULONG(Long.BYTES, Category.UNSIGNED),
	LONG(Long.BYTES, Category.SIGNED),
	ULONG_LONG(Long.BYTES, Category.UNSIGNED),
	LONG_LONG(Long.BYTES, Category.SIGNED),
	FLOAT(Float.BYTES, Category.FLOATING),
	DOUBLE(Double.BYTES, Category.FLOATING),
	// extended precision slot width; the payload is held at double precision
	LONG_DOUBLE(16, Category.FLOATING),
	CHAR(Character.BYTES, Category.CHARACTER),
	STRING(-1, Category.TEXT),
	BLOB(-1, Category.BLOB);

	public enum Category {
		SIGNED,
		UNSIGNED,
		FLOATING,
		CHARACTER,
		TEXT,
		BLOB
	}

	private final int byteWidth;
	private final Category category;

	ValueType(int byteWidth, Category category) {
		this.byteWidth = byteWidth;
		this.category = category;
	}

	/**
	 * Fixed payload width in bytes, or {@code -1} for variable-width kinds.
	 */
	public int byteWidth() {
		return byteWidth;
	}

	public Category category() {
		return category;
	}

	public boolean isVariableWidth() {
		return byteWidth < 0;
	}

	public boolean isInteger() {
		return category == Category.SIGNED || category == Category.UNSIGNED;
	}
}
