package io.github.unitable;

/**
 * How a table takes hold of a value payload.
 */
public enum PassMethod {
	/** The table keeps the caller's payload and never copies it. */
	BY_REFERENCE,
	/** The table keeps a private byte-for-byte duplicate. */
	BY_COPY
}
