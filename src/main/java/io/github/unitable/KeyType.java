package io.github.unitable;

/**
 * Key variants a table accepts.
 */
public enum KeyType {
	/** 32-bit signed integer key. */
	INT,
	/** Text key, stored as a private UTF-8 copy. */
	STRING
}
