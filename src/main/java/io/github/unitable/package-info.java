/**
 * Open-addressing hash table over integer and string keys with typed values.
 *
 * <p>{@link io.github.unitable.UniversalHashTable} is the table itself;
 * {@link io.github.unitable.Key} and {@link io.github.unitable.Value} model what it
 * stores and {@link io.github.unitable.Pairs} builds them from plain arguments.
 * Tables are not thread-safe.
 */
@NullMarked
package io.github.unitable;

import org.jspecify.annotations.NullMarked;
