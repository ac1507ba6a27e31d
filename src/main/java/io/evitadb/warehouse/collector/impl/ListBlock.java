package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * One bullet or ordered list. Nested lists are reported as separate blocks.
 *
 * @param kind  list kind
 * @param items text of the list items in order
 * @param line  start line or null
 */
public record ListBlock(@Nonnull Kind kind, @Nonnull List<String> items, @Nullable Integer line) {

	public ListBlock {
		Objects.requireNonNull(kind, "kind must not be null");
		items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
	}

	/**
	 * Kind of the list.
	 */
	public enum Kind {
		BULLET,
		ORDERED
	}
}
