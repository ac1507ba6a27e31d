package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Table with its cell text. The header row, when present, is the first row.
 *
 * @param rows      rows of cell text
 * @param hasHeader true when the first row comes from the table head
 * @param line      start line or null
 * @param sectionId id of the enclosing section or null
 */
public record TableItem(
	@Nonnull List<List<String>> rows,
	boolean hasHeader,
	@Nullable Integer line,
	@Nullable String sectionId
) {

	public TableItem {
		Objects.requireNonNull(rows, "rows must not be null");
		rows = rows.stream().map(List::copyOf).toList();
	}

	/**
	 * Returns the number of columns of the widest row.
	 *
	 * @return column count
	 */
	public int columnCount() {
		int max = 0;
		for (final List<String> row : this.rows) {
			max = Math.max(max, row.size());
		}
		return max;
	}
}
