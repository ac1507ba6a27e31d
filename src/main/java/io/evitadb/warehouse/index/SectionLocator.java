package io.evitadb.warehouse.index;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers "which section does line L belong to" with a binary search over the sorted section starts.
 */
public final class SectionLocator {

	@Nonnull
	private final List<Section> sections;
	@Nonnull
	private final int[] starts;

	/**
	 * Creates a locator over a section table sorted by start line.
	 *
	 * @param sections sorted, non-overlapping sections
	 */
	public SectionLocator(@Nonnull List<Section> sections) {
		this.sections = List.copyOf(Objects.requireNonNull(sections, "sections must not be null"));
		this.starts = new int[this.sections.size()];
		for (int i = 0; i < this.starts.length; i++) {
			this.starts[i] = this.sections.get(i).startLine();
			if (i > 0 && this.starts[i] <= this.starts[i - 1]) {
				throw new IllegalArgumentException("Sections must be sorted by strictly increasing start line");
			}
		}
	}

	/**
	 * Finds the section containing the line. Never throws, any int is a valid query.
	 *
	 * @param line zero-based line
	 * @return section containing the line, or empty for lines outside every section
	 */
	@Nonnull
	public Optional<Section> find(int line) {
		final int position = indexOf(line);
		return position < 0 ? Optional.empty() : Optional.of(this.sections.get(position));
	}

	/**
	 * Finds the position of the section containing the line within the table.
	 *
	 * @param line zero-based line
	 * @return position in the section table or -1
	 */
	public int indexOf(int line) {
		int low = 0;
		int high = this.starts.length - 1;
		int candidate = -1;
		// last section whose start is <= line
		while (low <= high) {
			final int mid = (low + high) >>> 1;
			if (this.starts[mid] <= line) {
				candidate = mid;
				low = mid + 1;
			} else {
				high = mid - 1;
			}
		}
		if (candidate < 0 || !this.sections.get(candidate).contains(line)) {
			return -1;
		}
		return candidate;
	}

	/**
	 * Returns the number of sections.
	 *
	 * @return section count
	 */
	public int size() {
		return this.sections.size();
	}
}
