package io.evitadb.warehouse.index;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves source text slices by line range. Slices are memoized, so repeated lookups of the same range
 * by different collectors are computed once.
 */
public final class LineTextCache {

	@Nonnull
	private final List<String> lines;
	@Nonnull
	private final Map<Long, String> cache = new HashMap<>();

	/**
	 * Creates a cache over the given source text.
	 *
	 * @param sourceText normalized source text or null when unavailable
	 */
	public LineTextCache(@Nullable String sourceText) {
		this.lines = sourceText == null ? List.of() : splitLines(sourceText);
	}

	/**
	 * Returns the number of lines of the source text.
	 *
	 * @return line count, 0 when no text was supplied
	 */
	public int lineCount() {
		return this.lines.size();
	}

	/**
	 * Returns true when the source text was supplied.
	 *
	 * @return true when lines are available
	 */
	public boolean hasText() {
		return !this.lines.isEmpty();
	}

	/**
	 * Returns the lines `start..end` (both inclusive) joined by line feeds. Bounds outside the text are clamped,
	 * an empty range yields an empty string.
	 *
	 * @param start first line
	 * @param end   last line
	 * @return text of the range
	 */
	@Nonnull
	public String text(int start, int end) {
		final int from = Math.max(start, 0);
		final int to = Math.min(end, this.lines.size() - 1);
		if (from > to) {
			return "";
		}
		final long key = ((long) from << 32) | (to & 0xffffffffL);
		return this.cache.computeIfAbsent(key, k -> String.join("\n", this.lines.subList(from, to + 1)));
	}

	/**
	 * Returns all lines of the source text.
	 *
	 * @return immutable list of lines without terminators
	 */
	@Nonnull
	public List<String> lines() {
		return this.lines;
	}

	@Nonnull
	private static List<String> splitLines(@Nonnull String text) {
		final List<String> result = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				result.add(text.substring(start, i));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			result.add(text.substring(start));
		}
		return Collections.unmodifiableList(result);
	}
}
