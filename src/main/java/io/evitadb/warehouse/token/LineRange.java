package io.evitadb.warehouse.token;

/**
 * Normalized source line range of a token.
 *
 * @param start first line (zero-based)
 * @param end   last line, never lower than `start`
 */
public record LineRange(int start, int end) {

	/**
	 * Upper bound of any line number accepted by the warehouse.
	 */
	public static final int MAX_LINE = 1_000_000;

	/**
	 * Creates a new LineRange with validation.
	 */
	public LineRange {
		if (start < 0 || end < start || end > MAX_LINE) {
			throw new IllegalArgumentException(
				"Invalid line range [" + start + ", " + end + "], expected 0 <= start <= end <= " + MAX_LINE
			);
		}
	}

	/**
	 * Clamps arbitrary bounds into a valid range: negative values become 0, values above {@link #MAX_LINE}
	 * are clamped down and an inverted range collapses onto its start.
	 *
	 * @param start raw start
	 * @param end   raw end
	 * @return valid range
	 */
	public static LineRange clamp(long start, long end) {
		final int s = (int) Math.min(Math.max(start, 0L), MAX_LINE);
		int e = (int) Math.min(Math.max(end, 0L), MAX_LINE);
		if (e < s) {
			e = s;
		}
		return new LineRange(s, e);
	}
}
