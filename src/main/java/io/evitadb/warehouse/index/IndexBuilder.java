package io.evitadb.warehouse.index;

import io.evitadb.warehouse.token.LineRange;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link IndexTables} in a single forward pass over canonical tokens.
 *
 * Pairs and parents are computed with an explicit stack, never recursion, so arbitrarily deep (but guarded)
 * nesting cannot overflow the call stack. Sections are derived from `heading_open` tokens sorted by their
 * normalized start line: each section ends right before the next one starts, and lines preceding the first
 * heading belong to a synthetic preamble section.
 */
public final class IndexBuilder {

	private static final String HEADING_OPEN = "heading_open";
	private static final String INLINE = "inline";
	private static final String FENCE = "fence";

	private IndexBuilder() {
		// utility class
	}

	/**
	 * Builds all index tables.
	 *
	 * @param tokens     canonical tokens in document order
	 * @param sourceText normalized source text or null
	 * @return index tables
	 */
	@Nonnull
	public static IndexTables build(@Nonnull List<TokenView> tokens, @Nullable String sourceText) {
		Objects.requireNonNull(tokens, "tokens must not be null");
		final int size = tokens.size();
		final Map<String, List<Integer>> byType = new LinkedHashMap<>();
		final int[] pairs = new int[size];
		final int[] parents = new int[size];
		Arrays.fill(pairs, -1);
		Arrays.fill(parents, -1);
		final List<Fence> fences = new ArrayList<>();
		final List<int[]> headings = new ArrayList<>();
		final int[] openStack = new int[size];
		int depth = 0;
		int maxMapEnd = -1;
		int lastMapStart = 0;
		int lastHeadingStart = -1;

		for (int i = 0; i < size; i++) {
			final TokenView token = tokens.get(i);
			byType.computeIfAbsent(token.type(), t -> new ArrayList<>()).add(i);

			// parent is assigned before the stack changes, so a close token's parent is its own opener
			if (depth > 0) {
				parents[i] = openStack[depth - 1];
			}
			if (token.isOpening()) {
				openStack[depth++] = i;
			} else if (token.isClosing() && depth > 0) {
				final int open = openStack[--depth];
				pairs[open] = i;
				pairs[i] = open;
			}

			final LineRange map = token.map();
			if (map != null && map.end() > maxMapEnd) {
				maxMapEnd = map.end();
			}
			if (FENCE.equals(token.type()) && map != null) {
				final String info = token.info() == null ? "" : token.info().strip();
				fences.add(new Fence(i, map.start(), map.end(), info));
			}
			if (HEADING_OPEN.equals(token.type())) {
				// a heading without a map is placed after the preceding heading, never onto its line
				final int start = map == null ? Math.max(lastMapStart, lastHeadingStart + 1) : map.start();
				headings.add(new int[]{i, start});
				lastHeadingStart = start;
			}
			if (map != null) {
				lastMapStart = map.start();
			}
		}

		final Map<String, List<Integer>> frozen = new LinkedHashMap<>(byType.size());
		for (final Map.Entry<String, List<Integer>> entry : byType.entrySet()) {
			frozen.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
		}

		final LineTextCache lineText = new LineTextCache(sourceText);
		final int lastLine = lineText.hasText() ? lineText.lineCount() - 1 : inferLastLine(tokens, maxMapEnd);
		final List<Section> sections = buildSections(tokens, headings, lastLine);
		return new IndexTables(Collections.unmodifiableMap(frozen), pairs, parents, sections, fences, lineText);
	}

	/**
	 * Builds the section table from `(tokenIndex, startLine)` heading pairs.
	 *
	 * @param tokens   canonical tokens
	 * @param headings heading positions and their start lines in document order
	 * @param lastLine last line of the document, -1 when unknown
	 * @return sections sorted by start line
	 */
	@Nonnull
	static List<Section> buildSections(@Nonnull List<TokenView> tokens, @Nonnull List<int[]> headings, int lastLine) {
		// stable sort keeps document order for headings sharing a start line
		final List<int[]> sorted = new ArrayList<>(headings);
		sorted.sort(Comparator.comparingInt(h -> h[1]));

		// only the last heading on a given line opens a section there
		final List<int[]> openers = new ArrayList<>(sorted.size());
		for (final int[] heading : sorted) {
			if (!openers.isEmpty() && openers.get(openers.size() - 1)[1] == heading[1]) {
				openers.set(openers.size() - 1, heading);
			} else {
				openers.add(heading);
			}
		}

		final List<Section> sections = new ArrayList<>(openers.size() + 1);
		if (openers.isEmpty()) {
			if (lastLine >= 0) {
				sections.add(Section.preamble(lastLine));
			}
			return sections;
		}
		final int firstStart = openers.get(0)[1];
		if (firstStart > 0) {
			sections.add(Section.preamble(firstStart - 1));
		}
		for (int k = 0; k < openers.size(); k++) {
			final int tokenIndex = openers.get(k)[0];
			final int start = openers.get(k)[1];
			final int end = k + 1 < openers.size()
				? openers.get(k + 1)[1] - 1
				: Math.max(start, lastLine);
			final TokenView heading = tokens.get(tokenIndex);
			sections.add(new Section(
				"section_" + k,
				tokenIndex,
				start,
				Math.max(start, end),
				levelOf(heading.tag()),
				headingText(tokens, tokenIndex)
			));
		}
		return sections;
	}

	/**
	 * Parses the heading level from its tag (`h1`..`h6`), defaulting to 1.
	 *
	 * @param tag heading tag
	 * @return heading level
	 */
	public static int levelOf(@Nonnull String tag) {
		if (tag.length() == 2 && (tag.charAt(0) == 'h' || tag.charAt(0) == 'H')) {
			final int level = tag.charAt(1) - '0';
			if (level >= 1 && level <= 6) {
				return level;
			}
		}
		return 1;
	}

	@Nonnull
	private static String headingText(@Nonnull List<TokenView> tokens, int headingIndex) {
		if (headingIndex + 1 < tokens.size()) {
			final TokenView next = tokens.get(headingIndex + 1);
			if (INLINE.equals(next.type())) {
				return next.content();
			}
		}
		return "";
	}

	private static int inferLastLine(@Nonnull List<TokenView> tokens, int maxMapEnd) {
		if (maxMapEnd < 0) {
			return -1;
		}
		int maxStart = 0;
		for (final TokenView token : tokens) {
			if (token.map() != null && token.map().start() > maxStart) {
				maxStart = token.map().start();
			}
		}
		// map ends are exclusive in markdown-it style streams
		return Math.max(maxMapEnd - 1, maxStart);
	}
}
