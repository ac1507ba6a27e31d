package io.evitadb.warehouse.index;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Auxiliary indices built in one forward pass over the canonical token stream.
 * All tables are immutable once built.
 */
public final class IndexTables {

	@Nonnull
	private final Map<String, List<Integer>> byType;
	@Nonnull
	private final int[] pairs;
	@Nonnull
	private final int[] parents;
	@Nonnull
	private final List<Section> sections;
	@Nonnull
	private final List<Fence> fences;
	@Nonnull
	private final SectionLocator sectionLocator;
	@Nonnull
	private final LineTextCache lineText;

	IndexTables(
		@Nonnull Map<String, List<Integer>> byType,
		@Nonnull int[] pairs,
		@Nonnull int[] parents,
		@Nonnull List<Section> sections,
		@Nonnull List<Fence> fences,
		@Nonnull LineTextCache lineText
	) {
		this.byType = Objects.requireNonNull(byType, "byType must not be null");
		this.pairs = Objects.requireNonNull(pairs, "pairs must not be null");
		this.parents = Objects.requireNonNull(parents, "parents must not be null");
		this.sections = List.copyOf(sections);
		this.fences = List.copyOf(fences);
		this.sectionLocator = new SectionLocator(this.sections);
		this.lineText = Objects.requireNonNull(lineText, "lineText must not be null");
	}

	/**
	 * Returns the positions of all tokens of the given type in document order.
	 *
	 * @param type token type
	 * @return ordered positions, empty when the type does not occur
	 */
	@Nonnull
	public List<Integer> positionsOf(@Nonnull String type) {
		final List<Integer> positions = this.byType.get(type);
		return positions == null ? List.of() : positions;
	}

	/**
	 * Returns all indexed token types.
	 *
	 * @return type to positions map
	 */
	@Nonnull
	public Map<String, List<Integer>> byType() {
		return this.byType;
	}

	/**
	 * Returns the counterpart of an opening or closing token.
	 *
	 * @param index token index
	 * @return index of the matching close (for an open) or open (for a close) token
	 */
	@Nonnull
	public Optional<Integer> pairOf(int index) {
		if (index < 0 || index >= this.pairs.length || this.pairs[index] < 0) {
			return Optional.empty();
		}
		return Optional.of(this.pairs[index]);
	}

	/**
	 * Returns the innermost open token enclosing the token.
	 *
	 * @param index token index
	 * @return index of the enclosing opening token
	 */
	@Nonnull
	public Optional<Integer> parentOf(int index) {
		if (index < 0 || index >= this.parents.length || this.parents[index] < 0) {
			return Optional.empty();
		}
		return Optional.of(this.parents[index]);
	}

	/**
	 * Returns the section table sorted by start line.
	 *
	 * @return sections
	 */
	@Nonnull
	public List<Section> sections() {
		return this.sections;
	}

	/**
	 * Returns fenced code blocks in document order.
	 *
	 * @return fences
	 */
	@Nonnull
	public List<Fence> fences() {
		return this.fences;
	}

	@Nonnull
	public SectionLocator sectionLocator() {
		return this.sectionLocator;
	}

	@Nonnull
	public LineTextCache lineText() {
		return this.lineText;
	}

	/**
	 * Returns the number of indexed tokens.
	 *
	 * @return token count
	 */
	public int tokenCount() {
		return this.parents.length;
	}
}
