package io.evitadb.warehouse.index;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One entry of the section table. Sections are sorted by start line and partition the document: every line
 * between the first section start and the last section end belongs to exactly one section.
 *
 * @param id           stable identifier, `preamble` or `section_<n>` where n is the heading ordinal
 * @param headingIndex index of the `heading_open` token, -1 for the preamble
 * @param startLine    first line of the section (inclusive)
 * @param endLine      last line of the section (inclusive)
 * @param level        heading level 1-6, 0 for the preamble
 * @param headingText  text of the heading, empty for the preamble
 */
public record Section(
	@Nonnull String id,
	int headingIndex,
	int startLine,
	int endLine,
	int level,
	@Nonnull String headingText
) {

	/**
	 * Identifier of the synthetic section covering lines before the first heading.
	 */
	public static final String PREAMBLE_ID = "preamble";

	/**
	 * Creates a new Section with validation.
	 */
	public Section {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(headingText, "headingText must not be null");
		if (startLine < 0 || endLine < startLine) {
			throw new IllegalArgumentException("Invalid section bounds [" + startLine + ", " + endLine + "]");
		}
	}

	/**
	 * Creates the synthetic preamble section.
	 *
	 * @param endLine last line before the first heading
	 * @return preamble section starting at line 0
	 */
	@Nonnull
	public static Section preamble(int endLine) {
		return new Section(PREAMBLE_ID, -1, 0, endLine, 0, "");
	}

	/**
	 * Returns true for the synthetic preamble section.
	 *
	 * @return true when this section precedes the first heading
	 */
	public boolean isPreamble() {
		return this.headingIndex < 0;
	}

	/**
	 * Returns true when the line falls into this section.
	 *
	 * @param line zero-based line
	 * @return true if `startLine <= line <= endLine`
	 */
	public boolean contains(int line) {
		return line >= this.startLine && line <= this.endLine;
	}
}
