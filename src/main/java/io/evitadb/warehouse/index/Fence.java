package io.evitadb.warehouse.index;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Fenced code block recorded by the index.
 *
 * @param tokenIndex index of the `fence` token
 * @param startLine  first line of the block
 * @param endLine    last line of the block
 * @param info       trimmed info string (may be empty)
 */
public record Fence(int tokenIndex, int startLine, int endLine, @Nonnull String info) {

	/**
	 * Creates a new Fence with validation.
	 */
	public Fence {
		Objects.requireNonNull(info, "info must not be null");
	}

	/**
	 * Returns the language of the block, i.e. the first word of the info string.
	 *
	 * @return language or empty string
	 */
	@Nonnull
	public String language() {
		final int space = this.info.indexOf(' ');
		return space < 0 ? this.info : this.info.substring(0, space);
	}
}
