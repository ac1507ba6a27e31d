package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Paragraph text with its position.
 *
 * @param text      plain text
 * @param line      start line or null
 * @param sectionId id of the enclosing section or null
 */
public record ParagraphItem(@Nonnull String text, @Nullable Integer line, @Nullable String sectionId) {

	public ParagraphItem {
		Objects.requireNonNull(text, "text must not be null");
	}
}
