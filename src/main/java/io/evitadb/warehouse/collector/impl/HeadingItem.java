package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Heading found in the document.
 *
 * @param level     heading level 1-6
 * @param text      plain heading text
 * @param anchor    GitHub style anchor slug, unique within the document
 * @param line      start line or null
 * @param sectionId id of the section the heading opens, or null
 */
public record HeadingItem(
	int level,
	@Nonnull String text,
	@Nonnull String anchor,
	@Nullable Integer line,
	@Nullable String sectionId
) {

	public HeadingItem {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(anchor, "anchor must not be null");
	}
}
