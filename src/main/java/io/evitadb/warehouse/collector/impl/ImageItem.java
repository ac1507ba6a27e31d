package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Image found in the document.
 *
 * @param src        raw image source
 * @param normalized normalized source, null when rejected as invalid
 * @param alt        alternative text
 * @param line       start line or null
 * @param sectionId  id of the enclosing section or null
 * @param allowed    verdict of the shared URL normalizer
 */
public record ImageItem(
	@Nonnull String src,
	@Nullable String normalized,
	@Nonnull String alt,
	@Nullable Integer line,
	@Nullable String sectionId,
	boolean allowed
) {

	public ImageItem {
		Objects.requireNonNull(src, "src must not be null");
		Objects.requireNonNull(alt, "alt must not be null");
	}
}
