package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Link found in the document.
 *
 * @param id         ordinal based identifier, `link_<n>`
 * @param url        raw link target
 * @param normalized normalized target, null when the URL was rejected as invalid
 * @param scheme     lower-case scheme, null for relative or invalid URLs
 * @param text       visible link text
 * @param line       start line of the link or null
 * @param sectionId  id of the enclosing section or null
 * @param allowed    verdict of the shared URL normalizer
 */
public record LinkItem(
	@Nonnull String id,
	@Nonnull String url,
	@Nullable String normalized,
	@Nullable String scheme,
	@Nonnull String text,
	@Nullable Integer line,
	@Nullable String sectionId,
	boolean allowed
) {

	public LinkItem {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(url, "url must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
