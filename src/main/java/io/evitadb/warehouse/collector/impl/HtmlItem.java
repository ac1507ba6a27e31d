package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Raw HTML fragment. The warehouse never sanitizes it; renderers must treat it as untrusted.
 *
 * @param tokenIndex        index of the token in the canonical stream
 * @param content           raw HTML
 * @param inline            true for inline HTML, false for HTML blocks
 * @param line              start line or null
 * @param needsSanitization always true
 */
public record HtmlItem(
	int tokenIndex,
	@Nonnull String content,
	boolean inline,
	@Nullable Integer line,
	boolean needsSanitization
) {

	public HtmlItem {
		Objects.requireNonNull(content, "content must not be null");
	}
}
