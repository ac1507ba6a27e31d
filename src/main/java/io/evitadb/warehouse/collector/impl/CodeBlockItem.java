package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Fenced or indented code block.
 *
 * @param fenced    true for fenced blocks, false for indented ones
 * @param lang      language from the info string, empty when absent
 * @param code      block content
 * @param startLine first line or null
 * @param endLine   line after the block or null
 */
public record CodeBlockItem(
	boolean fenced,
	@Nonnull String lang,
	@Nonnull String code,
	@Nullable Integer startLine,
	@Nullable Integer endLine
) {

	public CodeBlockItem {
		Objects.requireNonNull(lang, "lang must not be null");
		Objects.requireNonNull(code, "code must not be null");
	}
}
