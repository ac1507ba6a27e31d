package io.evitadb.warehouse.collector.impl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Task list entry (`- [ ] text` or `- [x] text`).
 *
 * @param text      text of the task
 * @param checked   true for completed tasks
 * @param line      start line or null
 * @param sectionId id of the enclosing section or null
 */
public record TaskItem(@Nonnull String text, boolean checked, @Nullable Integer line, @Nullable String sectionId) {

	public TaskItem {
		Objects.requireNonNull(text, "text must not be null");
	}
}
