package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Collects task list entries. A list item is a task when a `task_list_marker` token appears in it.
 */
public final class TaskListsCollector extends AbstractCollector<TaskItem> {

	public static final String NAME = "tasklists";

	@Nonnull
	private final Deque<OpenItem> open = new ArrayDeque<>();

	public TaskListsCollector() {
		super(NAME, Interest.of("list_item_open", "task_list_marker", "inline", "list_item_close"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		final OpenItem current = this.open.peek();
		switch (view.type()) {
			case "list_item_open" -> this.open.push(new OpenItem(view.startLine()));
			case "task_list_marker" -> {
				if (current != null) {
					current.task = true;
					current.checked = "x".equalsIgnoreCase(view.info() == null ? "" : view.info().strip());
				}
			}
			case "inline" -> {
				if (current != null && current.text == null) {
					current.text = view.content().strip();
				}
			}
			case "list_item_close" -> {
				if (current != null) {
					this.open.pop();
					if (current.task) {
						this.items.add(new TaskItem(
							current.text == null ? "" : current.text, current.checked, current.line,
							sectionIdOf(warehouse, current.line)
						));
					}
				}
			}
			default -> {
				// not routed
			}
		}
	}

	private static final class OpenItem {
		@Nullable
		private final Integer line;
		@Nullable
		private String text;
		private boolean task;
		private boolean checked;

		OpenItem(@Nullable Integer line) {
			this.line = line;
		}
	}
}
