package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Collects bullet and ordered lists. The item count (and so the item cap) refers to list items, not lists.
 */
public final class ListsCollector extends AbstractCollector<ListBlock> {

	public static final String NAME = "lists";

	@Nonnull
	private final Deque<OpenList> open = new ArrayDeque<>();
	private int totalItems;

	public ListsCollector() {
		super(NAME, Interest.of(
			"bullet_list_open", "bullet_list_close",
			"ordered_list_open", "ordered_list_close",
			"list_item_open", "list_item_close",
			"inline"
		));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		final OpenList current = this.open.peek();
		switch (view.type()) {
			case "bullet_list_open" -> this.open.push(new OpenList(ListBlock.Kind.BULLET, view.startLine()));
			case "ordered_list_open" -> this.open.push(new OpenList(ListBlock.Kind.ORDERED, view.startLine()));
			case "list_item_open" -> {
				if (current != null) {
					current.inItem = true;
					current.buffer.setLength(0);
				}
			}
			case "inline" -> {
				if (current != null && current.inItem) {
					current.buffer.append(view.content());
				}
			}
			case "list_item_close" -> {
				if (current != null && current.inItem) {
					current.items.add(current.buffer.toString().strip());
					current.inItem = false;
					this.totalItems++;
				}
			}
			case "bullet_list_close", "ordered_list_close" -> {
				if (current != null) {
					this.open.pop();
					this.items.add(new ListBlock(current.kind, current.items, current.line));
				}
			}
			default -> {
				// not routed
			}
		}
	}

	@Override
	public int getItemCount() {
		return this.totalItems;
	}

	/**
	 * Returns the closed lists followed by the lists still open, innermost first. Lists stay open when
	 * the item cap stopped routing before their closing token, and they keep the items collected so far.
	 */
	@Nonnull
	@Override
	public CollectorResult<ListBlock> finish(@Nonnull TokenWarehouse warehouse) {
		final List<ListBlock> result = new ArrayList<>(this.items);
		for (final OpenList list : this.open) {
			final List<String> listItems = new ArrayList<>(list.items);
			if (list.inItem && !list.buffer.isEmpty()) {
				listItems.add(list.buffer.toString().strip());
			}
			result.add(new ListBlock(list.kind, listItems, list.line));
		}
		return new CollectorResult<>(result, this.totalItems, !this.open.isEmpty(), warehouse.getConfig().maxItemsFor(NAME));
	}

	private static final class OpenList {
		@Nonnull
		private final ListBlock.Kind kind;
		@Nullable
		private final Integer line;
		@Nonnull
		private final List<String> items = new ArrayList<>();
		@Nonnull
		private final StringBuilder buffer = new StringBuilder();
		private boolean inItem;

		OpenList(@Nonnull ListBlock.Kind kind, @Nullable Integer line) {
			this.kind = kind;
			this.line = line;
		}
	}
}
