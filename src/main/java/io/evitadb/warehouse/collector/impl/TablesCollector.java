package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects GFM tables as rows of cell text.
 */
public final class TablesCollector extends AbstractCollector<TableItem> {

	public static final String NAME = "tables";

	@Nullable
	private List<List<String>> rows;
	@Nullable
	private List<String> row;
	@Nullable
	private Integer line;
	private boolean inHead;
	private boolean hasHeader;
	private boolean inCell;
	@Nonnull
	private final StringBuilder cell = new StringBuilder();

	public TablesCollector() {
		super(NAME, Interest.of(
			"table_open", "table_close", "thead_open", "thead_close", "tbody_open", "tbody_close",
			"tr_open", "tr_close", "th_open", "th_close", "td_open", "td_close", "inline"
		));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		switch (view.type()) {
			case "table_open" -> {
				this.rows = new ArrayList<>();
				this.line = view.startLine();
				this.hasHeader = false;
			}
			case "thead_open" -> this.inHead = true;
			case "thead_close" -> this.inHead = false;
			case "tr_open" -> this.row = new ArrayList<>();
			case "th_open", "td_open" -> {
				this.inCell = true;
				this.cell.setLength(0);
			}
			case "inline" -> {
				if (this.inCell) {
					this.cell.append(view.content());
				}
			}
			case "th_close", "td_close" -> {
				this.inCell = false;
				if (this.row != null) {
					this.row.add(this.cell.toString().strip());
				}
			}
			case "tr_close" -> {
				if (this.rows != null && this.row != null) {
					if (this.inHead && this.rows.isEmpty()) {
						this.hasHeader = true;
					}
					this.rows.add(this.row);
				}
				this.row = null;
			}
			case "table_close" -> {
				if (this.rows != null) {
					this.items.add(new TableItem(this.rows, this.hasHeader, this.line, sectionIdOf(warehouse, this.line)));
				}
				this.rows = null;
			}
			default -> {
				// tbody delimiters carry no data
			}
		}
	}
}
