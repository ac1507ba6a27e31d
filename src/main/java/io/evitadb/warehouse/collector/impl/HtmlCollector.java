package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;

/**
 * Flags raw HTML. Nothing is collected unless {@link io.evitadb.warehouse.config.WarehouseConfig#allowRawHtml()}
 * is set; collected fragments are always marked as needing sanitization.
 */
public final class HtmlCollector extends AbstractCollector<HtmlItem> {

	public static final String NAME = "html";

	public HtmlCollector() {
		super(NAME, Interest.of("html_block", "html_inline").ignoringInside("fence", "code_block"));
	}

	@Override
	public boolean shouldProcess(@Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		return warehouse.getConfig().allowRawHtml();
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		this.items.add(new HtmlItem(index, view.content(), "html_inline".equals(view.type()), view.startLine(), true));
	}
}
