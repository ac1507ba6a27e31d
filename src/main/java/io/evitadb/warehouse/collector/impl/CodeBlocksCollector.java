package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;

/**
 * Collects fenced and indented code blocks.
 */
public final class CodeBlocksCollector extends AbstractCollector<CodeBlockItem> {

	public static final String NAME = "codeblocks";

	public CodeBlocksCollector() {
		super(NAME, Interest.of("fence", "code_block"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		final String info = view.info() == null ? "" : view.info().strip();
		final int space = info.indexOf(' ');
		final String lang = space < 0 ? info : info.substring(0, space);
		this.items.add(new CodeBlockItem(
			"fence".equals(view.type()),
			lang,
			view.content(),
			view.map() == null ? null : view.map().start(),
			view.map() == null ? null : view.map().end()
		));
	}
}
