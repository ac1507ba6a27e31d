package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.index.Section;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Presents the section table of the index. It receives no tokens.
 */
public final class SectionsCollector extends AbstractCollector<Section> {

	public static final String NAME = "sections";

	public SectionsCollector() {
		super(NAME, Interest.none());
	}

	@Override
	public boolean shouldProcess(@Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		return false;
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		// sections come from the index
	}

	@Nonnull
	@Override
	public CollectorResult<Section> finish(@Nonnull TokenWarehouse warehouse) {
		final List<Section> sections = warehouse.getIndex().sections();
		final int cap = warehouse.getConfig().maxItemsFor(NAME);
		if (sections.size() > cap) {
			return CollectorResult.of(sections.subList(0, cap), true, cap);
		}
		return CollectorResult.of(sections, false, cap);
	}
}
