package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.collector.Collector;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Factory of the bundled collectors.
 */
public final class ReferenceCollectors {

	private ReferenceCollectors() {
		// utility class
	}

	/**
	 * Creates fresh instances of all bundled collectors. Collectors are stateful, so every warehouse needs its own.
	 *
	 * @return new collectors
	 */
	@Nonnull
	public static List<Collector<?>> createAll() {
		return List.of(
			new CodeBlocksCollector(),
			new HeadingsCollector(),
			new HtmlCollector(),
			new ImagesCollector(),
			new LinksCollector(),
			new ListsCollector(),
			new ParagraphsCollector(),
			new SectionsCollector(),
			new TablesCollector(),
			new TaskListsCollector()
		);
	}
}
