package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.index.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.evitadb.warehouse.collector.impl.CollectorTestSupport.collect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SectionsCollector exposes the section index")
public class SectionsCollectorTest {

	@Test
	@DisplayName("returns the preamble and heading sections")
	public void shouldReturnSections() {
		final CollectorResult<Section> result = collect("intro\n\n# One\n\n## Two\n", new SectionsCollector());

		assertEquals(
			List.of(Section.PREAMBLE_ID, "section_0", "section_1"),
			result.items().stream().map(Section::id).toList()
		);
		assertEquals("Two", result.items().get(2).headingText());
	}

	@Test
	@DisplayName("honors the item cap")
	public void shouldCapSections() {
		final CollectorResult<Section> result = collect(
			"# a\n\n# b\n\n# c\n\n# d\n",
			WarehouseConfig.defaults().withMaxItems(SectionsCollector.NAME, 2),
			new SectionsCollector()
		);

		assertTrue(result.truncated());
		assertEquals(2, result.count());
		assertEquals(2, result.maxAllowed());
		assertEquals(List.of("section_0", "section_1"), result.items().stream().map(Section::id).toList());
	}
}
