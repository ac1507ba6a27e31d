package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;
import io.evitadb.warehouse.url.InvalidUrlException;
import io.evitadb.warehouse.url.NormalizedUrl;

import javax.annotation.Nonnull;

/**
 * Collects images with their alternative text and the normalizer verdict on their source.
 */
public final class ImagesCollector extends AbstractCollector<ImageItem> {

	public static final String NAME = "images";

	public ImagesCollector() {
		super(NAME, Interest.of("image").ignoringInside("fence", "code_block"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		final String src = view.src() == null ? "" : view.src();
		final Integer line = view.startLine();
		final String sectionId = sectionIdOf(warehouse, line);
		ImageItem item;
		try {
			final NormalizedUrl normalized = warehouse.getUrlNormalizer().normalize(src);
			item = new ImageItem(src, normalized.normalized(), view.content(), line, sectionId, normalized.allowed());
		} catch (InvalidUrlException e) {
			item = new ImageItem(src, null, view.content(), line, sectionId, false);
		}
		this.items.add(item);
	}
}
