package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;
import io.evitadb.warehouse.url.InvalidUrlException;
import io.evitadb.warehouse.url.NormalizedUrl;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Collects links together with their text. Nested links are folded into the outermost one.
 * Every target is judged by the warehouse's URL normalizer; invalid targets are kept but marked as not allowed.
 */
public final class LinksCollector extends AbstractCollector<LinkItem> {

	public static final String NAME = "links";

	private int depth;
	@Nullable
	private String currentUrl;
	@Nullable
	private Integer currentLine;
	@Nonnull
	private final StringBuilder currentText = new StringBuilder();

	public LinksCollector() {
		super(NAME, Interest.of("link_open", "text", "code_inline", "link_close").ignoringInside("fence", "code_block"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		switch (view.type()) {
			case "link_open" -> {
				this.depth++;
				if (this.depth == 1) {
					this.currentUrl = view.href() == null ? "" : view.href();
					this.currentLine = view.startLine();
					this.currentText.setLength(0);
				}
			}
			case "text", "code_inline" -> {
				if (this.currentUrl != null) {
					this.currentText.append(view.content());
				}
			}
			case "link_close" -> {
				if (this.depth > 0) {
					this.depth--;
				}
				if (this.depth == 0 && this.currentUrl != null) {
					this.items.add(toItem(this.currentUrl, warehouse));
					this.currentUrl = null;
				}
			}
			default -> {
				// not routed
			}
		}
	}

	@Nonnull
	private LinkItem toItem(@Nonnull String url, @Nonnull TokenWarehouse warehouse) {
		final String id = "link_" + this.items.size();
		final String sectionId = sectionIdOf(warehouse, this.currentLine);
		try {
			final NormalizedUrl normalized = warehouse.getUrlNormalizer().normalize(url);
			return new LinkItem(
				id, url, normalized.normalized(), normalized.scheme(), this.currentText.toString(),
				this.currentLine, sectionId, normalized.allowed()
			);
		} catch (InvalidUrlException e) {
			return new LinkItem(id, url, null, null, this.currentText.toString(), this.currentLine, sectionId, false);
		}
	}
}
