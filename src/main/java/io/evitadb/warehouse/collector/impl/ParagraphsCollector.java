package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Collects paragraph text, including paragraphs nested in lists and block quotes.
 */
public final class ParagraphsCollector extends AbstractCollector<ParagraphItem> {

	public static final String NAME = "paragraphs";

	private boolean inParagraph;
	@Nullable
	private Integer currentLine;
	@Nonnull
	private final StringBuilder currentText = new StringBuilder();

	public ParagraphsCollector() {
		super(NAME, Interest.of("paragraph_open", "inline", "paragraph_close"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		switch (view.type()) {
			case "paragraph_open" -> {
				this.inParagraph = true;
				this.currentLine = view.startLine();
				this.currentText.setLength(0);
			}
			case "inline" -> {
				if (this.inParagraph) {
					this.currentText.append(view.content());
				}
			}
			case "paragraph_close" -> {
				if (this.inParagraph) {
					this.items.add(new ParagraphItem(
						this.currentText.toString(), this.currentLine, sectionIdOf(warehouse, this.currentLine)
					));
					this.inParagraph = false;
				}
			}
			default -> {
				// not routed
			}
		}
	}
}
