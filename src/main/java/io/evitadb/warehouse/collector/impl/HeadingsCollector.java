package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.index.IndexBuilder;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collects headings with their level, text and anchor slug.
 */
public final class HeadingsCollector extends AbstractCollector<HeadingItem> {

	public static final String NAME = "headings";

	private static final Pattern SPECIAL_CHARACTERS = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s");
	private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

	@Nonnull
	private final Map<String, Integer> anchorUsage = new HashMap<>();
	private int currentLevel = -1;
	@Nullable
	private Integer currentLine;
	@Nonnull
	private final StringBuilder currentText = new StringBuilder();

	public HeadingsCollector() {
		super(NAME, Interest.of("heading_open", "inline", "heading_close"));
	}

	@Override
	public void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		switch (view.type()) {
			case "heading_open" -> {
				this.currentLevel = IndexBuilder.levelOf(view.tag());
				this.currentLine = view.startLine();
				this.currentText.setLength(0);
			}
			case "inline" -> {
				if (this.currentLevel >= 0) {
					this.currentText.append(view.content());
				}
			}
			case "heading_close" -> {
				if (this.currentLevel >= 0) {
					final String text = this.currentText.toString().strip();
					this.items.add(new HeadingItem(
						this.currentLevel, text, uniqueAnchor(slugify(text)), this.currentLine,
						sectionIdOf(warehouse, this.currentLine)
					));
					this.currentLevel = -1;
				}
			}
			default -> {
				// not routed
			}
		}
	}

	/**
	 * Converts heading text to a GitHub style anchor: lower case, Unicode letters, digits, spaces and hyphens
	 * kept, each whitespace replaced by a hyphen, leading and trailing hyphens trimmed.
	 *
	 * @param text heading text
	 * @return anchor slug
	 */
	@Nonnull
	static String slugify(@Nonnull String text) {
		final String lower = text.toLowerCase(Locale.ROOT);
		final String kept = SPECIAL_CHARACTERS.matcher(lower).replaceAll("");
		final String hyphenated = WHITESPACE.matcher(kept).replaceAll("-");
		return EDGE_HYPHENS.matcher(hyphenated).replaceAll("");
	}

	@Nonnull
	private String uniqueAnchor(@Nonnull String slug) {
		final int seen = this.anchorUsage.merge(slug, 1, Integer::sum) - 1;
		return seen == 0 ? slug : slug + "-" + seen;
	}
}
