package io.evitadb.warehouse.markdown;

import org.commonmark.Extension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed markdown document with YAML front matter support.
 *
 * The text is normalized with {@link TextNormalizer} before parsing and block source spans are recorded,
 * so that the line numbers of the parsed nodes refer to {@link #getContent()}.
 */
public class MarkdownDocument {

	/**
	 * List of CommonMark extensions used for parsing.
	 */
	public static final List<Extension> MARKDOWN_EXTENSIONS = List.of(
		YamlFrontMatterExtension.create(),
		StrikethroughExtension.create(),
		TablesExtension.create(),
		TaskListItemsExtension.create()
	);

	private static final Parser PARSER = Parser.builder()
		.extensions(MARKDOWN_EXTENSIONS)
		.includeSourceSpans(IncludeSourceSpans.BLOCKS)
		.build();

	private final Node document;
	private final Map<String, List<String>> properties;
	private final String content;

	/**
	 * Normalizes and parses the markdown content.
	 *
	 * @param markdown the Markdown content to parse; must not be null
	 */
	public MarkdownDocument(@Nonnull String markdown) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		this.content = TextNormalizer.normalize(markdown);
		this.document = PARSER.parse(this.content);

		final YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
		this.document.accept(visitor);
		this.properties = new LinkedHashMap<>(visitor.getData());
	}

	/**
	 * Returns the root Node of the parsed Markdown document.
	 *
	 * @return the root Node representing the parsed Markdown content
	 */
	@Nonnull
	public Node getDocument() {
		return this.document;
	}

	/**
	 * Returns the normalized text the document was parsed from.
	 *
	 * @return NFC text with `\n` line endings
	 */
	@Nonnull
	public String getContent() {
		return this.content;
	}

	/**
	 * Retrieves the first value of the front matter property.
	 *
	 * @param key property name
	 * @return first value or empty when the property is missing
	 */
	@Nonnull
	public Optional<String> getProperty(@Nonnull String key) {
		Objects.requireNonNull(key, "key must not be null");
		final List<String> values = this.properties.get(key);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	/**
	 * Returns all front matter properties in declaration order.
	 *
	 * @return map of property names to their values
	 */
	@Nonnull
	public Map<String, List<String>> getProperties() {
		return Collections.unmodifiableMap(this.properties);
	}
}
