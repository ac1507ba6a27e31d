package io.evitadb.warehouse.markdown;

import io.evitadb.warehouse.token.RawNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Markdown-it style token produced by {@link MarkdownTokenizer}. Block tokens form a flat stream,
 * inline tokens are attached as children of `inline` tokens.
 */
public final class MarkdownNode implements RawNode {

	@Nonnull
	private final String type;
	private final int nesting;
	@Nonnull
	private final String tag;
	@Nullable
	private final int[] map;
	@Nonnull
	private final Map<String, String> attributes = new TreeMap<>();
	@Nonnull
	private final List<MarkdownNode> children = new ArrayList<>();
	@Nullable
	private String info;
	@Nonnull
	private String content = "";

	/**
	 * Creates a token.
	 *
	 * @param type    token type
	 * @param nesting 1 for opening, -1 for closing, 0 for leaf tokens
	 * @param tag     HTML tag name
	 * @param map     line range `[start, end)` or null
	 */
	public MarkdownNode(@Nonnull String type, int nesting, @Nonnull String tag, @Nullable int[] map) {
		this.type = Objects.requireNonNull(type, "type must not be null");
		this.nesting = nesting;
		this.tag = Objects.requireNonNull(tag, "tag must not be null");
		this.map = map == null ? null : map.clone();
	}

	@Nonnull
	@Override
	public String getType() {
		return this.type;
	}

	@Override
	public int getNesting() {
		return this.nesting;
	}

	@Nullable
	@Override
	public int[] getMap() {
		return this.map == null ? null : this.map.clone();
	}

	@Nonnull
	@Override
	public String getTag() {
		return this.tag;
	}

	@Nullable
	@Override
	public String getInfo() {
		return this.info;
	}

	@Nonnull
	@Override
	public String getContent() {
		return this.content;
	}

	@Nullable
	@Override
	public String attrGet(@Nonnull String name) {
		return this.attributes.get(name);
	}

	@Nonnull
	@Override
	public List<MarkdownNode> getChildren() {
		return Collections.unmodifiableList(this.children);
	}

	@Nonnull
	MarkdownNode withInfo(@Nullable String info) {
		this.info = info;
		return this;
	}

	@Nonnull
	MarkdownNode withContent(@Nullable String content) {
		this.content = content == null ? "" : content;
		return this;
	}

	@Nonnull
	MarkdownNode withAttribute(@Nonnull String name, @Nullable String value) {
		if (value != null) {
			this.attributes.put(name, value);
		}
		return this;
	}

	void addChild(@Nonnull MarkdownNode child) {
		this.children.add(child);
	}

	@Override
	public String toString() {
		return this.type + (this.map == null ? "" : "[" + this.map[0] + "," + this.map[1] + "]");
	}
}
