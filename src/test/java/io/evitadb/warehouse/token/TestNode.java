package io.evitadb.warehouse.token;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Well-behaved {@link RawNode} used to build token streams by hand.
 */
public class TestNode implements RawNode {

	private final String type;
	private final int nesting;
	private String tag = "";
	private int[] map;
	private String info;
	private String content = "";
	private final Map<String, String> attributes = new HashMap<>();
	private final List<RawNode> children = new ArrayList<>();

	public TestNode(@Nonnull String type, int nesting) {
		this.type = type;
		this.nesting = nesting;
	}

	@Nonnull
	public static TestNode open(@Nonnull String baseType) {
		return new TestNode(baseType + "_open", 1);
	}

	@Nonnull
	public static TestNode close(@Nonnull String baseType) {
		return new TestNode(baseType + "_close", -1);
	}

	@Nonnull
	public static TestNode leaf(@Nonnull String type) {
		return new TestNode(type, 0);
	}

	@Nonnull
	public static TestNode text(@Nonnull String content) {
		return leaf("text").content(content);
	}

	@Nonnull
	public TestNode tag(@Nonnull String tag) {
		this.tag = tag;
		return this;
	}

	@Nonnull
	public TestNode map(int start, int end) {
		this.map = new int[]{start, end};
		return this;
	}

	@Nonnull
	public TestNode info(@Nullable String info) {
		this.info = info;
		return this;
	}

	@Nonnull
	public TestNode content(@Nonnull String content) {
		this.content = content;
		return this;
	}

	@Nonnull
	public TestNode attr(@Nonnull String name, @Nullable String value) {
		this.attributes.put(name, value);
		return this;
	}

	@Nonnull
	public TestNode child(@Nonnull RawNode child) {
		this.children.add(child);
		return this;
	}

	@Nullable @Override public String getType() { return this.type; }
	@Override public int getNesting() { return this.nesting; }
	@Nullable @Override public int[] getMap() { return this.map; }
	@Nullable @Override public String getTag() { return this.tag; }
	@Nullable @Override public String getInfo() { return this.info; }
	@Nullable @Override public String getContent() { return this.content; }
	@Nullable @Override public String attrGet(@Nonnull String name) { return this.attributes.get(name); }
	@Nullable @Override public List<? extends RawNode> getChildren() { return this.children; }
}
