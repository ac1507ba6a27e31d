package io.evitadb.warehouse.token;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Input contract for nodes produced by an external parser or by third-party parser plugins.
 *
 * Implementations are untrusted: any accessor may throw, return null or return values outside the documented ranges.
 * Nodes are read exactly once by {@link TokenCanonicalizer}; nothing downstream keeps a reference to them.
 */
public interface RawNode {

	/**
	 * Returns the token type, e.g. `heading_open`, `inline` or `fence`.
	 *
	 * @return token type
	 */
	@Nullable
	String getType();

	/**
	 * Returns the nesting delta of the token: `1` opens a pair, `-1` closes it, `0` is a leaf.
	 *
	 * @return nesting delta
	 */
	int getNesting();

	/**
	 * Returns the source line range `[start, end]` of the token or null when unknown.
	 *
	 * @return two-element line range
	 */
	@Nullable
	int[] getMap();

	/**
	 * Returns the HTML tag name associated with the token (e.g. `h2`).
	 *
	 * @return tag name
	 */
	@Nullable
	String getTag();

	/**
	 * Returns the info string of fenced code blocks.
	 *
	 * @return info string
	 */
	@Nullable
	String getInfo();

	/**
	 * Returns the textual content of the token.
	 *
	 * @return content
	 */
	@Nullable
	String getContent();

	/**
	 * Returns the value of the named attribute (e.g. `href` or `src`).
	 *
	 * @param name attribute name
	 * @return attribute value or null if not present
	 */
	@Nullable
	String attrGet(@Nonnull String name);

	/**
	 * Returns nested child nodes. Parsers emitting a markdown-it like stream attach inline tokens
	 * as children of `inline` tokens.
	 *
	 * @return child nodes, never null for well-behaved implementations
	 */
	@Nullable
	default List<? extends RawNode> getChildren() {
		return List.of();
	}
}
