package io.evitadb.warehouse.token;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable, primitive-only projection of one parsed node. All fields are copied when the view is created,
 * so holding a view never reaches back to the node it was made from.
 *
 * @param type    token type, empty when the node did not provide a readable one
 * @param nesting nesting delta, always -1, 0 or 1
 * @param tag     tag name, empty when absent
 * @param map     normalized source line range or null
 * @param info    info string of fences or null
 * @param content textual content, empty when absent
 * @param href    link target or null
 * @param src     image source or null
 * @param level   depth of the node in the children hierarchy it was flattened from (0 for top-level nodes)
 */
public record TokenView(
	@Nonnull String type,
	int nesting,
	@Nonnull String tag,
	@Nullable LineRange map,
	@Nullable String info,
	@Nonnull String content,
	@Nullable String href,
	@Nullable String src,
	int level
) {

	/**
	 * Creates a new TokenView with validation.
	 */
	public TokenView {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(tag, "tag must not be null");
		Objects.requireNonNull(content, "content must not be null");
		if (nesting < -1 || nesting > 1) {
			throw new IllegalArgumentException("nesting must be -1, 0 or 1, got " + nesting);
		}
		if (level < 0) {
			throw new IllegalArgumentException("level must not be negative");
		}
	}

	/**
	 * Returns true when this token opens a pair.
	 *
	 * @return true for opening tokens
	 */
	public boolean isOpening() {
		return this.nesting == 1;
	}

	/**
	 * Returns true when this token closes a pair.
	 *
	 * @return true for closing tokens
	 */
	public boolean isClosing() {
		return this.nesting == -1;
	}

	/**
	 * Returns the start line of the token or null when the token carries no map.
	 *
	 * @return start line or null
	 */
	@Nullable
	public Integer startLine() {
		return this.map == null ? null : this.map.start();
	}

	/**
	 * Returns the type without its `_open` / `_close` suffix, e.g. `table` for `table_open`.
	 *
	 * @return base type name
	 */
	@Nonnull
	public String baseType() {
		return baseTypeOf(this.type);
	}

	/**
	 * Strips the `_open` / `_close` suffix from a token type.
	 *
	 * @param type token type
	 * @return base type name
	 */
	@Nonnull
	public static String baseTypeOf(@Nonnull String type) {
		if (type.endsWith("_open")) {
			return type.substring(0, type.length() - "_open".length());
		} else if (type.endsWith("_close")) {
			return type.substring(0, type.length() - "_close".length());
		}
		return type;
	}
}
