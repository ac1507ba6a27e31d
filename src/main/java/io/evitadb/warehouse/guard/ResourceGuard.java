package io.evitadb.warehouse.guard;

import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.guard.ResourceLimitExceededException.Limit;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Enforces document-wide limits (token count, byte size and nesting depth) before any index is built.
 * Per-collector item caps are looked up here as well but enforced by the dispatcher while tokens flow.
 */
public final class ResourceGuard {

	@Nonnull
	private final WarehouseConfig config;

	/**
	 * Creates a guard over the given configuration.
	 *
	 * @param config warehouse configuration with the limits
	 */
	public ResourceGuard(@Nonnull WarehouseConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	/**
	 * Validates measured document characteristics against the configured limits.
	 *
	 * @param tokenCount number of (flattened) tokens
	 * @param byteSize   size of the document in bytes
	 * @param maxNesting deepest nesting level reached by the stream
	 * @throws ResourceLimitExceededException when any of the limits is exceeded
	 */
	public void validate(long tokenCount, long byteSize, int maxNesting) {
		if (tokenCount > this.config.maxTokens()) {
			throw new ResourceLimitExceededException(Limit.TOKENS, tokenCount, this.config.maxTokens());
		}
		if (byteSize > this.config.maxBytes()) {
			throw new ResourceLimitExceededException(Limit.BYTES, byteSize, this.config.maxBytes());
		}
		if (maxNesting > this.config.maxNesting()) {
			throw new ResourceLimitExceededException(Limit.NESTING, maxNesting, this.config.maxNesting());
		}
	}

	/**
	 * Measures the canonical stream and validates it.
	 *
	 * @param tokens     canonical tokens
	 * @param sourceText source text the tokens were parsed from, or null when unavailable
	 * @throws ResourceLimitExceededException when any of the limits is exceeded
	 */
	public void validate(@Nonnull List<TokenView> tokens, @Nullable String sourceText) {
		Objects.requireNonNull(tokens, "tokens must not be null");
		if (tokens.size() > this.config.maxTokens()) {
			throw new ResourceLimitExceededException(Limit.TOKENS, tokens.size(), this.config.maxTokens());
		}
		final long byteSize = sourceText != null ? utf8Length(sourceText) : contentSize(tokens);
		validate(tokens.size(), byteSize, computeMaxNesting(tokens));
	}

	/**
	 * Returns the item cap configured for the given collector.
	 *
	 * @param collectorName collector name
	 * @return maximum number of items the collector may accumulate
	 */
	public int itemCapFor(@Nonnull String collectorName) {
		return this.config.maxItemsFor(collectorName);
	}

	/**
	 * Computes the peak of the running nesting sum. Unbalanced closing tokens never drive the depth below zero.
	 *
	 * @param tokens canonical tokens
	 * @return deepest nesting level
	 */
	public static int computeMaxNesting(@Nonnull List<TokenView> tokens) {
		int depth = 0;
		int max = 0;
		for (final TokenView token : tokens) {
			if (token.isOpening()) {
				depth++;
				if (depth > max) {
					max = depth;
				}
			} else if (token.isClosing() && depth > 0) {
				depth--;
			}
		}
		return max;
	}

	private static long contentSize(@Nonnull List<TokenView> tokens) {
		long size = 0;
		for (final TokenView token : tokens) {
			size += utf8Length(token.content());
		}
		return size;
	}

	/**
	 * Computes the UTF-8 encoded length without allocating the encoded bytes.
	 *
	 * @param text text to measure
	 * @return number of UTF-8 bytes
	 */
	public static long utf8Length(@Nonnull String text) {
		long count = 0;
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (c < 0x80) {
				count++;
			} else if (c < 0x800) {
				count += 2;
			} else if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
				count += 4;
				i++;
			} else {
				count += 3;
			}
		}
		return count;
	}
}
