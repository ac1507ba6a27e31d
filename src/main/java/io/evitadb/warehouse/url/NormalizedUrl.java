package io.evitadb.warehouse.url;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Canonical answer of {@link UrlNormalizer} for one URL.
 *
 * @param scheme     lower-case scheme or null for relative references
 * @param normalized the normalized form of the URL
 * @param allowed    whether the URL passed the scheme allowlist
 */
public record NormalizedUrl(
	@Nullable String scheme,
	@Nonnull String normalized,
	boolean allowed
) {

	/**
	 * Creates a new NormalizedUrl with validation.
	 */
	public NormalizedUrl {
		Objects.requireNonNull(normalized, "normalized must not be null");
	}

	/**
	 * Returns true for relative references (URLs without a scheme).
	 *
	 * @return true when no scheme is present
	 */
	public boolean isRelative() {
		return this.scheme == null;
	}

	/**
	 * Returns true for allowed absolute `http` or `https` URLs, i.e. URLs a downstream fetcher may retrieve.
	 *
	 * @return true if fetchable
	 */
	public boolean isFetchable() {
		return this.allowed && ("http".equals(this.scheme) || "https".equals(this.scheme));
	}
}
