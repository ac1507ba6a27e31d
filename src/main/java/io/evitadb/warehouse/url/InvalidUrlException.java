package io.evitadb.warehouse.url;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when a URL cannot be normalized. Callers must treat such a URL as unsafe;
 * the exception is never fatal to the document it came from.
 */
public final class InvalidUrlException extends Exception {

	@Nonnull
	private final String rawUrl;

	/**
	 * Creates a new InvalidUrlException.
	 *
	 * @param message reason of the rejection
	 * @param rawUrl  the rejected input
	 */
	public InvalidUrlException(@Nonnull String message, @Nonnull String rawUrl) {
		super(message);
		this.rawUrl = Objects.requireNonNull(rawUrl, "rawUrl must not be null");
	}

	/**
	 * Creates a new InvalidUrlException with a cause.
	 *
	 * @param message reason of the rejection
	 * @param rawUrl  the rejected input
	 * @param cause   underlying failure
	 */
	public InvalidUrlException(@Nonnull String message, @Nonnull String rawUrl, @Nonnull Throwable cause) {
		super(message, cause);
		this.rawUrl = Objects.requireNonNull(rawUrl, "rawUrl must not be null");
	}

	/**
	 * Returns the rejected input.
	 *
	 * @return raw URL as supplied by the caller
	 */
	@Nonnull
	public String getRawUrl() {
		return this.rawUrl;
	}
}
