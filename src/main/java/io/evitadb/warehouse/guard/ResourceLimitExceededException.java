package io.evitadb.warehouse.guard;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when a document exceeds one of the document-wide resource limits.
 * It is raised before any index is built; the caller is expected to reject the document.
 */
public final class ResourceLimitExceededException extends RuntimeException {

	@Nonnull
	private final Limit limit;
	private final long actual;
	private final long maximum;

	/**
	 * Creates a new ResourceLimitExceededException.
	 *
	 * @param limit   which limit was exceeded
	 * @param actual  the measured value
	 * @param maximum the configured maximum
	 */
	public ResourceLimitExceededException(@Nonnull Limit limit, long actual, long maximum) {
		super(buildMessage(limit, actual, maximum));
		this.limit = Objects.requireNonNull(limit, "limit must not be null");
		this.actual = actual;
		this.maximum = maximum;
	}

	@Nonnull
	private static String buildMessage(@Nonnull Limit limit, long actual, long maximum) {
		return String.format(
			"Document rejected: %s %d exceeds the limit of %d.",
			limit.getDescription(), actual, maximum
		);
	}

	/**
	 * Returns the limit that was exceeded.
	 *
	 * @return exceeded limit
	 */
	@Nonnull
	public Limit getLimit() {
		return this.limit;
	}

	/**
	 * Returns the measured value.
	 *
	 * @return measured value
	 */
	public long getActual() {
		return this.actual;
	}

	/**
	 * Returns the configured maximum.
	 *
	 * @return configured maximum
	 */
	public long getMaximum() {
		return this.maximum;
	}

	/**
	 * Document-wide limits enforced by {@link ResourceGuard}.
	 */
	public enum Limit {
		TOKENS("token count"),
		BYTES("byte size"),
		NESTING("nesting depth");

		@Nonnull
		private final String description;

		Limit(@Nonnull String description) {
			this.description = description;
		}

		@Nonnull
		public String getDescription() {
			return this.description;
		}
	}
}
