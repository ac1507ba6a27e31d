package io.evitadb.warehouse;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Raised in strict mode when a collector callback fails. In lenient mode the same failure is only logged
 * as a {@link CollectorError}.
 */
public final class CollectorException extends RuntimeException {

	@Nonnull
	private final CollectorError error;

	/**
	 * Creates a new CollectorException.
	 *
	 * @param error log entry describing the failure
	 * @param cause the failure
	 */
	public CollectorException(@Nonnull CollectorError error, @Nonnull Throwable cause) {
		super("Collector failed: " + Objects.requireNonNull(error, "error must not be null").describe(), cause);
		this.error = error;
	}

	/**
	 * Returns the log entry describing the failure.
	 *
	 * @return collector error
	 */
	@Nonnull
	public CollectorError getError() {
		return this.error;
	}
}
