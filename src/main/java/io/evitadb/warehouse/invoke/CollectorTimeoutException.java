package io.evitadb.warehouse.invoke;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Thrown when a collector callback exceeds its wall-clock budget.
 */
public final class CollectorTimeoutException extends RuntimeException {

	@Nonnull
	private final String collectorName;
	@Nonnull
	private final Duration timeout;

	/**
	 * Creates a new CollectorTimeoutException.
	 *
	 * @param collectorName collector whose call timed out
	 * @param timeout       the exceeded budget
	 */
	public CollectorTimeoutException(@Nonnull String collectorName, @Nonnull Duration timeout) {
		super(String.format(
			"Collector '%s' exceeded its time budget of %d ms",
			Objects.requireNonNull(collectorName, "collectorName must not be null"),
			Objects.requireNonNull(timeout, "timeout must not be null").toMillis()
		));
		this.collectorName = collectorName;
		this.timeout = timeout;
	}

	@Nonnull
	public String getCollectorName() {
		return this.collectorName;
	}

	@Nonnull
	public Duration getTimeout() {
		return this.timeout;
	}
}
