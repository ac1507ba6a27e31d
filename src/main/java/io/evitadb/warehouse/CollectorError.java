package io.evitadb.warehouse;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One entry of the collector error log.
 *
 * @param collectorName name of the failing collector
 * @param tokenIndex    index of the token being dispatched, -1 for failures in `finish`
 * @param exceptionType fully qualified class name of the failure
 * @param message       message of the failure, may be null
 * @param kind          exception or timeout
 * @param phase         callback that failed
 */
public record CollectorError(
	@Nonnull String collectorName,
	int tokenIndex,
	@Nonnull String exceptionType,
	@Nullable String message,
	@Nonnull Kind kind,
	@Nonnull Phase phase
) {

	/**
	 * Creates a new CollectorError with validation.
	 */
	public CollectorError {
		Objects.requireNonNull(collectorName, "collectorName must not be null");
		Objects.requireNonNull(exceptionType, "exceptionType must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(phase, "phase must not be null");
	}

	/**
	 * Creates an entry describing a failure.
	 *
	 * @param collectorName collector name
	 * @param tokenIndex    token index or -1
	 * @param phase         failing callback
	 * @param failure       the failure
	 * @param kind          exception or timeout
	 * @return log entry
	 */
	@Nonnull
	public static CollectorError of(
		@Nonnull String collectorName,
		int tokenIndex,
		@Nonnull Phase phase,
		@Nonnull Throwable failure,
		@Nonnull Kind kind
	) {
		return new CollectorError(collectorName, tokenIndex, failure.getClass().getName(), failure.getMessage(), kind, phase);
	}

	/**
	 * Returns a single-line description used in logs.
	 *
	 * @return description
	 */
	@Nonnull
	public String describe() {
		final String location = this.tokenIndex >= 0 ? " at token " + this.tokenIndex : "";
		return "[" + this.collectorName + "] " + this.kind + " in " + this.phase.getCallback() + location + ": " +
			this.exceptionType + (this.message == null ? "" : " (" + this.message + ")");
	}

	/**
	 * Kind of collector failure.
	 */
	public enum Kind {
		EXCEPTION,
		TIMEOUT
	}

	/**
	 * Collector callback in which the failure happened.
	 */
	public enum Phase {
		SHOULD_PROCESS("shouldProcess"),
		ON_TOKEN("onToken"),
		FINISH("finish");

		private final String callback;

		Phase(@Nonnull String callback) {
			this.callback = callback;
		}

		@Nonnull
		public String getCallback() {
			return this.callback;
		}
	}
}
