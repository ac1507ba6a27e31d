package io.evitadb.warehouse;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Thrown when {@link TokenWarehouse#dispatchAll()} is called while a pass is running or after it has run.
 * This is a programming error and is never recorded as a collector failure.
 */
public final class ReentrancyException extends IllegalStateException {

	@Nonnull
	private final DispatchState state;

	/**
	 * Creates a new ReentrancyException.
	 *
	 * @param state state the warehouse was in when dispatch was requested
	 */
	public ReentrancyException(@Nonnull DispatchState state) {
		super(buildMessage(Objects.requireNonNull(state, "state must not be null")));
		this.state = state;
	}

	@Nonnull
	private static String buildMessage(@Nonnull DispatchState state) {
		if (state == DispatchState.DISPATCHING) {
			return "dispatchAll() called while the warehouse is already dispatching";
		}
		return "dispatchAll() may run only once per warehouse, current state is " + state;
	}

	/**
	 * Returns the state the warehouse was in.
	 *
	 * @return dispatch state
	 */
	@Nonnull
	public DispatchState getState() {
		return this.state;
	}
}
