package io.evitadb.warehouse;

/**
 * Lifecycle of a {@link TokenWarehouse}: `IDLE -> DISPATCHING -> FINALIZED -> DRAINED`.
 */
public enum DispatchState {

	/**
	 * Collectors may be registered, no pass has run yet.
	 */
	IDLE,
	/**
	 * The single pass over the token stream is running.
	 */
	DISPATCHING,
	/**
	 * The pass completed (or aborted); results can be drained.
	 */
	FINALIZED,
	/**
	 * Results were drained and collector references released.
	 */
	DRAINED
}
