package io.evitadb.warehouse.collector;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;

/**
 * Pluggable extractor fed by {@link TokenWarehouse} during its single pass over the token stream.
 *
 * Callbacks must not block: no network, no file system, no sleeping. Expensive follow-up work belongs
 * after {@link TokenWarehouse#finalizeAll()} returns. Every call runs behind an exception and timeout
 * boundary, so a failure here only affects this collector.
 *
 * @param <R> type of the collected items
 */
public interface Collector<R> {

	/**
	 * Returns the unique name of the collector. It keys item caps, routing order and the result map.
	 *
	 * @return collector name
	 */
	@Nonnull
	String getName();

	/**
	 * Returns the token types the collector subscribes to.
	 *
	 * @return interest, read once at registration
	 */
	@Nonnull
	Interest getInterest();

	/**
	 * Fine-grained filter evaluated before {@link #onToken}.
	 *
	 * @param view      current token
	 * @param context   state of the running pass
	 * @param warehouse owning warehouse
	 * @return true to receive the token
	 */
	default boolean shouldProcess(@Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
		return true;
	}

	/**
	 * Receives one token of interest.
	 *
	 * @param index     position of the token in the canonical stream
	 * @param view      the token
	 * @param context   state of the running pass
	 * @param warehouse owning warehouse
	 */
	void onToken(int index, @Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse);

	/**
	 * Returns the number of items accumulated so far. The dispatcher compares it with the item cap after every call.
	 *
	 * @return accumulated item count
	 */
	int getItemCount();

	/**
	 * Produces the result of the pass.
	 *
	 * @param warehouse owning warehouse
	 * @return collected items
	 */
	@Nonnull
	CollectorResult<R> finish(@Nonnull TokenWarehouse warehouse);
}
