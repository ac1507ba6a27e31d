package io.evitadb.warehouse.collector;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Result drained from one collector by {@link io.evitadb.warehouse.TokenWarehouse#finalizeAll()}.
 *
 * @param items      domain specific items in document order
 * @param count      number of accumulated items, which may differ from `items.size()` for nested results
 * @param truncated  true when the collector hit its item cap or failed, so the items are incomplete
 * @param maxAllowed item cap the collector ran with
 * @param <R>        item type
 */
public record CollectorResult<R>(
	@Nonnull List<R> items,
	int count,
	boolean truncated,
	int maxAllowed
) {

	/**
	 * Creates a new CollectorResult with validation and defensive copying.
	 */
	public CollectorResult {
		Objects.requireNonNull(items, "items must not be null");
		if (count < 0) {
			throw new IllegalArgumentException("count must not be negative");
		}
		items = List.copyOf(items);
	}

	/**
	 * Creates a result whose count equals the number of items.
	 *
	 * @param items      collected items
	 * @param truncated  truncation flag known to the collector
	 * @param maxAllowed item cap
	 * @param <R>        item type
	 * @return new result
	 */
	@Nonnull
	public static <R> CollectorResult<R> of(@Nonnull List<R> items, boolean truncated, int maxAllowed) {
		return new CollectorResult<>(items, items.size(), truncated, maxAllowed);
	}

	/**
	 * Creates the result reported for a collector whose `finish` failed.
	 *
	 * @param maxAllowed item cap
	 * @param <R>        item type
	 * @return empty, truncated result
	 */
	@Nonnull
	public static <R> CollectorResult<R> failed(int maxAllowed) {
		return new CollectorResult<>(List.of(), 0, true, maxAllowed);
	}

	/**
	 * Returns a copy with the truncation flag raised when `truncated` is true. A raised flag is never cleared.
	 *
	 * @param truncated truncation observed by the dispatcher
	 * @return result with merged flag
	 */
	@Nonnull
	public CollectorResult<R> withTruncated(boolean truncated) {
		if (!truncated || this.truncated) {
			return this;
		}
		return new CollectorResult<>(this.items, this.count, true, this.maxAllowed);
	}
}
