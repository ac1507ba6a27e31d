package io.evitadb.warehouse.collector;

import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tracks open "ignore inside" regions during one dispatch pass and answers whether a collector is currently
 * suppressed.
 *
 * Distinct ignore types are sorted and get bits 0..63 of a mask. With more than {@link #MASK_WIDTH} types the
 * tracker falls back to name sets. Both variants give the same answers; only the cost differs.
 */
public abstract class IgnoreTracker {

	/**
	 * Number of ignore types a bit mask can hold.
	 */
	public static final int MASK_WIDTH = Long.SIZE;

	@Nonnull
	protected final Map<String, Integer> slotOfType;
	@Nonnull
	protected final int[] depth;

	/**
	 * Creates a tracker over sorted ignore types.
	 *
	 * @param sortedTypes distinct, sorted ignore types
	 */
	protected IgnoreTracker(@Nonnull List<String> sortedTypes) {
		final Map<String, Integer> slots = new TreeMap<>();
		for (int i = 0; i < sortedTypes.size(); i++) {
			slots.put(sortedTypes.get(i), i);
		}
		this.slotOfType = Collections.unmodifiableMap(slots);
		this.depth = new int[sortedTypes.size()];
	}

	/**
	 * Compiles the ignore filters of collectors listed in routing order.
	 *
	 * @param interests interests indexed by collector slot
	 * @return mask based tracker when the types fit into {@link #MASK_WIDTH} bits, set based otherwise
	 */
	@Nonnull
	public static IgnoreTracker compile(@Nonnull List<Interest> interests) {
		Objects.requireNonNull(interests, "interests must not be null");
		final TreeSet<String> allTypes = new TreeSet<>();
		for (final Interest interest : interests) {
			allTypes.addAll(interest.ignoreInside());
		}
		final List<String> sorted = new ArrayList<>(allTypes);
		if (sorted.size() <= MASK_WIDTH) {
			return new MaskIgnoreTracker(sorted, interests);
		}
		return new SetIgnoreTracker(sorted, interests);
	}

	/**
	 * Returns the slot (bit number for mask trackers) assigned to each ignore type.
	 *
	 * @return sorted type to slot mapping
	 */
	@Nonnull
	public Map<String, Integer> getSlots() {
		return this.slotOfType;
	}

	/**
	 * Updates region depth for a token that is about to be dispatched. Opening tokens enter their region
	 * before dispatch, so the delimiters themselves are part of the ignored region.
	 *
	 * @param view current token
	 */
	public void beforeToken(@Nonnull TokenView view) {
		if (view.isOpening()) {
			final Integer slot = this.slotOfType.get(view.baseType());
			if (slot != null) {
				this.depth[slot]++;
				activate(slot);
			}
		}
	}

	/**
	 * Updates region depth after a token was dispatched. A closing token without a matching opener is ignored.
	 *
	 * @param view current token
	 */
	public void afterToken(@Nonnull TokenView view) {
		if (view.isClosing()) {
			final Integer slot = this.slotOfType.get(view.baseType());
			if (slot != null && this.depth[slot] > 0) {
				this.depth[slot]--;
				if (this.depth[slot] == 0) {
					deactivate(slot);
				}
			}
		}
	}

	/**
	 * Returns true when dispatch of the token to the collector must be skipped.
	 *
	 * @param collectorSlot position of the collector in routing order
	 * @param view          current token
	 * @return true if the collector is inside one of its ignored regions or the token is an ignored leaf
	 */
	public boolean isSuppressed(int collectorSlot, @Nonnull TokenView view) {
		if (isInsideIgnored(collectorSlot)) {
			return true;
		}
		if (view.nesting() == 0) {
			final Integer slot = this.slotOfType.get(view.type());
			return slot != null && ignores(collectorSlot, slot);
		}
		return false;
	}

	/**
	 * Returns true while any region is open.
	 *
	 * @return true when some ignore region is active
	 */
	public boolean isAnyActive() {
		for (final int d : this.depth) {
			if (d > 0) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns true when this tracker uses bit masks.
	 *
	 * @return true for the mask variant
	 */
	public abstract boolean isMaskBased();

	protected abstract void activate(int slot);

	protected abstract void deactivate(int slot);

	protected abstract boolean isInsideIgnored(int collectorSlot);

	protected abstract boolean ignores(int collectorSlot, int slot);
}
