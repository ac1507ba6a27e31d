package io.evitadb.warehouse.collector;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * {@link IgnoreTracker} for more ignore types than a mask can hold. Each collector keeps the set of its slots.
 */
final class SetIgnoreTracker extends IgnoreTracker {

	@Nonnull
	private final List<BitSet> collectorSlots;
	@Nonnull
	private final BitSet active;

	SetIgnoreTracker(@Nonnull List<String> sortedTypes, @Nonnull List<Interest> interests) {
		super(sortedTypes);
		this.active = new BitSet(sortedTypes.size());
		this.collectorSlots = new ArrayList<>(interests.size());
		for (final Interest interest : interests) {
			final BitSet slots = new BitSet(sortedTypes.size());
			for (final String type : interest.ignoreInside()) {
				slots.set(this.slotOfType.get(type));
			}
			this.collectorSlots.add(slots);
		}
	}

	@Override
	public boolean isMaskBased() {
		return false;
	}

	@Override
	protected void activate(int slot) {
		this.active.set(slot);
	}

	@Override
	protected void deactivate(int slot) {
		this.active.clear(slot);
	}

	@Override
	protected boolean isInsideIgnored(int collectorSlot) {
		return this.collectorSlots.get(collectorSlot).intersects(this.active);
	}

	@Override
	protected boolean ignores(int collectorSlot, int slot) {
		return this.collectorSlots.get(collectorSlot).get(slot);
	}
}
