package io.evitadb.warehouse.collector;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * {@link IgnoreTracker} keeping the open regions in one 64-bit mask.
 */
final class MaskIgnoreTracker extends IgnoreTracker {

	@Nonnull
	private final long[] collectorMasks;
	private long active;

	MaskIgnoreTracker(@Nonnull List<String> sortedTypes, @Nonnull List<Interest> interests) {
		super(sortedTypes);
		if (sortedTypes.size() > MASK_WIDTH) {
			throw new IllegalArgumentException("At most " + MASK_WIDTH + " ignore types fit into a mask, got " + sortedTypes.size());
		}
		this.collectorMasks = new long[interests.size()];
		for (int i = 0; i < interests.size(); i++) {
			long mask = 0L;
			for (final String type : interests.get(i).ignoreInside()) {
				mask |= 1L << this.slotOfType.get(type);
			}
			this.collectorMasks[i] = mask;
		}
	}

	@Override
	public boolean isMaskBased() {
		return true;
	}

	@Override
	protected void activate(int slot) {
		this.active |= 1L << slot;
	}

	@Override
	protected void deactivate(int slot) {
		this.active &= ~(1L << slot);
	}

	@Override
	protected boolean isInsideIgnored(int collectorSlot) {
		return (this.active & this.collectorMasks[collectorSlot]) != 0L;
	}

	@Override
	protected boolean ignores(int collectorSlot, int slot) {
		return (this.collectorMasks[collectorSlot] & (1L << slot)) != 0L;
	}
}
