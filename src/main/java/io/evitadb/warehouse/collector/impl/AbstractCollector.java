package io.evitadb.warehouse.collector.impl;

import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.Collector;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.Interest;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base of the bundled collectors: keeps the name, the interest and the accumulated items.
 *
 * @param <R> item type
 */
public abstract class AbstractCollector<R> implements Collector<R> {

	@Nonnull
	private final String name;
	@Nonnull
	private final Interest interest;
	@Nonnull
	protected final List<R> items = new ArrayList<>();

	protected AbstractCollector(@Nonnull String name, @Nonnull Interest interest) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.interest = Objects.requireNonNull(interest, "interest must not be null");
	}

	@Nonnull
	@Override
	public String getName() {
		return this.name;
	}

	@Nonnull
	@Override
	public Interest getInterest() {
		return this.interest;
	}

	@Override
	public int getItemCount() {
		return this.items.size();
	}

	@Nonnull
	@Override
	public CollectorResult<R> finish(@Nonnull TokenWarehouse warehouse) {
		return CollectorResult.of(this.items, false, warehouse.getConfig().maxItemsFor(this.name));
	}

	/**
	 * Resolves the section id of a line.
	 *
	 * @param warehouse owning warehouse
	 * @param line      zero-based line or null
	 * @return section id or null when the line is unknown or outside every section
	 */
	@Nullable
	protected static String sectionIdOf(@Nonnull TokenWarehouse warehouse, @Nullable Integer line) {
		return line == null ? null : warehouse.sectionOf(line).orElse(null);
	}
}
