package io.evitadb.warehouse.collector;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Registration and routing table of collectors.
 *
 * Collectors may be added until the registry is frozen. Freezing orders collectors by name, builds the
 * type to collector routing lists and compiles the ignore filters. The resulting routing is independent
 * of the order in which collectors were registered.
 */
public final class CollectorRegistry {

	private static final int[] NO_ROUTE = new int[0];

	@Nonnull
	private final Map<String, Collector<?>> byName = new TreeMap<>();
	@Nonnull
	private List<Collector<?>> ordered = List.of();
	@Nonnull
	private Map<String, int[]> routes = Map.of();
	@Nonnull
	private List<Interest> interests = List.of();
	private boolean frozen;

	/**
	 * Adds a collector.
	 *
	 * @param collector collector to add
	 * @throws IllegalStateException    when the registry is frozen
	 * @throws IllegalArgumentException when a collector with the same name is already registered
	 */
	public void register(@Nonnull Collector<?> collector) {
		Objects.requireNonNull(collector, "collector must not be null");
		if (this.frozen) {
			throw new IllegalStateException("Collector '" + collector.getName() + "' cannot be registered after dispatch has started");
		}
		final String name = Objects.requireNonNull(collector.getName(), "collector name must not be null");
		if (this.byName.containsKey(name)) {
			throw new IllegalArgumentException("Collector named '" + name + "' is already registered");
		}
		this.byName.put(name, collector);
	}

	/**
	 * Freezes the registry and builds the routing table. Calling it again has no effect.
	 */
	public void freeze() {
		if (this.frozen) {
			return;
		}
		this.frozen = true;
		final List<Collector<?>> sorted = new ArrayList<>(this.byName.values());
		sorted.sort(Comparator.comparing(Collector::getName));

		final List<Interest> sortedInterests = new ArrayList<>(sorted.size());
		final Map<String, List<Integer>> slotsByType = new TreeMap<>();
		for (int slot = 0; slot < sorted.size(); slot++) {
			final Interest interest = Objects.requireNonNull(
				sorted.get(slot).getInterest(), "interest of collector '" + sorted.get(slot).getName() + "' must not be null"
			);
			sortedInterests.add(interest);
			for (final String type : interest.types()) {
				slotsByType.computeIfAbsent(type, k -> new ArrayList<>()).add(slot);
			}
		}

		final Map<String, int[]> compiled = new TreeMap<>();
		for (final Map.Entry<String, List<Integer>> entry : slotsByType.entrySet()) {
			compiled.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
		}
		this.ordered = Collections.unmodifiableList(sorted);
		this.interests = Collections.unmodifiableList(sortedInterests);
		this.routes = Collections.unmodifiableMap(compiled);
	}

	/**
	 * Returns true once routing was built.
	 *
	 * @return true when frozen
	 */
	public boolean isFrozen() {
		return this.frozen;
	}

	/**
	 * Returns collectors in routing order (by name). Before freezing the list is in name order as well.
	 *
	 * @return ordered collectors
	 */
	@Nonnull
	public List<Collector<?>> getCollectors() {
		return this.frozen ? this.ordered : List.copyOf(this.byName.values());
	}

	/**
	 * Returns the slots of collectors interested in the token type, in routing order.
	 *
	 * @param type token type
	 * @return collector slots, never null
	 */
	@Nonnull
	public int[] routeFor(@Nonnull String type) {
		final int[] route = this.routes.get(type);
		return route == null ? NO_ROUTE : route;
	}

	/**
	 * Returns routed token types in sorted order.
	 *
	 * @return routed types
	 */
	@Nonnull
	public List<String> getRoutedTypes() {
		return List.copyOf(this.routes.keySet());
	}

	/**
	 * Creates a fresh ignore tracker for one dispatch pass.
	 *
	 * @return compiled tracker
	 * @throws IllegalStateException when the registry is not frozen yet
	 */
	@Nonnull
	public IgnoreTracker newIgnoreTracker() {
		if (!this.frozen) {
			throw new IllegalStateException("Registry must be frozen before dispatch");
		}
		return IgnoreTracker.compile(this.interests);
	}

	/**
	 * Returns the number of registered collectors.
	 *
	 * @return collector count
	 */
	public int size() {
		return this.byName.size();
	}

	/**
	 * Drops all collectors and routing. The registry stays frozen.
	 */
	public void clear() {
		this.frozen = true;
		this.byName.clear();
		this.ordered = List.of();
		this.interests = List.of();
		this.routes = Map.of();
	}
}
