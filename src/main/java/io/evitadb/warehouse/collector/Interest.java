package io.evitadb.warehouse.collector;

import io.evitadb.warehouse.token.TokenView;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declared subscription of a collector.
 *
 * Names in `ignoreInside` are base names: `blockquote` covers the region between `blockquote_open`
 * and `blockquote_close`, while a leaf token such as `fence` is suppressed by its own name.
 * Both sets are kept sorted so that routing never depends on declaration order.
 *
 * @param types        token types routed to the collector
 * @param ignoreInside base types whose region suppresses dispatch to the collector
 */
public record Interest(
	@Nonnull Set<String> types,
	@Nonnull Set<String> ignoreInside
) {

	/**
	 * Creates a new Interest with validation and defensive copying.
	 */
	public Interest {
		Objects.requireNonNull(types, "types must not be null");
		Objects.requireNonNull(ignoreInside, "ignoreInside must not be null");
		final TreeSet<String> sortedTypes = new TreeSet<>();
		for (final String type : types) {
			sortedTypes.add(Objects.requireNonNull(type, "type must not be null"));
		}
		final TreeSet<String> sortedIgnores = new TreeSet<>();
		for (final String ignore : ignoreInside) {
			sortedIgnores.add(TokenView.baseTypeOf(Objects.requireNonNull(ignore, "ignoreInside type must not be null")));
		}
		types = Collections.unmodifiableSet(sortedTypes);
		ignoreInside = Collections.unmodifiableSet(sortedIgnores);
	}

	/**
	 * Creates an interest in the given token types with no ignored regions.
	 *
	 * @param types token types
	 * @return new interest
	 */
	@Nonnull
	public static Interest of(@Nonnull String... types) {
		return new Interest(Set.copyOf(Arrays.asList(types)), Set.of());
	}

	/**
	 * Creates an interest that matches no token at all. Used by collectors reading only the index.
	 *
	 * @return empty interest
	 */
	@Nonnull
	public static Interest none() {
		return new Interest(Set.of(), Set.of());
	}

	/**
	 * Returns a copy of this interest that additionally ignores the given regions.
	 *
	 * @param types base types of ignored regions
	 * @return new interest
	 */
	@Nonnull
	public Interest ignoringInside(@Nonnull String... types) {
		final TreeSet<String> merged = new TreeSet<>(this.ignoreInside);
		merged.addAll(Arrays.asList(types));
		return new Interest(this.types, merged);
	}

	/**
	 * Returns true when the token type is routed to the collector.
	 *
	 * @param type token type
	 * @return true if interested
	 */
	public boolean isInterestedIn(@Nonnull String type) {
		return this.types.contains(type);
	}
}
