package io.evitadb.warehouse.config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable security and resource configuration of a token warehouse.
 *
 * @param maxTokens           maximum number of (flattened) tokens per document
 * @param maxBytes            maximum document size in UTF-8 bytes
 * @param maxNesting          maximum nesting depth of open/close pairs
 * @param maxItemsPerType     item caps keyed by collector name
 * @param defaultMaxItems     item cap of collectors not listed in `maxItemsPerType`
 * @param allowedSchemes      lower-case URL schemes considered safe
 * @param allowRelativeUrls   whether URLs without a scheme are considered safe
 * @param collectorTimeout    wall-clock budget of a single collector call, {@link Duration#ZERO} disables the watchdog
 * @param allowRawHtml        whether raw HTML is collected at all
 * @param raiseOnCollectorError when true, the first collector failure aborts dispatch (used in tests)
 */
public record WarehouseConfig(
	int maxTokens,
	long maxBytes,
	int maxNesting,
	@Nonnull Map<String, Integer> maxItemsPerType,
	int defaultMaxItems,
	@Nonnull Set<String> allowedSchemes,
	boolean allowRelativeUrls,
	@Nonnull Duration collectorTimeout,
	boolean allowRawHtml,
	boolean raiseOnCollectorError
) {

	public static final int DEFAULT_MAX_TOKENS = 500_000;
	public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
	public static final int DEFAULT_MAX_NESTING = 1_000;
	public static final int DEFAULT_MAX_ITEMS = 10_000;
	public static final Duration DEFAULT_COLLECTOR_TIMEOUT = Duration.ofSeconds(5);
	public static final Set<String> DEFAULT_ALLOWED_SCHEMES = Set.of("http", "https", "mailto", "tel");
	public static final Map<String, Integer> DEFAULT_MAX_ITEMS_PER_TYPE = Map.of(
		"links", 10_000,
		"images", 5_000,
		"headings", 5_000,
		"codeblocks", 2_000,
		"tables", 1_000,
		"lists", 50_000
	);

	private static final String ENV_PREFIX = "WAREHOUSE_";
	private static final String ENV_MAX_ITEMS_PREFIX = ENV_PREFIX + "MAX_ITEMS_";

	/**
	 * Creates a new WarehouseConfig with validation and defensive copying.
	 */
	public WarehouseConfig {
		Objects.requireNonNull(maxItemsPerType, "maxItemsPerType must not be null");
		Objects.requireNonNull(allowedSchemes, "allowedSchemes must not be null");
		Objects.requireNonNull(collectorTimeout, "collectorTimeout must not be null");
		requirePositive("maxTokens", maxTokens);
		requirePositive("maxBytes", maxBytes);
		requirePositive("maxNesting", maxNesting);
		requirePositive("defaultMaxItems", defaultMaxItems);
		if (collectorTimeout.isNegative()) {
			throw new IllegalArgumentException("collectorTimeout must not be negative");
		}
		for (final Map.Entry<String, Integer> entry : maxItemsPerType.entrySet()) {
			requirePositive("maxItems of " + entry.getKey(), entry.getValue());
		}
		maxItemsPerType = Collections.unmodifiableMap(new TreeMap<>(maxItemsPerType));
		allowedSchemes = Collections.unmodifiableSet(
			allowedSchemes.stream()
				.map(scheme -> scheme.trim().toLowerCase(Locale.ROOT))
				.filter(scheme -> !scheme.isEmpty())
				.collect(Collectors.<String, TreeSet<String>>toCollection(TreeSet::new))
		);
	}

	/**
	 * Returns the default configuration.
	 *
	 * @return default configuration
	 */
	@Nonnull
	public static WarehouseConfig defaults() {
		return new WarehouseConfig(
			DEFAULT_MAX_TOKENS,
			DEFAULT_MAX_BYTES,
			DEFAULT_MAX_NESTING,
			DEFAULT_MAX_ITEMS_PER_TYPE,
			DEFAULT_MAX_ITEMS,
			DEFAULT_ALLOWED_SCHEMES,
			true,
			DEFAULT_COLLECTOR_TIMEOUT,
			false,
			false
		);
	}

	/**
	 * Reads the configuration from `WAREHOUSE_*` environment variables, falling back to defaults
	 * for every variable that is not set.
	 *
	 * Recognized keys: `WAREHOUSE_MAX_TOKENS`, `WAREHOUSE_MAX_BYTES`, `WAREHOUSE_MAX_NESTING`,
	 * `WAREHOUSE_MAX_ITEMS` (default cap), `WAREHOUSE_MAX_ITEMS_<COLLECTOR>`, `WAREHOUSE_ALLOWED_SCHEMES`
	 * (comma separated), `WAREHOUSE_ALLOW_RELATIVE_URLS`, `WAREHOUSE_COLLECTOR_TIMEOUT_SECONDS`,
	 * `WAREHOUSE_COLLECTOR_TIMEOUT_MILLIS`, `WAREHOUSE_ALLOW_RAW_HTML` and `WAREHOUSE_STRICT`.
	 *
	 * @param environment environment variables, usually `System.getenv()`
	 * @return configuration
	 * @throws IllegalArgumentException when a variable holds an unparseable value
	 */
	@Nonnull
	public static WarehouseConfig fromEnvironment(@Nonnull Map<String, String> environment) {
		Objects.requireNonNull(environment, "environment must not be null");
		WarehouseConfig config = defaults();

		final String maxTokens = environment.get(ENV_PREFIX + "MAX_TOKENS");
		if (isSet(maxTokens)) {
			config = config.withMaxTokens(parseInt("WAREHOUSE_MAX_TOKENS", maxTokens));
		}
		final String maxBytes = environment.get(ENV_PREFIX + "MAX_BYTES");
		if (isSet(maxBytes)) {
			config = config.withMaxBytes(parseLong("WAREHOUSE_MAX_BYTES", maxBytes));
		}
		final String maxNesting = environment.get(ENV_PREFIX + "MAX_NESTING");
		if (isSet(maxNesting)) {
			config = config.withMaxNesting(parseInt("WAREHOUSE_MAX_NESTING", maxNesting));
		}
		final String defaultMaxItems = environment.get(ENV_PREFIX + "MAX_ITEMS");
		if (isSet(defaultMaxItems)) {
			config = config.withDefaultMaxItems(parseInt("WAREHOUSE_MAX_ITEMS", defaultMaxItems));
		}
		// sorted so that the resulting map does not depend on the iteration order of the environment
		for (final Map.Entry<String, String> entry : new TreeMap<>(environment).entrySet()) {
			if (entry.getKey().startsWith(ENV_MAX_ITEMS_PREFIX) && isSet(entry.getValue())) {
				final String collector = entry.getKey().substring(ENV_MAX_ITEMS_PREFIX.length()).toLowerCase(Locale.ROOT);
				if (!collector.isEmpty()) {
					config = config.withMaxItems(collector, parseInt(entry.getKey(), entry.getValue()));
				}
			}
		}
		final String schemes = environment.get(ENV_PREFIX + "ALLOWED_SCHEMES");
		if (isSet(schemes)) {
			config = config.withAllowedSchemes(parseSchemes(schemes));
		}
		final String allowRelative = environment.get(ENV_PREFIX + "ALLOW_RELATIVE_URLS");
		if (isSet(allowRelative)) {
			config = config.withAllowRelativeUrls(Boolean.parseBoolean(allowRelative.trim()));
		}
		final String timeoutMillis = environment.get(ENV_PREFIX + "COLLECTOR_TIMEOUT_MILLIS");
		final String timeoutSeconds = environment.get(ENV_PREFIX + "COLLECTOR_TIMEOUT_SECONDS");
		if (isSet(timeoutMillis)) {
			config = config.withCollectorTimeout(Duration.ofMillis(parseLong("WAREHOUSE_COLLECTOR_TIMEOUT_MILLIS", timeoutMillis)));
		} else if (isSet(timeoutSeconds)) {
			config = config.withCollectorTimeout(Duration.ofSeconds(parseLong("WAREHOUSE_COLLECTOR_TIMEOUT_SECONDS", timeoutSeconds)));
		}
		final String allowRawHtml = environment.get(ENV_PREFIX + "ALLOW_RAW_HTML");
		if (isSet(allowRawHtml)) {
			config = config.withAllowRawHtml(Boolean.parseBoolean(allowRawHtml.trim()));
		}
		final String strict = environment.get(ENV_PREFIX + "STRICT");
		if (isSet(strict)) {
			config = config.withRaiseOnCollectorError(Boolean.parseBoolean(strict.trim()));
		}
		return config;
	}

	/**
	 * Returns the item cap for the given collector.
	 *
	 * @param collectorName collector name
	 * @return configured cap or {@link #defaultMaxItems()}
	 */
	public int maxItemsFor(@Nonnull String collectorName) {
		Objects.requireNonNull(collectorName, "collectorName must not be null");
		final Integer cap = this.maxItemsPerType.get(collectorName);
		return cap == null ? this.defaultMaxItems : cap;
	}

	/**
	 * Returns true when the per-call watchdog is enabled.
	 *
	 * @return true when the collector timeout is positive
	 */
	public boolean isWatchdogEnabled() {
		return !this.collectorTimeout.isZero();
	}

	@Nonnull
	public WarehouseConfig withMaxTokens(int maxTokens) {
		return new WarehouseConfig(maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withMaxBytes(long maxBytes) {
		return new WarehouseConfig(this.maxTokens, maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withMaxNesting(int maxNesting) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	/**
	 * Returns a copy with the item cap of one collector replaced.
	 *
	 * @param collectorName collector name
	 * @param maxItems      new cap
	 * @return updated configuration
	 */
	@Nonnull
	public WarehouseConfig withMaxItems(@Nonnull String collectorName, int maxItems) {
		Objects.requireNonNull(collectorName, "collectorName must not be null");
		final Map<String, Integer> caps = new TreeMap<>(this.maxItemsPerType);
		caps.put(collectorName, maxItems);
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, caps, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withDefaultMaxItems(int defaultMaxItems) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withAllowedSchemes(@Nonnull Set<String> allowedSchemes) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withAllowRelativeUrls(boolean allowRelativeUrls) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withCollectorTimeout(@Nonnull Duration collectorTimeout) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, collectorTimeout, this.allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withAllowRawHtml(boolean allowRawHtml) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, allowRawHtml, this.raiseOnCollectorError);
	}

	@Nonnull
	public WarehouseConfig withRaiseOnCollectorError(boolean raiseOnCollectorError) {
		return new WarehouseConfig(this.maxTokens, this.maxBytes, this.maxNesting, this.maxItemsPerType, this.defaultMaxItems,
			this.allowedSchemes, this.allowRelativeUrls, this.collectorTimeout, this.allowRawHtml, raiseOnCollectorError);
	}

	/**
	 * Parses a comma separated scheme list.
	 *
	 * @param schemes e.g. `http, https,mailto`
	 * @return set of schemes
	 */
	@Nonnull
	public static Set<String> parseSchemes(@Nonnull String schemes) {
		return Arrays.stream(schemes.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(Collectors.toSet());
	}

	private static boolean isSet(@Nullable String value) {
		return value != null && !value.isBlank();
	}

	private static int parseInt(@Nonnull String key, @Nonnull String value) {
		try {
			return Integer.parseInt(value.trim().replace("_", ""));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer value of " + key + ": '" + value + "'", e);
		}
	}

	private static long parseLong(@Nonnull String key, @Nonnull String value) {
		try {
			return Long.parseLong(value.trim().replace("_", ""));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid numeric value of " + key + ": '" + value + "'", e);
		}
	}

	private static void requirePositive(@Nonnull String name, long value) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be at least 1, got " + value);
		}
	}
}
