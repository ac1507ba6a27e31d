package io.evitadb.warehouse.url;

import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.impl.ImageItem;
import io.evitadb.warehouse.collector.impl.ImagesCollector;
import io.evitadb.warehouse.collector.impl.LinkItem;
import io.evitadb.warehouse.collector.impl.LinksCollector;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the URLs an external, rate-limited fetcher may retrieve after extraction.
 *
 * Raw URLs are always normalized again with the shared {@link UrlNormalizer}; flags stored by collectors are
 * never trusted. Only allowed absolute `http` / `https` URLs are selected, de-duplicated in document order.
 */
public final class FetchCandidateSelector {

	@Nonnull
	private final UrlNormalizer normalizer;
	private final int maxCandidates;

	/**
	 * Creates a selector.
	 *
	 * @param normalizer    shared URL normalizer
	 * @param maxCandidates maximum number of selected URLs
	 */
	public FetchCandidateSelector(@Nonnull UrlNormalizer normalizer, int maxCandidates) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
		if (maxCandidates < 0) {
			throw new IllegalArgumentException("maxCandidates must not be negative");
		}
		this.maxCandidates = maxCandidates;
	}

	/**
	 * Selects fetchable URLs from raw URLs.
	 *
	 * @param rawUrls raw URLs in document order
	 * @return normalized fetchable URLs without duplicates
	 */
	@Nonnull
	public List<String> select(@Nonnull Iterable<String> rawUrls) {
		Objects.requireNonNull(rawUrls, "rawUrls must not be null");
		final Set<String> selected = new LinkedHashSet<>();
		for (final String rawUrl : rawUrls) {
			if (selected.size() >= this.maxCandidates) {
				break;
			}
			try {
				final NormalizedUrl normalized = this.normalizer.normalize(rawUrl);
				if (normalized.isFetchable()) {
					selected.add(normalized.normalized());
				}
			} catch (InvalidUrlException e) {
				// invalid URLs are unsafe and never fetched
				continue;
			}
		}
		return List.copyOf(selected);
	}

	/**
	 * Selects fetchable URLs from the links and images results of {@code TokenWarehouse.finalizeAll()}.
	 * Link targets come first, then image sources.
	 *
	 * @param results drained collector results
	 * @return normalized fetchable URLs without duplicates
	 */
	@Nonnull
	public List<String> selectFrom(@Nonnull Map<String, CollectorResult<?>> results) {
		Objects.requireNonNull(results, "results must not be null");
		final List<String> rawUrls = new ArrayList<>();
		final CollectorResult<?> links = results.get(LinksCollector.NAME);
		if (links != null) {
			for (final Object item : links.items()) {
				if (item instanceof LinkItem link) {
					rawUrls.add(link.url());
				}
			}
		}
		final CollectorResult<?> images = results.get(ImagesCollector.NAME);
		if (images != null) {
			for (final Object item : images.items()) {
				if (item instanceof ImageItem image) {
					rawUrls.add(image.src());
				}
			}
		}
		return select(rawUrls);
	}

	/**
	 * Returns the verdict a fetcher acts on for one URL.
	 *
	 * @param rawUrl raw URL
	 * @return true when the URL is allowed and absolute http(s)
	 */
	public boolean isFetchable(@Nonnull String rawUrl) {
		try {
			return this.normalizer.normalize(rawUrl).isFetchable();
		} catch (InvalidUrlException e) {
			return false;
		}
	}

	/**
	 * Returns the allowlist verdict of this call site.
	 *
	 * @param rawUrl raw URL
	 * @return true when the shared normalizer allows the URL
	 */
	public boolean isAllowed(@Nonnull String rawUrl) {
		return this.normalizer.isAllowed(rawUrl);
	}
}
