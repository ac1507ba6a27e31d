package io.evitadb.warehouse;

import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.url.FetchCandidateSelector;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of extracting one file.
 *
 * @param file            extracted file
 * @param counts          item count per collector name
 * @param truncated       names of collectors that hit their item cap
 * @param errors          collector failures recorded during dispatch and finalization
 * @param fetchCandidates normalized http(s) URLs of links and images that an external fetcher may retrieve
 */
public record ExtractionReport(
	@Nonnull Path file,
	@Nonnull Map<String, Integer> counts,
	@Nonnull Set<String> truncated,
	@Nonnull List<CollectorError> errors,
	@Nonnull List<String> fetchCandidates
) {

	public ExtractionReport {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(counts, "counts must not be null");
		Objects.requireNonNull(truncated, "truncated must not be null");
		Objects.requireNonNull(errors, "errors must not be null");
		Objects.requireNonNull(fetchCandidates, "fetchCandidates must not be null");
		counts = Collections.unmodifiableMap(new TreeMap<>(counts));
		truncated = Collections.unmodifiableSet(new TreeSet<>(truncated));
		errors = List.copyOf(errors);
		fetchCandidates = List.copyOf(fetchCandidates);
	}

	/**
	 * Builds a report from drained results.
	 *
	 * @param file      extracted file
	 * @param results   results returned by {@link TokenWarehouse#finalizeAll()}
	 * @param errors    error log of the warehouse
	 * @param selector  selector of fetch candidates
	 * @return report
	 */
	@Nonnull
	public static ExtractionReport from(
		@Nonnull Path file,
		@Nonnull Map<String, CollectorResult<?>> results,
		@Nonnull List<CollectorError> errors,
		@Nonnull FetchCandidateSelector selector
	) {
		final Map<String, Integer> counts = new TreeMap<>();
		final Set<String> truncated = new TreeSet<>();
		for (final Map.Entry<String, CollectorResult<?>> entry : results.entrySet()) {
			counts.put(entry.getKey(), entry.getValue().count());
			if (entry.getValue().truncated()) {
				truncated.add(entry.getKey());
			}
		}
		return new ExtractionReport(file, counts, truncated, errors, selector.selectFrom(results));
	}

	/**
	 * Returns true when at least one collector failed.
	 *
	 * @return true when the error log is not empty
	 */
	public boolean hasErrors() {
		return !this.errors.isEmpty();
	}

	/**
	 * One-line summary such as `links=3, headings=2 (truncated: links)`.
	 *
	 * @return summary
	 */
	@Nonnull
	public String summary() {
		final String joined = this.counts.entrySet().stream()
			.map(entry -> entry.getKey() + "=" + entry.getValue())
			.collect(Collectors.joining(", "));
		final StringBuilder sb = new StringBuilder(joined.isEmpty() ? "<no collectors>" : joined);
		if (!this.truncated.isEmpty()) {
			sb.append(" (truncated: ").append(String.join(", ", this.truncated)).append(')');
		}
		if (!this.errors.isEmpty()) {
			sb.append(" [").append(this.errors.size()).append(" collector error(s)]");
		}
		return sb.toString();
	}
}
