package io.evitadb.warehouse.collector;

import io.evitadb.warehouse.CollectorError;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable state of one dispatch pass: the collector error log, truncation flags and collectors disabled
 * after a timeout.
 */
public final class DispatchContext {

	@Nonnull
	private final List<CollectorError> errors = new ArrayList<>();
	@Nonnull
	private final Set<String> truncated = new TreeSet<>();
	@Nonnull
	private final Set<String> disabled = new TreeSet<>();

	/**
	 * Appends an entry to the error log.
	 *
	 * @param error failure to record
	 */
	public void recordError(@Nonnull CollectorError error) {
		this.errors.add(Objects.requireNonNull(error, "error must not be null"));
	}

	/**
	 * Returns the error log in the order failures happened.
	 *
	 * @return unmodifiable error log
	 */
	@Nonnull
	public List<CollectorError> getErrors() {
		return Collections.unmodifiableList(this.errors);
	}

	public void markTruncated(@Nonnull String collectorName) {
		this.truncated.add(collectorName);
	}

	public boolean isTruncated(@Nonnull String collectorName) {
		return this.truncated.contains(collectorName);
	}

	/**
	 * Stops routing tokens to the collector for the rest of the pass.
	 *
	 * @param collectorName collector name
	 */
	public void disable(@Nonnull String collectorName) {
		this.disabled.add(collectorName);
	}

	public boolean isDisabled(@Nonnull String collectorName) {
		return this.disabled.contains(collectorName);
	}
}
