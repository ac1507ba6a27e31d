package io.evitadb.warehouse;

import io.evitadb.warehouse.CollectorError.Kind;
import io.evitadb.warehouse.CollectorError.Phase;
import io.evitadb.warehouse.collector.Collector;
import io.evitadb.warehouse.collector.CollectorRegistry;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.IgnoreTracker;
import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.guard.ResourceGuard;
import io.evitadb.warehouse.guard.ResourceLimitExceededException;
import io.evitadb.warehouse.index.IndexBuilder;
import io.evitadb.warehouse.index.IndexTables;
import io.evitadb.warehouse.index.Section;
import io.evitadb.warehouse.invoke.CollectorInvoker;
import io.evitadb.warehouse.invoke.CollectorTimeoutException;
import io.evitadb.warehouse.invoke.DirectCollectorInvoker;
import io.evitadb.warehouse.invoke.WatchdogCollectorInvoker;
import io.evitadb.warehouse.markdown.MarkdownDocument;
import io.evitadb.warehouse.markdown.MarkdownTokenizer;
import io.evitadb.warehouse.token.RawNode;
import io.evitadb.warehouse.token.TokenCanonicalizer;
import io.evitadb.warehouse.token.TokenView;
import io.evitadb.warehouse.url.UrlNormalizer;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-pass, multi-collector extraction engine over one parsed document.
 *
 * Construction canonicalizes the raw node stream, validates it against the resource limits and builds all
 * indices. Collectors are then registered, {@link #dispatchAll()} walks the tokens exactly once and
 * {@link #finalizeAll()} drains the results. An instance serves exactly one document and one pass; it is
 * not meant to be shared between threads.
 *
 * Each collector call runs behind an exception boundary and, when {@link WarehouseConfig#collectorTimeout()}
 * is positive, behind a watchdog with that budget. A failing collector is logged in the error log and skipped,
 * the other collectors keep receiving tokens.
 */
public final class TokenWarehouse {

	@Nonnull
	private final WarehouseConfig config;
	@Nonnull
	private final Log log;
	@Nonnull
	private final List<TokenView> tokens;
	@Nonnull
	private final IndexTables index;
	@Nonnull
	private final ResourceGuard guard;
	@Nonnull
	private final UrlNormalizer urlNormalizer;
	@Nonnull
	private final CollectorRegistry registry = new CollectorRegistry();
	@Nonnull
	private final AtomicReference<DispatchState> state = new AtomicReference<>(DispatchState.IDLE);
	private final int malformedNodes;
	private final int repairedFields;

	@Nullable
	private DispatchContext context;
	@Nullable
	private CollectorInvoker invoker;
	@Nonnull
	private boolean[] stopped = new boolean[0];

	/**
	 * Creates a warehouse over raw nodes with default configuration.
	 *
	 * @param nodes raw nodes in document order
	 */
	public TokenWarehouse(@Nonnull List<? extends RawNode> nodes) {
		this(nodes, null, WarehouseConfig.defaults(), new SystemStreamLog());
	}

	/**
	 * Creates a warehouse over raw nodes.
	 *
	 * @param nodes      raw nodes in document order
	 * @param sourceText text the nodes were parsed from, enables line text slices and exact byte size checks
	 * @param config     limits and policies
	 * @param log        Maven log for output
	 * @throws ResourceLimitExceededException when the document exceeds any document-wide limit
	 */
	public TokenWarehouse(
		@Nonnull List<? extends RawNode> nodes,
		@Nullable String sourceText,
		@Nonnull WarehouseConfig config,
		@Nonnull Log log
	) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.guard = new ResourceGuard(config);
		this.urlNormalizer = UrlNormalizer.fromConfig(config);

		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(config.maxTokens());
		this.tokens = Collections.unmodifiableList(canonicalizer.canonicalizeAll(nodes));
		this.malformedNodes = canonicalizer.getMalformedNodes();
		this.repairedFields = canonicalizer.getRepairedFields();
		if (this.malformedNodes > 0) {
			this.log.warn("Dropped " + this.malformedNodes + " malformed node(s) during canonicalization");
		}

		this.guard.validate(this.tokens, sourceText);
		this.index = IndexBuilder.build(this.tokens, sourceText);
		if (this.log.isDebugEnabled()) {
			this.log.debug(String.format(
				"Indexed %d tokens: %d types, %d sections, %d fences",
				this.tokens.size(), this.index.byType().size(), this.index.sections().size(), this.index.fences().size()
			));
		}
	}

	/**
	 * Parses markdown with the bundled commonmark bridge and creates a warehouse over the result.
	 * The byte limit is checked before parsing starts.
	 *
	 * @param markdown markdown source
	 * @param config   limits and policies
	 * @param log      Maven log for output
	 * @return new warehouse
	 * @throws ResourceLimitExceededException when the document exceeds any document-wide limit
	 */
	@Nonnull
	public static TokenWarehouse fromMarkdown(@Nonnull String markdown, @Nonnull WarehouseConfig config, @Nonnull Log log) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		new ResourceGuard(config).validate(0, ResourceGuard.utf8Length(markdown), 0);
		final MarkdownDocument document = new MarkdownDocument(markdown);
		final List<? extends RawNode> nodes = new MarkdownTokenizer().tokenize(document);
		return new TokenWarehouse(nodes, document.getContent(), config, log);
	}

	/**
	 * Registers a collector. Only allowed before {@link #dispatchAll()}.
	 *
	 * @param collector collector to register
	 * @throws IllegalStateException    after dispatch has started
	 * @throws IllegalArgumentException when the collector name is already taken
	 */
	public void registerCollector(@Nonnull Collector<?> collector) {
		Objects.requireNonNull(collector, "collector must not be null");
		if (this.state.get() != DispatchState.IDLE) {
			throw new IllegalStateException(
				"Collector '" + collector.getName() + "' cannot be registered in state " + this.state.get()
			);
		}
		this.registry.register(collector);
	}

	/**
	 * Walks the token stream once and feeds every registered collector.
	 *
	 * @throws ReentrancyException when called while dispatching or after a pass has already run
	 * @throws CollectorException  in strict mode, on the first collector failure
	 */
	public void dispatchAll() {
		if (!this.state.compareAndSet(DispatchState.IDLE, DispatchState.DISPATCHING)) {
			throw new ReentrancyException(this.state.get());
		}
		final long start = System.nanoTime();
		boolean completed = false;
		try {
			this.registry.freeze();
			final List<Collector<?>> collectors = this.registry.getCollectors();
			final IgnoreTracker tracker = this.registry.newIgnoreTracker();
			final DispatchContext ctx = new DispatchContext();
			this.context = ctx;
			this.stopped = new boolean[collectors.size()];
			this.invoker = createInvoker();

			final int[] caps = new int[collectors.size()];
			for (int slot = 0; slot < caps.length; slot++) {
				caps[slot] = this.guard.itemCapFor(collectors.get(slot).getName());
			}

			for (int i = 0; i < this.tokens.size(); i++) {
				final TokenView view = this.tokens.get(i);
				tracker.beforeToken(view);
				for (final int slot : this.registry.routeFor(view.type())) {
					if (!this.stopped[slot] && !tracker.isSuppressed(slot, view)) {
						deliver(slot, collectors.get(slot), i, view, ctx, caps[slot]);
					}
				}
				tracker.afterToken(view);
			}
			completed = true;
		} finally {
			if (!completed && this.invoker != null) {
				this.invoker.close();
				this.invoker = null;
			}
			this.state.set(DispatchState.FINALIZED);
			if (this.log.isDebugEnabled()) {
				this.log.debug(String.format(
					"Dispatched %d tokens to %d collector(s) in %d ms",
					this.tokens.size(), this.registry.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)
				));
			}
		}
	}

	/**
	 * Drains the result of every collector, then releases collectors, routing and worker threads.
	 *
	 * @return results keyed by collector name, sorted by name
	 * @throws IllegalStateException when no pass has run or the results were already drained
	 */
	@Nonnull
	public Map<String, CollectorResult<?>> finalizeAll() {
		if (this.state.get() != DispatchState.FINALIZED) {
			throw new IllegalStateException("finalizeAll() requires a completed dispatch, current state is " + this.state.get());
		}
		final DispatchContext ctx = Objects.requireNonNull(this.context, "dispatch context must exist after dispatch");
		final Map<String, CollectorResult<?>> results = new TreeMap<>();
		if (this.invoker == null) {
			this.invoker = createInvoker();
		}
		try {
			final List<Collector<?>> collectors = this.registry.getCollectors();
			for (int slot = 0; slot < collectors.size(); slot++) {
				final Collector<?> collector = collectors.get(slot);
				final String name = collector.getName();
				final int cap = this.guard.itemCapFor(name);
				if (ctx.isDisabled(name)) {
					// a timed out callback may still be running, its state is not trustworthy
					results.put(name, CollectorResult.failed(cap));
					continue;
				}
				final CollectorResult<?> result = invokeGuarded(
					slot, collector, -1, Phase.FINISH,
					() -> Objects.requireNonNull(collector.finish(this), "finish() returned null")
				);
				if (result == null) {
					results.put(name, CollectorResult.failed(cap));
				} else {
					if (result.truncated() || ctx.isTruncated(name)) {
						this.log.warn("[" + name + "] result truncated at " + cap + " item(s)");
					}
					results.put(name, result.withTruncated(ctx.isTruncated(name)));
				}
			}
		} finally {
			this.registry.clear();
			if (this.invoker != null) {
				this.invoker.close();
				this.invoker = null;
			}
			this.state.set(DispatchState.DRAINED);
		}
		return Collections.unmodifiableMap(results);
	}

	/**
	 * Returns the typed result of a collector from a map returned by {@link #finalizeAll()}.
	 *
	 * @param results   drained results
	 * @param collector the collector
	 * @param <R>       item type
	 * @return result of the collector
	 * @throws IllegalArgumentException when the map holds no result for the collector
	 */
	@Nonnull
	public static <R> CollectorResult<R> resultOf(@Nonnull Map<String, CollectorResult<?>> results, @Nonnull Collector<R> collector) {
		final CollectorResult<?> result = results.get(collector.getName());
		if (result == null) {
			throw new IllegalArgumentException("No result for collector '" + collector.getName() + "'");
		}
		return (CollectorResult<R>) result;
	}

	/**
	 * Returns the id of the section containing the line. Never throws.
	 *
	 * @param line zero-based line
	 * @return section id or empty for lines outside every section
	 */
	@Nonnull
	public Optional<String> sectionOf(int line) {
		return this.index.sectionLocator().find(line).map(Section::id);
	}

	/**
	 * Returns the section containing the line. Never throws.
	 *
	 * @param line zero-based line
	 * @return section or empty
	 */
	@Nonnull
	public Optional<Section> sectionAt(int line) {
		return this.index.sectionLocator().find(line);
	}

	/**
	 * Returns source text of lines `[start, end)`, empty when no source text was supplied.
	 *
	 * @param start first line (inclusive)
	 * @param end   last line (exclusive)
	 * @return line text
	 */
	@Nonnull
	public String lineText(int start, int end) {
		return this.index.lineText().text(start, end);
	}

	/**
	 * Returns the collector error log of the pass, empty before dispatch.
	 *
	 * @return errors in the order they happened
	 */
	@Nonnull
	public List<CollectorError> getErrors() {
		return this.context == null ? List.of() : this.context.getErrors();
	}

	@Nonnull
	public List<TokenView> getTokens() {
		return this.tokens;
	}

	@Nonnull
	public IndexTables getIndex() {
		return this.index;
	}

	@Nonnull
	public WarehouseConfig getConfig() {
		return this.config;
	}

	/**
	 * Returns the URL normalizer configured for this warehouse. Collectors judging URLs must use it.
	 *
	 * @return shared normalizer
	 */
	@Nonnull
	public UrlNormalizer getUrlNormalizer() {
		return this.urlNormalizer;
	}

	@Nonnull
	public DispatchState getState() {
		return this.state.get();
	}

	@Nonnull
	public Log getLog() {
		return this.log;
	}

	/**
	 * Returns the number of raw nodes dropped during canonicalization.
	 *
	 * @return malformed node count
	 */
	public int getMalformedNodeCount() {
		return this.malformedNodes;
	}

	/**
	 * Returns the number of node fields that were defaulted or clamped during canonicalization.
	 *
	 * @return repaired field count
	 */
	public int getRepairedFieldCount() {
		return this.repairedFields;
	}

	private void deliver(
		int slot,
		@Nonnull Collector<?> collector,
		int index,
		@Nonnull TokenView view,
		@Nonnull DispatchContext ctx,
		int cap
	) {
		final Boolean accepted = invokeGuarded(
			slot, collector, index, Phase.SHOULD_PROCESS,
			() -> collector.shouldProcess(view, ctx, this)
		);
		if (!Boolean.TRUE.equals(accepted)) {
			return;
		}
		final Integer count = invokeGuarded(
			slot, collector, index, Phase.ON_TOKEN,
			() -> {
				collector.onToken(index, view, ctx, this);
				return collector.getItemCount();
			}
		);
		if (count != null && count >= cap) {
			ctx.markTruncated(collector.getName());
			this.stopped[slot] = true;
			this.log.debug("[" + collector.getName() + "] reached its item cap of " + cap + " at token " + index);
		}
	}

	/**
	 * Runs one collector callback behind the exception and timeout boundary.
	 *
	 * @return result of the call or null when the call failed and the failure was recorded
	 */
	@Nullable
	private <T> T invokeGuarded(
		int slot,
		@Nonnull Collector<?> collector,
		int index,
		@Nonnull Phase phase,
		@Nonnull Callable<T> call
	) {
		final DispatchContext ctx = Objects.requireNonNull(this.context, "dispatch context must exist");
		final CollectorInvoker activeInvoker = Objects.requireNonNull(this.invoker, "invoker must exist");
		final String name = collector.getName();
		try {
			return activeInvoker.invoke(name, call);
		} catch (ReentrancyException e) {
			throw e;
		} catch (CollectorTimeoutException e) {
			ctx.disable(name);
			if (slot >= 0 && slot < this.stopped.length) {
				this.stopped[slot] = true;
			}
			return recordFailure(ctx, CollectorError.of(name, index, phase, e, Kind.TIMEOUT), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Dispatch interrupted while waiting for collector '" + name + "'", e);
		} catch (Exception | StackOverflowError e) {
			return recordFailure(ctx, CollectorError.of(name, index, phase, e, Kind.EXCEPTION), e);
		}
	}

	@Nullable
	private <T> T recordFailure(@Nonnull DispatchContext ctx, @Nonnull CollectorError error, @Nonnull Throwable cause) {
		ctx.recordError(error);
		this.log.warn(error.describe());
		if (this.config.raiseOnCollectorError()) {
			throw new CollectorException(error, cause);
		}
		return null;
	}

	@Nonnull
	private CollectorInvoker createInvoker() {
		if (this.config.isWatchdogEnabled()) {
			return new WatchdogCollectorInvoker(this.config.collectorTimeout(), this.log);
		}
		return DirectCollectorInvoker.INSTANCE;
	}
}
