package io.evitadb.warehouse;

import io.evitadb.warehouse.collector.Collector;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.impl.ReferenceCollectors;
import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.guard.ResourceLimitExceededException;
import io.evitadb.warehouse.url.FetchCandidateSelector;
import io.evitadb.warehouse.url.UrlNormalizer;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Main Mojo of the token warehouse plugin providing actions:
 * - show-config: prints the effective configuration
 * - extract: runs every reference collector over each matched markdown file and reports the results
 *
 * Configuration is layered: defaults, then `WAREHOUSE_*` environment variables, then the plugin parameters.
 */
@Mojo(name = "extract", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class WarehouseMojo extends AbstractMojo {

	/** Which action to perform: "show-config" or "extract". */
	@Parameter(property = "warehouse.action", defaultValue = "show-config")
	private String action;

	/** Source directory path - relative to the project root (no default). */
	@Parameter(property = "warehouse.sourceDir")
	private String sourceDir;

	/** Regex to match all files to extract - default (?i).*\.md (ignore case). */
	@Parameter(property = "warehouse.fileRegex", defaultValue = "(?i).*\\.md")
	private String fileRegex = "(?i).*\\.md";

	/** Regex patterns of paths to skip. */
	@Parameter(property = "warehouse.excludes")
	private List<String> excludes;

	/** Maximum number of files to be extracted (default Integer.MAX_VALUE). */
	@Parameter(property = "warehouse.limit", defaultValue = "2147483647")
	private int limit = Integer.MAX_VALUE;

	@Parameter(property = "warehouse.maxTokens")
	private Integer maxTokens;

	@Parameter(property = "warehouse.maxBytes")
	private Long maxBytes;

	@Parameter(property = "warehouse.maxNesting")
	private Integer maxNesting;

	/** Item cap of collectors without their own entry in {@link #maxItemsPerType}. */
	@Parameter(property = "warehouse.defaultMaxItems")
	private Integer defaultMaxItems;

	/** Item caps keyed by collector name, e.g. `<links>500</links>`. */
	@Parameter
	private Map<String, Integer> maxItemsPerType;

	/** Comma separated URL schemes considered safe. */
	@Parameter(property = "warehouse.allowedSchemes")
	private String allowedSchemes;

	@Parameter(property = "warehouse.allowRelativeUrls")
	private Boolean allowRelativeUrls;

	/** Budget of a single collector call in milliseconds, 0 disables the watchdog. */
	@Parameter(property = "warehouse.collectorTimeoutMillis")
	private Long collectorTimeoutMillis;

	@Parameter(property = "warehouse.allowRawHtml")
	private Boolean allowRawHtml;

	/** When true, the first collector failure aborts extraction of the file. */
	@Parameter(property = "warehouse.strict")
	private Boolean strict;

	/** Fail the build when any collector failed. */
	@Parameter(property = "warehouse.failOnCollectorError", defaultValue = "false")
	private boolean failOnCollectorError = false;

	/** Fail the build when any document exceeded a resource limit. */
	@Parameter(property = "warehouse.failOnRejectedDocument", defaultValue = "true")
	private boolean failOnRejectedDocument = true;

	/** Maximum number of fetch candidates listed per file. */
	@Parameter(property = "warehouse.maxFetchCandidates", defaultValue = "100")
	private int maxFetchCandidates = 100;

	@Nonnull
	private Map<String, String> environment = System.getenv();

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		final WarehouseConfig config = resolveConfig();
		switch (this.action) {
			case "show-config":
				showConfig(getLog(), config);
				break;
			case "extract":
				extract(getLog(), config);
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, extract");
		}
	}

	/**
	 * Combines environment variables and plugin parameters into one configuration.
	 *
	 * @return effective configuration
	 * @throws MojoExecutionException when a value is out of range or unparseable
	 */
	@Nonnull
	WarehouseConfig resolveConfig() throws MojoExecutionException {
		try {
			WarehouseConfig config = WarehouseConfig.fromEnvironment(this.environment);
			if (this.maxTokens != null) {
				config = config.withMaxTokens(this.maxTokens);
			}
			if (this.maxBytes != null) {
				config = config.withMaxBytes(this.maxBytes);
			}
			if (this.maxNesting != null) {
				config = config.withMaxNesting(this.maxNesting);
			}
			if (this.defaultMaxItems != null) {
				config = config.withDefaultMaxItems(this.defaultMaxItems);
			}
			if (this.maxItemsPerType != null) {
				for (final Map.Entry<String, Integer> entry : this.maxItemsPerType.entrySet()) {
					config = config.withMaxItems(entry.getKey(), entry.getValue());
				}
			}
			if (this.allowedSchemes != null && !this.allowedSchemes.isBlank()) {
				config = config.withAllowedSchemes(WarehouseConfig.parseSchemes(this.allowedSchemes));
			}
			if (this.allowRelativeUrls != null) {
				config = config.withAllowRelativeUrls(this.allowRelativeUrls);
			}
			if (this.collectorTimeoutMillis != null) {
				config = config.withCollectorTimeout(Duration.ofMillis(this.collectorTimeoutMillis));
			}
			if (this.allowRawHtml != null) {
				config = config.withAllowRawHtml(this.allowRawHtml);
			}
			if (this.strict != null) {
				config = config.withRaiseOnCollectorError(this.strict);
			}
			return config;
		} catch (final IllegalArgumentException ex) {
			throw new MojoExecutionException("Invalid warehouse configuration: " + ex.getMessage(), ex);
		}
	}

	private void showConfig(@Nonnull final Log log, @Nonnull final WarehouseConfig config) {
		log.info("Token Warehouse Plugin Configuration:");
		log.info(" - sourceDir: " + (this.sourceDir == null || this.sourceDir.isBlank() ? "<not set>" : this.sourceDir));
		if (this.sourceDir == null || this.sourceDir.isBlank()) {
			log.warn("Source directory is not set");
		}
		log.info(" - fileRegex: " + this.fileRegex);
		log.info(" - excludes: " + (this.excludes == null || this.excludes.isEmpty() ? "<none>" : String.join(", ", this.excludes)));
		log.info(" - limit: " + this.limit);
		log.info(" - maxTokens: " + config.maxTokens());
		log.info(" - maxBytes: " + config.maxBytes());
		log.info(" - maxNesting: " + config.maxNesting());
		log.info(" - defaultMaxItems: " + config.defaultMaxItems());
		log.info(" - maxItemsPerType: " + config.maxItemsPerType());
		log.info(" - allowedSchemes: " + String.join(",", config.allowedSchemes()));
		log.info(" - allowRelativeUrls: " + config.allowRelativeUrls());
		log.info(" - collectorTimeout: " + (config.isWatchdogEnabled() ? config.collectorTimeout().toMillis() + " ms" : "<disabled>"));
		if (!config.isWatchdogEnabled()) {
			log.warn("Collector watchdog is disabled, a hanging collector blocks extraction");
		}
		log.info(" - allowRawHtml: " + config.allowRawHtml());
		log.info(" - strict: " + config.raiseOnCollectorError());
		log.info(" - failOnCollectorError: " + this.failOnCollectorError);
		log.info(" - failOnRejectedDocument: " + this.failOnRejectedDocument);
	}

	/**
	 * Executes the extract action.
	 *
	 * @param log    the Maven log
	 * @param config effective configuration
	 * @throws MojoExecutionException when the source directory is invalid or a failure flag is tripped
	 */
	private void extract(@Nonnull final Log log, @Nonnull final WarehouseConfig config) throws MojoExecutionException {
		if (this.sourceDir == null || this.sourceDir.isBlank()) {
			log.error("Source directory must be specified for extract action");
			throw new MojoExecutionException("Source directory not specified");
		}
		final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
		if (!Files.exists(root) || !Files.isDirectory(root)) {
			log.error("Source directory does not exist or is not a directory: " + root);
			throw new MojoExecutionException("Invalid source directory: " + root);
		}

		final Pattern pattern = Pattern.compile(this.fileRegex);
		final List<Pattern> exclusions = new ArrayList<>();
		if (this.excludes != null) {
			for (final String exclude : this.excludes) {
				if (exclude != null && !exclude.isBlank()) {
					exclusions.add(Pattern.compile(exclude));
				}
			}
		}

		final FetchCandidateSelector selector = new FetchCandidateSelector(
			UrlNormalizer.fromConfig(config), this.maxFetchCandidates
		);
		final AtomicInteger processed = new AtomicInteger(0);
		final AtomicInteger rejected = new AtomicInteger(0);
		final AtomicInteger failedFiles = new AtomicInteger(0);
		final AtomicInteger truncatedFiles = new AtomicInteger(0);

		final Visitor extractingVisitor = new Visitor() {
			@Override
			public void visit(@Nonnull Path file, @Nonnull String content) {
				if (processed.get() >= WarehouseMojo.this.limit) {
					return;
				}
				processed.incrementAndGet();
				final Path relativePath = root.relativize(file.toAbsolutePath().normalize());
				try {
					final ExtractionReport report = extractFile(relativePath, content, config, log, selector);
					log.info(relativePath + ": " + report.summary());
					for (final CollectorError error : report.errors()) {
						log.warn("  " + error.describe());
					}
					for (final String candidate : report.fetchCandidates()) {
						log.debug("  fetch candidate: " + candidate);
					}
					if (report.hasErrors()) {
						failedFiles.incrementAndGet();
					}
					if (!report.truncated().isEmpty()) {
						truncatedFiles.incrementAndGet();
					}
				} catch (final ResourceLimitExceededException ex) {
					rejected.incrementAndGet();
					log.error(relativePath + ": " + ex.getMessage());
				} catch (final CollectorException ex) {
					failedFiles.incrementAndGet();
					log.error(relativePath + ": " + ex.getMessage());
				}
			}

			@Override
			public void oversized(@Nonnull Path file, long size) {
				rejected.incrementAndGet();
				log.error(root.relativize(file.toAbsolutePath().normalize()) + ": Document rejected: byte size "
					+ size + " exceeds the limit of " + config.maxBytes() + ".");
			}
		};

		log.info("=== Extracting files in: " + root + " ===");
		try {
			final Traverser traverser = new Traverser(root, pattern, exclusions, config.maxBytes(), extractingVisitor);
			traverser.traverse();
		} catch (final IOException ex) {
			throw new MojoExecutionException("Extract action failed: " + ex.getMessage(), ex);
		}

		log.info("--- Extraction Summary ---");
		log.info("Processed: " + processed.get());
		log.info("Rejected: " + rejected.get());
		log.info("With collector errors: " + failedFiles.get());
		log.info("With truncated results: " + truncatedFiles.get());

		if (this.failOnRejectedDocument && rejected.get() > 0) {
			throw new MojoExecutionException(rejected.get() + " document(s) exceeded resource limits");
		}
		if (this.failOnCollectorError && failedFiles.get() > 0) {
			throw new MojoExecutionException("Collectors failed in " + failedFiles.get() + " document(s)");
		}
	}

	/**
	 * Runs one warehouse with every reference collector over a document.
	 *
	 * @param file     path reported in the result
	 * @param content  markdown source
	 * @param config   effective configuration
	 * @param log      the Maven log
	 * @param selector selector of fetch candidates
	 * @return extraction report
	 * @throws ResourceLimitExceededException when the document is rejected
	 * @throws CollectorException             when a collector fails in strict mode
	 */
	@Nonnull
	static ExtractionReport extractFile(
		@Nonnull final Path file,
		@Nonnull final String content,
		@Nonnull final WarehouseConfig config,
		@Nonnull final Log log,
		@Nonnull final FetchCandidateSelector selector
	) {
		final TokenWarehouse warehouse = TokenWarehouse.fromMarkdown(content, config, log);
		for (final Collector<?> collector : ReferenceCollectors.createAll()) {
			warehouse.registerCollector(collector);
		}
		try {
			warehouse.dispatchAll();
		} catch (final CollectorException ex) {
			// drain anyway so the registry is released and the watchdog thread shut down
			try {
				warehouse.finalizeAll();
			} catch (final RuntimeException suppressed) {
				ex.addSuppressed(suppressed);
			}
			throw ex;
		}
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();
		return ExtractionReport.from(file, results, warehouse.getErrors(), selector);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setExcludes(@Nullable final List<String> excludes) { this.excludes = excludes; }
	void setLimit(final int limit) { this.limit = limit; }
	void setMaxTokens(@Nullable final Integer maxTokens) { this.maxTokens = maxTokens; }
	void setMaxBytes(@Nullable final Long maxBytes) { this.maxBytes = maxBytes; }
	void setMaxNesting(@Nullable final Integer maxNesting) { this.maxNesting = maxNesting; }
	void setDefaultMaxItems(@Nullable final Integer defaultMaxItems) { this.defaultMaxItems = defaultMaxItems; }
	void setMaxItemsPerType(@Nullable final Map<String, Integer> maxItemsPerType) { this.maxItemsPerType = maxItemsPerType; }
	void setAllowedSchemes(@Nullable final String allowedSchemes) { this.allowedSchemes = allowedSchemes; }
	void setAllowRelativeUrls(@Nullable final Boolean allowRelativeUrls) { this.allowRelativeUrls = allowRelativeUrls; }
	void setCollectorTimeoutMillis(@Nullable final Long collectorTimeoutMillis) { this.collectorTimeoutMillis = collectorTimeoutMillis; }
	void setAllowRawHtml(@Nullable final Boolean allowRawHtml) { this.allowRawHtml = allowRawHtml; }
	void setStrict(@Nullable final Boolean strict) { this.strict = strict; }
	void setFailOnCollectorError(final boolean failOnCollectorError) { this.failOnCollectorError = failOnCollectorError; }
	void setFailOnRejectedDocument(final boolean failOnRejectedDocument) { this.failOnRejectedDocument = failOnRejectedDocument; }
	void setMaxFetchCandidates(final int maxFetchCandidates) { this.maxFetchCandidates = maxFetchCandidates; }
	void setEnvironment(@Nonnull final Map<String, String> environment) { this.environment = environment; }
}
