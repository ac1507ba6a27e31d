package io.evitadb.warehouse;

import io.evitadb.warehouse.CollectorError.Kind;
import io.evitadb.warehouse.CollectorError.Phase;
import io.evitadb.warehouse.collector.Collector;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.DispatchContext;
import io.evitadb.warehouse.collector.Interest;
import io.evitadb.warehouse.collector.RecordingCollector;
import io.evitadb.warehouse.collector.impl.HeadingsCollector;
import io.evitadb.warehouse.collector.impl.LinkItem;
import io.evitadb.warehouse.collector.impl.LinksCollector;
import io.evitadb.warehouse.collector.impl.ReferenceCollectors;
import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.token.RawNode;
import io.evitadb.warehouse.token.TestNode;
import io.evitadb.warehouse.token.TokenView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TokenWarehouse dispatches one token stream to many isolated collectors")
public class TokenWarehouseTest {

	private static final WarehouseConfig DIRECT = WarehouseConfig.defaults().withCollectorTimeout(Duration.ZERO);

	@Test
	@DisplayName("moves through IDLE, DISPATCHING, FINALIZED and DRAINED")
	public void shouldFollowLifecycle() {
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, DIRECT, new CapturingLog());
		final AtomicReference<DispatchState> observed = new AtomicReference<>();
		warehouse.registerCollector(new RecordingCollector("probe", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				observed.set(warehouse.getState());
			}
		});

		assertEquals(DispatchState.IDLE, warehouse.getState());
		warehouse.dispatchAll();
		assertEquals(DispatchState.DISPATCHING, observed.get());
		assertEquals(DispatchState.FINALIZED, warehouse.getState());
		warehouse.finalizeAll();
		assertEquals(DispatchState.DRAINED, warehouse.getState());
	}

	@Test
	@DisplayName("rejects a second dispatch and out-of-order calls")
	public void shouldRejectOutOfOrderCalls() {
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, DIRECT, new CapturingLog());

		assertThrows(IllegalStateException.class, warehouse::finalizeAll);
		warehouse.dispatchAll();
		final ReentrancyException second = assertThrows(ReentrancyException.class, warehouse::dispatchAll);
		assertEquals(DispatchState.FINALIZED, second.getState());
		assertThrows(IllegalStateException.class, () -> warehouse.registerCollector(new RecordingCollector("late", Interest.none())));
		warehouse.finalizeAll();
		assertThrows(IllegalStateException.class, warehouse::finalizeAll);
		assertThrows(ReentrancyException.class, warehouse::dispatchAll);
	}

	@Test
	@DisplayName("a collector re-entering dispatchAll() aborts the pass without double-processing")
	public void shouldRejectReentrantDispatch() {
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, WarehouseConfig.defaults(), new CapturingLog());
		final RecordingCollector reentrant = new RecordingCollector("reentrant", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				warehouse.dispatchAll();
			}
		};
		warehouse.registerCollector(reentrant);

		final ReentrancyException ex = assertThrows(ReentrancyException.class, warehouse::dispatchAll);
		assertEquals(DispatchState.DISPATCHING, ex.getState());
		assertEquals(List.of("2:text"), reentrant.getSeen());
		assertEquals(DispatchState.FINALIZED, warehouse.getState());
	}

	@Test
	@DisplayName("a failing collector is logged while the others keep receiving tokens")
	public void shouldIsolateCollectorFailures() {
		final CapturingLog log = new CapturingLog();
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, DIRECT, log);
		final RecordingCollector failing = new RecordingCollector("failing", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				if (index == 2) {
					throw new IllegalArgumentException("boom");
				}
			}
		};
		final RecordingCollector healthy = new RecordingCollector("healthy", Interest.of("text"));
		warehouse.registerCollector(failing);
		warehouse.registerCollector(healthy);

		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();

		assertEquals(List.of("2:text", "5:text"), healthy.getSeen());
		assertEquals(List.of("2:text", "5:text"), failing.getSeen());
		assertEquals(1, warehouse.getErrors().size());
		final CollectorError error = warehouse.getErrors().get(0);
		assertEquals("failing", error.collectorName());
		assertEquals(2, error.tokenIndex());
		assertEquals(IllegalArgumentException.class.getName(), error.exceptionType());
		assertEquals("boom", error.message());
		assertEquals(Kind.EXCEPTION, error.kind());
		assertEquals(Phase.ON_TOKEN, error.phase());
		assertEquals(2, results.get("healthy").count());
		assertTrue(log.getOutput().contains("[WARN] [failing] EXCEPTION in onToken at token 2"));
	}

	@Test
	@DisplayName("failures in shouldProcess skip onToken for that token")
	public void shouldSkipTokenWhenShouldProcessFails() {
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, DIRECT, new CapturingLog());
		final RecordingCollector picky = new RecordingCollector("picky", Interest.of("text")) {
			@Override
			public boolean shouldProcess(@Nonnull TokenView view, @Nonnull DispatchContext context, @Nonnull TokenWarehouse warehouse) {
				if ("first".equals(view.content())) {
					throw new IllegalStateException("cannot decide");
				}
				return true;
			}
		};
		warehouse.registerCollector(picky);
		warehouse.dispatchAll();

		assertEquals(List.of("5:text"), picky.getSeen());
		assertEquals(Phase.SHOULD_PROCESS, warehouse.getErrors().get(0).phase());
	}

	@Test
	@DisplayName("a failing or null finish() yields an empty truncated result")
	public void shouldReplaceFailedFinishResults() {
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, DIRECT, new CapturingLog());
		warehouse.registerCollector(new RecordingCollector("throwing", Interest.of("text")) {
			@Nonnull
			@Override
			public CollectorResult<String> finish(@Nonnull TokenWarehouse warehouse) {
				throw new UnsupportedOperationException("no result");
			}
		});
		warehouse.registerCollector(new RecordingCollector("nulling", Interest.of("text")) {
			@Override
			public CollectorResult<String> finish(@Nonnull TokenWarehouse warehouse) {
				return null;
			}
		});
		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();

		assertEquals(CollectorResult.failed(WarehouseConfig.DEFAULT_MAX_ITEMS), results.get("throwing"));
		assertEquals(CollectorResult.failed(WarehouseConfig.DEFAULT_MAX_ITEMS), results.get("nulling"));
		assertEquals(2, warehouse.getErrors().size());
		assertTrue(warehouse.getErrors().stream().allMatch(error -> error.phase() == Phase.FINISH && error.tokenIndex() == -1));
		assertEquals(List.of("nulling", "throwing"), List.copyOf(results.keySet()));
	}

	@Test
	@DisplayName("strict mode raises the first collector failure")
	public void shouldRaiseInStrictMode() {
		final TokenWarehouse warehouse = new TokenWarehouse(
			simpleDocument(), null, DIRECT.withRaiseOnCollectorError(true), new CapturingLog()
		);
		warehouse.registerCollector(new RecordingCollector("failing", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				throw new IllegalArgumentException("strict boom");
			}
		});

		final CollectorException ex = assertThrows(CollectorException.class, warehouse::dispatchAll);
		assertEquals("failing", ex.getError().collectorName());
		assertTrue(ex.getCause() instanceof IllegalArgumentException);
		assertEquals(DispatchState.FINALIZED, warehouse.getState());
		warehouse.finalizeAll();
		assertEquals(DispatchState.DRAINED, warehouse.getState());
	}

	@Test
	@DisplayName("a collector exceeding its time budget is disabled and reported as a timeout")
	public void shouldTimeOutSlowCollector() {
		final WarehouseConfig config = WarehouseConfig.defaults().withCollectorTimeout(Duration.ofMillis(100));
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, config, new CapturingLog());
		final RecordingCollector sleepy = new RecordingCollector("sleepy", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				try {
					Thread.sleep(10_000);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
		};
		final RecordingCollector healthy = new RecordingCollector("healthy", Interest.of("text"));
		warehouse.registerCollector(sleepy);
		warehouse.registerCollector(healthy);

		final long start = System.nanoTime();
		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();
		final long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

		assertTrue(elapsedMillis < 5_000, "dispatch must not wait for the sleeping collector, took " + elapsedMillis + " ms");
		assertEquals(List.of("2:text"), sleepy.getSeen());
		assertEquals(List.of("2:text", "5:text"), healthy.getSeen());
		assertEquals(1, warehouse.getErrors().size());
		assertEquals(Kind.TIMEOUT, warehouse.getErrors().get(0).kind());
		assertEquals(CollectorResult.failed(WarehouseConfig.DEFAULT_MAX_ITEMS), results.get("sleepy"));
		assertEquals(2, results.get("healthy").count());
	}

	@Test
	@DisplayName("a collector ignoring interruption is abandoned and dispatch still completes")
	public void shouldAbandonUninterruptibleCollector() {
		final WarehouseConfig config = WarehouseConfig.defaults().withCollectorTimeout(Duration.ofMillis(100));
		final TokenWarehouse warehouse = new TokenWarehouse(simpleDocument(), null, config, new CapturingLog());
		final AtomicBoolean release = new AtomicBoolean();
		warehouse.registerCollector(new RecordingCollector("spinning", Interest.of("text")) {
			@Override
			protected void onRecorded(int index, @Nonnull TokenView view, @Nonnull TokenWarehouse warehouse) {
				while (!release.get()) {
					Thread.onSpinWait();
				}
			}
		});
		final RecordingCollector healthy = new RecordingCollector("healthy", Interest.of("text"));
		warehouse.registerCollector(healthy);

		try {
			warehouse.dispatchAll();
			warehouse.finalizeAll();
		} finally {
			release.set(true);
		}

		assertEquals(List.of("2:text", "5:text"), healthy.getSeen());
		assertEquals(Kind.TIMEOUT, warehouse.getErrors().get(0).kind());
	}

	@Test
	@DisplayName("an href accessor that throws never reaches dispatch")
	public void shouldKeepHostileHrefOutOfErrorLog() {
		final RawNode hostileLink = new TestNode("link_open", 1) {
			@Override
			public String attrGet(@Nonnull String name) {
				throw new RuntimeException("hostile attrGet");
			}
		};
		final TestNode inline = TestNode.leaf("inline").map(0, 1)
			.child(hostileLink)
			.child(TestNode.text("click"))
			.child(TestNode.close("link"));
		final TokenWarehouse warehouse = new TokenWarehouse(
			List.of(TestNode.open("paragraph").map(0, 1), inline, TestNode.close("paragraph").map(0, 1)),
			null, DIRECT, new CapturingLog()
		);
		final LinksCollector links = new LinksCollector();
		warehouse.registerCollector(links);

		warehouse.dispatchAll();
		final CollectorResult<LinkItem> result = TokenWarehouse.resultOf(warehouse.finalizeAll(), links);

		assertTrue(warehouse.getErrors().isEmpty());
		assertEquals(2, warehouse.getRepairedFieldCount());
		assertEquals(1, result.count());
		assertEquals("", result.items().get(0).url());
		assertFalse(result.items().get(0).allowed());
		assertEquals("click", result.items().get(0).text());
	}

	@Test
	@DisplayName("caps links at 10,000 while other collectors still receive every token")
	public void shouldTruncateLinksAtCap() {
		final TestNode inline = TestNode.leaf("inline").map(0, 1);
		for (int i = 0; i < 10_005; i++) {
			inline.child(TestNode.open("link").attr("href", "https://example.com/" + i));
			inline.child(TestNode.text("link " + i));
			inline.child(TestNode.close("link"));
		}
		final CapturingLog log = new CapturingLog();
		final TokenWarehouse warehouse = new TokenWarehouse(
			List.of(TestNode.open("paragraph").map(0, 1), inline, TestNode.close("paragraph").map(0, 1)),
			null, DIRECT.withMaxItems("closers", 1_000_000), log
		);
		final LinksCollector links = new LinksCollector();
		final RecordingCollector closers = new RecordingCollector("closers", Interest.of("link_close"));
		warehouse.registerCollector(links);
		warehouse.registerCollector(closers);

		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();
		final CollectorResult<LinkItem> linkResult = TokenWarehouse.resultOf(results, links);

		assertEquals(10_000, linkResult.count());
		assertEquals(10_000, linkResult.items().size());
		assertTrue(linkResult.truncated());
		assertEquals(10_000, linkResult.maxAllowed());
		assertEquals("link_9999", linkResult.items().get(9_999).id());
		assertEquals(10_005, closers.getSeen().size());
		assertFalse(results.get("closers").truncated());
		assertTrue(log.getOutput().contains("[links] result truncated at 10000 item(s)"));
	}

	@Test
	@DisplayName("registration order does not change the results")
	public void shouldProduceIdenticalResultsForAnyRegistrationOrder() {
		final StringBuilder markdown = new StringBuilder();
		for (int i = 0; i < 400; i++) {
			markdown.append("## Heading ").append(i % 50).append("\n\n")
				.append("See [link ").append(i).append("](https://example.com/").append(i).append(") and ![img](img")
				.append(i).append(".png)\n\n");
		}
		final List<Map<String, CollectorResult<?>>> outputs = new ArrayList<>();
		for (final boolean reversed : new boolean[]{false, true}) {
			final TokenWarehouse warehouse = TokenWarehouse.fromMarkdown(markdown.toString(), DIRECT, new CapturingLog());
			assertTrue(warehouse.getTokens().size() >= 5_000, "document has " + warehouse.getTokens().size() + " tokens");
			final List<Collector<?>> collectors = new ArrayList<>(Arrays.asList(
				new RecordingCollector("A", Interest.of("text", "image").ignoringInside("heading")),
				new RecordingCollector("B", Interest.of("text", "link_open")),
				new LinksCollector(),
				new HeadingsCollector()
			));
			if (reversed) {
				Collections.reverse(collectors);
			}
			collectors.forEach(warehouse::registerCollector);
			warehouse.dispatchAll();
			outputs.add(warehouse.finalizeAll());
		}

		assertEquals(outputs.get(0), outputs.get(1));
		assertEquals(outputs.get(0).toString(), outputs.get(1).toString());
	}

	@Test
	@DisplayName("dispatch time grows linearly with document size")
	public void shouldScaleLinearly() {
		final long small = medianDispatchNanos(1_000);
		final double ratio = (double) medianDispatchNanos(2_000) / small;
		assertTrue(ratio <= 2.5, "2,000 tokens took " + ratio + "x longer than 1,000 tokens");

		final long large = medianDispatchNanos(8_000);
		final double largeRatio = (double) medianDispatchNanos(16_000) / large;
		assertTrue(largeRatio <= 2.5, "16,000 tokens took " + largeRatio + "x longer than 8,000 tokens");
	}

	@Test
	@DisplayName("ignored regions hide their tokens from the collector that ignores them")
	public void shouldHonorIgnoredRegions() {
		final TokenWarehouse warehouse = new TokenWarehouse(
			List.of(
				TestNode.text("outside"),
				TestNode.open("blockquote"),
				TestNode.text("inside"),
				TestNode.close("blockquote"),
				TestNode.text("after")
			),
			null, DIRECT, new CapturingLog()
		);
		final RecordingCollector ignoring = new RecordingCollector("ignoring", Interest.of("text").ignoringInside("blockquote"));
		final RecordingCollector all = new RecordingCollector("all", Interest.of("text"));
		warehouse.registerCollector(ignoring);
		warehouse.registerCollector(all);
		warehouse.dispatchAll();

		assertEquals(List.of("0:text", "4:text"), ignoring.getSeen());
		assertEquals(List.of("0:text", "2:text", "4:text"), all.getSeen());
	}

	@Test
	@DisplayName("exposes index, sections and logs diagnostics")
	public void shouldExposeIndexAndLog() {
		final CapturingLog log = new CapturingLog();
		final TokenWarehouse warehouse = new TokenWarehouse(
			Arrays.asList(TestNode.open("heading").tag("h1").map(0, 1), null, TestNode.close("heading").map(0, 1)),
			"# Title\n", DIRECT, log
		);
		warehouse.dispatchAll();
		warehouse.finalizeAll();

		assertEquals(1, warehouse.getMalformedNodeCount());
		assertEquals(2, warehouse.getTokens().size());
		assertEquals(Optional.of("section_0"), warehouse.sectionOf(0));
		assertTrue(warehouse.sectionAt(-5).isEmpty());
		assertEquals("# Title", warehouse.lineText(0, 0));
		assertSame(DIRECT, warehouse.getConfig());
		assertNotNull(warehouse.getUrlNormalizer());
		assertTrue(log.getOutput().contains("[WARN] Dropped 1 malformed node(s) during canonicalization"));
		assertTrue(log.getOutput().contains("[DEBUG] Indexed 2 tokens"));
		assertTrue(log.getOutput().contains("[DEBUG] Dispatched 2 tokens to 0 collector(s)"));
	}

	@Test
	@DisplayName("resultOf() rejects unknown collectors")
	public void shouldRejectUnknownResult() {
		assertThrows(IllegalArgumentException.class, () -> TokenWarehouse.resultOf(Map.of(), new LinksCollector()));
	}

	@Test
	@DisplayName("runs every reference collector over markdown")
	public void shouldRunReferenceCollectors() {
		final TokenWarehouse warehouse = TokenWarehouse.fromMarkdown(
			"# Title\n\nSome [link](https://example.com).\n", WarehouseConfig.defaults(), new CapturingLog()
		);
		ReferenceCollectors.createAll().forEach(warehouse::registerCollector);
		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();

		assertEquals(
			List.of("codeblocks", "headings", "html", "images", "links", "lists", "paragraphs", "sections", "tables", "tasklists"),
			List.copyOf(results.keySet())
		);
		assertEquals(1, results.get("links").count());
		assertEquals(1, results.get("headings").count());
		assertTrue(warehouse.getErrors().isEmpty());
	}

	/**
	 * Median dispatch time with the default configuration, so every call crosses the watchdog.
	 */
	private static long medianDispatchNanos(int textTokens) {
		final List<RawNode> nodes = new ArrayList<>(textTokens);
		for (int i = 0; i < textTokens; i++) {
			nodes.add(TestNode.text("t").map(i / 10, i / 10));
		}
		final WarehouseConfig config = WarehouseConfig.defaults().withMaxItems("counter", Integer.MAX_VALUE);
		final int warmups = 3;
		final int runs = 11;
		final long[] samples = new long[runs];
		for (int run = 0; run < warmups + runs; run++) {
			final TokenWarehouse warehouse = new TokenWarehouse(nodes, null, config, new CapturingLog());
			warehouse.registerCollector(new RecordingCollector("counter", Interest.of("text")));
			final long start = System.nanoTime();
			warehouse.dispatchAll();
			final long elapsed = System.nanoTime() - start;
			warehouse.finalizeAll();
			if (run >= warmups) {
				samples[run - warmups] = elapsed;
			}
		}
		Arrays.sort(samples);
		return Math.max(samples[runs / 2], 1);
	}

	/**
	 * Two paragraphs: tokens 2 and 5 are the texts "first" and "second".
	 */
	@Nonnull
	private static List<RawNode> simpleDocument() {
		return List.of(
			TestNode.open("paragraph").map(0, 1),
			TestNode.leaf("inline").map(0, 1).content("first"),
			TestNode.text("first").map(0, 1),
			TestNode.close("paragraph").map(0, 1),
			TestNode.open("paragraph").map(2, 3),
			TestNode.text("second").map(2, 3),
			TestNode.close("paragraph").map(2, 3)
		);
	}
}
