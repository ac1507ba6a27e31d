package io.evitadb.warehouse.url;

import io.evitadb.warehouse.CapturingLog;
import io.evitadb.warehouse.TokenWarehouse;
import io.evitadb.warehouse.collector.CollectorResult;
import io.evitadb.warehouse.collector.impl.ImageItem;
import io.evitadb.warehouse.collector.impl.ImagesCollector;
import io.evitadb.warehouse.collector.impl.LinkItem;
import io.evitadb.warehouse.collector.impl.LinksCollector;
import io.evitadb.warehouse.config.WarehouseConfig;
import io.evitadb.warehouse.token.RawNode;
import io.evitadb.warehouse.token.TestNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FetchCandidateSelector shares the normalizer verdict with every collector")
public class FetchCandidateSelectorTest {

	private static final List<String> ADVERSARIAL_URLS = List.of(
		"https://example.com/page",
		"HTTPS://EXAMPLE.COM/",
		"JaVaScRiPt:alert(1)",
		"%6Aavascript:alert(1)",
		"java\tscript:alert(1)",
		"java%0Ascript:alert(1)",
		"  javascript:alert(1)",
		"vbscript:msgbox(1)",
		"data:text/html;base64,PHNjcmlwdD4=",
		"//evil.com/x",
		"\\\\evil.com\\x",
		"%2F%2Fevil.com",
		"%252F%252Fevil.com",
		"https://exa mple.com",
		"https://bücher.de/",
		"https://" + "a".repeat(64) + ".com",
		"https:///nohost",
		"https://example.com:99999999999999999999/",
		"https://example.com:port/",
		"http://[::1]/",
		"http://[::1/",
		"mailto:someone@example.com",
		"tel:+1",
		"relative/path.md",
		"#anchor",
		"1abc:def",
		"",
		"ftp://example.com/"
	);

	@Test
	@DisplayName("collectors and the selector agree on every adversarial URL")
	public void shouldAgreeWithNormalizerOnAdversarialUrls() {
		final WarehouseConfig config = WarehouseConfig.defaults();
		final UrlNormalizer normalizer = UrlNormalizer.fromConfig(config);
		final FetchCandidateSelector selector = new FetchCandidateSelector(normalizer, 100);

		final List<RawNode> nodes = new ArrayList<>();
		for (final String url : ADVERSARIAL_URLS) {
			nodes.add(TestNode.open("paragraph").tag("p"));
			nodes.add(TestNode.leaf("inline")
				.child(TestNode.open("link").attr("href", url))
				.child(TestNode.text("x"))
				.child(TestNode.close("link"))
				.child(TestNode.leaf("image").attr("src", url)));
			nodes.add(TestNode.close("paragraph").tag("p"));
		}
		final TokenWarehouse warehouse = new TokenWarehouse(nodes, null, config, new CapturingLog());
		final LinksCollector links = new LinksCollector();
		final ImagesCollector images = new ImagesCollector();
		warehouse.registerCollector(links);
		warehouse.registerCollector(images);
		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();
		final List<LinkItem> linkItems = TokenWarehouse.resultOf(results, links).items();
		final List<ImageItem> imageItems = TokenWarehouse.resultOf(results, images).items();

		assertEquals(ADVERSARIAL_URLS.size(), linkItems.size());
		assertEquals(ADVERSARIAL_URLS.size(), imageItems.size());
		for (int i = 0; i < ADVERSARIAL_URLS.size(); i++) {
			final String url = ADVERSARIAL_URLS.get(i);
			final boolean verdict = normalizer.isAllowed(url);
			assertEquals(verdict, selector.isAllowed(url), "selector verdict of " + url);
			assertEquals(verdict, linkItems.get(i).allowed(), "links verdict of " + url);
			assertEquals(verdict, imageItems.get(i).allowed(), "images verdict of " + url);
		}
		assertFalse(normalizer.isAllowed("JaVaScRiPt:alert(1)"));
		assertTrue(normalizer.isAllowed("relative/path.md"));
	}

	@Test
	@DisplayName("selects only absolute http(s) URLs without duplicates")
	public void shouldSelectFetchableUrls() {
		final FetchCandidateSelector selector = new FetchCandidateSelector(UrlNormalizer.DEFAULT, 10);

		final List<String> selected = selector.select(List.of(
			"https://example.com/a",
			"HTTPS://Example.com/a",
			"mailto:a@example.com",
			"javascript:alert(1)",
			"docs/page.md",
			"//evil.com",
			"http://example.org"
		));

		assertEquals(List.of("https://example.com/a", "http://example.org"), selected);
		assertTrue(selector.isFetchable("https://example.com"));
		assertFalse(selector.isFetchable("mailto:a@example.com"));
		assertFalse(selector.isFetchable("//evil.com"));
	}

	@Test
	@DisplayName("stops at the candidate limit")
	public void shouldRespectCandidateLimit() {
		final FetchCandidateSelector selector = new FetchCandidateSelector(UrlNormalizer.DEFAULT, 2);

		assertEquals(
			List.of("https://a.example", "https://b.example"),
			selector.select(List.of("https://a.example", "https://b.example", "https://c.example"))
		);
	}

	@Test
	@DisplayName("selects link targets before image sources")
	public void shouldSelectFromResults() {
		final TokenWarehouse warehouse = TokenWarehouse.fromMarkdown(
			"![logo](https://img.example/logo.png) and [site](https://example.com)\n",
			WarehouseConfig.defaults(), new CapturingLog()
		);
		warehouse.registerCollector(new LinksCollector());
		warehouse.registerCollector(new ImagesCollector());
		warehouse.dispatchAll();
		final Map<String, CollectorResult<?>> results = warehouse.finalizeAll();

		assertEquals(
			List.of("https://example.com", "https://img.example/logo.png"),
			new FetchCandidateSelector(UrlNormalizer.DEFAULT, 10).selectFrom(results)
		);
	}
}
