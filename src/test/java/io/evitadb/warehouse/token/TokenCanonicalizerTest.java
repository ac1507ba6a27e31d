package io.evitadb.warehouse.token;

import io.evitadb.warehouse.guard.ResourceLimitExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TokenCanonicalizer turns untrusted nodes into safe views")
public class TokenCanonicalizerTest {

	@Test
	@DisplayName("copies fields of a well-behaved node")
	public void shouldCopyFieldsOfWellBehavedNode() {
		final TestNode node = TestNode.leaf("fence").tag("code").map(3, 7).info("java").content("int a;");
		final TokenView view = new TokenCanonicalizer(10).canonicalize(node, 0, null, 0);

		assertEquals("fence", view.type());
		assertEquals(0, view.nesting());
		assertEquals("code", view.tag());
		assertEquals(new LineRange(3, 7), view.map());
		assertEquals("java", view.info());
		assertEquals("int a;", view.content());
		assertNull(view.href());
	}

	@Test
	@DisplayName("defaults every field whose accessor throws")
	public void shouldDefaultFieldsWhenAccessorsThrow() {
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(10);
		final TokenView view = canonicalizer.canonicalize(new HostileNode(), 0, null, 0);

		assertEquals("", view.type());
		assertEquals(0, view.nesting());
		assertEquals("", view.tag());
		assertNull(view.map());
		assertNull(view.info());
		assertEquals("", view.content());
		assertNull(view.href());
		assertNull(view.src());
		assertEquals(8, canonicalizer.getRepairedFields());
	}

	@Test
	@DisplayName("a throwing getChildren() yields no children")
	public void shouldIgnoreChildrenWhenAccessorThrows() {
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(10);
		final List<TokenView> views = canonicalizer.canonicalizeAll(List.of(new HostileNode()));

		assertEquals(1, views.size());
		assertEquals(9, canonicalizer.getRepairedFields());
	}

	@Test
	@DisplayName("clamps negative, inverted and oversized maps")
	public void shouldClampMaps() {
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(10);

		assertEquals(new LineRange(0, 0), canonicalizer.canonicalize(TestNode.open("heading").map(-100, -50), 0, null, 0).map());
		assertEquals(new LineRange(10, 10), canonicalizer.canonicalize(TestNode.leaf("hr").map(10, 5), 1, null, 0).map());
		assertEquals(
			new LineRange(5, LineRange.MAX_LINE),
			canonicalizer.canonicalize(TestNode.leaf("hr").map(5, Integer.MAX_VALUE), 2, null, 0).map()
		);
		assertEquals(3, canonicalizer.getRepairedFields());
	}

	@Test
	@DisplayName("drops maps of the wrong arity")
	public void shouldDropShortMaps() {
		final RawNode node = new TestNode("hr", 0) {
			@Override
			public int[] getMap() {
				return new int[]{4};
			}
		};
		final TokenView view = new TokenCanonicalizer(10).canonicalize(node, 0, null, 0);

		assertNull(view.map());
	}

	@Test
	@DisplayName("folds out-of-range nesting to its sign")
	public void shouldFoldNestingToSign() {
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(10);

		assertEquals(1, canonicalizer.canonicalize(new TestNode("x_open", 42), 0, null, 0).nesting());
		assertEquals(-1, canonicalizer.canonicalize(new TestNode("x_close", -7), 1, null, 0).nesting());
		assertEquals(2, canonicalizer.getRepairedFields());
	}

	@Test
	@DisplayName("drops null nodes and counts them as malformed")
	public void shouldDropNullNodes() {
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(10);
		final List<TokenView> views = canonicalizer.canonicalizeAll(Arrays.asList(TestNode.leaf("hr"), null, TestNode.leaf("hr")));

		assertEquals(2, views.size());
		assertEquals(1, canonicalizer.getMalformedNodes());
	}

	@Test
	@DisplayName("throws MalformedNodeException for a single null node")
	public void shouldRejectSingleNullNode() {
		final MalformedNodeException ex = assertThrows(
			MalformedNodeException.class,
			() -> new TokenCanonicalizer(10).canonicalize(null, 5, null, 0)
		);
		assertEquals(5, ex.getPosition());
	}

	@Test
	@DisplayName("flattens children in document order and lets them inherit the parent map")
	public void shouldFlattenChildren() {
		final TestNode inline = TestNode.leaf("inline").map(2, 3)
			.child(TestNode.open("link").attr("href", "https://example.com"))
			.child(TestNode.text("docs"))
			.child(TestNode.close("link"));
		final List<TokenView> views = new TokenCanonicalizer(10).canonicalizeAll(List.of(
			TestNode.open("paragraph").map(2, 3), inline, TestNode.close("paragraph").map(2, 3)
		));

		assertEquals(
			List.of("paragraph_open", "inline", "link_open", "text", "link_close", "paragraph_close"),
			views.stream().map(TokenView::type).toList()
		);
		assertEquals("https://example.com", views.get(2).href());
		assertEquals(new LineRange(2, 3), views.get(3).map());
		assertEquals(1, views.get(3).level());
		assertEquals(0, views.get(5).level());
	}

	@Test
	@DisplayName("terminates on cyclic children")
	public void shouldTerminateOnCycles() {
		final TestNode loop = TestNode.leaf("inline");
		loop.child(loop);
		final TokenCanonicalizer canonicalizer = new TokenCanonicalizer(100);
		final List<TokenView> views = canonicalizer.canonicalizeAll(List.of(loop));

		assertEquals(1, views.size());
		assertEquals(1, canonicalizer.getMalformedNodes());
	}

	@Test
	@DisplayName("rejects streams that flatten beyond the token limit")
	public void shouldRejectStreamsBeyondLimit() {
		final TestNode inline = TestNode.leaf("inline");
		for (int i = 0; i < 20; i++) {
			inline.child(TestNode.text("t" + i));
		}
		final List<RawNode> nodes = new ArrayList<>();
		nodes.add(inline);

		final ResourceLimitExceededException ex = assertThrows(
			ResourceLimitExceededException.class,
			() -> new TokenCanonicalizer(10).canonicalizeAll(nodes)
		);
		assertEquals(ResourceLimitExceededException.Limit.TOKENS, ex.getLimit());
	}

	@Test
	@DisplayName("views hold no reference to the node they came from")
	public void shouldNotRetainNodes() {
		final TestNode node = TestNode.leaf("text").content("before");
		final TokenView view = new TokenCanonicalizer(10).canonicalize(node, 0, null, 0);
		node.content("after");

		assertEquals("before", view.content());
		assertTrue(Arrays.stream(TokenView.class.getRecordComponents())
			.noneMatch(component -> RawNode.class.isAssignableFrom(component.getType())));
	}

	/**
	 * Node whose every accessor throws.
	 */
	private static class HostileNode implements RawNode {
		@Nullable @Override public String getType() { throw new IllegalStateException("type"); }
		@Override public int getNesting() { throw new IllegalStateException("nesting"); }
		@Nullable @Override public int[] getMap() { throw new IllegalStateException("map"); }
		@Nullable @Override public String getTag() { throw new IllegalStateException("tag"); }
		@Nullable @Override public String getInfo() { throw new IllegalStateException("info"); }
		@Nullable @Override public String getContent() { throw new IllegalStateException("content"); }
		@Nullable @Override public String attrGet(@Nonnull String name) { throw new IllegalStateException(name); }
		@Nullable @Override public List<? extends RawNode> getChildren() { throw new IllegalStateException("children"); }
	}
}
