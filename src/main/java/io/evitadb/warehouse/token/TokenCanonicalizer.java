package io.evitadb.warehouse.token;

import io.evitadb.warehouse.guard.ResourceLimitExceededException;
import io.evitadb.warehouse.guard.ResourceLimitExceededException.Limit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Converts untrusted {@link RawNode} instances into {@link TokenView} records. This is the only place in the
 * library that calls methods on parser-supplied nodes.
 *
 * - Only allowlisted fields are read: type, nesting, tag, map, info, content, `href` and `src` attributes and children.
 * - Every accessor is called at most once per node, and anything it throws is swallowed and the field defaulted.
 * - Out-of-range values are clamped rather than rejected.
 * - Children are flattened in pre-order right after their owner using an explicit stack; each node instance
 *   is visited at most once, so cyclic or shared child graphs terminate.
 *
 * Instances keep counters of repaired fields and dropped nodes and are not thread-safe.
 */
public final class TokenCanonicalizer {

	private final int maxTokens;
	private int repairedFields;
	private int malformedNodes;

	/**
	 * Creates a canonicalizer that refuses to produce more than `maxTokens` views.
	 *
	 * @param maxTokens upper bound of the flattened stream length
	 */
	public TokenCanonicalizer(int maxTokens) {
		if (maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be at least 1");
		}
		this.maxTokens = maxTokens;
	}

	/**
	 * Canonicalizes the whole raw stream including nested children.
	 *
	 * @param nodes raw nodes in document order
	 * @return flattened views in document order
	 * @throws ResourceLimitExceededException when the flattened stream grows beyond the token limit
	 */
	@Nonnull
	public List<TokenView> canonicalizeAll(@Nonnull List<? extends RawNode> nodes) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		if (nodes.size() > this.maxTokens) {
			throw new ResourceLimitExceededException(Limit.TOKENS, nodes.size(), this.maxTokens);
		}

		final List<TokenView> out = new ArrayList<>(nodes.size());
		final Set<RawNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		final Deque<Frame> stack = new ArrayDeque<>();
		int position = 0;

		for (final RawNode root : nodes) {
			stack.push(new Frame(root, null, 0));
			while (!stack.isEmpty()) {
				final Frame frame = stack.pop();
				final int current = position++;
				if (frame.node() != null && !seen.add(frame.node())) {
					// already flattened once, cycle or shared subtree
					this.malformedNodes++;
					continue;
				}
				final TokenView view;
				try {
					view = canonicalize(frame.node(), current, frame.inheritedMap(), frame.level());
				} catch (MalformedNodeException e) {
					this.malformedNodes++;
					continue;
				}
				out.add(view);
				if (out.size() > this.maxTokens) {
					throw new ResourceLimitExceededException(Limit.TOKENS, out.size(), this.maxTokens);
				}

				final List<RawNode> children = readChildren(frame.node(), this.maxTokens - out.size());
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(new Frame(children.get(i), view.map(), frame.level() + 1));
				}
			}
		}
		return out;
	}

	/**
	 * Canonicalizes a single node.
	 *
	 * @param node         the raw node
	 * @param position     position of the node in the raw stream (used for error reporting)
	 * @param inheritedMap map to use when the node does not carry its own
	 * @param level        flattening depth
	 * @return primitive-only view of the node
	 * @throws MalformedNodeException when the node is null
	 */
	@Nonnull
	public TokenView canonicalize(@Nullable RawNode node, int position, @Nullable LineRange inheritedMap, int level) {
		if (node == null) {
			throw new MalformedNodeException("Node is null", position);
		}
		final String type = readString(() -> node.getType(), "");
		final int nesting = readNesting(node);
		final String tag = readString(() -> node.getTag(), "");
		final LineRange ownMap = readMap(node);
		final String info = readString(() -> node.getInfo(), null);
		final String content = readString(() -> node.getContent(), "");
		final String href = readString(() -> node.attrGet("href"), null);
		final String src = readString(() -> node.attrGet("src"), null);
		return new TokenView(
			type,
			nesting,
			tag,
			ownMap == null ? inheritedMap : ownMap,
			info,
			content,
			href,
			src,
			Math.max(level, 0)
		);
	}

	/**
	 * Returns the number of fields that had to be defaulted or clamped so far.
	 *
	 * @return repaired field count
	 */
	public int getRepairedFields() {
		return this.repairedFields;
	}

	/**
	 * Returns the number of nodes that were dropped (null nodes or repeated node instances).
	 *
	 * @return dropped node count
	 */
	public int getMalformedNodes() {
		return this.malformedNodes;
	}

	@Nullable
	private String readString(@Nonnull StringAccessor accessor, @Nullable String defaultValue) {
		try {
			final String value = accessor.read();
			return value == null ? defaultValue : value;
		} catch (Exception | StackOverflowError e) {
			this.repairedFields++;
			return defaultValue;
		}
	}

	private int readNesting(@Nonnull RawNode node) {
		final int raw;
		try {
			raw = node.getNesting();
		} catch (Exception | StackOverflowError e) {
			this.repairedFields++;
			return 0;
		}
		if (raw < -1 || raw > 1) {
			this.repairedFields++;
			return Integer.signum(raw);
		}
		return raw;
	}

	@Nullable
	private LineRange readMap(@Nonnull RawNode node) {
		final int[] raw;
		try {
			raw = node.getMap();
		} catch (Exception | StackOverflowError e) {
			this.repairedFields++;
			return null;
		}
		if (raw == null) {
			return null;
		}
		if (raw.length < 2) {
			this.repairedFields++;
			return null;
		}
		final long start = raw[0];
		final long end = raw[1];
		final LineRange clamped = LineRange.clamp(start, end);
		if (clamped.start() != start || clamped.end() != end) {
			this.repairedFields++;
		}
		return clamped;
	}

	@Nonnull
	private List<RawNode> readChildren(@Nullable RawNode node, int budget) {
		if (node == null) {
			return List.of();
		}
		try {
			final List<? extends RawNode> children = node.getChildren();
			if (children == null || children.isEmpty()) {
				return List.of();
			}
			final List<RawNode> copy = new ArrayList<>();
			for (final RawNode child : children) {
				if (copy.size() > budget) {
					throw new ResourceLimitExceededException(Limit.TOKENS, (long) this.maxTokens + 1, this.maxTokens);
				}
				copy.add(child);
			}
			return copy;
		} catch (ResourceLimitExceededException e) {
			throw e;
		} catch (Exception | StackOverflowError e) {
			this.repairedFields++;
			return List.of();
		}
	}

	/**
	 * Accessor of a single string field of an untrusted node.
	 */
	@FunctionalInterface
	private interface StringAccessor {
		@Nullable
		String read();
	}

	/**
	 * Pending node on the flattening stack.
	 */
	private record Frame(@Nullable RawNode node, @Nullable LineRange inheritedMap, int level) {
	}
}
