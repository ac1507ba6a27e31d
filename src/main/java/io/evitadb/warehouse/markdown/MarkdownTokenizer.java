package io.evitadb.warehouse.markdown;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterNode;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Turns a commonmark AST into a markdown-it style token stream.
 *
 * Block nodes become a flat sequence of `*_open` / `*_close` pairs and leaf tokens (`fence`, `code_block`,
 * `html_block`, `hr`, `front_matter`). The inline content of headings, paragraphs and table cells is emitted
 * as an `inline` token whose children carry the inline tokens (`text`, `code_inline`, `link_open`, `image`...).
 * Token maps are `[firstLine, lastLine + 1)` taken from block source spans; nodes without spans inherit
 * the map of their enclosing block. Both walks use an explicit stack, so deeply nested documents cannot
 * overflow the call stack.
 */
public final class MarkdownTokenizer {

	/**
	 * Tokenizes a parsed document.
	 *
	 * @param document parsed document
	 * @return block tokens in document order
	 */
	@Nonnull
	public List<MarkdownNode> tokenize(@Nonnull MarkdownDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		return tokenize(document.getDocument());
	}

	/**
	 * Tokenizes the children of a commonmark node.
	 *
	 * @param root root node, usually a `Document`
	 * @return block tokens in document order
	 */
	@Nonnull
	public List<MarkdownNode> tokenize(@Nonnull Node root) {
		Objects.requireNonNull(root, "root must not be null");
		final List<MarkdownNode> out = new ArrayList<>();
		final Deque<Step> stack = new ArrayDeque<>();
		pushChildren(stack, root, mapOf(root, null));
		while (!stack.isEmpty()) {
			final Step step = stack.pop();
			if (step.close() != null) {
				out.add(step.close());
			} else {
				emitBlock(Objects.requireNonNull(step.node()), step.parentMap(), out, stack);
			}
		}
		return out;
	}

	private static void emitBlock(
		@Nonnull Node node,
		@Nullable int[] parentMap,
		@Nonnull List<MarkdownNode> out,
		@Nonnull Deque<Step> stack
	) {
		final int[] map = mapOf(node, parentMap);
		if (node instanceof Heading heading) {
			emitInlineBlock(node, "heading", "h" + heading.getLevel(), map, out);
		} else if (node instanceof Paragraph) {
			emitInlineBlock(node, "paragraph", "p", map, out);
		} else if (node instanceof TableCell tableCell) {
			final String cell = tableCell.isHeader() ? "th" : "td";
			emitInlineBlock(node, cell, cell, map, out);
		} else if (node instanceof BulletList) {
			openContainer(node, new MarkdownNode("bullet_list_open", 1, "ul", map), "bullet_list_close", map, out, stack);
		} else if (node instanceof OrderedList orderedList) {
			final Integer start = orderedList.getMarkerStartNumber();
			final MarkdownNode open = new MarkdownNode("ordered_list_open", 1, "ol", map)
				.withAttribute("start", start == null ? null : String.valueOf(start));
			openContainer(node, open, "ordered_list_close", map, out, stack);
		} else if (node instanceof ListItem) {
			openContainer(node, new MarkdownNode("list_item_open", 1, "li", map), "list_item_close", map, out, stack);
		} else if (node instanceof BlockQuote) {
			openContainer(node, new MarkdownNode("blockquote_open", 1, "blockquote", map), "blockquote_close", map, out, stack);
		} else if (node instanceof TableBlock) {
			openContainer(node, new MarkdownNode("table_open", 1, "table", map), "table_close", map, out, stack);
		} else if (node instanceof TableHead) {
			openContainer(node, new MarkdownNode("thead_open", 1, "thead", map), "thead_close", map, out, stack);
		} else if (node instanceof TableBody) {
			openContainer(node, new MarkdownNode("tbody_open", 1, "tbody", map), "tbody_close", map, out, stack);
		} else if (node instanceof TableRow) {
			openContainer(node, new MarkdownNode("tr_open", 1, "tr", map), "tr_close", map, out, stack);
		} else if (node instanceof FencedCodeBlock fence) {
			out.add(new MarkdownNode("fence", 0, "code", map)
				.withInfo(fence.getInfo() == null ? "" : fence.getInfo())
				.withContent(fence.getLiteral()));
		} else if (node instanceof IndentedCodeBlock indented) {
			out.add(new MarkdownNode("code_block", 0, "code", map).withContent(indented.getLiteral()));
		} else if (node instanceof HtmlBlock html) {
			out.add(new MarkdownNode("html_block", 0, "", map).withContent(html.getLiteral()));
		} else if (node instanceof ThematicBreak) {
			out.add(new MarkdownNode("hr", 0, "hr", map));
		} else if (node instanceof TaskListItemMarker marker) {
			out.add(taskMarker(marker, map));
		} else if (node instanceof YamlFrontMatterBlock) {
			out.add(new MarkdownNode("front_matter", 0, "", map).withContent(frontMatterText(node)));
		} else if (!(node instanceof LinkReferenceDefinition)) {
			// unknown container, only its children produce tokens
			pushChildren(stack, node, map);
		}
	}

	private static void emitInlineBlock(
		@Nonnull Node node,
		@Nonnull String baseType,
		@Nonnull String tag,
		@Nullable int[] map,
		@Nonnull List<MarkdownNode> out
	) {
		out.add(new MarkdownNode(baseType + "_open", 1, tag, map));
		out.add(inlineToken(node, map));
		out.add(new MarkdownNode(baseType + "_close", -1, tag, map));
	}

	private static void openContainer(
		@Nonnull Node node,
		@Nonnull MarkdownNode open,
		@Nonnull String closeType,
		@Nullable int[] map,
		@Nonnull List<MarkdownNode> out,
		@Nonnull Deque<Step> stack
	) {
		out.add(open);
		stack.push(new Step(null, null, new MarkdownNode(closeType, -1, open.getTag(), map)));
		pushChildren(stack, node, map);
	}

	@Nonnull
	private static MarkdownNode inlineToken(@Nonnull Node block, @Nullable int[] map) {
		final MarkdownNode inline = new MarkdownNode("inline", 0, "", map);
		final StringBuilder plain = new StringBuilder();
		final Deque<Step> stack = new ArrayDeque<>();
		pushChildren(stack, block, null);
		while (!stack.isEmpty()) {
			final Step step = stack.pop();
			if (step.close() != null) {
				inline.addChild(step.close());
				continue;
			}
			final Node node = Objects.requireNonNull(step.node());
			if (node instanceof Text text) {
				final String literal = text.getLiteral();
				inline.addChild(new MarkdownNode("text", 0, "", null).withContent(literal));
				plain.append(literal);
			} else if (node instanceof Code code) {
				final String literal = code.getLiteral();
				inline.addChild(new MarkdownNode("code_inline", 0, "code", null).withContent(literal));
				plain.append(literal);
			} else if (node instanceof SoftLineBreak) {
				inline.addChild(new MarkdownNode("softbreak", 0, "br", null));
				plain.append('\n');
			} else if (node instanceof HardLineBreak) {
				inline.addChild(new MarkdownNode("hardbreak", 0, "br", null));
				plain.append('\n');
			} else if (node instanceof HtmlInline html) {
				inline.addChild(new MarkdownNode("html_inline", 0, "", null).withContent(html.getLiteral()));
			} else if (node instanceof Image image) {
				final String alt = plainText(image);
				inline.addChild(new MarkdownNode("image", 0, "img", null)
					.withAttribute("src", image.getDestination())
					.withAttribute("title", image.getTitle())
					.withContent(alt));
				plain.append(alt);
			} else if (node instanceof Link link) {
				inline.addChild(new MarkdownNode("link_open", 1, "a", null)
					.withAttribute("href", link.getDestination())
					.withAttribute("title", link.getTitle()));
				stack.push(new Step(null, null, new MarkdownNode("link_close", -1, "a", null)));
				pushChildren(stack, node, null);
			} else if (node instanceof Emphasis) {
				pushInlinePair(inline, stack, node, "em", "em");
			} else if (node instanceof StrongEmphasis) {
				pushInlinePair(inline, stack, node, "strong", "strong");
			} else if (node instanceof Strikethrough) {
				pushInlinePair(inline, stack, node, "s", "s");
			} else if (node instanceof TaskListItemMarker marker) {
				inline.addChild(taskMarker(marker, null));
			} else {
				pushChildren(stack, node, null);
			}
		}
		return inline.withContent(plain.toString());
	}

	private static void pushInlinePair(
		@Nonnull MarkdownNode inline,
		@Nonnull Deque<Step> stack,
		@Nonnull Node node,
		@Nonnull String baseType,
		@Nonnull String tag
	) {
		inline.addChild(new MarkdownNode(baseType + "_open", 1, tag, null));
		stack.push(new Step(null, null, new MarkdownNode(baseType + "_close", -1, tag, null)));
		pushChildren(stack, node, null);
	}

	@Nonnull
	private static MarkdownNode taskMarker(@Nonnull TaskListItemMarker marker, @Nullable int[] map) {
		return new MarkdownNode("task_list_marker", 0, "input", map).withInfo(marker.isChecked() ? "x" : " ");
	}

	/**
	 * Concatenates literal text of all descendants, used for image alt text.
	 */
	@Nonnull
	private static String plainText(@Nonnull Node node) {
		final StringBuilder sb = new StringBuilder();
		final Deque<Node> stack = new ArrayDeque<>();
		pushReversed(stack, node);
		while (!stack.isEmpty()) {
			final Node current = stack.pop();
			if (current instanceof Text text) {
				sb.append(text.getLiteral());
			} else if (current instanceof Code code) {
				sb.append(code.getLiteral());
			} else {
				pushReversed(stack, current);
			}
		}
		return sb.toString();
	}

	@Nonnull
	private static String frontMatterText(@Nonnull Node block) {
		final StringBuilder sb = new StringBuilder();
		for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
			if (child instanceof YamlFrontMatterNode entry) {
				sb.append(entry.getKey()).append(": ").append(String.join(", ", entry.getValues())).append('\n');
			}
		}
		return sb.toString();
	}

	private static void pushChildren(@Nonnull Deque<Step> stack, @Nonnull Node parent, @Nullable int[] parentMap) {
		final List<Node> children = new ArrayList<>();
		for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
			children.add(child);
		}
		for (int i = children.size() - 1; i >= 0; i--) {
			stack.push(new Step(children.get(i), parentMap, null));
		}
	}

	private static void pushReversed(@Nonnull Deque<Node> stack, @Nonnull Node parent) {
		final List<Node> children = new ArrayList<>();
		for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
			children.add(child);
		}
		for (int i = children.size() - 1; i >= 0; i--) {
			stack.push(children.get(i));
		}
	}

	@Nullable
	private static int[] mapOf(@Nonnull Node node, @Nullable int[] parentMap) {
		final List<SourceSpan> spans = node.getSourceSpans();
		if (spans == null || spans.isEmpty()) {
			return parentMap;
		}
		final int start = spans.get(0).getLineIndex();
		final int end = spans.get(spans.size() - 1).getLineIndex() + 1;
		return new int[]{start, Math.max(start, end)};
	}

	/**
	 * Pending work of a walk: either a node still to emit or a closing token to append.
	 */
	private record Step(@Nullable Node node, @Nullable int[] parentMap, @Nullable MarkdownNode close) {
	}
}
