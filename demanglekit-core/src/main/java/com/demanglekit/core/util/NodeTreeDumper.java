package com.demanglekit.core.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.demanglekit.core.model.Node;

/**
 * Formats a node tree as indented text for debugging.
 *
 * <p>One line per node, indented by two spaces per level:
 * <pre>{@code
 * kind=Global
 *   kind=Function
 *     kind=Module, text="Module"
 *     kind=Identifier, text="functionName"
 * }</pre>
 *
 * <p>Subtrees below {@link #MAX_DEPTH} are replaced by one {@code ...} line.
 */
public final class NodeTreeDumper {

    private static final String INDENT = "  ";

    /** Levels below this depth are collapsed into a single {@code ...} line. */
    public static final int MAX_DEPTH = 1024;

    private NodeTreeDumper() {
        // Prevent instantiation
    }

    /**
     * Dumps a tree.
     *
     * @param root root node, may be {@code null}
     * @return indented tree text, {@code "<null>\n"} for a null root
     */
    public static String dump(Node root) {
        StringBuilder sb = new StringBuilder();
        if (root == null) {
            return sb.append("<null>\n").toString();
        }
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root, 0));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            if (frame.depth() > MAX_DEPTH) {
                sb.append(INDENT.repeat(frame.depth())).append("...\n");
                continue;
            }
            appendLine(frame.node(), frame.depth(), sb);
            List<Node> children = frame.node().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Frame(children.get(i), frame.depth() + 1));
            }
        }
        return sb.toString();
    }

    private static void appendLine(Node node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append("kind=").append(node.kind().kindName());
        if (node.hasText()) {
            sb.append(", text=\"").append(node.text()).append('"');
        }
        if (node.hasIndex()) {
            sb.append(", index=").append(Long.toUnsignedString(node.index()));
        }
        sb.append('\n');
    }

    private record Frame(Node node, int depth) {}
}
