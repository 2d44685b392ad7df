package com.demanglekit.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a decoded symbol tree.
 *
 * <p>A node has a {@link NodeKind} tag, an optional text payload (identifiers, module names,
 * operator spellings), an optional unsigned numeric payload (indices, counts, raw enum
 * values) and an ordered list of children. Each tag expects a particular shape; the record
 * does not enforce it, the printer checks the parts it depends on.
 *
 * <p>Nodes are immutable, so a tree is always finite and acyclic and may be shared freely
 * between threads.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Node module = Node.withText(NodeKind.MODULE, "Swift");
 * Node name = Node.withText(NodeKind.IDENTIFIER, "Int");
 * Node intType = Node.of(NodeKind.TYPE, Node.of(NodeKind.STRUCTURE, module, name));
 * }</pre>
 *
 * @param kind tag of this node
 * @param text text payload, or {@code null} if the node carries none
 * @param index unsigned numeric payload, or {@code null} if the node carries none
 * @param children ordered children, never {@code null}
 */
public record Node(
    NodeKind kind,
    String text,
    Long index,
    List<Node> children
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(kind, "kind must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a node with children and no payload.
     *
     * @param kind tag
     * @param children ordered children
     * @return new node
     */
    public static Node of(NodeKind kind, Node... children) {
        return new Node(kind, null, null, Arrays.asList(children));
    }

    /**
     * Creates a node with children and no payload.
     *
     * @param kind tag
     * @param children ordered children
     * @return new node
     */
    public static Node of(NodeKind kind, List<Node> children) {
        return new Node(kind, null, null, children);
    }

    /**
     * Creates a leaf node with a text payload.
     *
     * @param kind tag
     * @param text text payload
     * @return new node
     */
    public static Node withText(NodeKind kind, String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Node(kind, text, null, List.of());
    }

    /**
     * Creates a leaf node with an unsigned numeric payload.
     *
     * @param kind tag
     * @param index numeric payload, interpreted as unsigned
     * @return new node
     */
    public static Node withIndex(NodeKind kind, long index) {
        return new Node(kind, null, index, List.of());
    }

    /**
     * Creates a node with a numeric payload and children.
     *
     * @param kind tag
     * @param index numeric payload, interpreted as unsigned
     * @param children ordered children
     * @return new node
     */
    public static Node withIndex(NodeKind kind, long index, Node... children) {
        return new Node(kind, null, index, Arrays.asList(children));
    }

    public boolean hasText() {
        return text != null;
    }

    public boolean hasIndex() {
        return index != null;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public int numChildren() {
        return children.size();
    }

    /**
     * Returns the text payload, or the empty string when there is none.
     *
     * @return text payload or {@code ""}
     */
    public String textOrEmpty() {
        return text != null ? text : "";
    }

    /**
     * Returns the child at {@code position}.
     *
     * @param position zero-based child position
     * @return the child
     * @throws IndexOutOfBoundsException if the node has no such child
     */
    public Node child(int position) {
        return children.get(position);
    }

    /**
     * Returns the first child.
     *
     * @return the first child
     * @throws IndexOutOfBoundsException if the node has no children
     */
    public Node firstChild() {
        return children.get(0);
    }

    /**
     * Returns the last child.
     *
     * @return the last child
     * @throws IndexOutOfBoundsException if the node has no children
     */
    public Node lastChild() {
        return children.get(children.size() - 1);
    }

    /**
     * Finds the first child with the given tag.
     *
     * @param childKind tag to look for
     * @return first matching child, or empty
     */
    public Optional<Node> firstChildOfKind(NodeKind childKind) {
        for (Node child : children) {
            if (child.kind() == childKind) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }
}
