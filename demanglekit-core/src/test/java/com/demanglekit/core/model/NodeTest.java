package com.demanglekit.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Node}.
 */
class NodeTest {

    @Test
    void constructor_nullKind_throws() {
        assertThatThrownBy(() -> new Node(null, null, null, List.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void constructor_nullChildren_becomesEmpty() {
        Node node = new Node(NodeKind.TUPLE, null, null, null);

        assertThat(node.children()).isEmpty();
        assertThat(node.hasChildren()).isFalse();
    }

    @Test
    void constructor_copiesChildren() {
        List<Node> children = new ArrayList<>();
        children.add(Node.withText(NodeKind.IDENTIFIER, "a"));
        Node node = Node.of(NodeKind.TUPLE, children);

        children.add(Node.withText(NodeKind.IDENTIFIER, "b"));

        assertThat(node.numChildren()).isEqualTo(1);
        assertThatThrownBy(() -> node.children().add(Node.of(NodeKind.TUPLE)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withText_setsOnlyText() {
        Node node = Node.withText(NodeKind.MODULE, "Swift");

        assertThat(node.hasText()).isTrue();
        assertThat(node.text()).isEqualTo("Swift");
        assertThat(node.hasIndex()).isFalse();
        assertThat(node.textOrEmpty()).isEqualTo("Swift");
    }

    @Test
    void withIndex_keepsUnsignedBitPattern() {
        Node node = Node.withIndex(NodeKind.INDEX, -1L);

        assertThat(node.hasIndex()).isTrue();
        assertThat(Long.toUnsignedString(node.index())).isEqualTo("18446744073709551615");
        assertThat(node.textOrEmpty()).isEmpty();
    }

    @Test
    void childAccessors_returnPositions() {
        Node a = Node.withText(NodeKind.IDENTIFIER, "a");
        Node b = Node.withIndex(NodeKind.INDEX, 1);
        Node c = Node.withText(NodeKind.IDENTIFIER, "c");
        Node node = Node.of(NodeKind.GLOBAL, a, b, c);

        assertThat(node.firstChild()).isSameAs(a);
        assertThat(node.child(1)).isSameAs(b);
        assertThat(node.lastChild()).isSameAs(c);
        assertThat(node.firstChildOfKind(NodeKind.IDENTIFIER)).containsSame(a);
        assertThat(node.firstChildOfKind(NodeKind.TYPE)).isEmpty();
    }

    @Test
    void child_outOfRange_throws() {
        Node node = Node.of(NodeKind.GLOBAL);

        assertThatThrownBy(() -> node.child(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(node::firstChild).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void equals_comparesStructure() {
        Node left = Node.of(NodeKind.TYPE, Node.withText(NodeKind.IDENTIFIER, "x"));
        Node right = Node.of(NodeKind.TYPE, Node.withText(NodeKind.IDENTIFIER, "x"));

        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(left.is(NodeKind.TYPE)).isTrue();
    }
}
