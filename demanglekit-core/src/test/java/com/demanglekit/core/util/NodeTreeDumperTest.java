package com.demanglekit.core.util;

import org.junit.jupiter.api.Test;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeTreeDumper}.
 */
class NodeTreeDumperTest {

    @Test
    void dump_nestedTree_indentsByLevel() {
        Node tree = Node.of(NodeKind.GLOBAL,
            Node.of(NodeKind.FUNCTION,
                Node.withText(NodeKind.MODULE, "Module"),
                Node.withText(NodeKind.IDENTIFIER, "functionName")),
            Node.withIndex(NodeKind.INDEX, 3));

        assertThat(NodeTreeDumper.dump(tree)).isEqualTo("""
            kind=Global
              kind=Function
                kind=Module, text="Module"
                kind=Identifier, text="functionName"
              kind=Index, index=3
            """);
    }

    @Test
    void dump_textAndIndex_bothShown() {
        Node node = new Node(NodeKind.NUMBER, "n", -1L, null);

        assertThat(NodeTreeDumper.dump(node)).isEqualTo("kind=Number, text=\"n\", index=18446744073709551615\n");
    }

    @Test
    void dump_nullRoot() {
        assertThat(NodeTreeDumper.dump(null)).isEqualTo("<null>\n");
    }

    @Test
    void dump_treeDeeperThanLimit_collapsesTail() {
        Node deep = Node.withText(NodeKind.IDENTIFIER, "leaf");
        for (int i = 0; i < 200_000; i++) {
            deep = Node.of(NodeKind.TYPE, deep);
        }

        String dump = NodeTreeDumper.dump(deep);

        assertThat(dump.lines()).hasSize(NodeTreeDumper.MAX_DEPTH + 2);
        assertThat(dump).endsWith("  ".repeat(NodeTreeDumper.MAX_DEPTH + 1) + "...\n");
        assertThat(dump).doesNotContain("leaf");
    }
}
