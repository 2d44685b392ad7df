package com.demanglekit.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NodeTreeLoader}.
 */
class NodeTreeLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void fromYaml_nestedTree_buildsNodes() {
        Node node = NodeTreeLoader.fromYaml("""
            kind: Type
            children:
              - kind: Structure
                children:
                  - { kind: Module, text: Swift }
                  - { kind: Identifier, text: Int }
            """);

        assertThat(node).isEqualTo(Node.of(NodeKind.TYPE,
            Node.of(NodeKind.STRUCTURE,
                Node.withText(NodeKind.MODULE, "Swift"),
                Node.withText(NodeKind.IDENTIFIER, "Int"))));
    }

    @Test
    void fromJson_indexAsNumberOrString() {
        Node numeric = NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": 18446744073709551615}");
        Node textual = NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": \"18446744073709551615\"}");

        assertThat(numeric.index()).isEqualTo(-1L);
        assertThat(textual).isEqualTo(numeric);
    }

    @Test
    void fromJson_nullFields_areAbsent() {
        Node node = NodeTreeLoader.fromJson("{\"kind\": \"Tuple\", \"text\": null, \"index\": null, \"children\": null}");

        assertThat(node.hasText()).isFalse();
        assertThat(node.hasIndex()).isFalse();
        assertThat(node.hasChildren()).isFalse();
    }

    @Test
    void fromJson_unknownKind_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Gizmo\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Gizmo");
    }

    @Test
    void fromJson_missingKind_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"text\": \"x\"}"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromJson_nonObject_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("[1, 2]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ARRAY");
    }

    @Test
    void fromJson_childrenNotAList_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Tuple\", \"children\": {}}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Tuple");
    }

    @Test
    void fromJson_badIndex_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": \"-3\"}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": 1.5}"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromJson_integralIndexOutOfUnsignedRange_throws() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": -1}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("-1");
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": \"Index\", \"index\": 18446744073709551616}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeTreeLoader.fromYaml("kind: Index\nindex: -7\n"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromJson_malformedDocument_throwsUnchecked() {
        assertThatThrownBy(() -> NodeTreeLoader.fromJson("{\"kind\": "))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void load_selectsFormatByExtension() throws IOException {
        Path json = tempDir.resolve("tree.json");
        Path yaml = tempDir.resolve("tree.yml");
        Files.writeString(json, "{\"kind\": \"Module\", \"text\": \"M\"}");
        Files.writeString(yaml, "kind: Module\ntext: M\n");

        assertThat(NodeTreeLoader.load(json)).isEqualTo(Node.withText(NodeKind.MODULE, "M"));
        assertThat(NodeTreeLoader.load(yaml)).isEqualTo(Node.withText(NodeKind.MODULE, "M"));
    }

    @Test
    void load_missingFile_throwsUnchecked() {
        assertThatThrownBy(() -> NodeTreeLoader.load(tempDir.resolve("missing.json")))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void loadAndDump_preserveStructure() {
        String yaml = """
            kind: Global
            children:
              - kind: Index
                index: 7
              - kind: Identifier
                text: f
            """;

        assertThat(NodeTreeDumper.dump(NodeTreeLoader.fromYaml(yaml))).isEqualTo("""
            kind=Global
              kind=Index, index=7
              kind=Identifier, text="f"
            """);
    }
}
