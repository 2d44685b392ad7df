package com.demanglekit.core.printer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for {@link TypeClassifier}.
 */
class TypeClassifierTest extends PrinterTestBase {

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void isSimpleType_everyKind_isClassified(NodeKind kind) {
        Node typeList = typeList(stdlibStruct("Int"));
        Node node = new Node(kind, null, null, List.of(Node.of(NodeKind.PROTOCOL_LIST, typeList), typeList));

        assertThatCode(() -> TypeClassifier.isSimpleType(node)).doesNotThrowAnyException();
    }

    @Test
    void isSimpleType_nominalsAndSugar_areSimple() {
        assertThat(TypeClassifier.isSimpleType(nominal(NodeKind.STRUCTURE, "M", "S"))).isTrue();
        assertThat(TypeClassifier.isSimpleType(stdlibStruct("Int"))).isTrue();
        assertThat(TypeClassifier.isSimpleType(Node.of(NodeKind.SUGARED_ARRAY, stdlibStruct("Int")))).isTrue();
        assertThat(TypeClassifier.isSimpleType(emptyTuple())).isTrue();
    }

    @Test
    void isSimpleType_functionsAndCompositions_areCompound() {
        assertThat(TypeClassifier.isSimpleType(voidFunctionType())).isFalse();
        assertThat(TypeClassifier.isSimpleType(Node.of(NodeKind.PROTOCOL_LIST_WITH_CLASS))).isFalse();
        assertThat(TypeClassifier.isSimpleType(Node.of(NodeKind.IN_OUT, stdlibStruct("Int")))).isFalse();
    }

    @Test
    void isSimpleType_protocolList_dependsOnMemberCount() {
        Node single = Node.of(NodeKind.PROTOCOL_LIST, typeList(type(nominal(NodeKind.PROTOCOL, "M", "P"))));
        Node pair = Node.of(NodeKind.PROTOCOL_LIST,
            typeList(type(nominal(NodeKind.PROTOCOL, "M", "P")), type(nominal(NodeKind.PROTOCOL, "M", "Q"))));

        assertThat(TypeClassifier.isSimpleType(single)).isTrue();
        assertThat(TypeClassifier.isSimpleType(pair)).isFalse();
    }

    @Test
    void isSimpleType_anyObjectComposition_isSimpleOnlyWhenBare() {
        Node bare = Node.of(NodeKind.PROTOCOL_LIST_WITH_ANY_OBJECT, Node.of(NodeKind.PROTOCOL_LIST, typeList()));
        Node withProtocol = Node.of(NodeKind.PROTOCOL_LIST_WITH_ANY_OBJECT,
            Node.of(NodeKind.PROTOCOL_LIST, typeList(type(nominal(NodeKind.PROTOCOL, "M", "P")))));

        assertThat(TypeClassifier.isSimpleType(bare)).isTrue();
        assertThat(TypeClassifier.isSimpleType(withProtocol)).isFalse();
    }

    @Test
    void isExistentialType_protocolCompositions() {
        assertThat(TypeClassifier.isExistentialType(Node.of(NodeKind.PROTOCOL_LIST, typeList()))).isTrue();
        assertThat(TypeClassifier.isExistentialType(Node.of(NodeKind.EXISTENTIAL_METATYPE))).isTrue();
        assertThat(TypeClassifier.isExistentialType(nominal(NodeKind.PROTOCOL, "M", "P"))).isFalse();
    }

    @Test
    void needSpaceBeforeType_looksThroughTypeWrapper() {
        assertThat(TypeClassifier.needSpaceBeforeType(type(voidFunctionType()))).isFalse();
        assertThat(TypeClassifier.needSpaceBeforeType(stdlibStruct("Int"))).isTrue();
    }

    @Test
    void needSpaceBeforeType_deepTypeChain_doesNotRecurse() {
        Node deep = voidFunctionType();
        for (int i = 0; i < 200_000; i++) {
            deep = type(deep);
        }

        assertThat(TypeClassifier.needSpaceBeforeType(deep)).isFalse();
    }
}
