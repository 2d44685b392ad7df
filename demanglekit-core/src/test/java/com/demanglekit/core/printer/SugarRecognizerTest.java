package com.demanglekit.core.printer;

import org.junit.jupiter.api.Test;

import com.demanglekit.core.config.DemangleOptions;
import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;
import com.demanglekit.core.printer.SugarRecognizer.SugarType;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SugarRecognizer} and the sugared spellings it enables.
 */
class SugarRecognizerTest extends PrinterTestBase {

    private static final DemangleOptions SUGAR = NO_STDLIB.toBuilder().synthesizeSugarOnTypes(true).build();

    @Test
    void findSugar_recognizesStandardGenerics() {
        assertThat(SugarRecognizer.findSugar(optionalOf(stdlibStruct("Int")))).isEqualTo(SugarType.OPTIONAL);
        assertThat(SugarRecognizer.findSugar(type(optionalOf(stdlibStruct("Int"))))).isEqualTo(SugarType.OPTIONAL);
        assertThat(SugarRecognizer.findSugar(bound(NodeKind.BOUND_GENERIC_ENUM, "Swift", "ImplicitlyUnwrappedOptional",
            stdlibStruct("Int")))).isEqualTo(SugarType.IMPLICITLY_UNWRAPPED_OPTIONAL);
        assertThat(SugarRecognizer.findSugar(arrayOf(stdlibStruct("Int")))).isEqualTo(SugarType.ARRAY);
        assertThat(SugarRecognizer.findSugar(dictionaryOf(stdlibStruct("String"), stdlibStruct("Int"))))
            .isEqualTo(SugarType.DICTIONARY);
    }

    @Test
    void findSugar_rejectsNearMisses() {
        // wrong module
        assertThat(SugarRecognizer.findSugar(bound(NodeKind.BOUND_GENERIC_ENUM, "MyLib", "Optional",
            stdlibStruct("Int")))).isEqualTo(SugarType.NONE);
        // wrong arity
        assertThat(SugarRecognizer.findSugar(bound(NodeKind.BOUND_GENERIC_STRUCTURE, "Swift", "Array",
            stdlibStruct("Int"), stdlibStruct("Int")))).isEqualTo(SugarType.NONE);
        // wrong tag for the name
        assertThat(SugarRecognizer.findSugar(bound(NodeKind.BOUND_GENERIC_STRUCTURE, "Swift", "Optional",
            stdlibStruct("Int")))).isEqualTo(SugarType.NONE);
        assertThat(SugarRecognizer.findSugar(bound(NodeKind.BOUND_GENERIC_CLASS, "Swift", "Array",
            stdlibStruct("Int")))).isEqualTo(SugarType.NONE);
    }

    @Test
    void findSugar_deepTypeChain_looksThroughEveryWrapper() {
        Node deep = optionalOf(stdlibStruct("Int"));
        for (int i = 0; i < 200_000; i++) {
            deep = type(deep);
        }

        assertThat(SugarRecognizer.findSugar(deep)).isEqualTo(SugarType.OPTIONAL);
    }

    @Test
    void render_sugarOn_usesShorthand() {
        assertThat(render(optionalOf(stdlibStruct("Int")), SUGAR)).isEqualTo("Int?");
        assertThat(render(arrayOf(stdlibStruct("Int")), SUGAR)).isEqualTo("[Int]");
        assertThat(render(dictionaryOf(stdlibStruct("String"), stdlibStruct("Int")), SUGAR))
            .isEqualTo("[String : Int]");
        assertThat(render(bound(NodeKind.BOUND_GENERIC_ENUM, "Swift", "ImplicitlyUnwrappedOptional",
            stdlibStruct("Int")), SUGAR)).isEqualTo("Int!");
    }

    @Test
    void render_sugarOff_printsGenericForm() {
        assertThat(render(optionalOf(stdlibStruct("Int")))).isEqualTo("Swift.Optional<Swift.Int>");
        assertThat(render(dictionaryOf(stdlibStruct("String"), stdlibStruct("Int"))))
            .isEqualTo("Swift.Dictionary<Swift.String, Swift.Int>");
    }

    @Test
    void render_userModuleLookalike_isNotSugared() {
        Node lookalike = bound(NodeKind.BOUND_GENERIC_ENUM, "MyLib", "Optional", stdlibStruct("Int"));

        assertThat(render(lookalike, SUGAR)).isEqualTo("MyLib.Optional<Int>");
    }

    @Test
    void render_nestedSugar_composes() {
        Node nested = optionalOf(type(arrayOf(type(optionalOf(stdlibStruct("Int"))))));

        assertThat(render(nested, SUGAR)).isEqualTo("[Int?]?");
    }

    @Test
    void render_optionalComposition_isParenthesized() {
        Node composition = Node.of(NodeKind.PROTOCOL_LIST,
            typeList(type(nominal(NodeKind.PROTOCOL, "M", "P")), type(nominal(NodeKind.PROTOCOL, "M", "Q"))));

        assertThat(render(optionalOf(composition), SUGAR)).isEqualTo("(M.P & M.Q)?");
        assertThat(render(Node.of(NodeKind.SUGARED_OPTIONAL, composition), SUGAR)).isEqualTo("(M.P & M.Q)?");
    }

    @Test
    void render_alreadySugared_isUnaffectedBySugarSwitch() {
        Node sugared = Node.of(NodeKind.SUGARED_OPTIONAL, Node.of(NodeKind.SUGARED_ARRAY, stdlibStruct("Int")));

        assertThat(render(sugared, NO_STDLIB)).isEqualTo("[Int]?");
        assertThat(render(sugared, SUGAR)).isEqualTo("[Int]?");
    }

    @Test
    void render_boundClass_isNeverSugared() {
        Node boundClass = bound(NodeKind.BOUND_GENERIC_CLASS, "M", "Box", stdlibStruct("Int"));

        assertThat(render(boundClass, SUGAR)).isEqualTo("M.Box<Int>");
    }

    @Test
    void render_boundProtocol_printsConformingTypeAsProtocol() {
        Node boundProtocol = Node.of(NodeKind.BOUND_GENERIC_PROTOCOL,
            type(nominal(NodeKind.PROTOCOL, "M", "P")),
            typeList(stdlibStruct("Int")));

        assertThat(render(boundProtocol, SUGAR)).isEqualTo("Int as M.P");
        assertThat(render(boundProtocol, NO_STDLIB)).isEqualTo("M.P<Int>");
    }

    private static Node bound(NodeKind kind, String moduleName, String name, Node... arguments) {
        NodeKind unboundKind = switch (kind) {
            case BOUND_GENERIC_ENUM -> NodeKind.ENUM;
            case BOUND_GENERIC_CLASS -> NodeKind.CLASS;
            default -> NodeKind.STRUCTURE;
        };
        return Node.of(kind, type(nominal(unboundKind, moduleName, name)), typeList(arguments));
    }

    private static Node optionalOf(Node wrapped) {
        return bound(NodeKind.BOUND_GENERIC_ENUM, "Swift", "Optional", wrapped);
    }

    private static Node arrayOf(Node element) {
        return bound(NodeKind.BOUND_GENERIC_STRUCTURE, "Swift", "Array", element);
    }

    private static Node dictionaryOf(Node key, Node value) {
        return bound(NodeKind.BOUND_GENERIC_STRUCTURE, "Swift", "Dictionary", key, value);
    }
}
