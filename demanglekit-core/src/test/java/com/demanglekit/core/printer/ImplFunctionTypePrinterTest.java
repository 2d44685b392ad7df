package com.demanglekit.core.printer;

import org.junit.jupiter.api.Test;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImplFunctionTypePrinter}.
 */
class ImplFunctionTypePrinterTest extends PrinterTestBase {

    @Test
    void print_parametersAndResults_areGrouped() {
        Node function = Node.of(NodeKind.IMPL_FUNCTION_TYPE,
            convention("@callee_guaranteed"),
            parameter("@in_guaranteed", stdlibStruct("Int")),
            parameter("@guaranteed", stdlibStruct("String")),
            result("@out", stdlibStruct("Int")));

        assertThat(render(function, NO_STDLIB))
            .isEqualTo("@callee_guaranteed (@in_guaranteed Int, @guaranteed String) -> (@out Int)");
    }

    @Test
    void print_noParametersOrResults_stillOpensAndClosesLists() {
        Node function = Node.of(NodeKind.IMPL_FUNCTION_TYPE, convention("@convention(thin)"));

        assertThat(render(function)).isEqualTo("@convention(thin) () -> ()");
    }

    @Test
    void print_resultsOnly_opensParametersFirst() {
        Node function = Node.of(NodeKind.IMPL_FUNCTION_TYPE,
            result("@owned", stdlibStruct("Int")),
            Node.of(NodeKind.IMPL_ERROR_RESULT, convention("@owned"), stdlibStruct("Error")));

        assertThat(render(function, NO_STDLIB)).isEqualTo("() -> (@owned Int, @error @owned Error)");
    }

    @Test
    void print_attributeAfterParameters_isInvalid() {
        Node function = Node.of(NodeKind.IMPL_FUNCTION_TYPE,
            parameter("@in", stdlibStruct("Int")),
            Node.withText(NodeKind.IMPL_FUNCTION_ATTRIBUTE, "@Sendable"));

        assertThat(render(function)).isEmpty();
    }

    @Test
    void print_substitutions_trailTheType() {
        Node pattern = Node.of(NodeKind.IMPL_PATTERN_SUBSTITUTIONS,
            Node.of(NodeKind.DEPENDENT_GENERIC_SIGNATURE, index(NodeKind.DEPENDENT_GENERIC_PARAM_COUNT, 1)),
            typeList(stdlibStruct("Int")));
        Node invocation = Node.of(NodeKind.IMPL_INVOCATION_SUBSTITUTIONS, typeList(stdlibStruct("Bool")));
        Node function = Node.of(NodeKind.IMPL_FUNCTION_TYPE,
            convention("@callee_guaranteed"),
            pattern,
            parameter("@in_guaranteed", genericParam(0, 0)),
            invocation);

        assertThat(render(function, NO_STDLIB)).isEqualTo(
            "@callee_guaranteed @substituted <A> (@in_guaranteed A) -> () for <Int> for <Bool>");
    }

    @Test
    void parameter_withDifferentiability_printsIt() {
        Node parameter = Node.of(NodeKind.IMPL_PARAMETER,
            convention("@in"),
            Node.withText(NodeKind.IMPL_DIFFERENTIABILITY, "@noDerivative"),
            stdlibStruct("Int"));

        assertThat(render(parameter, NO_STDLIB)).isEqualTo("@in @noDerivative Int");
    }

    @Test
    void convention_withClangType_printsMangledType() {
        Node convention = Node.of(NodeKind.IMPL_FUNCTION_CONVENTION,
            Node.withText(NodeKind.IMPL_FUNCTION_CONVENTION_NAME, "c"),
            Node.withText(NodeKind.CLANG_TYPE, "FvvE"));

        assertThat(render(convention)).isEqualTo("@convention(c, mangledCType: \"FvvE\")");
        assertThat(render(Node.of(NodeKind.IMPL_FUNCTION_CONVENTION,
            Node.withText(NodeKind.IMPL_FUNCTION_CONVENTION_NAME, "block")))).isEqualTo("@convention(block)");
    }

    @Test
    void convention_withTooManyChildren_isInvalid() {
        Node name = Node.withText(NodeKind.IMPL_FUNCTION_CONVENTION_NAME, "c");
        Node convention = Node.of(NodeKind.IMPL_FUNCTION_CONVENTION, name, name, name);

        assertThat(render(convention)).isEmpty();
    }

    private static Node convention(String text) {
        return Node.withText(NodeKind.IMPL_CONVENTION, text);
    }

    private static Node parameter(String conventionText, Node parameterType) {
        return Node.of(NodeKind.IMPL_PARAMETER, convention(conventionText), parameterType);
    }

    private static Node result(String conventionText, Node resultType) {
        return Node.of(NodeKind.IMPL_RESULT, convention(conventionText), resultType);
    }
}
