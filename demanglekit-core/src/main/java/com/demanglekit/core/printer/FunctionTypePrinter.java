package com.demanglekit.core.printer;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Prints function types and their parameter lists.
 *
 * <p>A function type node holds, in order: an optional {@code ClangType}, an optional
 * {@code ThrowsAnnotation}, an optional {@code AsyncAnnotation}, the {@code ArgumentTuple}
 * and the {@code ReturnType}. The tag selects the leading attributes, e.g.
 * {@code @escaping @convention(block) }.
 */
final class FunctionTypePrinter {

    private static final int MIN_CHILDREN = 2;
    private static final int MAX_CHILDREN = 5;

    private final NodePrinter printer;
    private final OutputBuffer out;

    FunctionTypePrinter(NodePrinter printer) {
        this.printer = printer;
        this.out = printer.out();
    }

    /**
     * Prints a function type.
     *
     * @param labelList argument labels of the declaring entity, or {@code null}
     * @param node function-type node
     */
    void printFunctionType(Node labelList, Node node) {
        if (node.numChildren() < MIN_CHILDREN || node.numChildren() > MAX_CHILDREN) {
            printer.setInvalid();
            return;
        }

        switch (node.kind()) {
            case FUNCTION_TYPE, UNCURRIED_FUNCTION_TYPE, NO_ESCAPE_FUNCTION_TYPE -> {
                // no attributes
            }
            case AUTO_CLOSURE_TYPE, ESCAPING_AUTO_CLOSURE_TYPE -> out.append("@autoclosure ");
            case THIN_FUNCTION_TYPE -> out.append("@convention(thin) ");
            case C_FUNCTION_POINTER -> printConvention(node, "c");
            case ESCAPING_OBJC_BLOCK -> {
                out.append("@escaping ");
                printConvention(node, "block");
            }
            case OBJC_BLOCK -> printConvention(node, "block");
            case DIFFERENTIABLE_FUNCTION_TYPE -> out.append("@differentiable ");
            case ESCAPING_DIFFERENTIABLE_FUNCTION_TYPE -> out.append("@escaping @differentiable ");
            case LINEAR_FUNCTION_TYPE -> out.append("@differentiable(linear) ");
            case ESCAPING_LINEAR_FUNCTION_TYPE -> out.append("@escaping @differentiable(linear) ");
            default -> {
                printer.setInvalid();
                return;
            }
        }

        int start = 0;
        if (node.child(start).is(NodeKind.CLANG_TYPE)) {
            // already printed inside the convention
            start++;
        }
        boolean isThrows = false;
        if (node.child(start).is(NodeKind.THROWS_ANNOTATION)) {
            start++;
            isThrows = true;
        }
        boolean isAsync = false;
        if (node.child(start).is(NodeKind.ASYNC_ANNOTATION)) {
            start++;
            isAsync = true;
        }

        boolean showTypes = printer.options().showFunctionArgumentTypes();
        printFunctionParameters(labelList, node.child(start), showTypes);

        if (!showTypes) {
            return;
        }
        if (isAsync) {
            out.append(" async");
        }
        if (isThrows) {
            out.append(" throws");
        }
        printer.print(node.child(start + 1));
    }

    private void printConvention(Node node, String convention) {
        out.append("@convention(").append(convention);
        if (node.firstChild().is(NodeKind.CLANG_TYPE)) {
            out.append(", mangledCType: \"");
            printer.print(node.firstChild());
            out.append('"');
        }
        out.append(") ");
    }

    /**
     * Prints a parenthesized parameter list.
     *
     * <p>With a non-empty label list every parameter is prefixed by its label, {@code _} for
     * unlabeled ones. Without types the selector form {@code (a:b:)} is printed, taking labels
     * from the tuple element names when no label list is given.
     *
     * @param labelList argument labels, or {@code null}
     * @param parameterType {@code ArgumentTuple} node
     * @param showTypes whether parameter types are printed
     */
    void printFunctionParameters(Node labelList, Node parameterType, boolean showTypes) {
        if (!parameterType.is(NodeKind.ARGUMENT_TUPLE)) {
            printer.setInvalid();
            return;
        }

        Node parameters = parameterType.firstChild().firstChild();
        if (!parameters.is(NodeKind.TUPLE)) {
            // a single unnamed parameter
            if (showTypes) {
                out.append('(');
                printer.print(parameters);
                out.append(')');
            } else {
                out.append("(_:)");
            }
            return;
        }

        boolean hasLabels = labelList != null && labelList.hasChildren();

        out.append('(');
        for (int i = 0; i < parameters.numChildren(); i++) {
            if (i > 0 && showTypes) {
                out.append(", ");
            }
            Node parameter = parameters.child(i);

            if (hasLabels) {
                out.append(labelFor(labelList.child(i))).append(':');
            } else if (!showTypes) {
                String name = parameter.firstChildOfKind(NodeKind.TUPLE_ELEMENT_NAME)
                    .map(NodePrinter::textOf)
                    .orElse("_");
                out.append(name).append(':');
            }

            if (hasLabels && showTypes) {
                out.append(' ');
            }
            if (showTypes) {
                printer.print(parameter);
            }
        }
        out.append(')');
    }

    private static String labelFor(Node label) {
        return label.is(NodeKind.IDENTIFIER) ? NodePrinter.textOf(label) : "_";
    }
}
