package com.demanglekit.core.printer;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Prints the lowered, calling-convention level function type.
 *
 * <p>Children are visited in order while moving forward through three sections:
 * attributes, then parameters, then results. Entering the parameter section opens the
 * parameter list and entering the result section closes it with {@code ") -> ("}; neither
 * is ever emitted twice. Substitution children are held back and printed as trailing
 * {@code for <...>} clauses.
 *
 * <p>Example: {@code @convention(thin) (@in_guaranteed A) -> (@out A) for <Int>}
 */
final class ImplFunctionTypePrinter {

    private enum Section {
        ATTRIBUTES,
        INPUTS,
        RESULTS
    }

    private final NodePrinter printer;
    private final OutputBuffer out;

    ImplFunctionTypePrinter(NodePrinter printer) {
        this.printer = printer;
        this.out = printer.out();
    }

    void print(Node function) {
        Walk walk = new Walk();

        for (Node child : function.children()) {
            switch (child.kind()) {
                case IMPL_PARAMETER -> {
                    if (walk.section == Section.INPUTS) {
                        out.append(", ");
                    }
                    walk.advanceTo(Section.INPUTS);
                    printer.print(child);
                }
                case IMPL_RESULT, IMPL_YIELD, IMPL_ERROR_RESULT -> {
                    if (walk.section == Section.RESULTS) {
                        out.append(", ");
                    }
                    walk.advanceTo(Section.RESULTS);
                    printer.print(child);
                }
                case IMPL_PATTERN_SUBSTITUTIONS -> walk.patternSubstitutions = child;
                case IMPL_INVOCATION_SUBSTITUTIONS -> walk.invocationSubstitutions = child;
                default -> {
                    if (walk.section != Section.ATTRIBUTES) {
                        printer.setInvalid();
                    }
                    printer.print(child);
                    out.append(' ');
                }
            }
        }
        walk.advanceTo(Section.RESULTS);
        out.append(')');

        if (walk.patternSubstitutions != null) {
            out.append(" for <");
            printer.printChildren(walk.patternSubstitutions.child(1));
            out.append('>');
        }
        if (walk.invocationSubstitutions != null) {
            out.append(" for <");
            printer.printChildren(walk.invocationSubstitutions.child(0));
            out.append('>');
        }
    }

    /**
     * Prints {@code convention [differentiability] type} of a parameter or result.
     */
    void printParameterOrResult(Node node) {
        printer.print(node.child(0));
        out.append(' ');
        if (node.numChildren() == 3) {
            printer.print(node.child(1));
        }
        printer.print(node.lastChild());
    }

    /**
     * Prints {@code @convention(name)}, with the mangled C type when present.
     */
    void printConvention(Node node) {
        out.append("@convention(");
        switch (node.numChildren()) {
            case 1 -> out.append(NodePrinter.textOf(node.child(0)));
            case 2 -> {
                out.append(NodePrinter.textOf(node.child(0))).append(", mangledCType: \"");
                printer.print(node.child(1));
                out.append('"');
            }
            default -> printer.setInvalid();
        }
        out.append(')');
    }

    /** Progress through one function type. */
    private final class Walk {
        private Section section = Section.ATTRIBUTES;
        private Node patternSubstitutions;
        private Node invocationSubstitutions;

        void advanceTo(Section target) {
            while (section.compareTo(target) < 0) {
                switch (section) {
                    case ATTRIBUTES -> {
                        if (patternSubstitutions != null) {
                            out.append("@substituted ");
                            printer.print(patternSubstitutions.child(0));
                            out.append(' ');
                        }
                        out.append('(');
                        section = Section.INPUTS;
                    }
                    case INPUTS -> {
                        out.append(") -> (");
                        section = Section.RESULTS;
                    }
                    case RESULTS -> throw new AssertionError("No section after results");
                }
            }
        }
    }
}
