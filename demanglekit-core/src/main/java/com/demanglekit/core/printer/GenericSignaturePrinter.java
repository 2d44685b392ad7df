package com.demanglekit.core.printer;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Prints generic signatures, their requirements and generic parameter references.
 *
 * <p>A signature starts with one {@code DependentGenericParamCount} child per depth level,
 * followed by its requirements: {@code <A, B><A1 where A: P, B == A1>}.
 */
final class GenericSignaturePrinter {

    /** Parameters printed per level before the rest is elided. */
    static final int MAX_PRINTED_PARAMETERS = 128;

    private final NodePrinter printer;
    private final OutputBuffer out;

    GenericSignaturePrinter(NodePrinter printer) {
        this.printer = printer;
        this.out = printer.out();
    }

    void printSignature(Node node) {
        out.append('<');

        int numChildren = node.numChildren();
        int depth = 0;
        for (; depth < numChildren && node.child(depth).is(NodeKind.DEPENDENT_GENERIC_PARAM_COUNT); depth++) {
            if (depth != 0) {
                out.append("><");
            }
            long count = NodePrinter.indexOf(node.child(depth));
            for (long index = 0; Long.compareUnsigned(index, count) < 0; index++) {
                if (index != 0) {
                    out.append(", ");
                }
                // bounds output for degenerate counts
                if (index >= MAX_PRINTED_PARAMETERS) {
                    out.append("...");
                    break;
                }
                out.append(printer.options().genericParameterName(depth, index));
            }
        }

        if (depth != numChildren && printer.options().displayWhereClauses()) {
            out.append(" where ");
            for (int i = depth; i < numChildren; i++) {
                if (i > depth) {
                    out.append(", ");
                }
                printer.print(node.child(i));
            }
        }
        out.append('>');
    }

    void printParamType(Node node) {
        long depth = NodePrinter.indexOf(node.child(0));
        long index = NodePrinter.indexOf(node.child(1));
        out.append(printer.options().genericParameterName(depth, index));
    }

    /**
     * Prints {@code T: _Layout} or {@code T: _Layout(size[, alignment])}.
     */
    void printLayoutRequirement(Node node) {
        printer.print(node.child(0));
        out.append(": ");
        out.append(layoutName(NodePrinter.textOf(node.child(1))));
        if (node.numChildren() > 2) {
            out.append('(');
            printer.print(node.child(2));
            if (node.numChildren() > 3) {
                out.append(", ");
                printer.print(node.child(3));
            }
            out.append(')');
        }
    }

    /**
     * Maps a one-letter layout code to its constraint name; unknown codes map to the empty
     * string so newer codes still render.
     */
    static String layoutName(String code) {
        if (code.isEmpty()) {
            return "";
        }
        return switch (code.charAt(0)) {
            case 'U' -> "_UnknownLayout";
            case 'R' -> "_RefCountedObject";
            case 'N' -> "_NativeRefCountedObject";
            case 'C' -> "AnyObject";
            case 'D' -> "_NativeClass";
            case 'T', 'E', 'e' -> "_Trivial";
            case 'M', 'm' -> "_TrivialAtMost";
            default -> "";
        };
    }
}
