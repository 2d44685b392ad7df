package com.demanglekit.core.printer;

import com.demanglekit.core.model.FunctionSigSpecializationParamKind;
import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Prints specialization wrappers and their parameters.
 *
 * <p>In condensed mode every wrapper contributes the shared prefix {@code "specialized "},
 * printed at most once per render however deeply wrappers nest. In detailed mode each
 * wrapper prints {@code "<description> <arg, arg, ...> of "}.
 */
final class SpecializationPrinter {

    private static final String CONDENSED_PREFIX = "specialized ";
    private static final String SIGNATURE_PREFIX = "Signature = ";

    private final NodePrinter printer;
    private final OutputBuffer out;

    // per render
    private boolean condensedPrefixPrinted;

    SpecializationPrinter(NodePrinter printer) {
        this.printer = printer;
        this.out = printer.out();
    }

    void printSpecializationPrefix(Node node) {
        switch (node.kind()) {
            case FUNCTION_SIGNATURE_SPECIALIZATION -> printSpecializationPrefix(node,
                "function signature specialization", "");
            case GENERIC_PARTIAL_SPECIALIZATION -> printSpecializationPrefix(node,
                "generic partial specialization", SIGNATURE_PREFIX);
            case GENERIC_PARTIAL_SPECIALIZATION_NOT_RE_ABSTRACTED -> printSpecializationPrefix(node,
                "generic not-reabstracted partial specialization", SIGNATURE_PREFIX);
            case GENERIC_SPECIALIZATION -> printSpecializationPrefix(node, "generic specialization", "");
            case GENERIC_SPECIALIZATION_PRESPECIALIZED -> printSpecializationPrefix(node,
                "generic pre-specialization", "");
            case GENERIC_SPECIALIZATION_NOT_RE_ABSTRACTED -> printSpecializationPrefix(node,
                "generic not re-abstracted specialization", "");
            case INLINED_GENERIC_FUNCTION -> printSpecializationPrefix(node, "inlined generic function", "");
            default -> throw new AssertionError("Not a specialization: " + node.kind().kindName());
        }
    }

    private void printSpecializationPrefix(Node node, String description, String paramPrefix) {
        if (!printer.options().displayGenericSpecializations()) {
            if (!condensedPrefixPrinted) {
                out.append(CONDENSED_PREFIX);
                condensedPrefixPrinted = true;
            }
            return;
        }

        out.append(description).append(" <");
        String separator = "";
        int argNum = 0;
        for (Node child : node.children()) {
            switch (child.kind()) {
                case SPECIALIZATION_PASS_ID -> {
                    // the optimizer pass is of no interest to readers
                }
                case IS_SERIALIZED -> {
                    out.append(separator);
                    separator = ", ";
                    printer.print(child);
                }
                default -> {
                    // empty specializations are skipped but still counted
                    if (child.hasChildren()) {
                        out.append(separator).append(paramPrefix);
                        separator = ", ";
                        switch (child.kind()) {
                            case FUNCTION_SIGNATURE_SPECIALIZATION_PARAM -> {
                                out.append("Arg[").append(String.valueOf(argNum)).append("] = ");
                                printFunctionSigSpecializationParams(child);
                            }
                            case FUNCTION_SIGNATURE_SPECIALIZATION_RETURN -> {
                                out.append("Return = ");
                                printFunctionSigSpecializationParams(child);
                            }
                            default -> printer.print(child);
                        }
                    }
                    argNum++;
                }
            }
        }
        out.append("> of ");
    }

    /**
     * Prints the optimizations applied to one parameter or the return value.
     *
     * @throws AssertionError if a parameter kind is neither a value optimization nor carries
     *         any option bit
     */
    private void printFunctionSigSpecializationParams(Node node) {
        int idx = 0;
        int end = node.numChildren();
        while (idx < end) {
            long raw = NodePrinter.indexOf(node.child(idx));
            FunctionSigSpecializationParamKind valueKind = FunctionSigSpecializationParamKind.valueKindOf(raw)
                .orElse(null);
            if (valueKind == null) {
                if (!FunctionSigSpecializationParamKind.hasOptionBits(raw)) {
                    throw new AssertionError("Invalid specialization parameter kind: " + Long.toUnsignedString(raw));
                }
                printer.print(node.child(idx++));
                continue;
            }

            switch (valueKind) {
                case BOX_TO_VALUE, BOX_TO_STACK -> printer.print(node.child(idx++));
                case CONSTANT_PROP_FUNCTION, CONSTANT_PROP_GLOBAL -> {
                    out.append('[');
                    printer.print(node.child(idx++));
                    out.append(" : ");
                    out.append(demangledOrRaw(NodePrinter.textOf(node.child(idx++))));
                    out.append(']');
                }
                case CONSTANT_PROP_INTEGER, CONSTANT_PROP_FLOAT -> {
                    out.append('[');
                    printer.print(node.child(idx++));
                    out.append(" : ");
                    printer.print(node.child(idx++));
                    out.append(']');
                }
                case CONSTANT_PROP_STRING -> {
                    out.append('[');
                    printer.print(node.child(idx++));
                    out.append(" : ");
                    printer.print(node.child(idx++));
                    out.append('\'');
                    printer.print(node.child(idx++));
                    out.append('\'');
                    out.append(']');
                }
                case CLOSURE_PROP -> {
                    out.append('[');
                    printer.print(node.child(idx++));
                    out.append(" : ");
                    printer.print(node.child(idx++));
                    out.append(", Argument Types : [");
                    while (idx < end) {
                        Node child = node.child(idx);
                        if (!child.is(NodeKind.TYPE)) {
                            break;
                        }
                        printer.print(child);
                        idx++;
                        if (idx < end && node.child(idx).hasText()) {
                            out.append(", ");
                        }
                    }
                    out.append(']');
                }
                default -> throw new AssertionError("Option flag decoded as value kind: " + valueKind);
            }
        }
    }

    /**
     * Prints a parameter kind: either the combined option flags joined by {@code and}, or the
     * single value optimization.
     */
    void printParamKind(Node node) {
        long raw = NodePrinter.indexOf(node);
        boolean printedOption = false;
        for (FunctionSigSpecializationParamKind option : FunctionSigSpecializationParamKind.optionsInPrintOrder()) {
            if (!option.isSetIn(raw)) {
                continue;
            }
            if (printedOption) {
                out.append(" and ");
            }
            out.append(option.description());
            printedOption = true;
            if (option == FunctionSigSpecializationParamKind.SROA) {
                return;
            }
        }
        if (printedOption) {
            return;
        }
        FunctionSigSpecializationParamKind.valueKindOf(raw)
            .ifPresent(kind -> out.append(kind.description()));
    }

    void printParamPayload(Node node) {
        out.append(demangledOrRaw(NodePrinter.textOf(node)));
    }

    /**
     * Prints the substituted type followed by its conformances.
     */
    void printGenericSpecializationParam(Node node) {
        printer.print(node.child(0));
        for (int i = 1; i < node.numChildren(); i++) {
            out.append(i == 1 ? " with " : " and ");
            printer.print(node.child(i));
        }
    }

    private String demangledOrRaw(String mangled) {
        String demangled = printer.options().symbolDemangler().demangle(mangled);
        return demangled == null || demangled.isEmpty() ? mangled : demangled;
    }
}
