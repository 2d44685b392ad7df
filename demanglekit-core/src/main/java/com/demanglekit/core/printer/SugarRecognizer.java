package com.demanglekit.core.printer;

import com.demanglekit.core.config.ModuleNames;
import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Recognizes bound-generic types that have a shorthand spelling.
 *
 * <p>Only exact matches qualify: the unbound type must be declared in the standard library
 * module, carry the expected name and be applied to the expected number of arguments.
 * {@code Swift.Optional<T>} becomes {@code T?}, {@code Swift.ImplicitlyUnwrappedOptional<T>}
 * becomes {@code T!}, {@code Swift.Array<T>} becomes {@code [T]} and
 * {@code Swift.Dictionary<K, V>} becomes {@code [K : V]}.
 */
final class SugarRecognizer {

    enum SugarType {
        NONE,
        OPTIONAL,
        IMPLICITLY_UNWRAPPED_OPTIONAL,
        ARRAY,
        DICTIONARY
    }

    private SugarRecognizer() {
        // Prevent instantiation
    }

    /**
     * Determines the sugar form of a bound-generic node, looking through {@code Type} wrappers.
     *
     * @param node candidate node
     * @return sugar form, or {@link SugarType#NONE}
     */
    static SugarType findSugar(Node node) {
        while (node.numChildren() == 1 && node.is(NodeKind.TYPE)) {
            node = node.child(0);
        }

        if (node.numChildren() != 2) {
            return SugarType.NONE;
        }

        if (!node.is(NodeKind.BOUND_GENERIC_ENUM) && !node.is(NodeKind.BOUND_GENERIC_STRUCTURE)) {
            return SugarType.NONE;
        }

        // child 0 is a Type wrapping the unbound nominal
        Node unboundType = node.child(0).child(0);
        int argumentCount = node.child(1).numChildren();

        if (node.is(NodeKind.BOUND_GENERIC_ENUM)) {
            if (isStdlibType(unboundType, "Optional") && argumentCount == 1) {
                return SugarType.OPTIONAL;
            }
            if (isStdlibType(unboundType, "ImplicitlyUnwrappedOptional") && argumentCount == 1) {
                return SugarType.IMPLICITLY_UNWRAPPED_OPTIONAL;
            }
            return SugarType.NONE;
        }

        if (isStdlibType(unboundType, "Array") && argumentCount == 1) {
            return SugarType.ARRAY;
        }
        if (isStdlibType(unboundType, "Dictionary") && argumentCount == 2) {
            return SugarType.DICTIONARY;
        }
        return SugarType.NONE;
    }

    private static boolean isStdlibType(Node unboundType, String name) {
        return isIdentifier(unboundType.child(1), name) && isStdlibModule(unboundType.child(0));
    }

    private static boolean isIdentifier(Node node, String desired) {
        return node.is(NodeKind.IDENTIFIER) && desired.equals(node.text());
    }

    static boolean isStdlibModule(Node node) {
        return node.is(NodeKind.MODULE) && ModuleNames.STDLIB.equals(node.text());
    }
}
