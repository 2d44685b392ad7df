package com.demanglekit.core.printer;

import com.demanglekit.core.config.DemangleOptions;
import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Base class for printer tests.
 *
 * <p>Provides builders for the tree shapes the printer expects, so tests read as the
 * declaration they describe rather than as raw node plumbing:
 * <ul>
 *   <li>leaf builders for modules, identifiers and indices</li>
 *   <li>nominal types from the standard library and from user modules</li>
 *   <li>function types with labelled and unlabelled parameter tuples</li>
 * </ul>
 */
public abstract class PrinterTestBase {

    protected static final DemangleOptions DEFAULTS = DemangleOptions.defaults();

    /** Defaults without the {@code Swift.} qualifier, which keeps expectations short. */
    protected static final DemangleOptions NO_STDLIB = DemangleOptions.defaults().toBuilder()
        .displayStdlibModule(false)
        .build();

    protected static Node module(String name) {
        return Node.withText(NodeKind.MODULE, name);
    }

    protected static Node identifier(String name) {
        return Node.withText(NodeKind.IDENTIFIER, name);
    }

    protected static Node index(NodeKind kind, long value) {
        return Node.withIndex(kind, value);
    }

    protected static Node type(Node inner) {
        return Node.of(NodeKind.TYPE, inner);
    }

    protected static Node nominal(NodeKind kind, String moduleName, String name) {
        return Node.of(kind, module(moduleName), identifier(name));
    }

    /**
     * Creates {@code Type(Structure(Swift, name))}.
     */
    protected static Node stdlibStruct(String name) {
        return type(nominal(NodeKind.STRUCTURE, "Swift", name));
    }

    protected static Node emptyTuple() {
        return Node.of(NodeKind.TUPLE);
    }

    protected static Node tupleElement(Node elementType) {
        return Node.of(NodeKind.TUPLE_ELEMENT, elementType);
    }

    protected static Node namedTupleElement(String label, Node elementType) {
        return Node.of(NodeKind.TUPLE_ELEMENT, Node.withText(NodeKind.TUPLE_ELEMENT_NAME, label), elementType);
    }

    /**
     * Creates a {@code FunctionType} whose parameters form a tuple of the given elements.
     */
    protected static Node functionType(Node returnType, Node... parameterElements) {
        Node parameters = Node.of(NodeKind.ARGUMENT_TUPLE, type(Node.of(NodeKind.TUPLE, parameterElements)));
        return Node.of(NodeKind.FUNCTION_TYPE, parameters, Node.of(NodeKind.RETURN_TYPE, returnType));
    }

    /**
     * Creates {@code () -> ()}.
     */
    protected static Node voidFunctionType() {
        return functionType(type(emptyTuple()));
    }

    /**
     * Creates {@code moduleName.name() -> ()}.
     */
    protected static Node voidFunction(String moduleName, String name) {
        return Node.of(NodeKind.FUNCTION, module(moduleName), identifier(name), type(voidFunctionType()));
    }

    protected static Node labelList(String... labels) {
        Node[] children = new Node[labels.length];
        for (int i = 0; i < labels.length; i++) {
            children[i] = labels[i] == null
                ? Node.of(NodeKind.FIRST_ELEMENT_MARKER)
                : identifier(labels[i]);
        }
        return Node.of(NodeKind.LABEL_LIST, children);
    }

    protected static Node variable(String moduleName, String name, Node variableType) {
        return Node.of(NodeKind.VARIABLE, module(moduleName), identifier(name), variableType);
    }

    protected static Node global(Node... children) {
        return Node.of(NodeKind.GLOBAL, children);
    }

    protected static Node typeList(Node... types) {
        return Node.of(NodeKind.TYPE_LIST, types);
    }

    /**
     * Creates {@code Type(DependentGenericParamType(depth, index))}.
     */
    protected static Node genericParam(long depth, long paramIndex) {
        return type(Node.of(NodeKind.DEPENDENT_GENERIC_PARAM_TYPE,
            index(NodeKind.INDEX, depth), index(NodeKind.INDEX, paramIndex)));
    }

    protected static String render(Node root) {
        return NodePrinter.render(root, DEFAULTS);
    }

    protected static String render(Node root, DemangleOptions options) {
        return NodePrinter.render(root, options);
    }
}
