package com.demanglekit.core.printer;

import java.util.Optional;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Composes a declaration from its context, its name and its type.
 *
 * <p>The context is printed in front ({@code Module.Type.name}) when it can be printed as a
 * plain prefix. A context that needs its own type annotation, a multi-word name such as
 * {@code closure #1}, or a local declaration moves the context behind the entity:
 * {@code closure #1 in Module.f()}. Initializer-like entities use {@code of} instead of
 * {@code in}.
 */
final class EntityPrinter {

    /** How the type of an entity follows its name. */
    enum TypePrinting {
        NO_TYPE,
        WITH_COLON,
        FUNCTION_STYLE
    }

    private final NodePrinter printer;
    private final OutputBuffer out;

    EntityPrinter(NodePrinter printer) {
        this.printer = printer;
        this.out = printer.out();
    }

    Optional<Node> printEntity(Node entity, boolean asPrefixContext, TypePrinting typePrinting, boolean hasName) {
        return printEntity(entity, asPrefixContext, typePrinting, hasName, "", -1, "");
    }

    Optional<Node> printEntity(Node entity, boolean asPrefixContext, TypePrinting typePrinting, boolean hasName,
                               String extraName) {
        return printEntity(entity, asPrefixContext, typePrinting, hasName, extraName, -1, "");
    }

    /**
     * Prints a closure as {@code closure #N}, with its signature when argument types are shown.
     */
    Optional<Node> printClosure(Node closure, boolean asPrefixContext, String extraName) {
        TypePrinting typePrinting = printer.options().showFunctionArgumentTypes()
            ? TypePrinting.FUNCTION_STYLE
            : TypePrinting.NO_TYPE;
        return printEntity(closure, asPrefixContext, typePrinting, false, extraName,
            NodePrinter.indexOf(closure.child(1)) + 1, "");
    }

    /**
     * Prints an accessor of a variable or subscript, e.g. {@code Module.x.getter : Int}.
     *
     * @throws AssertionError if {@code storage} is neither a variable nor a subscript
     */
    Optional<Node> printAbstractStorage(Node storage, boolean asPrefixContext, String accessorName) {
        return switch (storage.kind()) {
            case VARIABLE -> printEntity(storage, asPrefixContext, TypePrinting.WITH_COLON, true, accessorName);
            case SUBSCRIPT -> printEntity(storage, asPrefixContext, TypePrinting.WITH_COLON, false, accessorName,
                -1, "subscript");
            default -> throw new AssertionError("Not an abstract storage node: " + storage.kind().kindName());
        };
    }

    /**
     * Prints an entity.
     *
     * @param entity entity node; child 0 is the context, child 1 the name when {@code hasName}
     * @param asPrefixContext whether the entity is itself the context of another entity
     * @param typePrinting how the entity's type is printed
     * @param hasName whether child 1 holds the name
     * @param extraName text appended to the name, e.g. {@code getter} or {@code closure #}
     * @param extraIndex number appended to {@code extraName}, or negative for none
     * @param overwriteName name printed instead of child 1, or empty
     * @return context still to be printed in postfix form by the caller, or empty
     */
    Optional<Node> printEntity(Node entity, boolean asPrefixContext, TypePrinting typePrinting, boolean hasName,
                               String extraName, long extraIndex, String overwriteName) {
        Node genericFunctionTypeList = null;
        if (entity.is(NodeKind.BOUND_GENERIC_FUNCTION)) {
            genericFunctionTypeList = entity.child(1);
            entity = entity.firstChild();
        }

        boolean multiWordName = extraName.indexOf(' ') >= 0;
        // "name #1" reads badly with a prefix context
        boolean localName = hasName && entity.child(1).is(NodeKind.LOCAL_DECL_NAME);
        if (localName && printer.options().displayLocalNameContexts()) {
            multiWordName = true;
        }

        if (asPrefixContext && (typePrinting != TypePrinting.NO_TYPE || multiWordName)) {
            return Optional.of(entity);
        }

        Optional<Node> postfixContext = NodePrinter.NOTHING;
        Node context = entity.child(0);
        if (printer.printContext(context)) {
            if (multiWordName) {
                postfixContext = Optional.of(context);
            } else {
                int before = out.length();
                postfixContext = printer.print(context, true);
                if (out.length() != before) {
                    out.append('.');
                }
            }
        }

        String pendingExtraName = extraName;
        if (hasName || !overwriteName.isEmpty()) {
            if (!pendingExtraName.isEmpty() && multiWordName) {
                out.append(pendingExtraName).append(" of ");
                pendingExtraName = "";
            }
            int before = out.length();
            if (!overwriteName.isEmpty()) {
                out.append(overwriteName);
            } else {
                Node name = entity.child(1);
                if (!name.is(NodeKind.PRIVATE_DECL_NAME)) {
                    printer.print(name);
                }
                entity.firstChildOfKind(NodeKind.PRIVATE_DECL_NAME).ifPresent(printer::print);
            }
            if (out.length() != before && !pendingExtraName.isEmpty()) {
                out.append('.');
            }
        }
        if (!pendingExtraName.isEmpty()) {
            out.append(pendingExtraName);
            if (extraIndex >= 0) {
                out.appendUnsigned(extraIndex);
            }
        }

        if (typePrinting != TypePrinting.NO_TYPE) {
            Optional<Node> typeNode = entity.firstChildOfKind(NodeKind.TYPE);
            if (typeNode.isEmpty()) {
                printer.setInvalid();
                return NodePrinter.NOTHING;
            }
            Node type = typeNode.get().child(0);
            TypePrinting effective = typePrinting;
            if (effective == TypePrinting.FUNCTION_STYLE && !isFunctionLike(type)) {
                effective = TypePrinting.WITH_COLON;
            }

            if (effective == TypePrinting.WITH_COLON) {
                if (printer.options().displayEntityTypes()) {
                    out.append(" : ");
                    printEntityType(entity, type, genericFunctionTypeList);
                }
            } else {
                if (multiWordName || TypeClassifier.needSpaceBeforeType(type)) {
                    out.append(' ');
                }
                printEntityType(entity, type, genericFunctionTypeList);
            }
        }

        if (!asPrefixContext && postfixContext.isPresent()
            && (!localName || printer.options().displayLocalNameContexts())) {
            if (entity.is(NodeKind.DEFAULT_ARGUMENT_INITIALIZER)
                || entity.is(NodeKind.INITIALIZER)
                || entity.is(NodeKind.PROPERTY_WRAPPER_BACKING_INITIALIZER)) {
                out.append(" of ");
            } else {
                out.append(" in ");
            }
            printer.print(postfixContext.get());
            return NodePrinter.NOTHING;
        }
        return postfixContext;
    }

    /**
     * Generic wrappers are looked through; a non-function type falls back to colon style.
     */
    private static boolean isFunctionLike(Node type) {
        Node t = type;
        while (t.is(NodeKind.DEPENDENT_GENERIC_TYPE)) {
            t = t.child(1).child(0);
        }
        return TypeClassifier.isFunctionStyleType(t.kind());
    }

    /**
     * Prints the type of an entity, fusing argument labels and generic parameters into a
     * function signature where the entity has them.
     */
    private void printEntityType(Node entity, Node type, Node genericFunctionTypeList) {
        Node labelList = entity.firstChildOfKind(NodeKind.LABEL_LIST).orElse(null);
        if (labelList == null && genericFunctionTypeList == null) {
            printer.print(type);
            return;
        }

        Node functionType = type;
        if (genericFunctionTypeList != null) {
            out.append('<');
            printer.printChildren(genericFunctionTypeList, ", ");
            out.append('>');
        }
        if (functionType.is(NodeKind.DEPENDENT_GENERIC_TYPE)) {
            if (genericFunctionTypeList == null) {
                // generic signature
                printer.print(functionType.child(0));
            }
            Node dependentType = functionType.child(1);
            if (TypeClassifier.needSpaceBeforeType(dependentType)) {
                out.append(' ');
            }
            functionType = dependentType.firstChild();
        }
        printer.functionTypes().printFunctionType(labelList, functionType);
    }
}
