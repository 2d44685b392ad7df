package com.demanglekit.core.printer;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.demanglekit.core.config.DemangleOptions;
import com.demanglekit.core.config.ModuleNames;
import com.demanglekit.core.model.Directness;
import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;
import com.demanglekit.core.model.ReferenceOwnership;
import com.demanglekit.core.model.ValueWitnessKind;
import com.demanglekit.core.util.NodeTreeDumper;

/**
 * Renders a decoded symbol tree as the declaration text a programmer would write.
 *
 * <p>The printer walks the tree once, depth first, and dispatches on every node's tag. Most
 * tags print a fixed literal around some of their children; declarations, function types,
 * specializations and generic signatures are delegated to dedicated collaborators in this
 * package that share the per-render state held here.
 *
 * <h2>Call state</h2>
 * <p>Each call to {@link #render(Node, DemangleOptions)} creates a fresh printer holding the
 * output buffer, the sticky validity flag and the flag that limits the condensed
 * {@code "specialized "} prefix to one occurrence. Nothing is shared between calls, so
 * concurrent renders need no coordination.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li><b>Invalid shape:</b> a node whose children do not match its tag marks the render
 *       invalid; the walk goes on and the result is the empty string.</li>
 *   <li><b>Missing child or payload:</b> the walk is abandoned and the result is the empty
 *       string.</li>
 *   <li><b>Too deep:</b> nesting beyond {@link #MAX_DEPTH} marks the render invalid.</li>
 *   <li><b>Impossible value:</b> an option-bit combination or ordinal with no meaning throws
 *       {@link AssertionError}; this is a defect in the printer, not in the input.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Node root = ...; // produced by a decoder
 * String text = NodePrinter.render(root, DemangleOptions.simplified());
 * }</pre>
 */
public final class NodePrinter {

    private static final Logger log = LoggerFactory.getLogger(NodePrinter.class);

    /** Deepest nesting a render accepts before giving up. */
    public static final int MAX_DEPTH = 1024;

    static final Optional<Node> NOTHING = Optional.empty();

    private final DemangleOptions options;
    private final OutputBuffer out = new OutputBuffer();
    private final FunctionTypePrinter functionTypes;
    private final ImplFunctionTypePrinter implFunctionTypes;
    private final EntityPrinter entities;
    private final SpecializationPrinter specializations;
    private final GenericSignaturePrinter genericSignatures;

    private boolean valid = true;
    private int depth;

    private NodePrinter(DemangleOptions options) {
        this.options = options;
        this.functionTypes = new FunctionTypePrinter(this);
        this.implFunctionTypes = new ImplFunctionTypePrinter(this);
        this.entities = new EntityPrinter(this);
        this.specializations = new SpecializationPrinter(this);
        this.genericSignatures = new GenericSignaturePrinter(this);
    }

    /**
     * Renders a tree with {@link DemangleOptions#defaults()}.
     *
     * @param root root node, may be {@code null}
     * @return rendered text, or the empty string if the tree could not be rendered
     */
    public static String render(Node root) {
        return render(root, DemangleOptions.defaults());
    }

    /**
     * Renders a tree.
     *
     * @param root root node, may be {@code null}
     * @param options printing options
     * @return rendered text, or the empty string if {@code root} is null or the tree could not
     *         be rendered
     */
    public static String render(Node root, DemangleOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (root == null) {
            return "";
        }
        return new NodePrinter(options).printRoot(root);
    }

    private String printRoot(Node root) {
        try {
            print(root);
        } catch (MalformedNodeException | IndexOutOfBoundsException e) {
            log.debug("Rejected malformed {} tree: {}", root.kind().kindName(), e.getMessage());
            traceTree(root);
            return "";
        }
        if (!valid) {
            log.debug("Rejected {} tree: node shape does not match its kind", root.kind().kindName());
            traceTree(root);
            return "";
        }
        return out.toString();
    }

    private static void traceTree(Node root) {
        if (log.isTraceEnabled()) {
            log.trace("Rejected tree:\n{}", NodeTreeDumper.dump(root));
        }
    }

    // ---------------------------------------------------------------------
    // State shared with the collaborators
    // ---------------------------------------------------------------------

    DemangleOptions options() {
        return options;
    }

    OutputBuffer out() {
        return out;
    }

    void setInvalid() {
        valid = false;
    }

    Optional<Node> print(Node node) {
        return print(node, false);
    }

    /**
     * Prints one node.
     *
     * @param node node to print
     * @param asPrefixContext whether the node is printed as the {@code Context.} prefix of
     *        another entity; an entity that cannot be printed that way prints nothing and
     *        returns itself
     * @return context that the caller still has to print in postfix form, or empty
     */
    Optional<Node> print(Node node, boolean asPrefixContext) {
        if (depth >= MAX_DEPTH) {
            setInvalid();
            return NOTHING;
        }
        depth++;
        try {
            return dispatch(node, asPrefixContext);
        } finally {
            depth--;
        }
    }

    void printChildren(Node parent) {
        printChildren(parent, "");
    }

    void printChildren(Node parent, String separator) {
        for (int i = 0; i < parent.numChildren(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            print(parent.child(i));
        }
    }

    void printWithParens(Node type) {
        boolean needsParens = !TypeClassifier.isSimpleType(type);
        if (needsParens) {
            out.append('(');
        }
        print(type);
        if (needsParens) {
            out.append(')');
        }
    }

    /**
     * Decides whether an entity's context is printed at all.
     */
    boolean printContext(Node context) {
        if (!options.qualifyEntities()) {
            return false;
        }
        if (context.is(NodeKind.MODULE)) {
            String module = textOf(context);
            if (module.equals(ModuleNames.STDLIB)) {
                return options.displayStdlibModule();
            }
            if (module.equals(ModuleNames.OBJC_INTEROP)) {
                return options.displayObjCModule();
            }
            if (module.equals(options.hidingCurrentModule())) {
                return false;
            }
            if (module.startsWith(ModuleNames.DEBUGGER_EXPRESSIONS_PREFIX)) {
                return options.displayDebuggerGeneratedModule();
            }
        }
        return true;
    }

    static String textOf(Node node) {
        if (!node.hasText()) {
            throw new MalformedNodeException(node, "missing text");
        }
        return node.text();
    }

    static long indexOf(Node node) {
        if (!node.hasIndex()) {
            throw new MalformedNodeException(node, "missing index");
        }
        return node.index();
    }

    FunctionTypePrinter functionTypes() {
        return functionTypes;
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    private Optional<Node> dispatch(Node node, boolean asPrefixContext) {
        NodeKind kind = node.kind();
        return switch (kind) {
            case STATIC, CURRY_THUNK, DISPATCH_THUNK, METHOD_DESCRIPTOR, METHOD_LOOKUP_FUNCTION,
                OBJC_METADATA_UPDATE_FUNCTION, OBJC_RESILIENT_CLASS_STUB, FULL_OBJC_RESILIENT_CLASS_STUB,
                OBJC_ASYNC_COMPLETION_HANDLER_IMPL, IN_OUT, SHARED, OWNED, SIL_BOX_TYPE, ENUM_CASE,
                COROUTINE_CONTINUATION_PROTOTYPE, OUTLINED_RETAIN, OUTLINED_RELEASE,
                OUTLINED_INITIALIZE_WITH_TAKE, OUTLINED_INITIALIZE_WITH_COPY, OUTLINED_ASSIGN_WITH_TAKE,
                OUTLINED_ASSIGN_WITH_COPY, OUTLINED_DESTROY, PROTOCOL_SELF_CONFORMANCE_WITNESS_TABLE,
                PROTOCOL_WITNESS_TABLE_ACCESSOR, PROTOCOL_WITNESS_TABLE, PROTOCOL_WITNESS_TABLE_PATTERN,
                GENERIC_PROTOCOL_WITNESS_TABLE, GENERIC_PROTOCOL_WITNESS_TABLE_INSTANTIATION_FUNCTION,
                RESILIENT_PROTOCOL_WITNESS_TABLE, PROTOCOL_SELF_CONFORMANCE_WITNESS, VALUE_WITNESS_TABLE,
                PROTOCOL_SELF_CONFORMANCE_DESCRIPTOR, PROTOCOL_CONFORMANCE_DESCRIPTOR, PROTOCOL_DESCRIPTOR,
                PROTOCOL_REQUIREMENTS_BASE_DESCRIPTOR, ASSOCIATED_TYPE_DESCRIPTOR, PROPERTY_DESCRIPTOR,
                NOMINAL_TYPE_DESCRIPTOR, OPAQUE_TYPE_DESCRIPTOR, OPAQUE_TYPE_DESCRIPTOR_ACCESSOR,
                OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_IMPL, OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_KEY,
                OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_VAR, MODULE_DESCRIPTOR, ANONYMOUS_DESCRIPTOR,
                EXTENSION_DESCRIPTOR, REFLECTION_METADATA_BUILTIN_DESCRIPTOR,
                REFLECTION_METADATA_FIELD_DESCRIPTOR, REFLECTION_METADATA_ASSOC_TYPE_DESCRIPTOR,
                REFLECTION_METADATA_SUPERCLASS_DESCRIPTOR, GENERIC_TYPE_METADATA_PATTERN, METACLASS,
                FULL_TYPE_METADATA, TYPE_METADATA, TYPE_METADATA_ACCESS_FUNCTION,
                TYPE_METADATA_INSTANTIATION_CACHE, TYPE_METADATA_INSTANTIATION_FUNCTION,
                TYPE_METADATA_SINGLETON_INITIALIZATION_CACHE, TYPE_METADATA_COMPLETION_FUNCTION,
                TYPE_METADATA_DEMANGLING_CACHE, TYPE_METADATA_LAZY_CACHE,
                DEFAULT_ASSOCIATED_TYPE_METADATA_ACCESSOR, CLASS_METADATA_BASE_OFFSET,
                CANONICAL_SPECIALIZED_GENERIC_METACLASS, CANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_ACCESS_FUNCTION,
                METADATA_INSTANTIATION_CACHE, NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA,
                NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_CACHE,
                CANONICAL_PRESPECIALIZED_GENERIC_TYPE_CACHING_ONCE_TOKEN -> {
                out.append(ArtifactTemplates.singleSubjectPrefix(kind));
                print(node.child(0));
                yield NOTHING;
            }
            case ASSOCIATED_TYPE_GENERIC_PARAM_REF, DEPENDENT_ASSOCIATED_CONFORMANCE,
                PROTOCOL_CONFORMANCE_REF_IN_TYPE_MODULE, PROTOCOL_CONFORMANCE_REF_IN_PROTOCOL_MODULE,
                PROTOCOL_CONFORMANCE_REF_IN_OTHER_MODULE -> {
                out.append(ArtifactTemplates.allChildrenPrefix(kind));
                printChildren(node);
                yield NOTHING;
            }

            // Outlined operations with an optional second operand
            case OUTLINED_COPY -> printOutlinedWithOperand(node, "outlined copy of ");
            case OUTLINED_CONSUME -> printOutlinedWithOperand(node, "outlined consume of ");
            case OUTLINED_BRIDGED_METHOD -> {
                out.append("outlined bridged method (").append(textOf(node)).append(") of ");
                yield NOTHING;
            }
            case OUTLINED_VARIABLE -> {
                out.append("outlined variable #").appendUnsigned(indexOf(node)).append(" of ");
                yield NOTHING;
            }
            case DIRECTNESS -> {
                out.append(Directness.fromRaw(indexOf(node)).spelling()).append(' ');
                yield NOTHING;
            }

            // Contexts
            case ANONYMOUS_CONTEXT -> printAnonymousContext(node);
            case EXTENSION -> printExtension(node);
            case GLOBAL -> {
                printChildren(node);
                yield NOTHING;
            }
            case SUFFIX -> {
                if (options.displayUnmangledSuffix()) {
                    out.append(" with unmangled suffix ").appendQuoted(textOf(node));
                }
                yield NOTHING;
            }
            case DECL_CONTEXT, TYPE -> {
                print(node.child(0));
                yield NOTHING;
            }
            case TYPE_MANGLING -> {
                if (node.child(0).is(NodeKind.LABEL_LIST)) {
                    functionTypes.printFunctionType(node.child(0), node.child(1).firstChild());
                } else {
                    print(node.child(0));
                }
                yield NOTHING;
            }

            // Declarations
            case VARIABLE -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.WITH_COLON, true);
            case FUNCTION, BOUND_GENERIC_FUNCTION ->
                entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.FUNCTION_STYLE, true);
            case SUBSCRIPT -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.FUNCTION_STYLE,
                false, "", -1, "subscript");
            case GENERIC_TYPE_PARAM_DECL, CLASS, STRUCTURE, ENUM, PROTOCOL, TYPE_ALIAS, OTHER_NOMINAL_TYPE ->
                entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE, true);
            case EXPLICIT_CLOSURE -> entities.printClosure(node, asPrefixContext, "closure #");
            case IMPLICIT_CLOSURE -> entities.printClosure(node, asPrefixContext, "implicit closure #");
            case INITIALIZER -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE,
                false, "variable initialization expression");
            case PROPERTY_WRAPPER_BACKING_INITIALIZER -> entities.printEntity(node, asPrefixContext,
                EntityPrinter.TypePrinting.NO_TYPE, false, "property wrapper backing initializer");
            case DEFAULT_ARGUMENT_INITIALIZER -> entities.printEntity(node, asPrefixContext,
                EntityPrinter.TypePrinting.NO_TYPE, false, "default argument ", indexOf(node.child(1)), "");
            case ALLOCATOR -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.FUNCTION_STYLE,
                false, node.child(0).is(NodeKind.CLASS) ? "__allocating_init" : "init");
            case CONSTRUCTOR -> entities.printEntity(node, asPrefixContext,
                EntityPrinter.TypePrinting.FUNCTION_STYLE, node.numChildren() > 2, "init");
            case DESTRUCTOR -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE,
                false, "deinit");
            case DEALLOCATOR -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE,
                false, node.child(0).is(NodeKind.CLASS) ? "__deallocating_deinit" : "deinit");
            case IVAR_INITIALIZER -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE,
                false, "__ivar_initializer");
            case IVAR_DESTROYER -> entities.printEntity(node, asPrefixContext, EntityPrinter.TypePrinting.NO_TYPE,
                false, "__ivar_destroyer");

            // Accessors
            case OWNING_ADDRESSOR -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "owningAddressor");
            case OWNING_MUTABLE_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "owningMutableAddressor");
            case NATIVE_OWNING_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "nativeOwningAddressor");
            case NATIVE_OWNING_MUTABLE_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "nativeOwningMutableAddressor");
            case NATIVE_PINNING_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "nativePinningAddressor");
            case NATIVE_PINNING_MUTABLE_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "nativePinningMutableAddressor");
            case UNSAFE_ADDRESSOR -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "unsafeAddressor");
            case UNSAFE_MUTABLE_ADDRESSOR ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "unsafeMutableAddressor");
            case GLOBAL_GETTER, GETTER -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "getter");
            case SETTER -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "setter");
            case MATERIALIZE_FOR_SET ->
                entities.printAbstractStorage(node.firstChild(), asPrefixContext, "materializeForSet");
            case WILL_SET -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "willset");
            case DID_SET -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "didset");
            case READ_ACCESSOR -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "read");
            case MODIFY_ACCESSOR -> entities.printAbstractStorage(node.firstChild(), asPrefixContext, "modify");

            // Names
            case LOCAL_DECL_NAME -> {
                print(node.child(1));
                if (options.displayLocalNameContexts()) {
                    out.append(" #").appendUnsigned(indexOf(node.child(0)) + 1);
                }
                yield NOTHING;
            }
            case PRIVATE_DECL_NAME -> printPrivateDeclName(node);
            case RELATED_ENTITY_DECL_NAME -> {
                out.append("related decl '").append(textOf(node.firstChild())).append("' for ");
                print(node.child(1));
                yield NOTHING;
            }
            case MODULE -> {
                if (options.displayModuleNames()) {
                    out.append(textOf(node));
                }
                yield NOTHING;
            }
            case IDENTIFIER, CLANG_TYPE, BUILTIN_TYPE_NAME, METATYPE_REPRESENTATION, IMPL_CONVENTION,
                IMPL_FUNCTION_ATTRIBUTE -> emit(textOf(node));
            case INFIX_OPERATOR -> emit(textOf(node) + " infix");
            case PREFIX_OPERATOR -> emit(textOf(node) + " prefix");
            case POSTFIX_OPERATOR -> emit(textOf(node) + " postfix");
            case INDEX, NUMBER, SPECIALIZATION_PASS_ID -> {
                out.appendUnsigned(indexOf(node));
                yield NOTHING;
            }
            case UNKNOWN_INDEX -> emit("unknown index");

            // Function types
            case FUNCTION_TYPE, UNCURRIED_FUNCTION_TYPE, NO_ESCAPE_FUNCTION_TYPE, AUTO_CLOSURE_TYPE,
                ESCAPING_AUTO_CLOSURE_TYPE, THIN_FUNCTION_TYPE, C_FUNCTION_POINTER, OBJC_BLOCK, ESCAPING_OBJC_BLOCK,
                DIFFERENTIABLE_FUNCTION_TYPE, ESCAPING_DIFFERENTIABLE_FUNCTION_TYPE, LINEAR_FUNCTION_TYPE,
                ESCAPING_LINEAR_FUNCTION_TYPE -> {
                functionTypes.printFunctionType(null, node);
                yield NOTHING;
            }
            case ARGUMENT_TUPLE -> {
                functionTypes.printFunctionParameters(null, node, options.showFunctionArgumentTypes());
                yield NOTHING;
            }
            case TUPLE -> {
                out.append('(');
                printChildren(node, ", ");
                out.append(')');
                yield NOTHING;
            }
            case TUPLE_ELEMENT -> printTupleElement(node);
            case TUPLE_ELEMENT_NAME -> emit(textOf(node) + ": ");
            case RETURN_TYPE -> {
                out.append(" -> ");
                if (node.hasChildren()) {
                    printChildren(node);
                } else {
                    out.append(textOf(node));
                }
                yield NOTHING;
            }
            case RETROACTIVE_CONFORMANCE -> {
                if (node.numChildren() == 2) {
                    out.append("retroactive @ ");
                    print(node.child(0));
                    print(node.child(1));
                }
                yield NOTHING;
            }
            case WEAK, UNOWNED, UNMANAGED -> {
                out.append(ReferenceOwnership.of(kind).keyword()).append(' ');
                print(node.child(0));
                yield NOTHING;
            }

            // Attributes
            case NON_OBJC_ATTRIBUTE -> emit("@nonobjc ");
            case OBJC_ATTRIBUTE -> emit("@objc ");
            case DIRECT_METHOD_REFERENCE_ATTRIBUTE -> emit("super ");
            case DYNAMIC_ATTRIBUTE -> emit("dynamic ");
            case VTABLE_ATTRIBUTE -> emit("override ");

            // Specializations
            case FUNCTION_SIGNATURE_SPECIALIZATION, GENERIC_PARTIAL_SPECIALIZATION,
                GENERIC_PARTIAL_SPECIALIZATION_NOT_RE_ABSTRACTED, GENERIC_SPECIALIZATION,
                GENERIC_SPECIALIZATION_PRESPECIALIZED, GENERIC_SPECIALIZATION_NOT_RE_ABSTRACTED,
                INLINED_GENERIC_FUNCTION -> {
                specializations.printSpecializationPrefix(node);
                yield NOTHING;
            }
            case IS_SERIALIZED -> emit("serialized");
            case GENERIC_SPECIALIZATION_PARAM -> {
                specializations.printGenericSpecializationParam(node);
                yield NOTHING;
            }
            case FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_PAYLOAD -> {
                specializations.printParamPayload(node);
                yield NOTHING;
            }
            case FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_KIND -> {
                specializations.printParamKind(node);
                yield NOTHING;
            }

            // Witnesses and thunks
            case LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR ->
                printTypeAndConformance(node, "lazy protocol witness table accessor for type ");
            case LAZY_PROTOCOL_WITNESS_TABLE_CACHE_VARIABLE ->
                printTypeAndConformance(node, "lazy protocol witness table cache variable for type ");
            case VTABLE_THUNK -> {
                out.append("vtable thunk for ");
                print(node.child(1));
                out.append(" dispatching to ");
                print(node.child(0));
                yield NOTHING;
            }
            case PROTOCOL_WITNESS -> {
                out.append("protocol witness for ");
                print(node.child(1));
                out.append(" in conformance ");
                print(node.child(0));
                yield NOTHING;
            }
            case PARTIAL_APPLY_FORWARDER -> printPartialApply(node, "partial apply forwarder");
            case PARTIAL_APPLY_OBJC_FORWARDER -> printPartialApply(node, "partial apply ObjC forwarder");
            case KEY_PATH_GETTER_THUNK_HELPER -> printKeyPathAccessorThunk(node, "key path getter for ");
            case KEY_PATH_SETTER_THUNK_HELPER -> printKeyPathAccessorThunk(node, "key path setter for ");
            case KEY_PATH_EQUALS_THUNK_HELPER -> printKeyPathIndexThunk(node, "equality");
            case KEY_PATH_HASH_THUNK_HELPER -> printKeyPathIndexThunk(node, "hash");
            case FIELD_OFFSET -> {
                print(node.child(0));
                out.append("field offset for ");
                print(node.child(1), false);
                yield NOTHING;
            }
            case REABSTRACTION_THUNK, REABSTRACTION_THUNK_HELPER -> printReabstractionThunk(node);
            case REABSTRACTION_THUNK_HELPER_WITH_SELF -> printReabstractionThunkWithSelf(node);
            case MERGED_FUNCTION -> unlessShortened("merged ");
            case DYNAMICALLY_REPLACEABLE_FUNCTION_KEY -> unlessShortened("dynamically replaceable key for ");
            case DYNAMICALLY_REPLACEABLE_FUNCTION_IMPL -> unlessShortened("dynamically replaceable thunk for ");
            case DYNAMICALLY_REPLACEABLE_FUNCTION_VAR -> unlessShortened("dynamically replaceable variable for ");
            case TYPE_SYMBOLIC_REFERENCE -> printSymbolicReference(node, "type symbolic reference 0x");
            case OPAQUE_TYPE_DESCRIPTOR_SYMBOLIC_REFERENCE ->
                printSymbolicReference(node, "opaque type symbolic reference 0x");
            case PROTOCOL_SYMBOLIC_REFERENCE -> printSymbolicReference(node, "protocol symbolic reference 0x");
            case VALUE_WITNESS -> {
                out.append(ValueWitnessKind.fromRaw(indexOf(node.firstChild())).witnessName());
                out.append(options.shortenValueWitness() ? " for " : " value witness for ");
                print(node.child(1));
                yield NOTHING;
            }

            // Associated types and conformances
            case ASSOCIATED_CONFORMANCE_DESCRIPTOR ->
                printAssociatedConformance(node, "associated conformance descriptor for ");
            case DEFAULT_ASSOCIATED_CONFORMANCE_ACCESSOR ->
                printAssociatedConformance(node, "default associated conformance accessor for ");
            case ASSOCIATED_TYPE_METADATA_ACCESSOR -> {
                out.append("associated type metadata accessor for ");
                print(node.child(1));
                out.append(" in ");
                print(node.child(0));
                yield NOTHING;
            }
            case BASE_CONFORMANCE_DESCRIPTOR -> {
                out.append("base conformance descriptor for ");
                print(node.child(0));
                out.append(": ");
                print(node.child(1));
                yield NOTHING;
            }
            case ASSOCIATED_TYPE_WITNESS_TABLE_ACCESSOR -> {
                out.append("associated type witness table accessor for ");
                print(node.child(1));
                out.append(" : ");
                print(node.child(2));
                out.append(" in ");
                print(node.child(0));
                yield NOTHING;
            }
            case BASE_WITNESS_TABLE_ACCESSOR -> {
                out.append("base witness table accessor for ");
                print(node.child(1));
                out.append(" in ");
                print(node.child(0));
                yield NOTHING;
            }
            case PROTOCOL_CONFORMANCE -> printProtocolConformance(node);
            case ANY_PROTOCOL_CONFORMANCE_LIST, TYPE_LIST -> {
                printChildren(node);
                yield NOTHING;
            }
            case CONCRETE_PROTOCOL_CONFORMANCE -> {
                out.append("concrete protocol conformance ");
                if (node.hasIndex()) {
                    out.append('#').appendUnsigned(node.index()).append(' ');
                }
                printChildren(node);
                yield NOTHING;
            }
            case DEPENDENT_PROTOCOL_CONFORMANCE_ASSOCIATED ->
                printDependentConformance(node, "dependent associated protocol conformance ");
            case DEPENDENT_PROTOCOL_CONFORMANCE_INHERITED ->
                printDependentConformance(node, "dependent inherited protocol conformance ");
            case DEPENDENT_PROTOCOL_CONFORMANCE_ROOT ->
                printDependentConformance(node, "dependent root protocol conformance ");

            // Types
            case BOUND_GENERIC_CLASS, BOUND_GENERIC_STRUCTURE, BOUND_GENERIC_ENUM, BOUND_GENERIC_PROTOCOL,
                BOUND_GENERIC_OTHER_NOMINAL_TYPE, BOUND_GENERIC_TYPE_ALIAS -> {
                printBoundGeneric(node);
                yield NOTHING;
            }
            case DYNAMIC_SELF -> emit("Self");
            case METATYPE -> printMetatype(node);
            case EXISTENTIAL_METATYPE -> {
                int idx = printMetatypeRepresentation(node);
                print(node.child(idx));
                out.append(".Type");
                yield NOTHING;
            }
            case ASSOCIATED_TYPE_REF -> {
                print(node.child(0));
                out.append('.').append(textOf(node.child(1)));
                yield NOTHING;
            }
            case PROTOCOL_LIST -> {
                Node typeList = node.child(0);
                if (typeList.numChildren() == 0) {
                    out.append("Any");
                } else {
                    printChildren(typeList, " & ");
                }
                yield NOTHING;
            }
            case PROTOCOL_LIST_WITH_CLASS -> printProtocolListWithClass(node);
            case PROTOCOL_LIST_WITH_ANY_OBJECT -> printProtocolListWithAnyObject(node);
            case ASSOCIATED_TYPE, LABEL_LIST -> NOTHING;
            case ERROR_TYPE -> emit("<ERROR TYPE>");
            case SUGARED_OPTIONAL -> {
                printWithParens(node.child(0));
                out.append('?');
                yield NOTHING;
            }
            case SUGARED_ARRAY -> {
                out.append('[');
                print(node.child(0));
                out.append(']');
                yield NOTHING;
            }
            case SUGARED_DICTIONARY -> {
                out.append('[');
                print(node.child(0));
                out.append(" : ");
                print(node.child(1));
                out.append(']');
                yield NOTHING;
            }
            case SUGARED_PAREN -> {
                out.append('(');
                print(node.child(0));
                out.append(')');
                yield NOTHING;
            }
            case OPAQUE_RETURN_TYPE -> emit("some");
            case OPAQUE_RETURN_TYPE_OF -> {
                out.append("<<opaque return type of ");
                printChildren(node);
                out.append(">>");
                yield NOTHING;
            }
            case OPAQUE_TYPE -> {
                print(node.child(0));
                out.append('.');
                print(node.child(1));
                yield NOTHING;
            }
            case ACCESSOR_FUNCTION_REFERENCE -> {
                out.append("accessor function at ").appendUnsigned(indexOf(node));
                yield NOTHING;
            }

            // Low-level function types
            case IMPL_DIFFERENTIABLE -> emit("@differentiable");
            case IMPL_LINEAR -> emit("@differentiable(linear)");
            case IMPL_ESCAPING -> emit("@escaping");
            case IMPL_DIFFERENTIABILITY -> {
                String text = textOf(node);
                if (!text.isEmpty()) {
                    out.append(text).append(' ');
                }
                yield NOTHING;
            }
            case IMPL_FUNCTION_CONVENTION -> {
                implFunctionTypes.printConvention(node);
                yield NOTHING;
            }
            case IMPL_ERROR_RESULT -> {
                out.append("@error ");
                printChildren(node, " ");
                yield NOTHING;
            }
            case IMPL_YIELD -> {
                out.append("@yields ");
                printChildren(node, " ");
                yield NOTHING;
            }
            case IMPL_PARAMETER, IMPL_RESULT -> {
                implFunctionTypes.printParameterOrResult(node);
                yield NOTHING;
            }
            case IMPL_FUNCTION_TYPE -> {
                implFunctionTypes.print(node);
                yield NOTHING;
            }
            case IMPL_INVOCATION_SUBSTITUTIONS -> {
                out.append("for <");
                printChildren(node.child(0), ", ");
                out.append('>');
                yield NOTHING;
            }
            case IMPL_PATTERN_SUBSTITUTIONS -> {
                out.append("@substituted ");
                print(node.child(0));
                out.append(" for <");
                printChildren(node.child(1), ", ");
                out.append('>');
                yield NOTHING;
            }

            // Generic signatures and dependent types
            case DEPENDENT_GENERIC_SIGNATURE, DEPENDENT_PSEUDOGENERIC_SIGNATURE -> {
                genericSignatures.printSignature(node);
                yield NOTHING;
            }
            case DEPENDENT_GENERIC_CONFORMANCE_REQUIREMENT -> {
                print(node.child(0));
                out.append(": ");
                print(node.child(1));
                yield NOTHING;
            }
            case DEPENDENT_GENERIC_LAYOUT_REQUIREMENT -> {
                genericSignatures.printLayoutRequirement(node);
                yield NOTHING;
            }
            case DEPENDENT_GENERIC_SAME_TYPE_REQUIREMENT -> {
                print(node.child(0));
                out.append(" == ");
                print(node.child(1));
                yield NOTHING;
            }
            case DEPENDENT_GENERIC_PARAM_TYPE -> {
                genericSignatures.printParamType(node);
                yield NOTHING;
            }
            case DEPENDENT_GENERIC_TYPE -> {
                Node dependentType = node.child(1);
                print(node.child(0));
                if (TypeClassifier.needSpaceBeforeType(dependentType)) {
                    out.append(' ');
                }
                print(dependentType);
                yield NOTHING;
            }
            case DEPENDENT_MEMBER_TYPE -> {
                print(node.child(0));
                out.append('.');
                print(node.child(1));
                yield NOTHING;
            }
            case DEPENDENT_ASSOCIATED_TYPE_REF -> {
                if (node.numChildren() > 1) {
                    print(node.child(1));
                    out.append('.');
                }
                print(node.child(0));
                yield NOTHING;
            }
            case ASSOC_TYPE_PATH -> {
                printChildren(node, ".");
                yield NOTHING;
            }

            // Markers that only appear in malformed or partially decoded trees
            case ASYNC_ANNOTATION -> emit(" async ");
            case THROWS_ANNOTATION -> emit(" throws ");
            case EMPTY_LIST -> emit(" empty-list ");
            case FIRST_ELEMENT_MARKER -> emit(" first-element-marker ");
            case VARIADIC_MARKER -> emit(" variadic-marker ");

            // Boxes
            case SIL_BOX_TYPE_WITH_LAYOUT -> printBoxWithLayout(node);
            case SIL_BOX_LAYOUT -> {
                out.append('{');
                for (int i = 0; i < node.numChildren(); i++) {
                    if (i > 0) {
                        out.append(',');
                    }
                    out.append(' ');
                    print(node.child(i));
                }
                out.append(" }");
                yield NOTHING;
            }
            case SIL_BOX_IMMUTABLE_FIELD, SIL_BOX_MUTABLE_FIELD -> {
                out.append(kind == NodeKind.SIL_BOX_IMMUTABLE_FIELD ? "let " : "var ");
                print(node.child(0));
                yield NOTHING;
            }

            // Global initialization
            case GLOBAL_VARIABLE_ONCE_TOKEN, GLOBAL_VARIABLE_ONCE_FUNCTION -> {
                out.append(kind == NodeKind.GLOBAL_VARIABLE_ONCE_TOKEN
                    ? "one-time initialization token for "
                    : "one-time initialization function for ");
                // The context decision is taken but the context itself is never printed
                printContext(node.child(0));
                print(node.child(1));
                yield NOTHING;
            }
            case GLOBAL_VARIABLE_ONCE_DECL_LIST -> {
                if (node.numChildren() == 1) {
                    print(node.child(0));
                } else {
                    out.append('(');
                    printChildren(node, ", ");
                    out.append(')');
                }
                yield NOTHING;
            }

            // Only meaningful below a specific parent
            case DEPENDENT_GENERIC_PARAM_COUNT, FUNCTION_SIGNATURE_SPECIALIZATION_PARAM,
                FUNCTION_SIGNATURE_SPECIALIZATION_RETURN, IMPL_FUNCTION_CONVENTION_NAME -> {
                setInvalid();
                yield NOTHING;
            }
        };
    }

    private Optional<Node> emit(String text) {
        out.append(text);
        return NOTHING;
    }

    private Optional<Node> unlessShortened(String text) {
        if (!options.shortenThunk()) {
            out.append(text);
        }
        return NOTHING;
    }

    private Optional<Node> printOutlinedWithOperand(Node node, String description) {
        out.append(description);
        print(node.child(0));
        if (node.numChildren() > 1) {
            print(node.child(1));
        }
        return NOTHING;
    }

    private Optional<Node> printSymbolicReference(Node node, String description) {
        out.append(description).appendHex(indexOf(node));
        return NOTHING;
    }

    private Optional<Node> printTypeAndConformance(Node node, String description) {
        out.append(description);
        print(node.child(0));
        out.append(" and conformance ");
        print(node.child(1));
        return NOTHING;
    }

    private Optional<Node> printAssociatedConformance(Node node, String description) {
        out.append(description);
        print(node.child(0));
        out.append('.');
        print(node.child(1));
        out.append(": ");
        print(node.child(2));
        return NOTHING;
    }

    private Optional<Node> printDependentConformance(Node node, String description) {
        out.append(description);
        Node index = node.child(2);
        if (index.hasIndex()) {
            out.append('#').appendUnsigned(index.index()).append(' ');
        }
        print(node.child(0));
        print(node.child(1));
        return NOTHING;
    }

    private Optional<Node> printAnonymousContext(Node node) {
        if (options.qualifyEntities() && options.displayExtensionContexts()) {
            print(node.child(1));
            out.append(".(unknown context at ");
            print(node.child(0));
            out.append(')');
            if (node.numChildren() >= 3 && node.child(2).numChildren() > 0) {
                out.append('<');
                print(node.child(2));
                out.append('>');
            }
        }
        return NOTHING;
    }

    private Optional<Node> printExtension(Node node) {
        if (options.qualifyEntities() && options.displayExtensionContexts()) {
            out.append("(extension in ");
            print(node.child(0), true);
            out.append("):");
        }
        print(node.child(1));
        // The runtime does not record the generic signature of an extension
        if (node.numChildren() == 3 && !options.printForTypeName()) {
            print(node.child(2));
        }
        return NOTHING;
    }

    private Optional<Node> printPrivateDeclName(Node node) {
        boolean showDiscriminator = options.showPrivateDiscriminators();
        if (node.numChildren() > 1) {
            if (showDiscriminator) {
                out.append('(');
            }
            print(node.child(1));
            if (showDiscriminator) {
                out.append(" in ").append(textOf(node.child(0))).append(')');
            }
        } else if (showDiscriminator) {
            out.append("(in ").append(textOf(node.child(0))).append(')');
        }
        return NOTHING;
    }

    private Optional<Node> printTupleElement(Node node) {
        node.firstChildOfKind(NodeKind.TUPLE_ELEMENT_NAME)
            .ifPresent(label -> out.append(textOf(label)).append(": "));

        Node type = node.firstChildOfKind(NodeKind.TYPE)
            .orElseThrow(() -> new MalformedNodeException(node, "tuple element without type"));
        print(type);

        if (node.firstChildOfKind(NodeKind.VARIADIC_MARKER).isPresent()) {
            out.append("...");
        }
        return NOTHING;
    }

    private Optional<Node> printPartialApply(Node node, String fullDescription) {
        out.append(options.shortenPartialApply() ? "partial apply" : fullDescription);
        if (node.hasChildren()) {
            out.append(" for ");
            printChildren(node);
        }
        return NOTHING;
    }

    private Optional<Node> printKeyPathAccessorThunk(Node node, String description) {
        out.append(description);
        print(node.child(0));
        out.append(" : ");
        for (int i = 1; i < node.numChildren(); i++) {
            Node child = node.child(i);
            if (child.is(NodeKind.IS_SERIALIZED)) {
                out.append(", ");
            }
            print(child);
        }
        return NOTHING;
    }

    private Optional<Node> printKeyPathIndexThunk(Node node, String operator) {
        out.append("key path index ").append(operator).append(" operator for ");

        int end = node.numChildren();
        Node last = node.child(end - 1);
        if (last.is(NodeKind.IS_SERIALIZED)) {
            end--;
            last = node.child(end - 1);
        }
        if (last.is(NodeKind.DEPENDENT_GENERIC_SIGNATURE)) {
            print(last);
            end--;
        }

        out.append('(');
        for (int i = 0; i < end; i++) {
            if (i != 0) {
                out.append(", ");
            }
            print(node.child(i));
        }
        out.append(')');
        return NOTHING;
    }

    private Optional<Node> printReabstractionThunk(Node node) {
        if (options.shortenThunk()) {
            out.append("thunk for ");
            print(node.lastChild());
            return NOTHING;
        }
        out.append("reabstraction thunk ");
        if (node.is(NodeKind.REABSTRACTION_THUNK_HELPER)) {
            out.append("helper ");
        }
        int idx = 0;
        if (node.numChildren() == 3) {
            print(node.child(0));
            out.append(' ');
            idx = 1;
        }
        out.append("from ");
        print(node.child(idx + 1));
        out.append(" to ");
        print(node.child(idx));
        return NOTHING;
    }

    private Optional<Node> printReabstractionThunkWithSelf(Node node) {
        out.append("reabstraction thunk ");
        int idx = 0;
        if (node.numChildren() == 4) {
            print(node.child(0));
            out.append(' ');
            idx = 1;
        }
        out.append("from ");
        print(node.child(idx + 2));
        out.append(" to ");
        print(node.child(idx + 1));
        out.append(" self ");
        print(node.child(idx));
        return NOTHING;
    }

    private Optional<Node> printProtocolConformance(Node node) {
        Node type = node.child(0);
        Node protocol = node.child(1);
        Node module = node.child(2);
        if (node.numChildren() == 4) {
            out.append("property behavior storage of ");
            print(module);
            out.append(" in ");
            print(type);
            out.append(" : ");
            print(protocol);
        } else {
            print(type);
            if (options.displayProtocolConformances()) {
                out.append(" : ");
                print(protocol);
                out.append(" in ");
                print(module);
            }
        }
        return NOTHING;
    }

    /**
     * Prints the optional representation child of a metatype and returns the position of the
     * instance type.
     */
    private int printMetatypeRepresentation(Node node) {
        if (node.numChildren() == 2) {
            print(node.child(0));
            out.append(' ');
            return 1;
        }
        return 0;
    }

    private Optional<Node> printMetatype(Node node) {
        int idx = printMetatypeRepresentation(node);
        Node type = node.child(idx).child(0);
        printWithParens(type);
        out.append(TypeClassifier.isExistentialType(type) ? ".Protocol" : ".Type");
        return NOTHING;
    }

    private Optional<Node> printProtocolListWithClass(Node node) {
        if (node.numChildren() < 2) {
            return NOTHING;
        }
        Node protocols = node.child(0);
        print(node.child(1));
        out.append(" & ");
        if (protocols.numChildren() < 1) {
            return NOTHING;
        }
        printChildren(protocols.child(0), " & ");
        return NOTHING;
    }

    private Optional<Node> printProtocolListWithAnyObject(Node node) {
        if (node.numChildren() < 1) {
            return NOTHING;
        }
        Node protocols = node.child(0);
        if (protocols.numChildren() < 1) {
            return NOTHING;
        }
        Node typeList = protocols.child(0);
        if (typeList.numChildren() > 0) {
            printChildren(typeList, " & ");
            out.append(" & ");
        }
        if (options.qualifyEntities() && options.displayStdlibModule()) {
            out.append(ModuleNames.STDLIB).append('.');
        }
        out.append("AnyObject");
        return NOTHING;
    }

    private Optional<Node> printBoxWithLayout(Node node) {
        if (node.numChildren() != 1 && node.numChildren() != 3) {
            setInvalid();
            return NOTHING;
        }
        Node layout = node.child(0);
        Node genericArgs = null;
        if (node.numChildren() == 3) {
            print(node.child(1));
            out.append(' ');
            genericArgs = node.child(2);
        }
        print(layout);
        if (genericArgs != null) {
            out.append(" <");
            printChildren(genericArgs, ", ");
            out.append('>');
        }
        return NOTHING;
    }

    private void printBoundGeneric(Node node) {
        if (node.numChildren() < 2) {
            return;
        }
        if (node.numChildren() != 2
            || !options.synthesizeSugarOnTypes()
            || node.is(NodeKind.BOUND_GENERIC_CLASS)) {
            printBoundGenericNoSugar(node);
            return;
        }

        // A bound protocol prints the conforming type "as" the protocol
        if (node.is(NodeKind.BOUND_GENERIC_PROTOCOL)) {
            printChildren(node.child(1));
            out.append(" as ");
            print(node.child(0));
            return;
        }

        Node arguments = node.child(1);
        switch (SugarRecognizer.findSugar(node)) {
            case NONE -> printBoundGenericNoSugar(node);
            case OPTIONAL -> {
                printWithParens(arguments.child(0));
                out.append('?');
            }
            case IMPLICITLY_UNWRAPPED_OPTIONAL -> {
                printWithParens(arguments.child(0));
                out.append('!');
            }
            case ARRAY -> {
                out.append('[');
                print(arguments.child(0));
                out.append(']');
            }
            case DICTIONARY -> {
                out.append('[');
                print(arguments.child(0));
                out.append(" : ");
                print(arguments.child(1));
                out.append(']');
            }
        }
    }

    private void printBoundGenericNoSugar(Node node) {
        if (node.numChildren() < 2) {
            return;
        }
        print(node.child(0));
        out.append('<');
        printChildren(node.child(1), ", ");
        out.append('>');
    }
}
