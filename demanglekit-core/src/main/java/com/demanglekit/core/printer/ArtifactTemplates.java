package com.demanglekit.core.printer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.demanglekit.core.model.NodeKind;

/**
 * Fixed descriptions of compiler-generated artifacts.
 *
 * <p>Each artifact prints its description followed by the rendering of its subject. For
 * {@link #SINGLE_SUBJECT} kinds the subject is the first child; for {@link #ALL_CHILDREN}
 * kinds every child is printed in order without separator.
 */
final class ArtifactTemplates {

    private static final Map<NodeKind, String> SINGLE_SUBJECT = new EnumMap<>(NodeKind.class);
    private static final Map<NodeKind, String> ALL_CHILDREN = new EnumMap<>(NodeKind.class);

    static {
        // Declaration modifiers and thunks
        single(NodeKind.STATIC, "static ");
        single(NodeKind.CURRY_THUNK, "curry thunk of ");
        single(NodeKind.DISPATCH_THUNK, "dispatch thunk of ");
        single(NodeKind.METHOD_DESCRIPTOR, "method descriptor for ");
        single(NodeKind.METHOD_LOOKUP_FUNCTION, "method lookup function for ");
        single(NodeKind.OBJC_METADATA_UPDATE_FUNCTION, "ObjC metadata update function for ");
        single(NodeKind.OBJC_RESILIENT_CLASS_STUB, "ObjC resilient class stub for ");
        single(NodeKind.FULL_OBJC_RESILIENT_CLASS_STUB, "full ObjC resilient class stub for ");
        single(NodeKind.OBJC_ASYNC_COMPLETION_HANDLER_IMPL, "@objc completion handler block implementation for ");
        single(NodeKind.IN_OUT, "inout ");
        single(NodeKind.SHARED, "__shared ");
        single(NodeKind.OWNED, "__owned ");
        single(NodeKind.SIL_BOX_TYPE, "@box ");
        single(NodeKind.ENUM_CASE, "enum case for ");
        single(NodeKind.COROUTINE_CONTINUATION_PROTOTYPE, "coroutine continuation prototype for ");

        // Outlined value operations
        single(NodeKind.OUTLINED_RETAIN, "outlined retain of ");
        single(NodeKind.OUTLINED_RELEASE, "outlined release of ");
        single(NodeKind.OUTLINED_INITIALIZE_WITH_TAKE, "outlined init with take of ");
        single(NodeKind.OUTLINED_INITIALIZE_WITH_COPY, "outlined init with copy of ");
        single(NodeKind.OUTLINED_ASSIGN_WITH_TAKE, "outlined assign with take of ");
        single(NodeKind.OUTLINED_ASSIGN_WITH_COPY, "outlined assign with copy of ");
        single(NodeKind.OUTLINED_DESTROY, "outlined destroy of ");

        // Witness tables
        single(NodeKind.PROTOCOL_SELF_CONFORMANCE_WITNESS_TABLE, "protocol self-conformance witness table for ");
        single(NodeKind.PROTOCOL_WITNESS_TABLE_ACCESSOR, "protocol witness table accessor for ");
        single(NodeKind.PROTOCOL_WITNESS_TABLE, "protocol witness table for ");
        single(NodeKind.PROTOCOL_WITNESS_TABLE_PATTERN, "protocol witness table pattern for ");
        single(NodeKind.GENERIC_PROTOCOL_WITNESS_TABLE, "generic protocol witness table for ");
        single(NodeKind.GENERIC_PROTOCOL_WITNESS_TABLE_INSTANTIATION_FUNCTION,
            "instantiation function for generic protocol witness table for ");
        single(NodeKind.RESILIENT_PROTOCOL_WITNESS_TABLE, "resilient protocol witness table for ");
        single(NodeKind.PROTOCOL_SELF_CONFORMANCE_WITNESS, "protocol self-conformance witness for ");
        single(NodeKind.VALUE_WITNESS_TABLE, "value witness table for ");

        // Descriptors
        single(NodeKind.PROTOCOL_SELF_CONFORMANCE_DESCRIPTOR, "protocol self-conformance descriptor for ");
        single(NodeKind.PROTOCOL_CONFORMANCE_DESCRIPTOR, "protocol conformance descriptor for ");
        single(NodeKind.PROTOCOL_DESCRIPTOR, "protocol descriptor for ");
        single(NodeKind.PROTOCOL_REQUIREMENTS_BASE_DESCRIPTOR, "protocol requirements base descriptor for ");
        single(NodeKind.ASSOCIATED_TYPE_DESCRIPTOR, "associated type descriptor for ");
        single(NodeKind.PROPERTY_DESCRIPTOR, "property descriptor for ");
        single(NodeKind.NOMINAL_TYPE_DESCRIPTOR, "nominal type descriptor for ");
        single(NodeKind.OPAQUE_TYPE_DESCRIPTOR, "opaque type descriptor for ");
        single(NodeKind.OPAQUE_TYPE_DESCRIPTOR_ACCESSOR, "opaque type descriptor accessor for ");
        single(NodeKind.OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_IMPL, "opaque type descriptor accessor impl for ");
        single(NodeKind.OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_KEY, "opaque type descriptor accessor key for ");
        single(NodeKind.OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_VAR, "opaque type descriptor accessor var for ");
        single(NodeKind.MODULE_DESCRIPTOR, "module descriptor ");
        single(NodeKind.ANONYMOUS_DESCRIPTOR, "anonymous descriptor ");
        single(NodeKind.EXTENSION_DESCRIPTOR, "extension descriptor ");
        single(NodeKind.REFLECTION_METADATA_BUILTIN_DESCRIPTOR, "reflection metadata builtin descriptor ");
        single(NodeKind.REFLECTION_METADATA_FIELD_DESCRIPTOR, "reflection metadata field descriptor ");
        single(NodeKind.REFLECTION_METADATA_ASSOC_TYPE_DESCRIPTOR, "reflection metadata associated type descriptor ");
        single(NodeKind.REFLECTION_METADATA_SUPERCLASS_DESCRIPTOR, "reflection metadata superclass descriptor ");

        // Type metadata
        single(NodeKind.GENERIC_TYPE_METADATA_PATTERN, "generic type metadata pattern for ");
        single(NodeKind.METACLASS, "metaclass for ");
        single(NodeKind.FULL_TYPE_METADATA, "full type metadata for ");
        single(NodeKind.TYPE_METADATA, "type metadata for ");
        single(NodeKind.TYPE_METADATA_ACCESS_FUNCTION, "type metadata accessor for ");
        single(NodeKind.TYPE_METADATA_INSTANTIATION_CACHE, "type metadata instantiation cache for ");
        single(NodeKind.TYPE_METADATA_INSTANTIATION_FUNCTION, "type metadata instantiation function for ");
        single(NodeKind.TYPE_METADATA_SINGLETON_INITIALIZATION_CACHE,
            "type metadata singleton initialization cache for ");
        single(NodeKind.TYPE_METADATA_COMPLETION_FUNCTION, "type metadata completion function for ");
        single(NodeKind.TYPE_METADATA_DEMANGLING_CACHE, "demangling cache variable for type metadata for ");
        single(NodeKind.TYPE_METADATA_LAZY_CACHE, "lazy cache variable for type metadata for ");
        single(NodeKind.DEFAULT_ASSOCIATED_TYPE_METADATA_ACCESSOR, "default associated type metadata accessor for ");
        single(NodeKind.CLASS_METADATA_BASE_OFFSET, "class metadata base offset for ");
        single(NodeKind.CANONICAL_SPECIALIZED_GENERIC_METACLASS, "specialized generic metaclass for ");
        single(NodeKind.CANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_ACCESS_FUNCTION,
            "canonical specialized generic type metadata accessor for ");
        single(NodeKind.METADATA_INSTANTIATION_CACHE, "metadata instantiation cache for ");
        single(NodeKind.NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA,
            "noncanonical specialized generic type metadata for ");
        single(NodeKind.NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_CACHE,
            "cache variable for noncanonical specialized generic type metadata for ");
        single(NodeKind.CANONICAL_PRESPECIALIZED_GENERIC_TYPE_CACHING_ONCE_TOKEN,
            "flag for loading of canonical specialized generic type metadata for ");

        // Conformance references
        all(NodeKind.ASSOCIATED_TYPE_GENERIC_PARAM_REF, "generic parameter reference for associated type ");
        all(NodeKind.DEPENDENT_ASSOCIATED_CONFORMANCE, "dependent associated conformance ");
        all(NodeKind.PROTOCOL_CONFORMANCE_REF_IN_TYPE_MODULE, "protocol conformance ref (type's module) ");
        all(NodeKind.PROTOCOL_CONFORMANCE_REF_IN_PROTOCOL_MODULE, "protocol conformance ref (protocol's module) ");
        all(NodeKind.PROTOCOL_CONFORMANCE_REF_IN_OTHER_MODULE, "protocol conformance ref (retroactive) ");
    }

    private ArtifactTemplates() {
        // Prevent instantiation
    }

    private static void single(NodeKind kind, String description) {
        SINGLE_SUBJECT.put(kind, description);
    }

    private static void all(NodeKind kind, String description) {
        ALL_CHILDREN.put(kind, description);
    }

    /**
     * Returns the description printed before the first child of {@code kind}.
     *
     * @throws AssertionError if {@code kind} is routed here but has no template
     */
    static String singleSubjectPrefix(NodeKind kind) {
        String description = SINGLE_SUBJECT.get(kind);
        if (description == null) {
            throw new AssertionError("No artifact template for " + kind.kindName());
        }
        return description;
    }

    /**
     * Returns the description printed before all children of {@code kind}.
     *
     * @throws AssertionError if {@code kind} is routed here but has no template
     */
    static String allChildrenPrefix(NodeKind kind) {
        String description = ALL_CHILDREN.get(kind);
        if (description == null) {
            throw new AssertionError("No artifact template for " + kind.kindName());
        }
        return description;
    }

    static Set<NodeKind> singleSubjectKinds() {
        return Collections.unmodifiableSet(SINGLE_SUBJECT.keySet());
    }

    static Set<NodeKind> allChildrenKinds() {
        return Collections.unmodifiableSet(ALL_CHILDREN.keySet());
    }
}
