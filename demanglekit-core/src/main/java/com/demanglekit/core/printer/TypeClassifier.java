package com.demanglekit.core.printer;

import com.demanglekit.core.model.Node;
import com.demanglekit.core.model.NodeKind;

/**
 * Splits every node tag into simple and compound types.
 *
 * <p>A compound type is parenthesized where a primary position is required, for example
 * as the operand of {@code ?} sugar or as the base of a metatype. The table is a switch
 * expression without a default branch, so adding a tag without classifying it does not
 * compile.
 */
final class TypeClassifier {

    private TypeClassifier() {
        // Prevent instantiation
    }

    static boolean isSimpleType(Node node) {
        return switch (node.kind()) {
            case ASSOCIATED_TYPE, ASSOCIATED_TYPE_REF, BOUND_GENERIC_CLASS, BOUND_GENERIC_ENUM, BOUND_GENERIC_STRUCTURE,
                BOUND_GENERIC_PROTOCOL, BOUND_GENERIC_OTHER_NOMINAL_TYPE, BOUND_GENERIC_TYPE_ALIAS,
                BOUND_GENERIC_FUNCTION, BUILTIN_TYPE_NAME, CLASS, DEPENDENT_GENERIC_TYPE, DEPENDENT_MEMBER_TYPE,
                DEPENDENT_GENERIC_PARAM_TYPE, DYNAMIC_SELF, ENUM, ERROR_TYPE, EXISTENTIAL_METATYPE,
                METATYPE, METATYPE_REPRESENTATION, MODULE, TUPLE, PROTOCOL, PROTOCOL_SYMBOLIC_REFERENCE,
                RETURN_TYPE, SIL_BOX_TYPE, SIL_BOX_TYPE_WITH_LAYOUT, STRUCTURE, OTHER_NOMINAL_TYPE,
                TUPLE_ELEMENT_NAME, TYPE, TYPE_ALIAS, TYPE_LIST, LABEL_LIST, TYPE_SYMBOLIC_REFERENCE,
                SUGARED_OPTIONAL, SUGARED_ARRAY, SUGARED_DICTIONARY, SUGARED_PAREN -> true;

            case PROTOCOL_LIST -> node.child(0).numChildren() <= 1;

            case PROTOCOL_LIST_WITH_ANY_OBJECT -> node.child(0).child(0).numChildren() == 0;

            case ACCESSOR_FUNCTION_REFERENCE, ALLOCATOR, ANONYMOUS_CONTEXT, ANONYMOUS_DESCRIPTOR, ANY_PROTOCOL_CONFORMANCE_LIST,
                ARGUMENT_TUPLE, ASSOC_TYPE_PATH, ASSOCIATED_CONFORMANCE_DESCRIPTOR, ASSOCIATED_TYPE_DESCRIPTOR,
                ASSOCIATED_TYPE_GENERIC_PARAM_REF, ASSOCIATED_TYPE_METADATA_ACCESSOR, ASSOCIATED_TYPE_WITNESS_TABLE_ACCESSOR,
                ASYNC_ANNOTATION, AUTO_CLOSURE_TYPE, BASE_CONFORMANCE_DESCRIPTOR, BASE_WITNESS_TABLE_ACCESSOR,
                C_FUNCTION_POINTER, CANONICAL_PRESPECIALIZED_GENERIC_TYPE_CACHING_ONCE_TOKEN, CANONICAL_SPECIALIZED_GENERIC_METACLASS,
                CANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_ACCESS_FUNCTION, CLANG_TYPE, CLASS_METADATA_BASE_OFFSET,
                CONCRETE_PROTOCOL_CONFORMANCE, CONSTRUCTOR, COROUTINE_CONTINUATION_PROTOTYPE, CURRY_THUNK,
                DEALLOCATOR, DECL_CONTEXT, DEFAULT_ARGUMENT_INITIALIZER, DEFAULT_ASSOCIATED_CONFORMANCE_ACCESSOR,
                DEFAULT_ASSOCIATED_TYPE_METADATA_ACCESSOR, DEPENDENT_ASSOCIATED_CONFORMANCE, DEPENDENT_ASSOCIATED_TYPE_REF,
                DEPENDENT_GENERIC_CONFORMANCE_REQUIREMENT, DEPENDENT_GENERIC_LAYOUT_REQUIREMENT, DEPENDENT_GENERIC_PARAM_COUNT,
                DEPENDENT_GENERIC_SAME_TYPE_REQUIREMENT, DEPENDENT_GENERIC_SIGNATURE, DEPENDENT_PROTOCOL_CONFORMANCE_ASSOCIATED,
                DEPENDENT_PROTOCOL_CONFORMANCE_INHERITED, DEPENDENT_PROTOCOL_CONFORMANCE_ROOT, DEPENDENT_PSEUDOGENERIC_SIGNATURE,
                DESTRUCTOR, DID_SET, DIFFERENTIABLE_FUNCTION_TYPE, DIRECT_METHOD_REFERENCE_ATTRIBUTE,
                DIRECTNESS, DISPATCH_THUNK, DYNAMIC_ATTRIBUTE, DYNAMICALLY_REPLACEABLE_FUNCTION_IMPL,
                DYNAMICALLY_REPLACEABLE_FUNCTION_KEY, DYNAMICALLY_REPLACEABLE_FUNCTION_VAR, EMPTY_LIST,
                ENUM_CASE, ESCAPING_AUTO_CLOSURE_TYPE, ESCAPING_DIFFERENTIABLE_FUNCTION_TYPE, ESCAPING_LINEAR_FUNCTION_TYPE,
                ESCAPING_OBJC_BLOCK, EXPLICIT_CLOSURE, EXTENSION, EXTENSION_DESCRIPTOR, FIELD_OFFSET,
                FIRST_ELEMENT_MARKER, FULL_OBJC_RESILIENT_CLASS_STUB, FULL_TYPE_METADATA, FUNCTION,
                FUNCTION_SIGNATURE_SPECIALIZATION, FUNCTION_SIGNATURE_SPECIALIZATION_PARAM, FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_KIND,
                FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_PAYLOAD, FUNCTION_SIGNATURE_SPECIALIZATION_RETURN,
                FUNCTION_TYPE, GENERIC_PARTIAL_SPECIALIZATION, GENERIC_PARTIAL_SPECIALIZATION_NOT_RE_ABSTRACTED,
                GENERIC_PROTOCOL_WITNESS_TABLE, GENERIC_PROTOCOL_WITNESS_TABLE_INSTANTIATION_FUNCTION,
                GENERIC_SPECIALIZATION, GENERIC_SPECIALIZATION_NOT_RE_ABSTRACTED, GENERIC_SPECIALIZATION_PARAM,
                GENERIC_SPECIALIZATION_PRESPECIALIZED, GENERIC_TYPE_METADATA_PATTERN, GENERIC_TYPE_PARAM_DECL,
                GETTER, GLOBAL, GLOBAL_GETTER, GLOBAL_VARIABLE_ONCE_DECL_LIST, GLOBAL_VARIABLE_ONCE_FUNCTION,
                GLOBAL_VARIABLE_ONCE_TOKEN, IVAR_DESTROYER, IVAR_INITIALIZER, IDENTIFIER, IMPL_CONVENTION,
                IMPL_DIFFERENTIABILITY, IMPL_DIFFERENTIABLE, IMPL_ERROR_RESULT, IMPL_ESCAPING, IMPL_FUNCTION_ATTRIBUTE,
                IMPL_FUNCTION_CONVENTION, IMPL_FUNCTION_CONVENTION_NAME, IMPL_FUNCTION_TYPE, IMPL_INVOCATION_SUBSTITUTIONS,
                IMPL_LINEAR, IMPL_PARAMETER, IMPL_PATTERN_SUBSTITUTIONS, IMPL_RESULT, IMPL_YIELD, IMPLICIT_CLOSURE,
                IN_OUT, INDEX, INFIX_OPERATOR, INITIALIZER, INLINED_GENERIC_FUNCTION, IS_SERIALIZED,
                KEY_PATH_EQUALS_THUNK_HELPER, KEY_PATH_GETTER_THUNK_HELPER, KEY_PATH_HASH_THUNK_HELPER,
                KEY_PATH_SETTER_THUNK_HELPER, LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR, LAZY_PROTOCOL_WITNESS_TABLE_CACHE_VARIABLE,
                LINEAR_FUNCTION_TYPE, LOCAL_DECL_NAME, MATERIALIZE_FOR_SET, MERGED_FUNCTION, METACLASS,
                METADATA_INSTANTIATION_CACHE, METHOD_DESCRIPTOR, METHOD_LOOKUP_FUNCTION, MODIFY_ACCESSOR,
                MODULE_DESCRIPTOR, NATIVE_OWNING_ADDRESSOR, NATIVE_OWNING_MUTABLE_ADDRESSOR, NATIVE_PINNING_ADDRESSOR,
                NATIVE_PINNING_MUTABLE_ADDRESSOR, NO_ESCAPE_FUNCTION_TYPE, NOMINAL_TYPE_DESCRIPTOR,
                NON_OBJC_ATTRIBUTE, NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA, NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_CACHE,
                NUMBER, OBJC_ASYNC_COMPLETION_HANDLER_IMPL, OBJC_ATTRIBUTE, OBJC_BLOCK, OBJC_METADATA_UPDATE_FUNCTION,
                OBJC_RESILIENT_CLASS_STUB, OPAQUE_RETURN_TYPE, OPAQUE_RETURN_TYPE_OF, OPAQUE_TYPE,
                OPAQUE_TYPE_DESCRIPTOR, OPAQUE_TYPE_DESCRIPTOR_ACCESSOR, OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_IMPL,
                OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_KEY, OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_VAR, OPAQUE_TYPE_DESCRIPTOR_SYMBOLIC_REFERENCE,
                OUTLINED_ASSIGN_WITH_COPY, OUTLINED_ASSIGN_WITH_TAKE, OUTLINED_BRIDGED_METHOD, OUTLINED_CONSUME,
                OUTLINED_COPY, OUTLINED_DESTROY, OUTLINED_INITIALIZE_WITH_COPY, OUTLINED_INITIALIZE_WITH_TAKE,
                OUTLINED_RELEASE, OUTLINED_RETAIN, OUTLINED_VARIABLE, OWNED, OWNING_ADDRESSOR, OWNING_MUTABLE_ADDRESSOR,
                PARTIAL_APPLY_FORWARDER, PARTIAL_APPLY_OBJC_FORWARDER, POSTFIX_OPERATOR, PREFIX_OPERATOR,
                PRIVATE_DECL_NAME, PROPERTY_DESCRIPTOR, PROPERTY_WRAPPER_BACKING_INITIALIZER, PROTOCOL_CONFORMANCE,
                PROTOCOL_CONFORMANCE_DESCRIPTOR, PROTOCOL_CONFORMANCE_REF_IN_OTHER_MODULE, PROTOCOL_CONFORMANCE_REF_IN_PROTOCOL_MODULE,
                PROTOCOL_CONFORMANCE_REF_IN_TYPE_MODULE, PROTOCOL_DESCRIPTOR, PROTOCOL_LIST_WITH_CLASS,
                PROTOCOL_REQUIREMENTS_BASE_DESCRIPTOR, PROTOCOL_SELF_CONFORMANCE_DESCRIPTOR, PROTOCOL_SELF_CONFORMANCE_WITNESS,
                PROTOCOL_SELF_CONFORMANCE_WITNESS_TABLE, PROTOCOL_WITNESS, PROTOCOL_WITNESS_TABLE,
                PROTOCOL_WITNESS_TABLE_ACCESSOR, PROTOCOL_WITNESS_TABLE_PATTERN, REABSTRACTION_THUNK,
                REABSTRACTION_THUNK_HELPER, REABSTRACTION_THUNK_HELPER_WITH_SELF, READ_ACCESSOR, REFLECTION_METADATA_ASSOC_TYPE_DESCRIPTOR,
                REFLECTION_METADATA_BUILTIN_DESCRIPTOR, REFLECTION_METADATA_FIELD_DESCRIPTOR, REFLECTION_METADATA_SUPERCLASS_DESCRIPTOR,
                RELATED_ENTITY_DECL_NAME, RESILIENT_PROTOCOL_WITNESS_TABLE, RETROACTIVE_CONFORMANCE,
                SIL_BOX_IMMUTABLE_FIELD, SIL_BOX_LAYOUT, SIL_BOX_MUTABLE_FIELD, SETTER, SHARED, SPECIALIZATION_PASS_ID,
                STATIC, SUBSCRIPT, SUFFIX, THIN_FUNCTION_TYPE, THROWS_ANNOTATION, TUPLE_ELEMENT, TYPE_MANGLING,
                TYPE_METADATA, TYPE_METADATA_ACCESS_FUNCTION, TYPE_METADATA_COMPLETION_FUNCTION, TYPE_METADATA_DEMANGLING_CACHE,
                TYPE_METADATA_INSTANTIATION_CACHE, TYPE_METADATA_INSTANTIATION_FUNCTION, TYPE_METADATA_LAZY_CACHE,
                TYPE_METADATA_SINGLETON_INITIALIZATION_CACHE, UNCURRIED_FUNCTION_TYPE, UNKNOWN_INDEX,
                UNMANAGED, UNOWNED, UNSAFE_ADDRESSOR, UNSAFE_MUTABLE_ADDRESSOR, VTABLE_ATTRIBUTE, VTABLE_THUNK,
                VALUE_WITNESS, VALUE_WITNESS_TABLE, VARIABLE, VARIADIC_MARKER, WEAK, WILL_SET -> false;
        };
    }

    /**
     * Existential types print {@code .Protocol} rather than {@code .Type} as metatype bases.
     */
    static boolean isExistentialType(Node node) {
        return switch (node.kind()) {
            case EXISTENTIAL_METATYPE, PROTOCOL_LIST, PROTOCOL_LIST_WITH_CLASS, PROTOCOL_LIST_WITH_ANY_OBJECT -> true;
            default -> false;
        };
    }

    /**
     * Whether a space separates an entity name from this type in function-style output.
     */
    static boolean needSpaceBeforeType(Node type) {
        while (type.is(NodeKind.TYPE)) {
            type = type.firstChild();
        }
        return switch (type.kind()) {
            case FUNCTION_TYPE, NO_ESCAPE_FUNCTION_TYPE, UNCURRIED_FUNCTION_TYPE, DEPENDENT_GENERIC_TYPE -> false;
            default -> true;
        };
    }

    static boolean isFunctionStyleType(NodeKind kind) {
        return switch (kind) {
            case FUNCTION_TYPE, NO_ESCAPE_FUNCTION_TYPE, UNCURRIED_FUNCTION_TYPE, C_FUNCTION_POINTER,
                THIN_FUNCTION_TYPE -> true;
            default -> false;
        };
    }
}
