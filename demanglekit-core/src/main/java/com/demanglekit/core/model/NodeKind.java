package com.demanglekit.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed enumeration of every tag a demangled node can carry.
 *
 * <p>Tags span declarations (functions, variables, nominal types), types and their sugared
 * forms, generic-signature elements, specialization metadata, and the descriptors and
 * accessors the compiler emits for the runtime. Each constant carries its canonical
 * CamelCase spelling, which is the name used by textual tree dumps and by
 * {@link com.demanglekit.core.util.NodeTreeLoader}.
 *
 * <p>The set is closed on purpose: the printer switches over it without a {@code default}
 * branch, so adding a tag without teaching the printer about it does not compile.
 *
 * @see Node
 */
public enum NodeKind {
    ACCESSOR_FUNCTION_REFERENCE("AccessorFunctionReference"),
    ALLOCATOR("Allocator"),
    ANONYMOUS_CONTEXT("AnonymousContext"),
    ANONYMOUS_DESCRIPTOR("AnonymousDescriptor"),
    ANY_PROTOCOL_CONFORMANCE_LIST("AnyProtocolConformanceList"),
    ARGUMENT_TUPLE("ArgumentTuple"),
    ASSOC_TYPE_PATH("AssocTypePath"),
    ASSOCIATED_CONFORMANCE_DESCRIPTOR("AssociatedConformanceDescriptor"),
    ASSOCIATED_TYPE("AssociatedType"),
    ASSOCIATED_TYPE_DESCRIPTOR("AssociatedTypeDescriptor"),
    ASSOCIATED_TYPE_GENERIC_PARAM_REF("AssociatedTypeGenericParamRef"),
    ASSOCIATED_TYPE_METADATA_ACCESSOR("AssociatedTypeMetadataAccessor"),
    ASSOCIATED_TYPE_REF("AssociatedTypeRef"),
    ASSOCIATED_TYPE_WITNESS_TABLE_ACCESSOR("AssociatedTypeWitnessTableAccessor"),
    ASYNC_ANNOTATION("AsyncAnnotation"),
    AUTO_CLOSURE_TYPE("AutoClosureType"),
    BASE_CONFORMANCE_DESCRIPTOR("BaseConformanceDescriptor"),
    BASE_WITNESS_TABLE_ACCESSOR("BaseWitnessTableAccessor"),
    BOUND_GENERIC_CLASS("BoundGenericClass"),
    BOUND_GENERIC_ENUM("BoundGenericEnum"),
    BOUND_GENERIC_FUNCTION("BoundGenericFunction"),
    BOUND_GENERIC_OTHER_NOMINAL_TYPE("BoundGenericOtherNominalType"),
    BOUND_GENERIC_PROTOCOL("BoundGenericProtocol"),
    BOUND_GENERIC_STRUCTURE("BoundGenericStructure"),
    BOUND_GENERIC_TYPE_ALIAS("BoundGenericTypeAlias"),
    BUILTIN_TYPE_NAME("BuiltinTypeName"),
    C_FUNCTION_POINTER("CFunctionPointer"),
    CANONICAL_PRESPECIALIZED_GENERIC_TYPE_CACHING_ONCE_TOKEN("CanonicalPrespecializedGenericTypeCachingOnceToken"),
    CANONICAL_SPECIALIZED_GENERIC_METACLASS("CanonicalSpecializedGenericMetaclass"),
    CANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_ACCESS_FUNCTION("CanonicalSpecializedGenericTypeMetadataAccessFunction"),
    CLANG_TYPE("ClangType"),
    CLASS("Class"),
    CLASS_METADATA_BASE_OFFSET("ClassMetadataBaseOffset"),
    CONCRETE_PROTOCOL_CONFORMANCE("ConcreteProtocolConformance"),
    CONSTRUCTOR("Constructor"),
    COROUTINE_CONTINUATION_PROTOTYPE("CoroutineContinuationPrototype"),
    CURRY_THUNK("CurryThunk"),
    DEALLOCATOR("Deallocator"),
    DECL_CONTEXT("DeclContext"),
    DEFAULT_ARGUMENT_INITIALIZER("DefaultArgumentInitializer"),
    DEFAULT_ASSOCIATED_CONFORMANCE_ACCESSOR("DefaultAssociatedConformanceAccessor"),
    DEFAULT_ASSOCIATED_TYPE_METADATA_ACCESSOR("DefaultAssociatedTypeMetadataAccessor"),
    DEPENDENT_ASSOCIATED_CONFORMANCE("DependentAssociatedConformance"),
    DEPENDENT_ASSOCIATED_TYPE_REF("DependentAssociatedTypeRef"),
    DEPENDENT_GENERIC_CONFORMANCE_REQUIREMENT("DependentGenericConformanceRequirement"),
    DEPENDENT_GENERIC_LAYOUT_REQUIREMENT("DependentGenericLayoutRequirement"),
    DEPENDENT_GENERIC_PARAM_COUNT("DependentGenericParamCount"),
    DEPENDENT_GENERIC_PARAM_TYPE("DependentGenericParamType"),
    DEPENDENT_GENERIC_SAME_TYPE_REQUIREMENT("DependentGenericSameTypeRequirement"),
    DEPENDENT_GENERIC_SIGNATURE("DependentGenericSignature"),
    DEPENDENT_GENERIC_TYPE("DependentGenericType"),
    DEPENDENT_MEMBER_TYPE("DependentMemberType"),
    DEPENDENT_PROTOCOL_CONFORMANCE_ASSOCIATED("DependentProtocolConformanceAssociated"),
    DEPENDENT_PROTOCOL_CONFORMANCE_INHERITED("DependentProtocolConformanceInherited"),
    DEPENDENT_PROTOCOL_CONFORMANCE_ROOT("DependentProtocolConformanceRoot"),
    DEPENDENT_PSEUDOGENERIC_SIGNATURE("DependentPseudogenericSignature"),
    DESTRUCTOR("Destructor"),
    DID_SET("DidSet"),
    DIFFERENTIABLE_FUNCTION_TYPE("DifferentiableFunctionType"),
    DIRECT_METHOD_REFERENCE_ATTRIBUTE("DirectMethodReferenceAttribute"),
    DIRECTNESS("Directness"),
    DISPATCH_THUNK("DispatchThunk"),
    DYNAMIC_ATTRIBUTE("DynamicAttribute"),
    DYNAMIC_SELF("DynamicSelf"),
    DYNAMICALLY_REPLACEABLE_FUNCTION_IMPL("DynamicallyReplaceableFunctionImpl"),
    DYNAMICALLY_REPLACEABLE_FUNCTION_KEY("DynamicallyReplaceableFunctionKey"),
    DYNAMICALLY_REPLACEABLE_FUNCTION_VAR("DynamicallyReplaceableFunctionVar"),
    EMPTY_LIST("EmptyList"),
    ENUM("Enum"),
    ENUM_CASE("EnumCase"),
    ERROR_TYPE("ErrorType"),
    ESCAPING_AUTO_CLOSURE_TYPE("EscapingAutoClosureType"),
    ESCAPING_DIFFERENTIABLE_FUNCTION_TYPE("EscapingDifferentiableFunctionType"),
    ESCAPING_LINEAR_FUNCTION_TYPE("EscapingLinearFunctionType"),
    ESCAPING_OBJC_BLOCK("EscapingObjCBlock"),
    EXISTENTIAL_METATYPE("ExistentialMetatype"),
    EXPLICIT_CLOSURE("ExplicitClosure"),
    EXTENSION("Extension"),
    EXTENSION_DESCRIPTOR("ExtensionDescriptor"),
    FIELD_OFFSET("FieldOffset"),
    FIRST_ELEMENT_MARKER("FirstElementMarker"),
    FULL_OBJC_RESILIENT_CLASS_STUB("FullObjCResilientClassStub"),
    FULL_TYPE_METADATA("FullTypeMetadata"),
    FUNCTION("Function"),
    FUNCTION_SIGNATURE_SPECIALIZATION("FunctionSignatureSpecialization"),
    FUNCTION_SIGNATURE_SPECIALIZATION_PARAM("FunctionSignatureSpecializationParam"),
    FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_KIND("FunctionSignatureSpecializationParamKind"),
    FUNCTION_SIGNATURE_SPECIALIZATION_PARAM_PAYLOAD("FunctionSignatureSpecializationParamPayload"),
    FUNCTION_SIGNATURE_SPECIALIZATION_RETURN("FunctionSignatureSpecializationReturn"),
    FUNCTION_TYPE("FunctionType"),
    GENERIC_PARTIAL_SPECIALIZATION("GenericPartialSpecialization"),
    GENERIC_PARTIAL_SPECIALIZATION_NOT_RE_ABSTRACTED("GenericPartialSpecializationNotReAbstracted"),
    GENERIC_PROTOCOL_WITNESS_TABLE("GenericProtocolWitnessTable"),
    GENERIC_PROTOCOL_WITNESS_TABLE_INSTANTIATION_FUNCTION("GenericProtocolWitnessTableInstantiationFunction"),
    GENERIC_SPECIALIZATION("GenericSpecialization"),
    GENERIC_SPECIALIZATION_NOT_RE_ABSTRACTED("GenericSpecializationNotReAbstracted"),
    GENERIC_SPECIALIZATION_PARAM("GenericSpecializationParam"),
    GENERIC_SPECIALIZATION_PRESPECIALIZED("GenericSpecializationPrespecialized"),
    GENERIC_TYPE_METADATA_PATTERN("GenericTypeMetadataPattern"),
    GENERIC_TYPE_PARAM_DECL("GenericTypeParamDecl"),
    GETTER("Getter"),
    GLOBAL("Global"),
    GLOBAL_GETTER("GlobalGetter"),
    GLOBAL_VARIABLE_ONCE_DECL_LIST("GlobalVariableOnceDeclList"),
    GLOBAL_VARIABLE_ONCE_FUNCTION("GlobalVariableOnceFunction"),
    GLOBAL_VARIABLE_ONCE_TOKEN("GlobalVariableOnceToken"),
    IVAR_DESTROYER("IVarDestroyer"),
    IVAR_INITIALIZER("IVarInitializer"),
    IDENTIFIER("Identifier"),
    IMPL_CONVENTION("ImplConvention"),
    IMPL_DIFFERENTIABILITY("ImplDifferentiability"),
    IMPL_DIFFERENTIABLE("ImplDifferentiable"),
    IMPL_ERROR_RESULT("ImplErrorResult"),
    IMPL_ESCAPING("ImplEscaping"),
    IMPL_FUNCTION_ATTRIBUTE("ImplFunctionAttribute"),
    IMPL_FUNCTION_CONVENTION("ImplFunctionConvention"),
    IMPL_FUNCTION_CONVENTION_NAME("ImplFunctionConventionName"),
    IMPL_FUNCTION_TYPE("ImplFunctionType"),
    IMPL_INVOCATION_SUBSTITUTIONS("ImplInvocationSubstitutions"),
    IMPL_LINEAR("ImplLinear"),
    IMPL_PARAMETER("ImplParameter"),
    IMPL_PATTERN_SUBSTITUTIONS("ImplPatternSubstitutions"),
    IMPL_RESULT("ImplResult"),
    IMPL_YIELD("ImplYield"),
    IMPLICIT_CLOSURE("ImplicitClosure"),
    IN_OUT("InOut"),
    INDEX("Index"),
    INFIX_OPERATOR("InfixOperator"),
    INITIALIZER("Initializer"),
    INLINED_GENERIC_FUNCTION("InlinedGenericFunction"),
    IS_SERIALIZED("IsSerialized"),
    KEY_PATH_EQUALS_THUNK_HELPER("KeyPathEqualsThunkHelper"),
    KEY_PATH_GETTER_THUNK_HELPER("KeyPathGetterThunkHelper"),
    KEY_PATH_HASH_THUNK_HELPER("KeyPathHashThunkHelper"),
    KEY_PATH_SETTER_THUNK_HELPER("KeyPathSetterThunkHelper"),
    LABEL_LIST("LabelList"),
    LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR("LazyProtocolWitnessTableAccessor"),
    LAZY_PROTOCOL_WITNESS_TABLE_CACHE_VARIABLE("LazyProtocolWitnessTableCacheVariable"),
    LINEAR_FUNCTION_TYPE("LinearFunctionType"),
    LOCAL_DECL_NAME("LocalDeclName"),
    MATERIALIZE_FOR_SET("MaterializeForSet"),
    MERGED_FUNCTION("MergedFunction"),
    METACLASS("Metaclass"),
    METADATA_INSTANTIATION_CACHE("MetadataInstantiationCache"),
    METATYPE("Metatype"),
    METATYPE_REPRESENTATION("MetatypeRepresentation"),
    METHOD_DESCRIPTOR("MethodDescriptor"),
    METHOD_LOOKUP_FUNCTION("MethodLookupFunction"),
    MODIFY_ACCESSOR("ModifyAccessor"),
    MODULE("Module"),
    MODULE_DESCRIPTOR("ModuleDescriptor"),
    NATIVE_OWNING_ADDRESSOR("NativeOwningAddressor"),
    NATIVE_OWNING_MUTABLE_ADDRESSOR("NativeOwningMutableAddressor"),
    NATIVE_PINNING_ADDRESSOR("NativePinningAddressor"),
    NATIVE_PINNING_MUTABLE_ADDRESSOR("NativePinningMutableAddressor"),
    NO_ESCAPE_FUNCTION_TYPE("NoEscapeFunctionType"),
    NOMINAL_TYPE_DESCRIPTOR("NominalTypeDescriptor"),
    NON_OBJC_ATTRIBUTE("NonObjCAttribute"),
    NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA("NoncanonicalSpecializedGenericTypeMetadata"),
    NONCANONICAL_SPECIALIZED_GENERIC_TYPE_METADATA_CACHE("NoncanonicalSpecializedGenericTypeMetadataCache"),
    NUMBER("Number"),
    OBJC_ASYNC_COMPLETION_HANDLER_IMPL("ObjCAsyncCompletionHandlerImpl"),
    OBJC_ATTRIBUTE("ObjCAttribute"),
    OBJC_BLOCK("ObjCBlock"),
    OBJC_METADATA_UPDATE_FUNCTION("ObjCMetadataUpdateFunction"),
    OBJC_RESILIENT_CLASS_STUB("ObjCResilientClassStub"),
    OPAQUE_RETURN_TYPE("OpaqueReturnType"),
    OPAQUE_RETURN_TYPE_OF("OpaqueReturnTypeOf"),
    OPAQUE_TYPE("OpaqueType"),
    OPAQUE_TYPE_DESCRIPTOR("OpaqueTypeDescriptor"),
    OPAQUE_TYPE_DESCRIPTOR_ACCESSOR("OpaqueTypeDescriptorAccessor"),
    OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_IMPL("OpaqueTypeDescriptorAccessorImpl"),
    OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_KEY("OpaqueTypeDescriptorAccessorKey"),
    OPAQUE_TYPE_DESCRIPTOR_ACCESSOR_VAR("OpaqueTypeDescriptorAccessorVar"),
    OPAQUE_TYPE_DESCRIPTOR_SYMBOLIC_REFERENCE("OpaqueTypeDescriptorSymbolicReference"),
    OTHER_NOMINAL_TYPE("OtherNominalType"),
    OUTLINED_ASSIGN_WITH_COPY("OutlinedAssignWithCopy"),
    OUTLINED_ASSIGN_WITH_TAKE("OutlinedAssignWithTake"),
    OUTLINED_BRIDGED_METHOD("OutlinedBridgedMethod"),
    OUTLINED_CONSUME("OutlinedConsume"),
    OUTLINED_COPY("OutlinedCopy"),
    OUTLINED_DESTROY("OutlinedDestroy"),
    OUTLINED_INITIALIZE_WITH_COPY("OutlinedInitializeWithCopy"),
    OUTLINED_INITIALIZE_WITH_TAKE("OutlinedInitializeWithTake"),
    OUTLINED_RELEASE("OutlinedRelease"),
    OUTLINED_RETAIN("OutlinedRetain"),
    OUTLINED_VARIABLE("OutlinedVariable"),
    OWNED("Owned"),
    OWNING_ADDRESSOR("OwningAddressor"),
    OWNING_MUTABLE_ADDRESSOR("OwningMutableAddressor"),
    PARTIAL_APPLY_FORWARDER("PartialApplyForwarder"),
    PARTIAL_APPLY_OBJC_FORWARDER("PartialApplyObjCForwarder"),
    POSTFIX_OPERATOR("PostfixOperator"),
    PREFIX_OPERATOR("PrefixOperator"),
    PRIVATE_DECL_NAME("PrivateDeclName"),
    PROPERTY_DESCRIPTOR("PropertyDescriptor"),
    PROPERTY_WRAPPER_BACKING_INITIALIZER("PropertyWrapperBackingInitializer"),
    PROTOCOL("Protocol"),
    PROTOCOL_CONFORMANCE("ProtocolConformance"),
    PROTOCOL_CONFORMANCE_DESCRIPTOR("ProtocolConformanceDescriptor"),
    PROTOCOL_CONFORMANCE_REF_IN_OTHER_MODULE("ProtocolConformanceRefInOtherModule"),
    PROTOCOL_CONFORMANCE_REF_IN_PROTOCOL_MODULE("ProtocolConformanceRefInProtocolModule"),
    PROTOCOL_CONFORMANCE_REF_IN_TYPE_MODULE("ProtocolConformanceRefInTypeModule"),
    PROTOCOL_DESCRIPTOR("ProtocolDescriptor"),
    PROTOCOL_LIST("ProtocolList"),
    PROTOCOL_LIST_WITH_ANY_OBJECT("ProtocolListWithAnyObject"),
    PROTOCOL_LIST_WITH_CLASS("ProtocolListWithClass"),
    PROTOCOL_REQUIREMENTS_BASE_DESCRIPTOR("ProtocolRequirementsBaseDescriptor"),
    PROTOCOL_SELF_CONFORMANCE_DESCRIPTOR("ProtocolSelfConformanceDescriptor"),
    PROTOCOL_SELF_CONFORMANCE_WITNESS("ProtocolSelfConformanceWitness"),
    PROTOCOL_SELF_CONFORMANCE_WITNESS_TABLE("ProtocolSelfConformanceWitnessTable"),
    PROTOCOL_SYMBOLIC_REFERENCE("ProtocolSymbolicReference"),
    PROTOCOL_WITNESS("ProtocolWitness"),
    PROTOCOL_WITNESS_TABLE("ProtocolWitnessTable"),
    PROTOCOL_WITNESS_TABLE_ACCESSOR("ProtocolWitnessTableAccessor"),
    PROTOCOL_WITNESS_TABLE_PATTERN("ProtocolWitnessTablePattern"),
    REABSTRACTION_THUNK("ReabstractionThunk"),
    REABSTRACTION_THUNK_HELPER("ReabstractionThunkHelper"),
    REABSTRACTION_THUNK_HELPER_WITH_SELF("ReabstractionThunkHelperWithSelf"),
    READ_ACCESSOR("ReadAccessor"),
    REFLECTION_METADATA_ASSOC_TYPE_DESCRIPTOR("ReflectionMetadataAssocTypeDescriptor"),
    REFLECTION_METADATA_BUILTIN_DESCRIPTOR("ReflectionMetadataBuiltinDescriptor"),
    REFLECTION_METADATA_FIELD_DESCRIPTOR("ReflectionMetadataFieldDescriptor"),
    REFLECTION_METADATA_SUPERCLASS_DESCRIPTOR("ReflectionMetadataSuperclassDescriptor"),
    RELATED_ENTITY_DECL_NAME("RelatedEntityDeclName"),
    RESILIENT_PROTOCOL_WITNESS_TABLE("ResilientProtocolWitnessTable"),
    RETROACTIVE_CONFORMANCE("RetroactiveConformance"),
    RETURN_TYPE("ReturnType"),
    SIL_BOX_IMMUTABLE_FIELD("SILBoxImmutableField"),
    SIL_BOX_LAYOUT("SILBoxLayout"),
    SIL_BOX_MUTABLE_FIELD("SILBoxMutableField"),
    SIL_BOX_TYPE("SILBoxType"),
    SIL_BOX_TYPE_WITH_LAYOUT("SILBoxTypeWithLayout"),
    SETTER("Setter"),
    SHARED("Shared"),
    SPECIALIZATION_PASS_ID("SpecializationPassID"),
    STATIC("Static"),
    STRUCTURE("Structure"),
    SUBSCRIPT("Subscript"),
    SUFFIX("Suffix"),
    SUGARED_ARRAY("SugaredArray"),
    SUGARED_DICTIONARY("SugaredDictionary"),
    SUGARED_OPTIONAL("SugaredOptional"),
    SUGARED_PAREN("SugaredParen"),
    THIN_FUNCTION_TYPE("ThinFunctionType"),
    THROWS_ANNOTATION("ThrowsAnnotation"),
    TUPLE("Tuple"),
    TUPLE_ELEMENT("TupleElement"),
    TUPLE_ELEMENT_NAME("TupleElementName"),
    TYPE("Type"),
    TYPE_ALIAS("TypeAlias"),
    TYPE_LIST("TypeList"),
    TYPE_MANGLING("TypeMangling"),
    TYPE_METADATA("TypeMetadata"),
    TYPE_METADATA_ACCESS_FUNCTION("TypeMetadataAccessFunction"),
    TYPE_METADATA_COMPLETION_FUNCTION("TypeMetadataCompletionFunction"),
    TYPE_METADATA_DEMANGLING_CACHE("TypeMetadataDemanglingCache"),
    TYPE_METADATA_INSTANTIATION_CACHE("TypeMetadataInstantiationCache"),
    TYPE_METADATA_INSTANTIATION_FUNCTION("TypeMetadataInstantiationFunction"),
    TYPE_METADATA_LAZY_CACHE("TypeMetadataLazyCache"),
    TYPE_METADATA_SINGLETON_INITIALIZATION_CACHE("TypeMetadataSingletonInitializationCache"),
    TYPE_SYMBOLIC_REFERENCE("TypeSymbolicReference"),
    UNCURRIED_FUNCTION_TYPE("UncurriedFunctionType"),
    UNKNOWN_INDEX("UnknownIndex"),
    UNMANAGED("Unmanaged"),
    UNOWNED("Unowned"),
    UNSAFE_ADDRESSOR("UnsafeAddressor"),
    UNSAFE_MUTABLE_ADDRESSOR("UnsafeMutableAddressor"),
    VTABLE_ATTRIBUTE("VTableAttribute"),
    VTABLE_THUNK("VTableThunk"),
    VALUE_WITNESS("ValueWitness"),
    VALUE_WITNESS_TABLE("ValueWitnessTable"),
    VARIABLE("Variable"),
    VARIADIC_MARKER("VariadicMarker"),
    WEAK("Weak"),
    WILL_SET("WillSet");

    private static final Map<String, NodeKind> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(NodeKind::kindName, Function.identity()));

    private final String kindName;

    NodeKind(String kindName) {
        this.kindName = kindName;
    }

    /**
     * Returns the canonical CamelCase spelling of this tag (e.g. {@code "BoundGenericEnum"}).
     *
     * @return canonical tag name
     */
    public String kindName() {
        return kindName;
    }

    /**
     * Looks up a tag by its canonical spelling.
     *
     * @param kindName canonical CamelCase name
     * @return matching tag, or empty if the name is not part of the enumeration
     */
    public static Optional<NodeKind> fromKindName(String kindName) {
        return Optional.ofNullable(BY_NAME.get(kindName));
    }
}
