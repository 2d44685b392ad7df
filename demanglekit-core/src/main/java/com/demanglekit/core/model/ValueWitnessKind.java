package com.demanglekit.core.model;

/**
 * Entries of a value witness table, in mangling order.
 *
 * <p>The numeric payload of the first child of a {@link NodeKind#VALUE_WITNESS} node is the
 * ordinal of one of these constants.
 */
public enum ValueWitnessKind {
    ALLOCATE_BUFFER("allocateBuffer"),
    ASSIGN_WITH_COPY("assignWithCopy"),
    ASSIGN_WITH_TAKE("assignWithTake"),
    DEALLOCATE_BUFFER("deallocateBuffer"),
    DESTROY("destroy"),
    DESTROY_BUFFER("destroyBuffer"),
    DESTROY_ARRAY("destroyArray"),
    INITIALIZE_BUFFER_WITH_COPY_OF_BUFFER("initializeBufferWithCopyOfBuffer"),
    INITIALIZE_BUFFER_WITH_COPY("initializeBufferWithCopy"),
    INITIALIZE_WITH_COPY("initializeWithCopy"),
    INITIALIZE_BUFFER_WITH_TAKE("initializeBufferWithTake"),
    INITIALIZE_WITH_TAKE("initializeWithTake"),
    PROJECT_BUFFER("projectBuffer"),
    INITIALIZE_BUFFER_WITH_TAKE_OF_BUFFER("initializeBufferWithTakeOfBuffer"),
    INITIALIZE_ARRAY_WITH_COPY("initializeArrayWithCopy"),
    INITIALIZE_ARRAY_WITH_TAKE_FRONT_TO_BACK("initializeArrayWithTakeFrontToBack"),
    INITIALIZE_ARRAY_WITH_TAKE_BACK_TO_FRONT("initializeArrayWithTakeBackToFront"),
    STORE_EXTRA_INHABITANT("storeExtraInhabitant"),
    GET_EXTRA_INHABITANT_INDEX("getExtraInhabitantIndex"),
    GET_ENUM_TAG("getEnumTag"),
    DESTRUCTIVE_PROJECT_ENUM_DATA("destructiveProjectEnumData"),
    DESTRUCTIVE_INJECT_ENUM_TAG("destructiveInjectEnumTag"),
    GET_ENUM_TAG_SINGLE_PAYLOAD("getEnumTagSinglePayload"),
    STORE_ENUM_TAG_SINGLE_PAYLOAD("storeEnumTagSinglePayload");

    private final String witnessName;

    ValueWitnessKind(String witnessName) {
        this.witnessName = witnessName;
    }

    public String witnessName() {
        return witnessName;
    }

    /**
     * Maps a raw payload to a witness kind.
     *
     * @param raw numeric payload
     * @return matching witness kind
     * @throws AssertionError if the payload is out of range
     */
    public static ValueWitnessKind fromRaw(long raw) {
        if (raw < 0 || raw >= values().length) {
            throw new AssertionError("bad value witness kind: " + raw);
        }
        return values()[(int) raw];
    }
}
