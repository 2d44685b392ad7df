package com.demanglekit.core.model;

/**
 * Whether a field offset or similar artifact is reached directly or through an indirection.
 *
 * <p>Encoded in the numeric payload of a {@link NodeKind#DIRECTNESS} node by ordinal.
 */
public enum Directness {
    /** Stored inline. */
    DIRECT("direct"),

    /** Reached through a pointer. */
    INDIRECT("indirect");

    private final String spelling;

    Directness(String spelling) {
        this.spelling = spelling;
    }

    public String spelling() {
        return spelling;
    }

    /**
     * Maps a raw payload to a directness value.
     *
     * @param raw numeric payload of the node
     * @return matching value
     * @throws AssertionError if the payload is out of range
     */
    public static Directness fromRaw(long raw) {
        if (raw < 0 || raw >= values().length) {
            throw new AssertionError("bad directness: " + raw);
        }
        return values()[(int) raw];
    }
}
