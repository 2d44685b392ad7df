package com.demanglekit.core.model;

import java.util.Optional;

/**
 * Optimizations recorded for one parameter of a function-signature specialization.
 *
 * <p>The raw value packs two things. Values {@code 0..7} in the low bits name a single
 * "value" optimization (constant propagation, closure propagation, box promotion). Bits 6
 * and above form an option set that may combine several signature rewrites; a raw value
 * with any option bit set is never one of the value optimizations.
 */
public enum FunctionSigSpecializationParamKind {
    CONSTANT_PROP_FUNCTION(0, "Constant Propagated Function"),
    CONSTANT_PROP_GLOBAL(1, "Constant Propagated Global"),
    CONSTANT_PROP_INTEGER(2, "Constant Propagated Integer"),
    CONSTANT_PROP_FLOAT(3, "Constant Propagated Float"),
    CONSTANT_PROP_STRING(4, "Constant Propagated String"),
    CLOSURE_PROP(5, "Closure Propagated"),
    BOX_TO_VALUE(6, "Value Promoted from Box"),
    BOX_TO_STACK(7, "Stack Promoted from Box"),

    DEAD(1L << 6, "Dead"),
    OWNED_TO_GUARANTEED(1L << 7, "Owned To Guaranteed"),
    SROA(1L << 8, "Exploded"),
    GUARANTEED_TO_OWNED(1L << 9, "Guaranteed To Owned"),
    EXISTENTIAL_TO_GENERIC(1L << 10, "Existential To Protocol Constrained Generic");

    /** Option-set bits in the order they are printed. */
    private static final FunctionSigSpecializationParamKind[] OPTION_PRINT_ORDER = {
        EXISTENTIAL_TO_GENERIC, DEAD, OWNED_TO_GUARANTEED, GUARANTEED_TO_OWNED, SROA
    };

    private final long raw;
    private final String description;

    FunctionSigSpecializationParamKind(long raw, String description) {
        this.raw = raw;
        this.description = description;
    }

    public long raw() {
        return raw;
    }

    public String description() {
        return description;
    }

    public boolean isOptionFlag() {
        return raw >= DEAD.raw;
    }

    /**
     * Tests whether this option bit is set in a raw value.
     *
     * @param rawValue raw node payload
     * @return true if this is an option flag and its bit is set
     */
    public boolean isSetIn(long rawValue) {
        return isOptionFlag() && (rawValue & raw) != 0;
    }

    /**
     * Returns the option flags in printing order.
     *
     * @return option flags, most significant description first
     */
    public static FunctionSigSpecializationParamKind[] optionsInPrintOrder() {
        return OPTION_PRINT_ORDER.clone();
    }

    /**
     * Tests whether any option bit is set in a raw value.
     *
     * @param rawValue raw node payload
     * @return true if at least one option flag is present
     */
    public static boolean hasOptionBits(long rawValue) {
        for (FunctionSigSpecializationParamKind option : OPTION_PRINT_ORDER) {
            if (option.isSetIn(rawValue)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps a raw value to a value optimization, ignoring option flags.
     *
     * @param rawValue raw node payload
     * @return matching value optimization, or empty if the value names none
     */
    public static Optional<FunctionSigSpecializationParamKind> valueKindOf(long rawValue) {
        for (FunctionSigSpecializationParamKind kind : values()) {
            if (!kind.isOptionFlag() && kind.raw == rawValue) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
