package com.demanglekit.core.config;

/**
 * Strategy that names a generic parameter from its position in a generic signature.
 *
 * <p>The default names parameters {@code A, B, ... Z, BA, ...} and appends the depth as a
 * decimal suffix for nested signatures (e.g. {@code A1}). Debuggers that know the real
 * source names can plug in their own strategy through
 * {@link DemangleOptions.Builder#genericParameterNamer(GenericParameterNamer)}.
 */
@FunctionalInterface
public interface GenericParameterNamer {

    /** Letter-based naming used unless overridden. */
    GenericParameterNamer DEFAULT = GenericParameterNamer::defaultName;

    /**
     * Names the parameter at {@code index} of the signature level {@code depth}.
     *
     * @param depth generic nesting depth, zero for the outermost level
     * @param index parameter position within its level
     * @return parameter name
     */
    String name(long depth, long index);

    /**
     * Computes the default name.
     *
     * <p>The index is written in base 26 with digits {@code A..Z}, least significant digit
     * first; a non-zero depth is appended in decimal.
     *
     * @param depth generic nesting depth
     * @param index parameter position within its level
     * @return default parameter name
     */
    static String defaultName(long depth, long index) {
        StringBuilder name = new StringBuilder();
        long remaining = index;
        do {
            name.append((char) ('A' + Long.remainderUnsigned(remaining, 26)));
            remaining = Long.divideUnsigned(remaining, 26);
        } while (remaining != 0);
        if (depth != 0) {
            name.append(Long.toUnsignedString(depth));
        }
        return name.toString();
    }
}
