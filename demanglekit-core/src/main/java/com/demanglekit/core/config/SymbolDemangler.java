package com.demanglekit.core.config;

/**
 * Hook for turning an embedded mangled symbol back into readable text.
 *
 * <p>Function-signature specializations that constant-propagate a function or a global
 * record the propagated symbol in its mangled form. Decoding mangled names is outside this
 * library, so callers that own a decoder can supply one here; without it the raw payload
 * is printed.
 */
@FunctionalInterface
public interface SymbolDemangler {

    /** Demangler that never recognizes anything. */
    SymbolDemangler NONE = mangledName -> "";

    /**
     * Demangles an embedded symbol.
     *
     * @param mangledName mangled symbol text
     * @return readable text, or an empty string if the symbol is not recognized
     */
    String demangle(String mangledName);
}
