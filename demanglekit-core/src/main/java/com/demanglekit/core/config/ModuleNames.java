package com.demanglekit.core.config;

/**
 * Module names the printer treats specially when qualifying entities.
 */
public final class ModuleNames {

    /** The standard library module. */
    public static final String STDLIB = "Swift";

    /** Pseudo-module that holds imported C and Objective-C declarations. */
    public static final String OBJC_INTEROP = "__C";

    /** Prefix of modules synthesized by the debugger for expression evaluation. */
    public static final String DEBUGGER_EXPRESSIONS_PREFIX = "__lldb_expr_";

    private ModuleNames() {
        // Prevent instantiation
    }
}
