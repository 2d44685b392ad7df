package com.demanglekit.core.config;

import java.util.Objects;

/**
 * Immutable switches that control how a node tree is printed.
 *
 * <p>Two presets cover the common cases: {@link #defaults()} prints everything the tree
 * records, {@link #simplified()} produces the terse form shown in UIs such as crash
 * reports. Individual switches are adjusted through {@link #toBuilder()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DemangleOptions options = DemangleOptions.defaults().toBuilder()
 *     .synthesizeSugarOnTypes(true)
 *     .hidingCurrentModule("MyApp")
 *     .build();
 *
 * String text = NodePrinter.render(root, options);
 * }</pre>
 *
 * @param synthesizeSugarOnTypes print {@code T?}, {@code [T]} and {@code [K : V]} for the standard generic types
 * @param displayDebuggerGeneratedModule qualify with modules synthesized by the debugger
 * @param qualifyEntities print the context of entities at all
 * @param displayExtensionContexts print {@code (extension in M):} and anonymous contexts
 * @param displayUnmangledSuffix print the unmangled suffix of a symbol
 * @param displayModuleNames print module names
 * @param displayGenericSpecializations describe each specialization in detail instead of "specialized"
 * @param displayProtocolConformances print the protocol and module of a conformance
 * @param displayWhereClauses print the {@code where} clause of generic signatures
 * @param displayEntityTypes print {@code : Type} after variables and similar entities
 * @param displayLocalNameContexts print {@code #N} after local declarations and their contexts
 * @param shortenPartialApply print "partial apply" instead of "partial apply forwarder"
 * @param shortenThunk print "thunk for" instead of the full reabstraction-thunk description
 * @param shortenValueWitness omit "value witness" from value witness descriptions
 * @param showPrivateDiscriminators print the file discriminator of private declarations
 * @param showFunctionArgumentTypes print parameter and result types of functions
 * @param displayStdlibModule qualify with the standard library module
 * @param displayObjCModule qualify with the C/Objective-C interop module
 * @param printForTypeName print the form used for runtime type names
 * @param hidingCurrentModule module whose name is elided, or empty for none
 * @param genericParameterNamer naming strategy for generic parameters
 * @param symbolDemangler decoder for mangled symbols embedded in specialization payloads
 */
public record DemangleOptions(
    boolean synthesizeSugarOnTypes,
    boolean displayDebuggerGeneratedModule,
    boolean qualifyEntities,
    boolean displayExtensionContexts,
    boolean displayUnmangledSuffix,
    boolean displayModuleNames,
    boolean displayGenericSpecializations,
    boolean displayProtocolConformances,
    boolean displayWhereClauses,
    boolean displayEntityTypes,
    boolean displayLocalNameContexts,
    boolean shortenPartialApply,
    boolean shortenThunk,
    boolean shortenValueWitness,
    boolean showPrivateDiscriminators,
    boolean showFunctionArgumentTypes,
    boolean displayStdlibModule,
    boolean displayObjCModule,
    boolean printForTypeName,
    String hidingCurrentModule,
    GenericParameterNamer genericParameterNamer,
    SymbolDemangler symbolDemangler
) {
    /**
     * Compact constructor with validation.
     */
    public DemangleOptions {
        if (hidingCurrentModule == null) {
            hidingCurrentModule = "";
        }
        if (genericParameterNamer == null) {
            genericParameterNamer = GenericParameterNamer.DEFAULT;
        }
        if (symbolDemangler == null) {
            symbolDemangler = SymbolDemangler.NONE;
        }
    }

    /**
     * Creates options that print everything the tree records, without type sugar.
     *
     * @return default options
     */
    public static DemangleOptions defaults() {
        return builder().build();
    }

    /**
     * Creates the terse preset used for user-facing displays.
     *
     * <p>Enables sugar and shortened descriptions; hides module names, extension contexts,
     * unmangled suffixes, specialization details, conformances, where clauses and entity
     * types.
     *
     * @return simplified options
     */
    public static DemangleOptions simplified() {
        return builder()
            .synthesizeSugarOnTypes(true)
            .qualifyEntities(true)
            .displayExtensionContexts(false)
            .displayUnmangledSuffix(false)
            .displayModuleNames(false)
            .displayGenericSpecializations(false)
            .displayProtocolConformances(false)
            .displayWhereClauses(false)
            .displayEntityTypes(false)
            .shortenPartialApply(true)
            .shortenThunk(true)
            .shortenValueWitness(true)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this instance's values.
     *
     * @return pre-filled builder
     */
    public Builder toBuilder() {
        return new Builder()
            .synthesizeSugarOnTypes(synthesizeSugarOnTypes)
            .displayDebuggerGeneratedModule(displayDebuggerGeneratedModule)
            .qualifyEntities(qualifyEntities)
            .displayExtensionContexts(displayExtensionContexts)
            .displayUnmangledSuffix(displayUnmangledSuffix)
            .displayModuleNames(displayModuleNames)
            .displayGenericSpecializations(displayGenericSpecializations)
            .displayProtocolConformances(displayProtocolConformances)
            .displayWhereClauses(displayWhereClauses)
            .displayEntityTypes(displayEntityTypes)
            .displayLocalNameContexts(displayLocalNameContexts)
            .shortenPartialApply(shortenPartialApply)
            .shortenThunk(shortenThunk)
            .shortenValueWitness(shortenValueWitness)
            .showPrivateDiscriminators(showPrivateDiscriminators)
            .showFunctionArgumentTypes(showFunctionArgumentTypes)
            .displayStdlibModule(displayStdlibModule)
            .displayObjCModule(displayObjCModule)
            .printForTypeName(printForTypeName)
            .hidingCurrentModule(hidingCurrentModule)
            .genericParameterNamer(genericParameterNamer)
            .symbolDemangler(symbolDemangler);
    }

    /**
     * Names a generic parameter through the configured strategy.
     *
     * @param depth signature depth
     * @param index parameter index
     * @return parameter name
     */
    public String genericParameterName(long depth, long index) {
        return genericParameterNamer.name(depth, index);
    }

    /**
     * Fluent builder for {@link DemangleOptions}. Starts from the full-output defaults.
     */
    public static final class Builder {
        private boolean synthesizeSugarOnTypes = false;
        private boolean displayDebuggerGeneratedModule = true;
        private boolean qualifyEntities = true;
        private boolean displayExtensionContexts = true;
        private boolean displayUnmangledSuffix = true;
        private boolean displayModuleNames = true;
        private boolean displayGenericSpecializations = true;
        private boolean displayProtocolConformances = true;
        private boolean displayWhereClauses = true;
        private boolean displayEntityTypes = true;
        private boolean displayLocalNameContexts = true;
        private boolean shortenPartialApply = false;
        private boolean shortenThunk = false;
        private boolean shortenValueWitness = false;
        private boolean showPrivateDiscriminators = true;
        private boolean showFunctionArgumentTypes = true;
        private boolean displayStdlibModule = true;
        private boolean displayObjCModule = true;
        private boolean printForTypeName = false;
        private String hidingCurrentModule = "";
        private GenericParameterNamer genericParameterNamer = GenericParameterNamer.DEFAULT;
        private SymbolDemangler symbolDemangler = SymbolDemangler.NONE;

        private Builder() {
        }

        public Builder synthesizeSugarOnTypes(boolean value) {
            this.synthesizeSugarOnTypes = value;
            return this;
        }

        public Builder displayDebuggerGeneratedModule(boolean value) {
            this.displayDebuggerGeneratedModule = value;
            return this;
        }

        public Builder qualifyEntities(boolean value) {
            this.qualifyEntities = value;
            return this;
        }

        public Builder displayExtensionContexts(boolean value) {
            this.displayExtensionContexts = value;
            return this;
        }

        public Builder displayUnmangledSuffix(boolean value) {
            this.displayUnmangledSuffix = value;
            return this;
        }

        public Builder displayModuleNames(boolean value) {
            this.displayModuleNames = value;
            return this;
        }

        public Builder displayGenericSpecializations(boolean value) {
            this.displayGenericSpecializations = value;
            return this;
        }

        public Builder displayProtocolConformances(boolean value) {
            this.displayProtocolConformances = value;
            return this;
        }

        public Builder displayWhereClauses(boolean value) {
            this.displayWhereClauses = value;
            return this;
        }

        public Builder displayEntityTypes(boolean value) {
            this.displayEntityTypes = value;
            return this;
        }

        public Builder displayLocalNameContexts(boolean value) {
            this.displayLocalNameContexts = value;
            return this;
        }

        public Builder shortenPartialApply(boolean value) {
            this.shortenPartialApply = value;
            return this;
        }

        public Builder shortenThunk(boolean value) {
            this.shortenThunk = value;
            return this;
        }

        public Builder shortenValueWitness(boolean value) {
            this.shortenValueWitness = value;
            return this;
        }

        public Builder showPrivateDiscriminators(boolean value) {
            this.showPrivateDiscriminators = value;
            return this;
        }

        public Builder showFunctionArgumentTypes(boolean value) {
            this.showFunctionArgumentTypes = value;
            return this;
        }

        public Builder displayStdlibModule(boolean value) {
            this.displayStdlibModule = value;
            return this;
        }

        public Builder displayObjCModule(boolean value) {
            this.displayObjCModule = value;
            return this;
        }

        public Builder printForTypeName(boolean value) {
            this.printForTypeName = value;
            return this;
        }

        public Builder hidingCurrentModule(String value) {
            this.hidingCurrentModule = value;
            return this;
        }

        public Builder genericParameterNamer(GenericParameterNamer value) {
            this.genericParameterNamer = Objects.requireNonNull(value, "genericParameterNamer must not be null");
            return this;
        }

        public Builder symbolDemangler(SymbolDemangler value) {
            this.symbolDemangler = Objects.requireNonNull(value, "symbolDemangler must not be null");
            return this;
        }

        public DemangleOptions build() {
            return new DemangleOptions(
                synthesizeSugarOnTypes,
                displayDebuggerGeneratedModule,
                qualifyEntities,
                displayExtensionContexts,
                displayUnmangledSuffix,
                displayModuleNames,
                displayGenericSpecializations,
                displayProtocolConformances,
                displayWhereClauses,
                displayEntityTypes,
                displayLocalNameContexts,
                shortenPartialApply,
                shortenThunk,
                shortenValueWitness,
                showPrivateDiscriminators,
                showFunctionArgumentTypes,
                displayStdlibModule,
                displayObjCModule,
                printForTypeName,
                hidingCurrentModule,
                genericParameterNamer,
                symbolDemangler
            );
        }
    }
}
