package com.demanglekit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Printing profile as stored in a YAML file.
 *
 * <p>A profile picks a preset and then flips individual switches on top of it.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * preset: simplified
 * hidingCurrentModule: MyApp
 * overrides:
 *   synthesizeSugarOnTypes: true
 *   displayWhereClauses: true
 * }</pre>
 *
 * @param preset {@code default} or {@code simplified}; {@code null} means {@code default}
 * @param hidingCurrentModule module whose name is elided, may be {@code null}
 * @param overrides switch name to value, applied after the preset
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OptionsProfile(
    @JsonProperty("preset") String preset,
    @JsonProperty("hidingCurrentModule") String hidingCurrentModule,
    @JsonProperty("overrides") Map<String, Boolean> overrides
) {
    public static final String PRESET_DEFAULT = "default";
    public static final String PRESET_SIMPLIFIED = "simplified";

    /**
     * Compact constructor with validation.
     */
    public OptionsProfile {
        if (overrides == null) {
            overrides = Map.of();
        }
    }

    /**
     * Builds the options this profile describes.
     *
     * <p>Unknown preset names fall back to {@code default}; unknown switch names are
     * reported through the returned {@link Resolution} so the caller can log them.
     *
     * @return resolved options and the override keys that matched no switch
     */
    public Resolution resolve() {
        DemangleOptions base = PRESET_SIMPLIFIED.equals(normalizedPreset())
            ? DemangleOptions.simplified()
            : DemangleOptions.defaults();

        DemangleOptions.Builder builder = base.toBuilder();
        if (hidingCurrentModule != null) {
            builder.hidingCurrentModule(hidingCurrentModule);
        }

        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : overrides.entrySet()) {
            if (entry.getValue() == null || !applySwitch(builder, entry.getKey(), entry.getValue())) {
                unknown.add(entry.getKey());
            }
        }
        return new Resolution(builder.build(), List.copyOf(unknown));
    }

    private String normalizedPreset() {
        return preset == null ? PRESET_DEFAULT : preset.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean applySwitch(DemangleOptions.Builder builder, String name, boolean value) {
        switch (name) {
            case "synthesizeSugarOnTypes" -> builder.synthesizeSugarOnTypes(value);
            case "displayDebuggerGeneratedModule" -> builder.displayDebuggerGeneratedModule(value);
            case "qualifyEntities" -> builder.qualifyEntities(value);
            case "displayExtensionContexts" -> builder.displayExtensionContexts(value);
            case "displayUnmangledSuffix" -> builder.displayUnmangledSuffix(value);
            case "displayModuleNames" -> builder.displayModuleNames(value);
            case "displayGenericSpecializations" -> builder.displayGenericSpecializations(value);
            case "displayProtocolConformances" -> builder.displayProtocolConformances(value);
            case "displayWhereClauses" -> builder.displayWhereClauses(value);
            case "displayEntityTypes" -> builder.displayEntityTypes(value);
            case "displayLocalNameContexts" -> builder.displayLocalNameContexts(value);
            case "shortenPartialApply" -> builder.shortenPartialApply(value);
            case "shortenThunk" -> builder.shortenThunk(value);
            case "shortenValueWitness" -> builder.shortenValueWitness(value);
            case "showPrivateDiscriminators" -> builder.showPrivateDiscriminators(value);
            case "showFunctionArgumentTypes" -> builder.showFunctionArgumentTypes(value);
            case "displayStdlibModule" -> builder.displayStdlibModule(value);
            case "displayObjCModule" -> builder.displayObjCModule(value);
            case "printForTypeName" -> builder.printForTypeName(value);
            default -> {
                return false;
            }
        }
        return true;
    }

    /**
     * Outcome of {@link #resolve()}.
     *
     * @param options resolved options
     * @param unknownOverrides override keys that matched no switch or had no value
     */
    public record Resolution(DemangleOptions options, List<String> unknownOverrides) {}
}
