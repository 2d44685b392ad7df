package com.demanglekit.core.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OptionsProfile}.
 */
class OptionsProfileTest {

    @Test
    void resolve_nullPreset_usesDefaults() {
        OptionsProfile profile = new OptionsProfile(null, null, null);

        OptionsProfile.Resolution resolution = profile.resolve();

        assertThat(resolution.options()).isEqualTo(DemangleOptions.defaults());
        assertThat(resolution.unknownOverrides()).isEmpty();
    }

    @Test
    void resolve_presetName_isCaseInsensitive() {
        OptionsProfile profile = new OptionsProfile(" Simplified ", null, Map.of());

        assertThat(profile.resolve().options()).isEqualTo(DemangleOptions.simplified());
    }

    @Test
    void resolve_unknownPreset_fallsBackToDefaults() {
        OptionsProfile profile = new OptionsProfile("verbose", null, Map.of());

        assertThat(profile.resolve().options()).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void resolve_reportsUnknownAndEmptyOverrides() {
        Map<String, Boolean> overrides = new HashMap<>();
        overrides.put("displayObjCModule", false);
        overrides.put("displayColours", true);
        overrides.put("shortenThunk", null);
        OptionsProfile profile = new OptionsProfile(OptionsProfile.PRESET_DEFAULT, "App", overrides);

        OptionsProfile.Resolution resolution = profile.resolve();

        assertThat(resolution.options().displayObjCModule()).isFalse();
        assertThat(resolution.options().shortenThunk()).isFalse();
        assertThat(resolution.options().hidingCurrentModule()).isEqualTo("App");
        assertThat(resolution.unknownOverrides()).containsExactlyInAnyOrder("displayColours", "shortenThunk");
    }

    @Test
    void resolve_everySwitchName_isAccepted() {
        String[] names = {
            "synthesizeSugarOnTypes", "displayDebuggerGeneratedModule", "qualifyEntities",
            "displayExtensionContexts", "displayUnmangledSuffix", "displayModuleNames",
            "displayGenericSpecializations", "displayProtocolConformances", "displayWhereClauses",
            "displayEntityTypes", "displayLocalNameContexts", "shortenPartialApply", "shortenThunk",
            "shortenValueWitness", "showPrivateDiscriminators", "showFunctionArgumentTypes",
            "displayStdlibModule", "displayObjCModule", "printForTypeName"
        };
        Map<String, Boolean> overrides = new HashMap<>();
        for (String name : names) {
            overrides.put(name, true);
        }

        OptionsProfile.Resolution resolution = new OptionsProfile(null, null, overrides).resolve();

        assertThat(resolution.unknownOverrides()).isEmpty();
        assertThat(resolution.options().shortenThunk()).isTrue();
        assertThat(resolution.options().printForTypeName()).isTrue();
    }
}
