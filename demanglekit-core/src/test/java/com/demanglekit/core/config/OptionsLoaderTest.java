package com.demanglekit.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OptionsLoader}.
 */
class OptionsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_simplifiedPresetWithOverrides_returnsOptions() throws IOException {
        Path profile = tempDir.resolve("demangle.yaml");
        Files.writeString(profile, """
            preset: simplified
            hidingCurrentModule: MyApp
            overrides:
              displayWhereClauses: true
              shortenThunk: false
            """);

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options.synthesizeSugarOnTypes()).isTrue();
        assertThat(options.displayModuleNames()).isFalse();
        assertThat(options.displayWhereClauses()).isTrue();
        assertThat(options.shortenThunk()).isFalse();
        assertThat(options.shortenPartialApply()).isTrue();
        assertThat(options.hidingCurrentModule()).isEqualTo("MyApp");
    }

    @Test
    void load_overridesOnly_startsFromDefaults() throws IOException {
        Path profile = tempDir.resolve("demangle.yaml");
        Files.writeString(profile, """
            overrides:
              synthesizeSugarOnTypes: true
            """);

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options).isEqualTo(DemangleOptions.defaults().toBuilder().synthesizeSugarOnTypes(true).build());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path profile = tempDir.resolve("demangle.yaml");
        Files.writeString(profile, """
            preset: default
            colour: blue
            overrides:
              noSuchSwitch: true
              displayEntityTypes: false
            """);

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options.displayEntityTypes()).isFalse();
        assertThat(options.displayModuleNames()).isTrue();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        DemangleOptions options = OptionsLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(options).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        DemangleOptions options = OptionsLoader.load(tempDir);

        assertThat(options).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path profile = tempDir.resolve("empty.yaml");
        Files.writeString(profile, "");

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path profile = tempDir.resolve("broken.yaml");
        Files.writeString(profile, """
            preset: [unclosed
            overrides: {
            """);

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void load_wrongValueType_returnsDefaults() throws IOException {
        Path profile = tempDir.resolve("typed.yaml");
        Files.writeString(profile, """
            overrides:
              displayModuleNames:
                nested: true
            """);

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options).isEqualTo(DemangleOptions.defaults());
    }

    @Test
    void load_bundledProfile_isReadable() throws Exception {
        Path profile = Path.of(getClass().getResource("/profiles/crash-report.yaml").toURI());

        DemangleOptions options = OptionsLoader.load(profile);

        assertThat(options.synthesizeSugarOnTypes()).isTrue();
        assertThat(options.displayModuleNames()).isTrue();
        assertThat(options.hidingCurrentModule()).isEqualTo("CrashApp");
    }
}
