package com.demanglekit.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading printing options from a YAML profile.
 *
 * <p>Uses Jackson to deserialize the file into an {@link OptionsProfile} and resolves it
 * into {@link DemangleOptions}. If the file is missing or invalid, returns
 * {@link DemangleOptions#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DemangleOptions options = OptionsLoader.load(Paths.get("demangle.yaml"));
 * String text = NodePrinter.render(root, options);
 * }</pre>
 */
public class OptionsLoader {

    private static final Logger log = LoggerFactory.getLogger(OptionsLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private OptionsLoader() {
        // Prevent instantiation
    }

    /**
     * Loads options from a YAML profile.
     *
     * <p>If the file doesn't exist or can't be parsed, logs the problem and returns
     * {@link DemangleOptions#defaults()}.
     *
     * @param profilePath path to the profile
     * @return loaded options or defaults if unavailable
     */
    public static DemangleOptions load(Path profilePath) {
        if (!Files.exists(profilePath)) {
            log.warn("Options profile not found: {}. Using defaults.", profilePath);
            return DemangleOptions.defaults();
        }

        if (!Files.isRegularFile(profilePath) || !Files.isReadable(profilePath)) {
            log.warn("Options profile is not readable: {}. Using defaults.", profilePath);
            return DemangleOptions.defaults();
        }

        try {
            log.debug("Loading options profile from: {}", profilePath);
            OptionsProfile profile = YAML_MAPPER.readValue(profilePath.toFile(), OptionsProfile.class);
            if (profile == null) {
                log.warn("Options profile is empty: {}. Using defaults.", profilePath);
                return DemangleOptions.defaults();
            }
            OptionsProfile.Resolution resolution = profile.resolve();
            if (!resolution.unknownOverrides().isEmpty()) {
                log.warn("Ignoring unknown overrides in {}: {}", profilePath, resolution.unknownOverrides());
            }
            log.info("Loaded options profile from: {}", profilePath);
            return resolution.options();
        } catch (IOException e) {
            log.error("Failed to parse options profile: {}. Using defaults. Error: {}",
                profilePath, e.getMessage());
            return DemangleOptions.defaults();
        }
    }
}
