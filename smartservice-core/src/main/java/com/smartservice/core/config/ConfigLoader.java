package com.smartservice.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the compiler settings file ({@code smartservice.yaml}) into a {@link CompilerConfig}.
 *
 * <p>The settings file is optional. A missing, unreadable, empty or malformed file never
 * stops a compilation; the compiler then runs with {@link CompilerConfig#defaults()}, which
 * accepts descriptor major version 1 and enables every registered provider.
 *
 * <pre>{@code
 * DescriptorCompiler compiler = new DescriptorCompiler(ConfigLoader.load(Path.of("smartservice.yaml")));
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper SETTINGS_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "smartservice.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Returns the compiler settings stored at {@code configPath}, or the built-in defaults
     * when the file cannot be used.
     *
     * @param configPath location of the settings file
     * @return settings from the file, or {@link CompilerConfig#defaults()}
     */
    public static CompilerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return withDefaults(configPath, "no settings file");
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            return withDefaults(configPath, "settings path is not a readable file");
        }

        log.debug("Reading compiler settings from {}", configPath);
        CompilerConfig config;
        try {
            config = SETTINGS_MAPPER.readValue(configPath.toFile(), CompilerConfig.class);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Compiler settings in {} are invalid ({}); falling back to built-in defaults",
                configPath, e.getMessage());
            return CompilerConfig.defaults();
        }
        if (config == null) {
            return withDefaults(configPath, "settings file is empty");
        }
        log.info("Compiler settings read from {} (compiler {}, major versions {})",
            configPath, config.compilerVersion(), config.supportedMajorVersions());
        return config;
    }

    private static CompilerConfig withDefaults(Path configPath, String reason) {
        log.warn("{}: {}; compiling with built-in defaults", configPath, reason);
        return CompilerConfig.defaults();
    }
}
