package com.smartservice.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("smartservice.yaml");
        Files.writeString(configFile, """
            compilerVersion: "1.2.0"
            supportedMajorVersions: [1, 2]
            providers:
              enabled:
                - fiware
                - dataskop
            entityTypes:
              ParkingSpot: [location, status]
            geoAttributes: [location]
            parallelism: 4
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config.compilerVersion()).isEqualTo("1.2.0");
        assertThat(config.supportedMajorVersions()).containsExactly(1, 2);
        assertThat(config.providers().isEnabled("Fiware")).isTrue();
        assertThat(config.providers().isEnabled("fotec")).isFalse();
        assertThat(config.attributesOf("ParkingSpot")).contains(List.of("location", "status"));
        assertThat(config.attributesOf("AirQualityObserved")).isEmpty();
        assertThat(config.geoAttributes()).containsExactly("location");
        assertThat(config.timeAttributes()).isEqualTo(EntityTypeCatalog.DEFAULT_TIME_ATTRIBUTES);
        assertThat(config.parallelism()).isEqualTo(4);
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("smartservice.yaml");
        Files.writeString(configFile, """
            compilerVersion: "3.1.0"
            unknownSetting: true
            """);

        CompilerConfig config = ConfigLoader.load(configFile);

        assertThat(config.supportedMajorVersions()).containsExactly(3);
        assertThat(config.providers().enabled()).isEmpty();
        assertThat(config.attributesOf("AirQualityObserved")).isPresent();
        assertThat(config.parallelism()).isEqualTo(1);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        CompilerConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("smartservice.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("smartservice.yaml");
        Files.writeString(configFile, "parallelism: [not, a, number");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_invalidCompilerVersion_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("smartservice.yaml");
        Files.writeString(configFile, "compilerVersion: latest\n");

        assertThat(ConfigLoader.load(configFile).compilerVersion()).isEqualTo(CompilerConfig.DEFAULT_COMPILER_VERSION);
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(CompilerConfig.defaults());
    }

    @Test
    void load_missingSettingsFile_acceptsMajorVersionOneOnly() {
        CompilerConfig config = ConfigLoader.load(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME));

        assertThat(config.compilerVersion()).isEqualTo(CompilerConfig.DEFAULT_COMPILER_VERSION);
        assertThat(config.supportedMajorVersions()).containsExactly(1);
        assertThat(config.parallelism()).isEqualTo(1);
    }
}
