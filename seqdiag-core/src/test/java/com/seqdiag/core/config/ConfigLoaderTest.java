package com.seqdiag.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, """
            entitySpacing: 25
            placeholderHeight: 300
            font:
              family: "monospace"
              size: 12
              charWidthRatio: 0.55
            """);

        DiagramConfig config = ConfigLoader.load(configFile);

        assertThat(config.entitySpacing()).isEqualTo(25.0);
        assertThat(config.placeholderHeight()).isEqualTo(300.0);
        assertThat(config.font().family()).isEqualTo("monospace");
        assertThat(config.font().size()).isEqualTo(12.0);
        assertThat(config.font().charWidthRatio()).isEqualTo(0.55);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, """
            entitySpacing: 10
            unknownSetting: true
            """);

        DiagramConfig config = ConfigLoader.load(configFile);

        assertThat(config.entitySpacing()).isEqualTo(10.0);
        assertThat(config.placeholderHeight()).isEqualTo(DiagramConfig.DEFAULT_PLACEHOLDER_HEIGHT);
        assertThat(config.font()).isEqualTo(DiagramConfig.FontConfig.defaults());
    }

    @Test
    void load_negativeValues_fallBackToDefaults() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, """
            entitySpacing: -5
            font:
              size: 0
            """);

        DiagramConfig config = ConfigLoader.load(configFile);

        assertThat(config.entitySpacing()).isEqualTo(DiagramConfig.DEFAULT_ENTITY_SPACING);
        assertThat(config.font().size()).isEqualTo(DiagramConfig.FontConfig.DEFAULT_SIZE);
    }

    @Test
    void load_nonFiniteValues_fallBackToDefaults() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, """
            entitySpacing: .nan
            placeholderHeight: .inf
            font:
              size: .inf
              charWidthRatio: .nan
            """);

        DiagramConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(DiagramConfig.defaults());
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        DiagramConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(DiagramConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(DiagramConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("seqdiag.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(DiagramConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(DiagramConfig.defaults());
    }

    @Test
    void toRenderAttributes_usesFontSettings() {
        DiagramConfig config = new DiagramConfig(null, null, new DiagramConfig.FontConfig("serif", 20.0, 0.5));

        assertThat(config.toRenderAttributes().measureText("abcd").width()).isEqualTo(40.0);
        assertThat(config.toRenderAttributes().fontFamily()).isEqualTo("serif");
    }
}
