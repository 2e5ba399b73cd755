package com.tgupgrade.core.config;

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
        Path configFile = tempDir.resolve("tgupgrade.yaml");
        Files.writeString(configFile, """
            files:
              source: "old.tfvars"
              target: "new.hcl"

            output:
              mode: git-mv
              parallelism: 4
            """);

        UpgradeConfig config = ConfigLoader.load(configFile);

        assertThat(config.files().source()).isEqualTo("old.tfvars");
        assertThat(config.files().target()).isEqualTo("new.hcl");
        assertThat(config.output().mode()).isEqualTo("git-mv");
        assertThat(config.output().parallelism()).isEqualTo(4);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tgupgrade.yaml");
        Files.writeString(configFile, """
            output:
              parallelism: 2
            """);

        UpgradeConfig config = ConfigLoader.load(configFile);

        assertThat(config.files().source()).isEqualTo(UpgradeConfig.DEFAULT_SOURCE);
        assertThat(config.files().target()).isEqualTo(UpgradeConfig.DEFAULT_TARGET);
        assertThat(config.output().mode()).isEqualTo(UpgradeConfig.DEFAULT_MODE);
        assertThat(config.output().parallelism()).isEqualTo(2);
    }

    @Test
    void load_unknownKeys_ignored() throws IOException {
        Path configFile = tempDir.resolve("tgupgrade.yaml");
        Files.writeString(configFile, """
            files:
              source: terraform.tfvars
              unknown: value
            extra: true
            """);

        UpgradeConfig config = ConfigLoader.load(configFile);

        assertThat(config.files().source()).isEqualTo("terraform.tfvars");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        UpgradeConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(UpgradeConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tgupgrade.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(UpgradeConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tgupgrade.yaml");
        Files.writeString(configFile, "files: [unclosed\n  : :");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(UpgradeConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(UpgradeConfig.defaults());
    }

    @Test
    void outputConfig_nonPositiveParallelism_fallsBackToOne() {
        assertThat(new UpgradeConfig.OutputConfig("in-place", 0).parallelism()).isEqualTo(1);
    }
}
