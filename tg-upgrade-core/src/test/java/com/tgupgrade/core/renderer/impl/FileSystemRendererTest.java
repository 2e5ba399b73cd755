package com.tgupgrade.core.renderer.impl;

import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private FileSystemRenderer renderer;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
        context = new RenderContext("terragrunt.hcl", Map.of());
    }

    @Test
    void getId_returnsInPlace() {
        assertThat(renderer.getId()).isEqualTo("in-place");
    }

    @Test
    void render_withSingleFile_writesTargetAndDeletesSource() throws IOException {
        // Given
        Path source = tempDir.resolve("terraform.tfvars");
        Files.writeString(source, "terragrunt = {}\n");
        UpgradeOutput output = new UpgradeOutput(List.of(new UpgradedFile(source, "inputs = {}\n")));

        // When
        renderer.render(output, context);

        // Then
        Path target = tempDir.resolve("terragrunt.hcl");
        assertThat(target).exists().hasContent("inputs = {}\n");
        assertThat(source).doesNotExist();
    }

    @Test
    void render_withMultipleDirectories_writesEachNextToSource() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("live/app"));
        Path db = Files.createDirectories(tempDir.resolve("live/db"));
        Files.writeString(app.resolve("terraform.tfvars"), "a");
        Files.writeString(db.resolve("terraform.tfvars"), "b");
        UpgradeOutput output = new UpgradeOutput(List.of(
            new UpgradedFile(app.resolve("terraform.tfvars"), "app\n"),
            new UpgradedFile(db.resolve("terraform.tfvars"), "db\n")));

        renderer.render(output, context);

        assertThat(app.resolve("terragrunt.hcl")).hasContent("app\n");
        assertThat(db.resolve("terragrunt.hcl")).hasContent("db\n");
        assertThat(app.resolve("terraform.tfvars")).doesNotExist();
        assertThat(db.resolve("terraform.tfvars")).doesNotExist();
    }

    @Test
    void render_existingTarget_overwritten() throws IOException {
        Path source = tempDir.resolve("terraform.tfvars");
        Files.writeString(source, "terragrunt = {}\n");
        Files.writeString(tempDir.resolve("terragrunt.hcl"), "stale\n");

        renderer.render(new UpgradeOutput(List.of(new UpgradedFile(source, "fresh\n"))), context);

        assertThat(tempDir.resolve("terragrunt.hcl")).hasContent("fresh\n");
    }

    @Test
    void render_targetSameAsSource_keepsFile() throws IOException {
        Path source = tempDir.resolve("terragrunt.hcl");
        Files.writeString(source, "old\n");

        renderer.render(new UpgradeOutput(List.of(new UpgradedFile(source, "new\n"))), context);

        assertThat(source).exists().hasContent("new\n");
    }

    @Test
    void render_missingDirectory_throwsIllegalState() {
        Path source = tempDir.resolve("missing/terraform.tfvars");
        UpgradeOutput output = new UpgradeOutput(List.of(new UpgradedFile(source, "x\n")));

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("Failed to write file: ");
    }
}
