package com.tgupgrade.core.renderer.impl;

import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
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
 * Tests for {@link GitMoveRenderer}.
 */
class GitMoveRendererTest {

    @TempDir
    Path tempDir;

    private GitMoveRenderer renderer;
    private RenderContext context;

    @BeforeEach
    void setUp() {
        renderer = new GitMoveRenderer();
        context = new RenderContext("terragrunt.hcl", Map.of());
    }

    @Test
    void getId_returnsGitMv() {
        assertThat(renderer.getId()).isEqualTo("git-mv");
    }

    @Test
    void render_committedSource_stagesRename() throws IOException, GitAPIException {
        // Given
        Path module = Files.createDirectories(tempDir.resolve("live/app"));
        Path source = module.resolve("terraform.tfvars");
        Files.writeString(source, "terragrunt = {}\n");
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            git.add().addFilepattern("live/app/terraform.tfvars").call();
            git.commit().setMessage("initial").setAuthor("test", "test@example.com")
                .setCommitter("test", "test@example.com").setSign(false).call();

            // When
            renderer.render(new UpgradeOutput(List.of(new UpgradedFile(source, "inputs = {}\n"))), context);

            // Then
            Status status = git.status().call();
            assertThat(status.getAdded()).containsExactly("live/app/terragrunt.hcl");
            assertThat(status.getRemoved()).containsExactly("live/app/terraform.tfvars");
        }
        assertThat(module.resolve("terragrunt.hcl")).hasContent("inputs = {}\n");
        assertThat(source).doesNotExist();
    }

    @Test
    void render_outsideRepository_throwsIllegalState() throws IOException {
        Path source = tempDir.resolve("terraform.tfvars");
        Files.writeString(source, "terragrunt = {}\n");
        UpgradeOutput output = new UpgradeOutput(List.of(new UpgradedFile(source, "inputs = {}\n")));

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not inside a git repository");
        assertThat(source).exists();
    }
}
