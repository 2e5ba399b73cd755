package com.tgupgrade.core.renderer.impl;

import com.tgupgrade.core.renderer.OutputRenderer;
import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that moves each source file to the target name in its git repository and
 * writes the upgraded content.
 *
 * <p>Equivalent to {@code git mv terraform.tfvars terragrunt.hcl} followed by writing the
 * new content and {@code git add terragrunt.hcl}: the old path is removed from the index
 * and the new path is staged, so git records a rename. Each source file must live inside
 * a git working tree.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new GitMoveRenderer().render(output, new RenderContext("terragrunt.hcl", Map.of()));
 * }</pre>
 */
public class GitMoveRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(GitMoveRenderer.class);

    @Override
    public String getId() {
        return "git-mv";
    }

    @Override
    public void render(UpgradeOutput output, RenderContext context) {
        for (UpgradedFile file : output.files()) {
            move(file, context.targetFileName());
        }
    }

    private void move(UpgradedFile file, String targetFileName) {
        Path source = file.source().toAbsolutePath().normalize();
        Path target = file.target(targetFileName).toAbsolutePath().normalize();

        try (Repository repository = openRepository(source); Git git = new Git(repository)) {
            Path workTree = repository.getWorkTree().toPath().toRealPath();
            Path directory = source.getParent().toRealPath();
            source = directory.resolve(source.getFileName());
            target = directory.resolve(target.getFileName());

            FileSystemRenderer.writeFile(target, file.content());
            Files.deleteIfExists(source);

            git.rm().setCached(true).addFilepattern(gitPath(workTree, source)).call();
            git.add().addFilepattern(gitPath(workTree, target)).call();
            logger.debug("Moved {} to {} in {}", source, target, workTree);
        } catch (IOException | GitAPIException e) {
            throw new IllegalStateException("Failed to git mv " + source + " to " + target + ": " + e.getMessage(), e);
        }
    }

    private static Repository openRepository(Path source) throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
            .readEnvironment()
            .findGitDir(source.getParent().toFile());
        if (builder.getGitDir() == null) {
            throw new IOException("not inside a git repository: " + source);
        }
        return builder.build();
    }

    /**
     * Path relative to the working tree, with forward slashes as git expects.
     */
    private static String gitPath(Path workTree, Path file) {
        return workTree.relativize(file).toString().replace('\\', '/');
    }
}
