package com.tgupgrade.core.renderer.impl;

import com.tgupgrade.core.renderer.OutputRenderer;
import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that replaces each source file with its upgraded version.
 *
 * <p>The upgraded content is written next to the source under the target file name
 * (overwriting an existing file), then the source is deleted.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * UpgradeOutput output = new UpgradeOutput(List.of(
 *     new UpgradedFile(Paths.get("live/app/terraform.tfvars"), upgraded)
 * ));
 *
 * new FileSystemRenderer().render(output, new RenderContext("terragrunt.hcl", Map.of()));
 * // Creates: live/app/terragrunt.hcl
 * // Deletes: live/app/terraform.tfvars
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "in-place";
    }

    @Override
    public void render(UpgradeOutput output, RenderContext context) {
        logger.debug("Writing {} upgraded files", output.files().size());

        for (UpgradedFile file : output.files()) {
            Path target = file.target(context.targetFileName());
            writeFile(target, file.content());
            deleteSource(file.source(), target);
        }
    }

    /**
     * Writes upgraded content.
     *
     * @param target file to write
     * @param content upgraded content
     */
    static void writeFile(Path target, String content) {
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
            logger.debug("Wrote file: {} ({} bytes)", target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    private static void deleteSource(Path source, Path target) {
        if (source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
            return;
        }
        try {
            Files.deleteIfExists(source);
            logger.debug("Deleted file: {}", source);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete file: " + source, e);
        }
    }
}
