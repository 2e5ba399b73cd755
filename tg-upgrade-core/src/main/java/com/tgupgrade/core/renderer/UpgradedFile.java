package com.tgupgrade.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An upgraded configuration file to be rendered.
 *
 * @param source path of the original {@code terraform.tfvars}
 * @param content upgraded {@code terragrunt.hcl} content
 */
public record UpgradedFile(
    Path source,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public UpgradedFile {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Resolves the path of the upgraded file, next to the source.
     *
     * @param targetFileName name of the upgraded file
     * @return target path
     */
    public Path target(String targetFileName) {
        return source.resolveSibling(targetFileName);
    }
}
