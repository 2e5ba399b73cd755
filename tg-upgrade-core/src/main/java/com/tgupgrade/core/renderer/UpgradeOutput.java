package com.tgupgrade.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of upgraded files to be rendered.
 *
 * @param files list of upgraded files
 */
public record UpgradeOutput(
    List<UpgradedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public UpgradeOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
