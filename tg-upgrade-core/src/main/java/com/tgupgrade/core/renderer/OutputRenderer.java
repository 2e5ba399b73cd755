package com.tgupgrade.core.renderer;

/**
 * Writes upgraded files to their destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}: {@code in-place} writes the new file and removes the old one,
 * {@code git-mv} does the same as a git move, {@code dry-run} prints to the console.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "in-place";
 *     }
 *
 *     @Override
 *     public void render(UpgradeOutput output, RenderContext context) {
 *         for (UpgradedFile file : output.files()) {
 *             Files.writeString(file.target(context.targetFileName()), file.content());
 *             Files.delete(file.source());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.tgupgrade.core.renderer.OutputRenderer}
 *
 * @see UpgradeOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the upgraded files.
     *
     * @param output the upgraded files
     * @param context rendering context with the target file name and settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(UpgradeOutput output, RenderContext context);
}
