package com.tgupgrade.core.renderer.impl;

import com.tgupgrade.core.renderer.OutputRenderer;
import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that prints upgraded files to the console and leaves the file system untouched.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors in headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - Print a header naming each file ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * UpgradeOutput output = new UpgradeOutput(List.of(
 *     new UpgradedFile(Paths.get("live/app/terraform.tfvars"), "inputs = {...}")
 * ));
 *
 * new ConsoleRenderer().render(output, new RenderContext("terragrunt.hcl", Map.of()));
 * // # live/app/terraform.tfvars -> live/app/terragrunt.hcl
 * // inputs = {...}
 * }</pre>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    public String getId() {
        return "dry-run";
    }

    @Override
    public void render(UpgradeOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));

        logger.debug("Printing {} upgraded files", output.files().size());

        for (int i = 0; i < output.files().size(); i++) {
            UpgradedFile file = output.files().get(i);
            if (i > 0) {
                System.out.println();
            }
            if (showHeaders) {
                printHeader(file, context.targetFileName(), useColors);
            }
            System.out.print(file.content());
        }
        System.out.flush();
    }

    private void printHeader(UpgradedFile file, String targetFileName, boolean useColors) {
        String prefix = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String suffix = useColors ? ANSI_RESET : "";
        System.out.println(prefix + "# " + file.source() + " -> " + file.target(targetFileName) + suffix);
    }
}
