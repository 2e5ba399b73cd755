package com.tgupgrade;

import ch.qos.logback.classic.Level;
import com.tgupgrade.cli.UpgradeCommand;
import com.tgupgrade.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for tg-upgrade.
 *
 * <p>Upgrades terragrunt configurations from terragrunt &lt;= 0.18 ({@code terraform.tfvars},
 * HCL 1) to terragrunt &gt;= 0.19 ({@code terragrunt.hcl}, HCL 2).
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code upgrade} - Upgrade terraform.tfvars files</li>
 *   <li>{@code validate} - Check terragrunt.hcl files for syntax errors</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Upgrade one file in place
 * tgupgrade upgrade live/prod/app/terraform.tfvars
 *
 * # Upgrade a whole tree, recording the renames in git
 * tgupgrade upgrade -r --git-mv live/
 *
 * # Preview without touching anything
 * tgupgrade -q upgrade -r --dry-run live/
 * }</pre>
 */
@Command(
    name = "tgupgrade",
    mixinStandardHelpOptions = true,
    version = "tg-upgrade 1.0.0-SNAPSHOT",
    description = "Upgrades terragrunt configs from terragrunt <= v0.18 to >= v0.19",
    subcommands = {
        UpgradeCommand.class,
        ValidateCommand.class
    }
)
public class TgUpgradeCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("tg-upgrade - terragrunt 0.18 to 0.19 configuration upgrader");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'tgupgrade --help' to see available commands");
        System.out.println("Use 'tgupgrade <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Subcommands call this before doing
     * any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TgUpgradeCLI()).execute(args);
        System.exit(exitCode);
    }
}
