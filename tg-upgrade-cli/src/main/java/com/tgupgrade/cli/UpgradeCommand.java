package com.tgupgrade.cli;

import com.tgupgrade.TgUpgradeCLI;
import com.tgupgrade.core.batch.BatchUpgrader;
import com.tgupgrade.core.batch.FileResult;
import com.tgupgrade.core.config.ConfigLoader;
import com.tgupgrade.core.config.UpgradeConfig;
import com.tgupgrade.core.renderer.OutputRenderer;
import com.tgupgrade.core.renderer.RenderContext;
import com.tgupgrade.core.renderer.UpgradeOutput;
import com.tgupgrade.core.renderer.UpgradedFile;
import com.tgupgrade.core.upgrade.ConfigUpgrader;
import com.tgupgrade.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to upgrade terraform.tfvars files to terragrunt.hcl.
 *
 * <p>Steps:
 * <ol>
 *   <li>Collect the files to upgrade from the arguments (walking directories with {@code -r})</li>
 *   <li>Upgrade each file; documents without a {@code terragrunt} object are skipped</li>
 *   <li>Hand the upgraded files to the renderer selected by the output mode</li>
 * </ol>
 *
 * <p>Exits with 0 when every file was upgraded or skipped, 1 when any file failed and 2 on
 * usage errors.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Upgrade one file in place
 * tgupgrade upgrade live/app/terraform.tfvars
 *
 * # Upgrade a tree with git mv, four files at a time
 * tgupgrade upgrade -r --git-mv --parallel 4 live/
 *
 * # Print the upgraded files instead of writing them
 * tgupgrade upgrade -r --dry-run live/
 * }</pre>
 */
@Command(
    name = "upgrade",
    description = "Upgrade terraform.tfvars files to terragrunt.hcl",
    mixinStandardHelpOptions = true
)
public class UpgradeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UpgradeCommand.class);

    @ParentCommand
    private TgUpgradeCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "1..*",
        paramLabel = "PATH",
        description = "terraform.tfvars files, or directories to search with -r"
    )
    private List<Path> paths;

    @Option(
        names = {"-r", "--recursive"},
        description = "Search directories for terraform.tfvars files"
    )
    private boolean recursive;

    @Option(
        names = {"--git-mv"},
        description = "Update files in place and \"git mv terraform.tfvars terragrunt.hcl\""
    )
    private boolean gitMv;

    @Option(
        names = {"--dry-run"},
        description = "Do not update any files, just print the upgraded files to stdout"
    )
    private boolean dryRun;

    @Option(
        names = {"--parallel"},
        paramLabel = "N",
        description = "Number of files to upgrade concurrently (overrides config)"
    )
    private Integer parallel;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tgupgrade.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    private boolean quiet;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
            quiet = parent.isQuiet();
        }
        if (gitMv && dryRun) {
            throw new ParameterException(spec.commandLine(), "--git-mv and --dry-run cannot be combined");
        }
        if (parallel != null && parallel < 1) {
            throw new ParameterException(spec.commandLine(), "--parallel must be at least 1");
        }

        UpgradeConfig config = ConfigLoader.load(configPath);
        String sourceName = config.files().source();
        List<Path> files = collectFiles(sourceName);

        // In dry-run mode stdout carries the upgraded files, so progress goes to stderr
        PrintStream status = dryRun ? System.err : System.out;
        if (files.isEmpty()) {
            log.debug("Nothing to upgrade under {}", paths);
            status.println("No " + sourceName + " files found");
            return 0;
        }

        try {
            OutputRenderer renderer = findRenderer(outputMode(config));
            RenderContext context = new RenderContext(config.files().target(), Map.of());
            int workers = parallel != null ? parallel : config.output().parallelism();
            log.debug("Upgrading {} files with {} workers, renderer {}", files.size(), workers, renderer.getId());

            List<FileResult> results = new BatchUpgrader(new ConfigUpgrader(), workers).upgrade(files);

            int upgraded = 0;
            int skipped = 0;
            int failed = 0;
            for (FileResult result : results) {
                switch (result.status()) {
                    case UPGRADED -> {
                        if (render(renderer, result, context, status)) {
                            upgraded++;
                        } else {
                            failed++;
                        }
                    }
                    case SKIPPED -> {
                        skipped++;
                        System.err.println("⚠ Skipped " + result.path() + ": " + result.message());
                    }
                    case FAILED -> {
                        failed++;
                        System.err.println("✗ " + result.message());
                    }
                }
            }

            if (quiet && failed == 0) {
                return 0;
            }
            status.println();
            status.println((failed == 0 ? "✓ " : "✗ ") + "Upgraded " + upgraded + " file(s), skipped "
                + skipped + ", failed " + failed);
            return failed == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Upgrade failed", e);
            System.err.println("✗ Upgrade failed: " + e.getMessage());
            return 1;
        }
    }

    private boolean render(OutputRenderer renderer, FileResult result, RenderContext context, PrintStream status) {
        UpgradedFile file = new UpgradedFile(result.path(), result.content());
        try {
            renderer.render(new UpgradeOutput(List.of(file)), context);
            if (!dryRun && !quiet) {
                status.println("✓ " + file.source() + " -> " + file.target(context.targetFileName()));
            }
            return true;
        } catch (IllegalStateException e) {
            log.debug("Rendering {} failed", file.source(), e);
            System.err.println("✗ " + e.getMessage());
            return false;
        }
    }

    /**
     * Expands the arguments into the list of files to upgrade.
     */
    private List<Path> collectFiles(String sourceName) {
        for (Path path : paths) {
            if (!Files.exists(path)) {
                throw new ParameterException(spec.commandLine(), "no such file or directory: " + path);
            }
            if (Files.isDirectory(path) && !recursive) {
                throw new ParameterException(spec.commandLine(), path + " is a directory (use -r to search it)");
            }
        }

        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try {
                    files.addAll(FileUtils.findFilesNamed(path, sourceName));
                } catch (IOException e) {
                    throw new ParameterException(spec.commandLine(), "cannot search " + path + ": " + e.getMessage(), e);
                }
            } else if (path.getFileName().toString().equals(sourceName)) {
                files.add(path);
            } else {
                log.warn("Ignoring file {}: not named {}", path, sourceName);
            }
        }
        return files;
    }

    private String outputMode(UpgradeConfig config) {
        if (dryRun) {
            return "dry-run";
        }
        if (gitMv) {
            return "git-mv";
        }
        return config.output().mode();
    }

    private static OutputRenderer findRenderer(String mode) {
        log.debug("Discovering output renderers via ServiceLoader");
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(mode)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Unknown output mode: " + mode + " (expected in-place, dry-run or git-mv)");
    }
}
