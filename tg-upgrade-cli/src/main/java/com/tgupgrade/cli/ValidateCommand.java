package com.tgupgrade.cli;

import com.tgupgrade.TgUpgradeCLI;
import com.tgupgrade.core.hcl2.Hcl2Validator;
import com.tgupgrade.core.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check terragrunt.hcl files for HCL 2 syntax errors.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tgupgrade validate live/app/terragrunt.hcl
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check terragrunt.hcl files for HCL 2 syntax errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private TgUpgradeCLI parent;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to validate")
    private List<Path> files;

    @Override
    public Integer call() {
        boolean quiet = false;
        if (parent != null) {
            parent.configureLogging();
            quiet = parent.isQuiet();
        }

        Hcl2Validator validator = new Hcl2Validator();
        int invalid = 0;
        for (Path file : files) {
            try {
                List<Diagnostic> diagnostics = validator.validate(Files.readString(file, StandardCharsets.UTF_8));
                if (diagnostics.isEmpty()) {
                    if (!quiet) {
                        System.out.println("✓ " + file);
                    }
                    continue;
                }
                invalid++;
                for (Diagnostic diagnostic : diagnostics) {
                    System.err.println("✗ " + file + ":" + diagnostic);
                }
            } catch (IOException e) {
                invalid++;
                log.error("Validation of {} failed", file, e);
                System.err.println("✗ Cannot read " + file + ": " + e.getMessage());
            }
        }
        return invalid == 0 ? 0 : 1;
    }
}
