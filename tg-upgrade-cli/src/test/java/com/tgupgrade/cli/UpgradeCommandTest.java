package com.tgupgrade.cli;

import com.tgupgrade.TgUpgradeCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link UpgradeCommand}.
 */
class UpgradeCommandTest {

    private static final String TFVARS = """
        terragrunt = {
          include {
            path = "${find_in_parent_folders()}"
          }
        }
        region = "us-east-1"
        """;

    private static final String HCL = """
        include {
          path = find_in_parent_folders()
        }

        inputs = {
          region = "us-east-1"
        }
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private StringWriter usage;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        usage = new StringWriter();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 3];
        withConfig[0] = "upgrade";
        withConfig[1] = "--config";
        withConfig[2] = tempDir.resolve("tgupgrade.yaml").toString();
        System.arraycopy(args, 0, withConfig, 3, args.length);

        CommandLine commandLine = new CommandLine(new TgUpgradeCLI());
        commandLine.setErr(new PrintWriter(usage, true));
        return commandLine.execute(withConfig);
    }

    private Path module(String name, String content) throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve(name));
        return Files.writeString(dir.resolve("terraform.tfvars"), content);
    }

    @Test
    void upgrade_singleFile_replacesWithTerragruntHcl() throws IOException {
        // Given
        Path source = module("app", TFVARS);

        // When
        int exitCode = run(source.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(source).doesNotExist();
        assertThat(source.resolveSibling("terragrunt.hcl")).hasContent(HCL);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("✓ " + source + " -> " + source.resolveSibling("terragrunt.hcl"))
            .contains("Upgraded 1 file(s), skipped 0, failed 0");
    }

    @Test
    void upgrade_recursive_upgradesEveryModule() throws IOException {
        Path app = module("live/app", TFVARS);
        Path db = module("live/db", TFVARS);

        int exitCode = run("-r", "--parallel", "2", tempDir.resolve("live").toString());

        assertThat(exitCode).isZero();
        assertThat(app.resolveSibling("terragrunt.hcl")).hasContent(HCL);
        assertThat(db.resolveSibling("terragrunt.hcl")).hasContent(HCL);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Upgraded 2 file(s)");
    }

    @Test
    void upgrade_dryRun_printsWithoutWriting() throws IOException {
        Path source = module("app", TFVARS);

        int exitCode = run("--dry-run", source.toString());

        assertThat(exitCode).isZero();
        assertThat(source).exists().hasContent(TFVARS);
        assertThat(source.resolveSibling("terragrunt.hcl")).doesNotExist();
        assertThat(out.toString(StandardCharsets.UTF_8)).endsWith(HCL);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Upgraded 1 file(s)");
    }

    @Test
    void upgrade_notTerragruntConfig_skipped() throws IOException {
        Path source = module("vars", "region = \"us-east-1\"\n");

        int exitCode = run(source.toString());

        assertThat(exitCode).isZero();
        assertThat(source).exists();
        assertThat(source.resolveSibling("terragrunt.hcl")).doesNotExist();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("⚠ Skipped " + source);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("skipped 1, failed 0");
    }

    @Test
    void upgrade_invalidFile_failsWithExitCodeOne() throws IOException {
        Path good = module("good", TFVARS);
        Path bad = module("bad", "terragrunt = {\n");

        int exitCode = run("-r", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(good.resolveSibling("terragrunt.hcl")).exists();
        assertThat(bad).exists();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ error upgrading file " + bad);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Upgraded 1 file(s), skipped 0, failed 1");
    }

    @Test
    void upgrade_directoryWithoutRecursive_usageError() throws IOException {
        module("app", TFVARS);

        int exitCode = run(tempDir.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(usage.toString()).contains("is a directory (use -r to search it)");
    }

    @Test
    void upgrade_missingPath_usageError() {
        int exitCode = run(tempDir.resolve("nope").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(usage.toString()).contains("no such file or directory");
    }

    @Test
    void upgrade_gitMvWithDryRun_usageError() throws IOException {
        Path source = module("app", TFVARS);

        int exitCode = run("--git-mv", "--dry-run", source.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(source).exists();
    }

    @Test
    void upgrade_zeroParallel_usageError() throws IOException {
        Path source = module("app", TFVARS);

        assertThat(run("--parallel", "0", source.toString())).isEqualTo(2);
    }

    @Test
    void upgrade_noMatchingFiles_succeeds() throws IOException {
        Files.createDirectories(tempDir.resolve("empty"));

        int exitCode = run("-r", tempDir.resolve("empty").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("No terraform.tfvars files found");
    }

    @Test
    void upgrade_configFile_changesTargetName() throws IOException {
        Files.writeString(tempDir.resolve("tgupgrade.yaml"), """
            files:
              target: upgraded.hcl
            """);
        Path source = module("app", TFVARS);

        int exitCode = run(source.toString());

        assertThat(exitCode).isZero();
        assertThat(source.resolveSibling("upgraded.hcl")).hasContent(HCL);
    }

    @Test
    void upgrade_gitMvOutsideRepository_reportsFailure() throws IOException {
        Path source = module("app", TFVARS);

        int exitCode = run("--git-mv", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not inside a git repository");
    }
}
