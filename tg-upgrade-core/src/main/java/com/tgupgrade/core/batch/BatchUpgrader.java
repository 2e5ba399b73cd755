package com.tgupgrade.core.batch;

import com.tgupgrade.core.exception.NotTerragruntConfigException;
import com.tgupgrade.core.exception.UpgradeException;
import com.tgupgrade.core.upgrade.ConfigUpgrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Upgrades a batch of files, optionally in parallel.
 *
 * <p>Each file is read and upgraded independently; a failure affects only its own
 * {@link FileResult}. Results are returned in input order whatever the parallelism.
 * Nothing is written: callers hand upgraded results to a renderer.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BatchUpgrader batch = new BatchUpgrader(new ConfigUpgrader(), 4);
 * for (FileResult result : batch.upgrade(paths)) {
 *     // report result.status()
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class BatchUpgrader {

    private static final Logger log = LoggerFactory.getLogger(BatchUpgrader.class);

    private final ConfigUpgrader upgrader;
    private final int parallelism;

    /**
     * @param upgrader upgrader shared by all tasks
     * @param parallelism number of files upgraded concurrently, at least 1
     */
    public BatchUpgrader(ConfigUpgrader upgrader, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.upgrader = upgrader;
        this.parallelism = parallelism;
    }

    /**
     * Upgrades every file.
     *
     * @param paths files to upgrade
     * @return one result per path, in the same order
     */
    public List<FileResult> upgrade(List<Path> paths) {
        if (parallelism == 1 || paths.size() < 2) {
            return paths.stream().map(this::upgradeFile).toList();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, paths.size()));
        try {
            List<Future<FileResult>> futures = new ArrayList<>(paths.size());
            for (Path path : paths) {
                futures.add(executor.submit(() -> upgradeFile(path)));
            }

            List<FileResult> results = new ArrayList<>(paths.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), paths.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Upgrades one file.
     *
     * @param path file to upgrade
     * @return result, never throws
     */
    public FileResult upgradeFile(Path path) {
        log.debug("Upgrading {}", path);
        try {
            byte[] input = Files.readAllBytes(path);
            byte[] output = upgrader.upgrade(input);
            return FileResult.upgraded(path, new String(output, StandardCharsets.UTF_8));
        } catch (NotTerragruntConfigException e) {
            log.warn("Skipping {}: {}", path, e.getMessage());
            return FileResult.skipped(path, e.getMessage());
        } catch (UpgradeException | IOException | IllegalStateException e) {
            log.debug("Upgrade of {} failed", path, e);
            return FileResult.failed(path, "error upgrading file " + path + ": " + e.getMessage());
        }
    }

    private static FileResult await(Future<FileResult> future, Path path) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileResult.failed(path, "interrupted while upgrading file " + path);
        } catch (ExecutionException e) {
            return FileResult.failed(path, "error upgrading file " + path + ": " + e.getCause());
        }
    }
}
