package com.tgupgrade.core.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of upgrading one file.
 *
 * @param path source file
 * @param status outcome
 * @param content upgraded content, {@code null} unless {@link Status#UPGRADED}
 * @param message reason for a skip or failure, {@code null} on success
 */
public record FileResult(
    Path path,
    Status status,
    String content,
    String message
) {
    public FileResult {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static FileResult upgraded(Path path, String content) {
        return new FileResult(path, Status.UPGRADED, content, null);
    }

    public static FileResult skipped(Path path, String message) {
        return new FileResult(path, Status.SKIPPED, null, message);
    }

    public static FileResult failed(Path path, String message) {
        return new FileResult(path, Status.FAILED, null, message);
    }

    public enum Status {
        /** Upgraded successfully. */
        UPGRADED,
        /** Not a terragrunt configuration; left alone. */
        SKIPPED,
        /** Parse, validation, internal or I/O error. */
        FAILED
    }
}
