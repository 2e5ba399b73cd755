package com.tgupgrade.core.model;

import java.util.Objects;

/**
 * A problem reported while validating a generated HCL 2 document.
 *
 * @param severity how serious the problem is
 * @param summary short description (e.g., "Missing newline after argument")
 * @param detail longer explanation, may be empty
 * @param line 1-based line of the offending token
 * @param column 1-based column of the offending token
 */
public record Diagnostic(
    Severity severity,
    String summary,
    String detail,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        if (detail == null) {
            detail = "";
        }
    }

    /**
     * Creates an error diagnostic.
     *
     * @param summary short description
     * @param detail longer explanation
     * @param position location of the problem
     * @return error diagnostic
     */
    public static Diagnostic error(String summary, String detail, Position position) {
        return new Diagnostic(Severity.ERROR, summary, detail, position.line(), position.column());
    }

    /**
     * Returns true if this diagnostic is an error.
     *
     * @return true for {@link Severity#ERROR}
     */
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String location = line + ":" + column;
        return detail.isEmpty()
            ? location + ": " + summary
            : location + ": " + summary + "; " + detail;
    }

    /**
     * Diagnostic severity.
     */
    public enum Severity {
        ERROR,
        WARNING
    }
}
