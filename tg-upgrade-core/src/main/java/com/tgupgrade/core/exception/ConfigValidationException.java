package com.tgupgrade.core.exception;

import com.tgupgrade.core.model.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the generated HCL 2 document does not validate.
 *
 * <p>This always indicates a defect in the transformation, so the full list of
 * diagnostics is carried for reporting and no partial output is produced.
 */
public class ConfigValidationException extends UpgradeException {

    private final List<Diagnostic> diagnostics;

    public ConfigValidationException(List<Diagnostic> diagnostics) {
        super("generated configuration is invalid: " + describe(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String describe(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
            .map(Diagnostic::toString)
            .collect(Collectors.joining(", "));
    }
}
