package com.tgupgrade.core.exception;

/**
 * Thrown when a document has no top-level {@code terragrunt} object.
 *
 * <p>Such files are regular terraform variable files, not terragrunt configurations.
 * Batch callers skip them with a warning.
 */
public class NotTerragruntConfigException extends UpgradeException {

    public NotTerragruntConfigException() {
        super("not a terragrunt config: no top-level terragrunt object found");
    }

    public NotTerragruntConfigException(String message) {
        super(message);
    }
}
