package com.tgupgrade.core.exception;

/**
 * Base class for failures reported while upgrading a single configuration document.
 *
 * <p>All subclasses are fatal for the document being upgraded but never for a batch:
 * callers decide whether to skip, warn or abort.
 */
public class UpgradeException extends Exception {

    public UpgradeException(String message) {
        super(message);
    }

    public UpgradeException(String message, Throwable cause) {
        super(message, cause);
    }
}
