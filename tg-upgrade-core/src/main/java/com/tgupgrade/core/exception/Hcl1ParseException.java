package com.tgupgrade.core.exception;

/**
 * Thrown when the input is not valid HCL 1 syntax.
 */
public class Hcl1ParseException extends UpgradeException {

    private final int line;
    private final int column;

    public Hcl1ParseException(String message, int line, int column) {
        super("At " + line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
