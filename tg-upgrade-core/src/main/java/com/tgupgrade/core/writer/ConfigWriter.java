package com.tgupgrade.core.writer;

import com.tgupgrade.core.exception.ConfigValidationException;
import com.tgupgrade.core.hcl2.Hcl2Token;

import java.util.List;

/**
 * Turns an HCL 2 token stream into the bytes of a configuration file.
 *
 * <p>Implementations format the tokens canonically and check that the result parses
 * before returning it.
 *
 * @since 1.0.0
 */
public interface ConfigWriter {

    /**
     * Formats and validates a token stream.
     *
     * @param tokens tokens produced by the upgrade engine
     * @return UTF-8 encoded file contents
     * @throws ConfigValidationException if the formatted output is not valid HCL 2
     */
    byte[] write(List<Hcl2Token> tokens) throws ConfigValidationException;
}
