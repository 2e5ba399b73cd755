package com.tgupgrade.core.writer;

import com.tgupgrade.core.exception.ConfigValidationException;
import com.tgupgrade.core.hcl2.Hcl2Formatter;
import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.hcl2.Hcl2Validator;
import com.tgupgrade.core.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link ConfigWriter} that formats with {@link Hcl2Formatter} and re-parses the result
 * with {@link Hcl2Validator}.
 *
 * @since 1.0.0
 */
public class Hcl2ConfigWriter implements ConfigWriter {

    private static final Logger log = LoggerFactory.getLogger(Hcl2ConfigWriter.class);

    private final Hcl2Formatter formatter;
    private final Hcl2Validator validator;

    public Hcl2ConfigWriter() {
        this(new Hcl2Formatter(), new Hcl2Validator());
    }

    public Hcl2ConfigWriter(Hcl2Formatter formatter, Hcl2Validator validator) {
        this.formatter = formatter;
        this.validator = validator;
    }

    @Override
    public byte[] write(List<Hcl2Token> tokens) throws ConfigValidationException {
        String formatted = formatter.format(tokens);

        List<Diagnostic> errors = validator.validate(formatted).stream()
            .filter(Diagnostic::isError)
            .toList();
        if (!errors.isEmpty()) {
            log.debug("Formatted output failed validation:\n{}", formatted);
            throw new ConfigValidationException(errors);
        }

        return formatted.getBytes(StandardCharsets.UTF_8);
    }
}
