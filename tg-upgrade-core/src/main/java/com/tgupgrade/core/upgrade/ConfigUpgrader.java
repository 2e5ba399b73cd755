package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.ast.Hcl1Parser;
import com.tgupgrade.core.ast.antlr.AntlrHcl1Parser;
import com.tgupgrade.core.exception.UpgradeException;
import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.writer.ConfigWriter;
import com.tgupgrade.core.writer.Hcl2ConfigWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Upgrades a terragrunt 0.18 {@code terraform.tfvars} document to a terragrunt 0.19
 * {@code terragrunt.hcl} document.
 *
 * <p>Parses the HCL 1 input, restructures it with {@link DocumentRestructurer}, then formats
 * and validates the HCL 2 output with a {@link ConfigWriter}. Instances hold no per-document
 * state and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfigUpgrader upgrader = new ConfigUpgrader();
 * byte[] upgraded = upgrader.upgrade(Files.readAllBytes(path));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ConfigUpgrader {

    private static final Logger log = LoggerFactory.getLogger(ConfigUpgrader.class);

    private final Hcl1Parser parser;
    private final DocumentRestructurer restructurer;
    private final ConfigWriter writer;

    public ConfigUpgrader() {
        this(new AntlrHcl1Parser(), new Hcl2ConfigWriter());
    }

    public ConfigUpgrader(Hcl1Parser parser, ConfigWriter writer) {
        this.parser = parser;
        this.restructurer = new DocumentRestructurer();
        this.writer = writer;
    }

    /**
     * Upgrades a document.
     *
     * @param input UTF-8 encoded HCL 1 document
     * @return UTF-8 encoded HCL 2 document
     * @throws com.tgupgrade.core.exception.NotTerragruntConfigException if the document has
     *         no top-level {@code terragrunt} object
     * @throws com.tgupgrade.core.exception.Hcl1ParseException if the input is not valid HCL 1
     * @throws com.tgupgrade.core.exception.ConfigValidationException if the output does not
     *         validate
     */
    public byte[] upgrade(byte[] input) throws UpgradeException {
        Hcl1Ast.File file = parser.parse(new String(input, StandardCharsets.UTF_8));
        List<Hcl2Token> tokens = restructurer.restructure(file);
        log.debug("Restructured document into {} tokens", tokens.size());
        return writer.write(tokens);
    }

    /**
     * Upgrades a document held in a string.
     *
     * @see #upgrade(byte[])
     */
    public String upgrade(String input) throws UpgradeException {
        return new String(upgrade(input.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }
}
