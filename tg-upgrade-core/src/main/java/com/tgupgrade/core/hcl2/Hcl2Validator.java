package com.tgupgrade.core.hcl2;

import com.tgupgrade.core.model.Diagnostic;
import com.tgupgrade.parser.HclV2Lexer;
import com.tgupgrade.parser.HclV2Parser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.List;

/**
 * Syntax check for HCL 2 configuration files, built on the generated {@link HclV2Parser}.
 *
 * <p>Covers the body structure (attributes and labeled blocks, each terminated by a line
 * break) and the expression grammar: literals, quoted templates with interpolations and
 * directives, heredocs, traversals and splats, function calls, tuples, objects, tuple and
 * object {@code for} expressions, unary, binary and conditional operators. Values are not
 * evaluated.
 *
 * <p>Only the first syntax error is reported; later ones usually follow from the parser's
 * recovery.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Diagnostic> diagnostics = new Hcl2Validator().validate(Files.readString(path));
 * if (diagnostics.isEmpty()) {
 *     // well-formed
 * }
 * }</pre>
 */
public class Hcl2Validator {

    /**
     * Validates a configuration file.
     *
     * @param source configuration text
     * @return diagnostics, empty if the text is well-formed
     */
    public List<Diagnostic> validate(String source) {
        HclV2Lexer lexer = new HclV2Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();

        HclV2Parser parser = new HclV2Parser(new CommonTokenStream(lexer));
        SyntaxDiagnosticListener listener = new SyntaxDiagnosticListener();
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        parser.configFile();
        return listener.diagnostics();
    }
}
