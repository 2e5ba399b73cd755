package com.tgupgrade.core.ast.antlr;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.ast.Hcl1Parser;
import com.tgupgrade.core.exception.Hcl1ParseException;
import com.tgupgrade.parser.HclV1Lexer;
import com.tgupgrade.parser.HclV1Parser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Hcl1Parser} backed by the ANTLR HCL 1 grammar.
 *
 * <p>The lexer routes comments to the hidden channel. After parsing, the full token
 * stream (hidden tokens included) is handed to {@link CommentAttacher}, and
 * {@link Hcl1AstBuilder} turns the parse tree into {@link Hcl1Ast} records.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Hcl1Ast.File file = new AntlrHcl1Parser().parse("terragrunt = {}\n");
 * }</pre>
 *
 * @since 1.0.0
 */
public class AntlrHcl1Parser implements Hcl1Parser {

    private static final Logger log = LoggerFactory.getLogger(AntlrHcl1Parser.class);

    @Override
    public Hcl1Ast.File parse(String source) throws Hcl1ParseException {
        SyntaxErrorCollector errors = new SyntaxErrorCollector();

        HclV1Lexer lexer = new HclV1Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        HclV1Parser parser = new HclV1Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        HclV1Parser.FileContext tree = parser.file();
        if (errors.hasErrors()) {
            SyntaxErrorCollector.SyntaxError error = errors.first();
            throw new Hcl1ParseException(error.message(), error.line(), error.column());
        }

        tokens.fill();
        log.debug("Parsed HCL 1 document: {} tokens", tokens.size());

        CommentAttacher comments = new CommentAttacher(tokens.getTokens());
        return new Hcl1AstBuilder(comments).build(tree);
    }
}
