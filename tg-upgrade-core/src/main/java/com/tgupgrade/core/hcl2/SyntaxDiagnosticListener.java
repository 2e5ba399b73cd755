package com.tgupgrade.core.hcl2;

import com.tgupgrade.core.model.Diagnostic;
import com.tgupgrade.parser.HclV2Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Error listener that turns the first syntax error into a {@link Diagnostic}.
 *
 * <p>ANTLR messages name token types ("missing NEWLINE at 'b'"); the diagnostic instead
 * describes the problem in configuration terms, chosen from the rule the parser was in
 * and the tokens it expected.
 */
class SyntaxDiagnosticListener extends BaseErrorListener {

    private static final Problem INVALID_CHARACTER = new Problem(
        "Invalid character", "This character is not used within the language.");
    private static final Problem UNTERMINATED_HEREDOC = new Problem(
        "Unterminated template string", "No closing marker was found for the heredoc.");
    private static final Problem UNTERMINATED_STRING = new Problem(
        "Unterminated template string", "No closing marker was found for the string.");
    private static final Problem EXTRA_AFTER_INTERPOLATION = new Problem(
        "Extra characters after interpolation expression",
        "Expected a closing brace to end the interpolation expression.");
    private static final Problem INVALID_DIRECTIVE = new Problem(
        "Invalid template directive",
        "A template directive keyword (\"if\", \"for\", etc) is expected at the beginning of a %{ sequence.");
    private static final Problem ARGUMENT_OR_BLOCK_REQUIRED = new Problem(
        "Argument or block definition required", "An argument or block definition is required here.");
    private static final Problem MISSING_NEWLINE_AFTER_ARGUMENT = new Problem(
        "Missing newline after argument", "An argument definition must end with a newline.");
    private static final Problem MISSING_NEWLINE_AFTER_BLOCK = new Problem(
        "Missing newline after block definition", "A block definition must end with a newline.");
    private static final Problem UNCLOSED_BLOCK = new Problem(
        "Unclosed configuration block",
        "There is no closing brace for this block before the end of the file.");
    private static final Problem INVALID_BLOCK = new Problem(
        "Invalid block definition",
        "Either a quoted string block label or an opening brace (\"{\") is expected here.");
    private static final Problem INVALID_SINGLE_ARGUMENT_BLOCK = new Problem(
        "Invalid single-argument block definition",
        "A single-line block definition must contain a single argument definition.");
    private static final Problem MISSING_ITEM_SEPARATOR = new Problem(
        "Missing item separator", "Expected a comma to mark the beginning of the next item.");
    private static final Problem MISSING_KEY_VALUE_SEPARATOR = new Problem(
        "Missing key/value separator",
        "Expected an equals sign (\"=\") to mark the beginning of the attribute value.");
    private static final Problem MISSING_ATTRIBUTE_SEPARATOR = new Problem(
        "Missing attribute separator",
        "Expected a newline or comma to mark the beginning of the next attribute.");
    private static final Problem MISSING_CLOSING_BRACE = new Problem(
        "Missing closing brace", "The object constructor has no closing brace.");
    private static final Problem MISSING_ARGUMENT_SEPARATOR = new Problem(
        "Missing argument separator",
        "A comma is required to separate each function argument from the next.");
    private static final Problem MISSING_CLOSE_BRACKET = new Problem(
        "Missing close bracket on index", "The index operator must end with a closing bracket (\"]\").");
    private static final Problem INVALID_ATTRIBUTE_NAME = new Problem(
        "Invalid attribute name", "An attribute name is required after a dot.");
    private static final Problem INVALID_FOR = new Problem(
        "Invalid 'for' expression",
        "A 'for' expression has the form [for x in coll : expr] or {for k, v in coll : key => value}.");
    private static final Problem UNBALANCED_PARENTHESES = new Problem(
        "Unbalanced parentheses", "Expected a closing parenthesis to terminate the expression.");
    private static final Problem MISSING_FALSE_EXPRESSION = new Problem(
        "Missing false expression in conditional",
        "The conditional operator (...?...:...) requires a false expression, delimited by a colon.");
    private static final Problem INVALID_EXPRESSION = new Problem(
        "Invalid expression", "Expected the start of an expression, but found an invalid expression token.");

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        if (!diagnostics.isEmpty()) {
            return;
        }
        Problem problem = describe((Parser) recognizer, (Token) offendingSymbol);
        diagnostics.add(new Diagnostic(
            Diagnostic.Severity.ERROR, problem.summary(), problem.detail(), line, charPositionInLine + 1));
    }

    List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    private static Problem describe(Parser parser, Token offending) {
        if (offending.getType() == HclV2Parser.ERROR_CHAR) {
            return INVALID_CHARACTER;
        }
        if (offending.getType() == HclV2Parser.HEREDOC_START) {
            return UNTERMINATED_HEREDOC;
        }

        IntervalSet expected = parser.getExpectedTokens();
        boolean atEof = offending.getType() == Token.EOF;

        return switch (parser.getContext().getRuleIndex()) {
            case HclV2Parser.RULE_configFile, HclV2Parser.RULE_body, HclV2Parser.RULE_bodyItem ->
                ARGUMENT_OR_BLOCK_REQUIRED;
            case HclV2Parser.RULE_attribute ->
                expected.contains(HclV2Parser.NEWLINE) ? MISSING_NEWLINE_AFTER_ARGUMENT : INVALID_EXPRESSION;
            case HclV2Parser.RULE_block -> {
                if (atEof) {
                    yield UNCLOSED_BLOCK;
                }
                if (expected.contains(HclV2Parser.OBRACE)) {
                    yield INVALID_BLOCK;
                }
                yield expected.contains(Token.EOF) ? MISSING_NEWLINE_AFTER_BLOCK : INVALID_SINGLE_ARGUMENT_BLOCK;
            }
            case HclV2Parser.RULE_blockLabel -> INVALID_BLOCK;
            case HclV2Parser.RULE_oneLineAttribute -> INVALID_SINGLE_ARGUMENT_BLOCK;
            case HclV2Parser.RULE_tupleCons -> MISSING_ITEM_SEPARATOR;
            case HclV2Parser.RULE_objectCons, HclV2Parser.RULE_objectSeparator ->
                atEof ? MISSING_CLOSING_BRACE : MISSING_ATTRIBUTE_SEPARATOR;
            case HclV2Parser.RULE_objectElem ->
                expected.contains(HclV2Parser.EQUAL) || expected.contains(HclV2Parser.COLON)
                    ? MISSING_KEY_VALUE_SEPARATOR
                    : INVALID_EXPRESSION;
            case HclV2Parser.RULE_functionCall, HclV2Parser.RULE_arguments -> MISSING_ARGUMENT_SEPARATOR;
            case HclV2Parser.RULE_indexOp -> MISSING_CLOSE_BRACKET;
            case HclV2Parser.RULE_attrAccess -> INVALID_ATTRIBUTE_NAME;
            case HclV2Parser.RULE_forTupleExpr, HclV2Parser.RULE_forObjectExpr,
                 HclV2Parser.RULE_forIntro, HclV2Parser.RULE_forCond -> INVALID_FOR;
            case HclV2Parser.RULE_quotedTemplate -> UNTERMINATED_STRING;
            case HclV2Parser.RULE_templatePart ->
                expected.contains(HclV2Parser.TEMPLATE_SEQ_END) ? EXTRA_AFTER_INTERPOLATION : UNTERMINATED_STRING;
            case HclV2Parser.RULE_directive -> INVALID_DIRECTIVE;
            case HclV2Parser.RULE_exprTerm ->
                expected.contains(HclV2Parser.CPAREN) ? UNBALANCED_PARENTHESES : INVALID_EXPRESSION;
            case HclV2Parser.RULE_expression ->
                expected.contains(HclV2Parser.COLON) ? MISSING_FALSE_EXPRESSION : INVALID_EXPRESSION;
            default -> INVALID_EXPRESSION;
        };
    }

    private record Problem(String summary, String detail) {}
}
