package com.tgupgrade.core.hcl2;

import com.tgupgrade.core.model.Position;
import com.tgupgrade.parser.HclV2Lexer;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns HCL 2 text into {@link Hcl2Token}s using the generated {@link HclV2Lexer}.
 *
 * <p>Produces the token stream consumed by {@link Hcl2Formatter}, and is used by the
 * upgrade engine to re-lex HCL 1 string literals as HCL 2 template expressions.
 *
 * <p><b>Token mapping:</b>
 * <ul>
 *   <li>Keywords ({@code for}, {@code in}, {@code if}, ...) become {@code IDENT}</li>
 *   <li>A heredoc becomes its opener line, its body (if not empty) and its closing marker</li>
 *   <li>A line comment absorbs the line break that follows it</li>
 *   <li>Characters outside the language become {@code INVALID}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"${find_in_parent_folders()}\"");
 * // OQUOTE TEMPLATE_INTERP IDENT OPAREN CPAREN TEMPLATE_SEQ_END CQUOTE
 * }</pre>
 */
public final class Hcl2Lexer {

    private static final Set<Integer> KEYWORDS = Set.of(
        HclV2Lexer.FOR, HclV2Lexer.IN, HclV2Lexer.IF,
        HclV2Lexer.ELSE, HclV2Lexer.ENDIF, HclV2Lexer.ENDFOR);

    private Hcl2Lexer() {
        // Utility class
    }

    /**
     * Lexes a whole configuration file. The result always ends with an {@code EOF} token.
     *
     * @param source configuration text
     * @return tokens
     */
    public static List<Hcl2Token> lexConfig(String source) {
        HclV2Lexer lexer = newLexer(source);
        List<Hcl2Token> tokens = convert(lexer.getAllTokens());

        tokens.add(new Hcl2Token(Hcl2TokenType.EOF, "", 0,
            new Position(lexer.getLine(), lexer.getCharPositionInLine() + 1, lexer.getInputStream().index())));
        return List.copyOf(tokens);
    }

    /**
     * Lexes an expression fragment. No {@code EOF} token is appended.
     *
     * @param source expression text
     * @return tokens
     */
    public static List<Hcl2Token> lexExpression(String source) {
        return List.copyOf(convert(newLexer(source).getAllTokens()));
    }

    private static HclV2Lexer newLexer(String source) {
        HclV2Lexer lexer = new HclV2Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        return lexer;
    }

    private static List<Hcl2Token> convert(List<? extends Token> raw) {
        List<Hcl2Token> tokens = new ArrayList<>();
        int previousStop = -1;

        for (int i = 0; i < raw.size(); i++) {
            Token token = raw.get(i);
            int spaces = token.getStartIndex() - previousStop - 1;
            previousStop = token.getStopIndex();
            Position pos = positionOf(token);

            switch (token.getType()) {
                case HclV2Lexer.HEREDOC, HclV2Lexer.HEREDOC_START -> addHeredoc(tokens, token, spaces);
                case HclV2Lexer.LINE_COMMENT -> {
                    String text = token.getText();
                    if (i + 1 < raw.size() && raw.get(i + 1).getType() == HclV2Lexer.NEWLINE) {
                        i++;
                        previousStop = raw.get(i).getStopIndex();
                        text += "\n";
                    }
                    tokens.add(new Hcl2Token(Hcl2TokenType.COMMENT, text, spaces, pos));
                }
                case HclV2Lexer.BLOCK_COMMENT -> tokens.add(new Hcl2Token(Hcl2TokenType.COMMENT, token.getText(), spaces, pos));
                case HclV2Lexer.NEWLINE -> tokens.add(new Hcl2Token(Hcl2TokenType.NEWLINE, "\n", spaces, pos));
                case HclV2Lexer.ERROR_CHAR -> tokens.add(new Hcl2Token(Hcl2TokenType.INVALID, token.getText(), spaces, pos));
                default -> tokens.add(new Hcl2Token(typeOf(token.getType()), token.getText(), spaces, pos));
            }
        }
        return tokens;
    }

    private static Hcl2TokenType typeOf(int type) {
        if (KEYWORDS.contains(type)) {
            return Hcl2TokenType.IDENT;
        }
        return Hcl2TokenType.valueOf(HclV2Lexer.VOCABULARY.getSymbolicName(type));
    }

    private static void addHeredoc(List<Hcl2Token> tokens, Token token, int spaces) {
        String text = token.getText();
        int firstBreak = text.indexOf('\n');
        int line = token.getLine();
        int offset = token.getStartIndex();

        tokens.add(new Hcl2Token(Hcl2TokenType.OHEREDOC,
            text.substring(0, firstBreak + 1).replace("\r\n", "\n"), spaces, positionOf(token)));

        boolean terminated = token.getType() == HclV2Lexer.HEREDOC;
        int lastBreak = terminated ? text.lastIndexOf('\n') : text.length() - 1;
        String body = text.substring(firstBreak + 1, lastBreak + 1);
        if (!body.isEmpty()) {
            tokens.add(new Hcl2Token(Hcl2TokenType.STRING_LIT, body, 0,
                new Position(line + 1, 1, offset + firstBreak + 1)));
        }
        if (terminated) {
            int closerLine = line + (int) text.chars().filter(c -> c == '\n').count();
            tokens.add(new Hcl2Token(Hcl2TokenType.CHEREDOC, text.substring(lastBreak + 1), 0,
                new Position(closerLine, 1, offset + lastBreak + 1)));
        }
    }

    private static Position positionOf(Token token) {
        return new Position(token.getLine(), token.getCharPositionInLine() + 1, token.getStartIndex());
    }
}
