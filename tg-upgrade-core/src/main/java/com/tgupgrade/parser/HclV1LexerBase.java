package com.tgupgrade.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.Pair;

/**
 * Base class for the HCL 1 lexer.
 *
 * <p>Reads heredoc bodies. The generated lexer matches only the opening marker line
 * ({@code <<EOF} or {@code <<-EOF} plus the line break); this class then consumes raw
 * lines until one consists of optional whitespace followed by the marker, and emits the
 * whole literal as a single heredoc token.
 */
public abstract class HclV1LexerBase extends Lexer {

    protected HclV1LexerBase(CharStream input) {
        super(input);
    }

    /**
     * Token type of the opening heredoc marker line.
     *
     * @return generated token type constant
     */
    protected abstract int heredocStartType();

    /**
     * Token type emitted for a complete heredoc literal.
     *
     * @return generated token type constant
     */
    protected abstract int heredocType();

    @Override
    public Token nextToken() {
        Token token = super.nextToken();
        if (token.getType() == heredocStartType()) {
            return readHeredoc(token);
        }
        return token;
    }

    private Token readHeredoc(Token start) {
        String anchor = anchorOf(start.getText());
        CharStream input = getInputStream();

        boolean terminated = false;
        while (!terminated && input.LA(1) != CharStream.EOF) {
            int lineStart = input.index();
            while (input.LA(1) != CharStream.EOF && input.LA(1) != '\n') {
                getInterpreter().consume(input);
            }
            String line = input.getText(Interval.of(lineStart, input.index() - 1));
            if (input.LA(1) == '\n') {
                getInterpreter().consume(input);
            }
            terminated = line.strip().equals(anchor);
        }

        if (!terminated) {
            // Hand back the opening line alone; the parser rejects it as unexpected.
            return start;
        }

        CommonToken heredoc = new CommonToken(
            new Pair<>(this, input),
            heredocType(),
            Token.DEFAULT_CHANNEL,
            start.getStartIndex(),
            input.index() - 1);
        heredoc.setLine(start.getLine());
        heredoc.setCharPositionInLine(start.getCharPositionInLine());
        return heredoc;
    }

    private static String anchorOf(String markerLine) {
        String anchor = markerLine.substring(2).strip();
        return anchor.startsWith("-") ? anchor.substring(1) : anchor;
    }
}
