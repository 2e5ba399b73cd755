package com.tgupgrade.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Pair;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class for the HCL 2 lexer.
 *
 * <p>Keeps the stack of open brackets. A closing brace pops back to the mode its opener
 * pushed, and becomes a {@code TEMPLATE_SEQ_END} when that opener was {@code ${} or
 * {@code %{}. Line breaks directly inside parentheses, brackets and interpolations go to
 * the hidden channel; inside braces and at the top level they terminate attributes.
 *
 * <p>Heredocs are read like in {@link HclV1LexerBase}, except that the line break after
 * the closing marker is left in the input, where it ends the attribute.
 */
public abstract class HclV2LexerBase extends Lexer {

    private static final char BRACE = '{';
    private static final char INTERPOLATION = '$';

    private final Deque<Character> openers = new ArrayDeque<>();

    protected HclV2LexerBase(CharStream input) {
        super(input);
    }

    /**
     * Token type of the opening heredoc marker line.
     *
     * @return generated token type constant
     */
    protected abstract int heredocStartType();

    /**
     * Token type emitted for a complete heredoc, from the opening marker to the closing one.
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

    @Override
    public void reset() {
        super.reset();
        openers.clear();
    }

    protected void openBrace() {
        openers.push(BRACE);
        pushMode(DEFAULT_MODE);
    }

    protected void openInterpolation() {
        openers.push(INTERPOLATION);
        pushMode(DEFAULT_MODE);
    }

    protected void closeBrace(int sequenceEndType) {
        while (!openers.isEmpty() && openers.peek() != BRACE && openers.peek() != INTERPOLATION) {
            openers.pop();
        }
        if (openers.isEmpty()) {
            return;
        }
        if (openers.pop() == INTERPOLATION) {
            setType(sequenceEndType);
        }
        popMode();
    }

    protected void openBracket(char bracket) {
        openers.push(bracket);
    }

    protected void closeBracket(char bracket) {
        if (!openers.isEmpty() && openers.peek() == bracket) {
            openers.pop();
        }
    }

    protected void hideNewlineInBrackets() {
        if (!openers.isEmpty() && openers.peek() != BRACE) {
            setChannel(HIDDEN);
        }
    }

    protected boolean notFollowedByBrace() {
        return _input.LA(1) != '{';
    }

    private Token readHeredoc(Token start) {
        String anchor = anchorOf(start.getText());
        CharStream input = getInputStream();

        while (input.LA(1) != CharStream.EOF) {
            String line = peekLine(input);
            int length = line.codePointCount(0, line.length());
            if (line.strip().equals(anchor)) {
                consume(input, line.endsWith("\r") ? length - 1 : length);
                return heredocToken(start, heredocType(), input);
            }
            consume(input, length);
            if (input.LA(1) == '\n') {
                consume(input, 1);
            }
        }

        // No closing marker: the opener swallows the rest and the parser rejects it.
        return heredocToken(start, start.getType(), input);
    }

    private String peekLine(CharStream input) {
        StringBuilder line = new StringBuilder();
        for (int i = 1; input.LA(i) != CharStream.EOF && input.LA(i) != '\n'; i++) {
            line.appendCodePoint(input.LA(i));
        }
        return line.toString();
    }

    private void consume(CharStream input, int count) {
        for (int i = 0; i < count; i++) {
            getInterpreter().consume(input);
        }
    }

    private Token heredocToken(Token start, int type, CharStream input) {
        CommonToken heredoc = new CommonToken(
            new Pair<>(this, input),
            type,
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
