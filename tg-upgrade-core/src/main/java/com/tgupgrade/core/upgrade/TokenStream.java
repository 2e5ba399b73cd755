package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.hcl2.Hcl2TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only HCL 2 output token sequence built during one upgrade run.
 */
public class TokenStream {

    private final List<Hcl2Token> tokens = new ArrayList<>();

    public void append(Hcl2Token token) {
        tokens.add(token);
    }

    public void append(Hcl2TokenType type, String text) {
        tokens.add(Hcl2Token.of(type, text));
    }

    public void appendAll(List<Hcl2Token> more) {
        tokens.addAll(more);
    }

    public void newline() {
        append(Hcl2TokenType.NEWLINE, "\n");
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * @return whether the next token starts a new line
     */
    public boolean atLineStart() {
        return tokens.isEmpty() || last(0).endsLine();
    }

    /**
     * @return whether the stream ends with an empty line
     */
    public boolean endsWithBlankLine() {
        return tokens.size() >= 2
            && last(0).type() == Hcl2TokenType.NEWLINE
            && last(1).endsLine();
    }

    /**
     * Terminates the current line and adds an empty one, unless the stream is empty, already
     * ends with an empty line, or the previous line opened a bracket.
     */
    public void ensureBlankLine() {
        if (tokens.isEmpty()) {
            return;
        }
        if (!atLineStart()) {
            newline();
        }
        if (endsWithBlankLine() || previousLineOpensBracket()) {
            return;
        }
        newline();
    }

    private boolean previousLineOpensBracket() {
        if (tokens.size() < 2 || last(0).type() != Hcl2TokenType.NEWLINE) {
            return false;
        }
        Hcl2TokenType type = last(1).type();
        return type == Hcl2TokenType.OBRACE || type == Hcl2TokenType.OBRACK;
    }

    public List<Hcl2Token> tokens() {
        return List.copyOf(tokens);
    }

    private Hcl2Token last(int back) {
        return tokens.get(tokens.size() - 1 - back);
    }
}
