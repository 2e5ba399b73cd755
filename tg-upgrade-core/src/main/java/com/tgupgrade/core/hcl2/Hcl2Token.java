package com.tgupgrade.core.hcl2;

import com.tgupgrade.core.model.Position;

import java.util.Objects;

/**
 * A token of an HCL 2 document.
 *
 * <p>Tokens built by the upgrade engine carry no source position and no spacing; tokens
 * produced by {@link Hcl2Lexer} record both. Inside quoted templates the formatter keeps
 * {@code spacesBefore} as written.
 *
 * @param type token type
 * @param text token text
 * @param spacesBefore number of spaces that preceded the token on its line
 * @param pos token position, {@link Position#NONE} for synthesized tokens
 */
public record Hcl2Token(
    Hcl2TokenType type,
    String text,
    int spacesBefore,
    Position pos
) {
    /**
     * Compact constructor with validation.
     */
    public Hcl2Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (pos == null) {
            pos = Position.NONE;
        }
    }

    /**
     * Creates a synthesized token.
     *
     * @param type token type
     * @param text token text
     * @return token without position or spacing
     */
    public static Hcl2Token of(Hcl2TokenType type, String text) {
        return new Hcl2Token(type, text, 0, Position.NONE);
    }

    /**
     * Returns true for comments that end their line ({@code #} and {@code //} comments).
     *
     * @return true if this is a comment whose text ends with a line break
     */
    public boolean isLineComment() {
        return type == Hcl2TokenType.COMMENT && text.endsWith("\n");
    }

    /**
     * Returns true if this token terminates the current line.
     *
     * @return true for newlines and line comments
     */
    public boolean endsLine() {
        return type == Hcl2TokenType.NEWLINE || isLineComment();
    }
}
