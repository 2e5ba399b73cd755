package com.tgupgrade.core.hcl2;

/**
 * Lexical token types of the HCL 2 native syntax.
 */
public enum Hcl2TokenType {
    IDENT,
    NUMBER_LIT,
    BOOL_LIT,

    EQUAL,
    OBRACE,
    CBRACE,
    OBRACK,
    CBRACK,
    OPAREN,
    CPAREN,
    COMMA,
    DOT,
    ELLIPSIS,
    QUESTION,
    COLON,
    FAT_ARROW,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    EQUAL_OP,
    NOT_EQUAL,
    LT,
    LTE,
    GT,
    GTE,
    AND,
    OR,
    BANG,
    /** Whitespace strip marker inside template sequences. */
    TILDE,

    /** Opening {@code "} of a quoted template. */
    OQUOTE,
    /** Closing {@code "} of a quoted template. */
    CQUOTE,
    /** Literal text inside a quoted template. */
    QUOTED_LIT,
    /** Interpolation opener inside a template. */
    TEMPLATE_INTERP,
    /** Directive opener inside a template. */
    TEMPLATE_CONTROL,
    /** Closing brace of an interpolation or directive. */
    TEMPLATE_SEQ_END,

    /** Heredoc opening marker, text includes the line break (e.g., {@code "<<EOF\n"}). */
    OHEREDOC,
    /** Heredoc body text. */
    STRING_LIT,
    /** Heredoc closing marker line, without the line break. */
    CHEREDOC,

    /** Comment; line comments include their terminating line break. */
    COMMENT,
    NEWLINE,
    INVALID,
    EOF;

    /**
     * Bracket depth change caused by a token of this type.
     *
     * @return +1 for openers, -1 for closers, 0 otherwise
     */
    public int bracketChange() {
        return switch (this) {
            case OBRACE, OBRACK, OPAREN, TEMPLATE_INTERP, TEMPLATE_CONTROL -> 1;
            case CBRACE, CBRACK, CPAREN, TEMPLATE_SEQ_END -> -1;
            default -> 0;
        };
    }
}
