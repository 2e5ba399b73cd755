package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.ast.HeredocDecoder;
import com.tgupgrade.core.hcl2.Hcl2Lexer;
import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.hcl2.Hcl2TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts one HCL 1 scalar into HCL 2 tokens.
 *
 * <p><b>Conversions:</b>
 * <ul>
 *   <li>numbers, floats and booleans keep their text; hexadecimal integers become decimal
 *       and a leading minus becomes a unary operator</li>
 *   <li>heredocs are decoded and re-emitted with a plain marker, so {@code <<-EOF} bodies
 *       come out unindented</li>
 *   <li>strings are re-lexed as HCL 2 templates; a string that is a single interpolation
 *       ({@code "${expr}"}) becomes the bare expression</li>
 *   <li>the terragrunt helpers {@code get_tfvars_dir()} and {@code get_parent_tfvars_dir()}
 *       are renamed to their 0.19 names</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Hcl2Token> tokens = new LiteralRewriter().rewrite(literal);
 * }</pre>
 *
 * @since 1.0.0
 */
public class LiteralRewriter {

    private static final Map<String, String> RENAMED_FUNCTIONS = Map.of(
        "get_tfvars_dir", "get_terragrunt_dir",
        "get_parent_tfvars_dir", "get_parent_terragrunt_dir"
    );

    /**
     * Rewrites a literal.
     *
     * @param literal HCL 1 literal
     * @return HCL 2 tokens; heredocs end with a newline token
     * @throws IllegalStateException if a heredoc literal is malformed
     */
    public List<Hcl2Token> rewrite(Hcl1Ast.LiteralScalar literal) {
        return switch (literal.kind()) {
            case NUMBER -> number(literal.text(), true);
            case FLOAT -> number(literal.text(), false);
            case BOOL -> List.of(Hcl2Token.of(Hcl2TokenType.BOOL_LIT, literal.text()));
            case HEREDOC -> heredoc(literal.text());
            case STRING -> string(literal.text());
        };
    }

    private static List<Hcl2Token> number(String text, boolean integer) {
        List<Hcl2Token> tokens = new ArrayList<>();
        String digits = text;
        if (digits.startsWith("-")) {
            tokens.add(Hcl2Token.of(Hcl2TokenType.MINUS, "-"));
            digits = digits.substring(1);
        }
        if (integer && (digits.startsWith("0x") || digits.startsWith("0X"))) {
            digits = new BigInteger(digits.substring(2), 16).toString();
        }
        tokens.add(Hcl2Token.of(Hcl2TokenType.NUMBER_LIT, digits));
        return tokens;
    }

    private static List<Hcl2Token> heredoc(String raw) {
        HeredocDecoder.Heredoc heredoc = HeredocDecoder.decode(raw);

        List<Hcl2Token> tokens = new ArrayList<>();
        tokens.add(Hcl2Token.of(Hcl2TokenType.OHEREDOC, "<<" + heredoc.marker() + "\n"));
        if (!heredoc.body().isEmpty()) {
            tokens.add(Hcl2Token.of(Hcl2TokenType.STRING_LIT, heredoc.body()));
        }
        tokens.add(Hcl2Token.of(Hcl2TokenType.CHEREDOC, heredoc.marker()));
        tokens.add(Hcl2Token.of(Hcl2TokenType.NEWLINE, "\n"));
        return tokens;
    }

    private static List<Hcl2Token> string(String raw) {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression(raw);
        if (isSingleInterpolation(tokens)) {
            tokens = tokens.subList(2, tokens.size() - 2);
        }
        return renameFunctions(tokens);
    }

    /**
     * Matches {@code " ${ ... } "} where the inner tokens open no further top-level
     * interpolation. Interpolations inside a nested quoted string do not count.
     */
    static boolean isSingleInterpolation(List<Hcl2Token> tokens) {
        int n = tokens.size();
        if (n < 5
            || tokens.get(0).type() != Hcl2TokenType.OQUOTE
            || tokens.get(1).type() != Hcl2TokenType.TEMPLATE_INTERP
            || tokens.get(n - 2).type() != Hcl2TokenType.TEMPLATE_SEQ_END
            || tokens.get(n - 1).type() != Hcl2TokenType.CQUOTE) {
            return false;
        }

        int quoteDepth = 0;
        for (Hcl2Token token : tokens.subList(2, n - 2)) {
            switch (token.type()) {
                case OQUOTE -> quoteDepth++;
                case CQUOTE -> quoteDepth--;
                case TEMPLATE_INTERP, TEMPLATE_CONTROL, QUOTED_LIT -> {
                    if (quoteDepth == 0) {
                        return false;
                    }
                }
                default -> {
                    // part of the expression
                }
            }
        }
        return true;
    }

    private static List<Hcl2Token> renameFunctions(List<Hcl2Token> tokens) {
        List<Hcl2Token> result = new ArrayList<>(tokens);
        for (int i = 0; i + 2 < result.size(); i++) {
            Hcl2Token token = result.get(i);
            String renamed = RENAMED_FUNCTIONS.get(token.text());
            if (token.type() == Hcl2TokenType.IDENT
                && renamed != null
                && result.get(i + 1).type() == Hcl2TokenType.OPAREN
                && result.get(i + 2).type() == Hcl2TokenType.CPAREN) {
                result.set(i, new Hcl2Token(Hcl2TokenType.IDENT, renamed, token.spacesBefore(), token.pos()));
            }
        }
        return result;
    }
}
