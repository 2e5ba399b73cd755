package com.tgupgrade.core.hcl2;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Hcl2Lexer}.
 */
class Hcl2LexerTest {

    @Test
    void lexExpression_singleInterpolation_producesTemplateTokens() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"${find_in_parent_folders()}\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.TEMPLATE_INTERP,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.OPAREN,
            Hcl2TokenType.CPAREN,
            Hcl2TokenType.TEMPLATE_SEQ_END,
            Hcl2TokenType.CQUOTE);
    }

    @Test
    void lexExpression_literalAroundInterpolation_producesQuotedLiterals() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"${path_relative_to_include()}/terraform.tfstate\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.TEMPLATE_INTERP,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.OPAREN,
            Hcl2TokenType.CPAREN,
            Hcl2TokenType.TEMPLATE_SEQ_END,
            Hcl2TokenType.QUOTED_LIT,
            Hcl2TokenType.CQUOTE);
        assertThat(tokens.get(6).text()).isEqualTo("/terraform.tfstate");
    }

    @Test
    void lexExpression_escapedInterpolation_staysLiteral() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"$${not_a_call}\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE, Hcl2TokenType.QUOTED_LIT, Hcl2TokenType.CQUOTE);
    }

    @Test
    void lexExpression_nestedQuotes_insideInterpolation() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"${lookup(map, \"key\")}\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.TEMPLATE_INTERP,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.OPAREN,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.COMMA,
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.QUOTED_LIT,
            Hcl2TokenType.CQUOTE,
            Hcl2TokenType.CPAREN,
            Hcl2TokenType.TEMPLATE_SEQ_END,
            Hcl2TokenType.CQUOTE);
    }

    @Test
    void lexConfig_heredoc_producesOpenerBodyAndCloser() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("a = <<EOF\nhello\nEOF\n");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.IDENT,
            Hcl2TokenType.EQUAL,
            Hcl2TokenType.OHEREDOC,
            Hcl2TokenType.STRING_LIT,
            Hcl2TokenType.CHEREDOC,
            Hcl2TokenType.NEWLINE,
            Hcl2TokenType.EOF);
        assertThat(tokens.get(2).text()).isEqualTo("<<EOF\n");
        assertThat(tokens.get(3).text()).isEqualTo("hello\n");
    }

    @Test
    void lexConfig_comments_lineCommentsKeepLineBreak() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("# hash\n// slashes\n/* block */\n");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.COMMENT,
            Hcl2TokenType.COMMENT,
            Hcl2TokenType.COMMENT,
            Hcl2TokenType.NEWLINE,
            Hcl2TokenType.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("# hash\n");
        assertThat(tokens.get(0).isLineComment()).isTrue();
        assertThat(tokens.get(2).isLineComment()).isFalse();
    }

    @Test
    void lexConfig_operatorsAndLiterals() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("x = a >= 1.5e3 && !b || c != true");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.IDENT,
            Hcl2TokenType.EQUAL,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.GTE,
            Hcl2TokenType.NUMBER_LIT,
            Hcl2TokenType.AND,
            Hcl2TokenType.BANG,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.OR,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.NOT_EQUAL,
            Hcl2TokenType.BOOL_LIT,
            Hcl2TokenType.EOF);
        assertThat(tokens.get(4).text()).isEqualTo("1.5e3");
    }

    @Test
    void lexConfig_identifierWithDash_singleToken() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("my-name = 1");

        assertThat(tokens.get(0).type()).isEqualTo(Hcl2TokenType.IDENT);
        assertThat(tokens.get(0).text()).isEqualTo("my-name");
    }

    @Test
    void lexConfig_tracksPositionsAndSpaces() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("a {\n  b = 1\n}\n");

        Hcl2Token b = tokens.get(3);
        assertThat(b.text()).isEqualTo("b");
        assertThat(b.pos().line()).isEqualTo(2);
        assertThat(b.pos().column()).isEqualTo(3);
        assertThat(b.spacesBefore()).isEqualTo(2);
    }

    @Test
    void lexConfig_unknownCharacter_producesInvalidToken() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("a = @");

        assertThat(tokens.get(2).type()).isEqualTo(Hcl2TokenType.INVALID);
    }

    @Test
    void lexConfig_keywords_becomeIdentifiers() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("a = [for x in l : x if x]");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.IDENT,
            Hcl2TokenType.EQUAL,
            Hcl2TokenType.OBRACK,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.COLON,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.CBRACK,
            Hcl2TokenType.EOF);
    }

    @Test
    void lexExpression_objectInsideInterpolation_closesEachBraceCorrectly() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"${lookup({a = 1}, \"a\")}x\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.TEMPLATE_INTERP,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.OPAREN,
            Hcl2TokenType.OBRACE,
            Hcl2TokenType.IDENT,
            Hcl2TokenType.EQUAL,
            Hcl2TokenType.NUMBER_LIT,
            Hcl2TokenType.CBRACE,
            Hcl2TokenType.COMMA,
            Hcl2TokenType.OQUOTE,
            Hcl2TokenType.QUOTED_LIT,
            Hcl2TokenType.CQUOTE,
            Hcl2TokenType.CPAREN,
            Hcl2TokenType.TEMPLATE_SEQ_END,
            Hcl2TokenType.QUOTED_LIT,
            Hcl2TokenType.CQUOTE);
    }

    @Test
    void lexConfig_newlinesInsideBrackets_areKept() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexConfig("a = [\n  1,\n]\n");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.IDENT,
            Hcl2TokenType.EQUAL,
            Hcl2TokenType.OBRACK,
            Hcl2TokenType.NEWLINE,
            Hcl2TokenType.NUMBER_LIT,
            Hcl2TokenType.COMMA,
            Hcl2TokenType.NEWLINE,
            Hcl2TokenType.CBRACK,
            Hcl2TokenType.NEWLINE,
            Hcl2TokenType.EOF);
    }

    @Test
    void lexExpression_dollarWithoutBrace_staysLiteral() {
        List<Hcl2Token> tokens = Hcl2Lexer.lexExpression("\"cost: $5 or 10%\"");

        assertThat(tokens).extracting(Hcl2Token::type).containsExactly(
            Hcl2TokenType.OQUOTE, Hcl2TokenType.QUOTED_LIT, Hcl2TokenType.CQUOTE);
        assertThat(tokens.get(1).text()).isEqualTo("cost: $5 or 10%");
    }
}

