package com.tgupgrade.core.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HeredocDecoder}.
 */
class HeredocDecoderTest {

    @Test
    void decode_plainHeredoc_keepsBody() {
        HeredocDecoder.Heredoc heredoc = HeredocDecoder.decode("<<EOF\nline one\n  line two\nEOF");

        assertThat(heredoc.marker()).isEqualTo("EOF");
        assertThat(heredoc.indented()).isFalse();
        assertThat(heredoc.body()).isEqualTo("line one\n  line two\n");
    }

    @Test
    void decode_indentedHeredoc_stripsClosingMarkerIndent() {
        HeredocDecoder.Heredoc heredoc = HeredocDecoder.decode("<<-POLICY\n    {\n      \"a\": 1\n    }\n    POLICY");

        assertThat(heredoc.marker()).isEqualTo("POLICY");
        assertThat(heredoc.indented()).isTrue();
        assertThat(heredoc.body()).isEqualTo("{\n  \"a\": 1\n}\n");
    }

    @Test
    void decode_indentedHeredocWithShallowLine_keepsBodyAsIs() {
        HeredocDecoder.Heredoc heredoc = HeredocDecoder.decode("<<-EOF\n    a\n  b\n    EOF");

        assertThat(heredoc.body()).isEqualTo("    a\n  b\n");
    }

    @Test
    void decode_emptyBody_returnsEmptyString() {
        HeredocDecoder.Heredoc heredoc = HeredocDecoder.decode("<<EOF\nEOF");

        assertThat(heredoc.body()).isEmpty();
    }

    @Test
    void decode_missingNewline_throwsException() {
        assertThatThrownBy(() -> HeredocDecoder.decode("<<EOF"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing newline");
    }

    @Test
    void decode_missingTerminator_throwsException() {
        assertThatThrownBy(() -> HeredocDecoder.decode("<<EOF\nbody\n"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing terminator EOF");
    }
}
