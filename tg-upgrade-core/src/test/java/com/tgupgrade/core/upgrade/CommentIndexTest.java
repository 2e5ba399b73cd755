package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.ast.antlr.AntlrHcl1Parser;
import com.tgupgrade.core.exception.Hcl1ParseException;
import com.tgupgrade.core.model.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CommentIndex}.
 */
class CommentIndexTest {

    private static Hcl1Ast.File parse(String source) throws Hcl1ParseException {
        return new AntlrHcl1Parser().parse(source);
    }

    private static List<String> texts(List<Hcl1Ast.CommentGroup> groups) {
        return groups.stream().map(group -> group.comments().get(0).text()).toList();
    }

    @Test
    void build_excludesLeadAndLineComments() throws Hcl1ParseException {
        // Given
        Hcl1Ast.File file = parse("""
            # detached one

            # lead
            a = 1 # line

            # detached two
            """);

        // When
        CommentIndex index = CommentIndex.build(file);

        // Then
        assertThat(texts(index.popAll())).containsExactly("# detached one", "# detached two");
        assertThat(index.isEmpty()).isTrue();
    }

    @Test
    void popBefore_removesOnlyEarlierComments() throws Hcl1ParseException {
        Hcl1Ast.File file = parse("# one\n\na = 1\n\n# two\n\nb = 2\n");
        CommentIndex index = CommentIndex.build(file);
        Position b = file.root().items().get(1).pos();
        Position a = file.root().items().get(0).pos();

        assertThat(texts(index.popBefore(a))).containsExactly("# one");
        assertThat(texts(index.peekBefore(b))).containsExactly("# two");
        assertThat(texts(index.popBefore(b))).containsExactly("# two");
        assertThat(index.popBefore(b)).isEmpty();
        assertThat(index.isEmpty()).isTrue();
    }

    @Test
    void peekBefore_doesNotRemove() throws Hcl1ParseException {
        Hcl1Ast.File file = parse("a = 1\n\n# end\n");
        CommentIndex index = CommentIndex.build(file);

        assertThat(index.peekBefore(new Position(10, 1, 100))).hasSize(1);
        assertThat(index.isEmpty()).isFalse();
    }
}
