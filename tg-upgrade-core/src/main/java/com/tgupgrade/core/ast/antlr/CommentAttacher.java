package com.tgupgrade.core.ast.antlr;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.model.Position;
import com.tgupgrade.parser.HclV1Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups the hidden-channel comments of a token stream and decides which groups are
 * lead or line comments of the token that follows them.
 *
 * <p>For every run of comments between two default-channel tokens:
 * <ul>
 *   <li>if the first comment starts on the same line as the previous token, the comments
 *       on that line form a group; it is a <b>line comment</b> when the next token starts on
 *       a later line than the group ends</li>
 *   <li>the remaining comments are grouped by adjacency (a comment on the line directly
 *       after the previous one joins its group)</li>
 *   <li>the last group is a <b>lead comment</b> of the next token when it ends on the line
 *       directly above it, unless that token is a closing brace or bracket</li>
 * </ul>
 *
 * <p>Groups are handed out at most once through {@link #claim}; the ones never claimed
 * are the document's detached comments.
 */
class CommentAttacher {

    private final List<Token> defaults = new ArrayList<>();
    private final Map<Integer, Integer> defaultIndex = new HashMap<>();
    private final Map<Integer, Hcl1Ast.CommentGroup> leadGroups = new HashMap<>();
    private final Map<Integer, Hcl1Ast.CommentGroup> lineGroups = new HashMap<>();
    private final List<Hcl1Ast.CommentGroup> groups = new ArrayList<>();
    private final Set<Hcl1Ast.CommentGroup> claimed = new HashSet<>();

    CommentAttacher(List<Token> tokens) {
        List<Token> pending = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                if (isComment(token)) {
                    pending.add(token);
                }
                continue;
            }
            defaultIndex.put(token.getTokenIndex(), defaults.size());
            defaults.add(token);
            if (!pending.isEmpty()) {
                groupComments(pending, token);
                pending.clear();
            }
        }
    }

    private static boolean isComment(Token token) {
        return token.getType() == HclV1Lexer.LINE_COMMENT || token.getType() == HclV1Lexer.BLOCK_COMMENT;
    }

    private void groupComments(List<Token> comments, Token next) {
        int index = defaultIndex.get(next.getTokenIndex());
        int previousLine = index == 0 ? 0 : defaults.get(index - 1).getLine();

        int cursor = 0;
        if (comments.get(0).getLine() == previousLine) {
            Hcl1Ast.CommentGroup group = nextGroup(comments, cursor, 0);
            cursor += group.comments().size();
            if (next.getLine() != group.endLine()) {
                lineGroups.put(next.getTokenIndex(), group);
            }
        }

        Hcl1Ast.CommentGroup last = null;
        while (cursor < comments.size()) {
            last = nextGroup(comments, cursor, 1);
            cursor += last.comments().size();
        }

        if (last != null && last.endLine() + 1 == next.getLine() && !isCloser(next)) {
            leadGroups.put(next.getTokenIndex(), last);
        }
    }

    private Hcl1Ast.CommentGroup nextGroup(List<Token> comments, int from, int lineGap) {
        List<Hcl1Ast.Comment> list = new ArrayList<>();
        int endLine = comments.get(from).getLine();
        for (int i = from; i < comments.size() && comments.get(i).getLine() <= endLine + lineGap; i++) {
            Hcl1Ast.Comment comment = toComment(comments.get(i));
            list.add(comment);
            endLine = comment.endLine();
        }
        Hcl1Ast.CommentGroup group = new Hcl1Ast.CommentGroup(list);
        groups.add(group);
        return group;
    }

    private static boolean isCloser(Token token) {
        return token.getType() == HclV1Lexer.RBRACE || token.getType() == HclV1Lexer.RBRACK;
    }

    private static Hcl1Ast.Comment toComment(Token token) {
        return new Hcl1Ast.Comment(token.getText(), position(token));
    }

    static Position position(Token token) {
        return new Position(token.getLine(), token.getCharPositionInLine() + 1, token.getStartIndex());
    }

    /**
     * Default-channel token following {@code token}.
     *
     * @param token a default-channel token
     * @return next token, or {@code token} itself at end of input
     */
    Token next(Token token) {
        int index = defaultIndex.get(token.getTokenIndex());
        return index + 1 < defaults.size() ? defaults.get(index + 1) : token;
    }

    /**
     * Claims the lead comment group directly above {@code token}.
     *
     * @param token a default-channel token
     * @return unclaimed lead group, or null
     */
    Hcl1Ast.CommentGroup leadBefore(Token token) {
        return claim(leadGroups.get(token.getTokenIndex()));
    }

    /**
     * Claims the line comment group that ends the line before {@code token}.
     *
     * @param token a default-channel token
     * @return unclaimed line group, or null
     */
    Hcl1Ast.CommentGroup lineBefore(Token token) {
        return claim(lineGroups.get(token.getTokenIndex()));
    }

    private Hcl1Ast.CommentGroup claim(Hcl1Ast.CommentGroup group) {
        if (group == null || !claimed.add(group)) {
            return null;
        }
        return group;
    }

    /**
     * Every comment group of the document in source order.
     *
     * @return all groups
     */
    List<Hcl1Ast.CommentGroup> groups() {
        return List.copyOf(groups);
    }
}
