package com.tgupgrade.core.ast.antlr;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.model.Position;
import com.tgupgrade.parser.HclV1Lexer;
import com.tgupgrade.parser.HclV1Parser;
import com.tgupgrade.parser.HclV1ParserBaseVisitor;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR parse tree visitor that builds {@link Hcl1Ast} nodes.
 *
 * <p>Comments are attached while building:
 * <ul>
 *   <li>an item's lead comment is the group directly above its first key</li>
 *   <li>an item's line comment is the group after its value (or after the comma following
 *       it) when the value starts on the key's line, otherwise a trailing comment after
 *       {@code =}</li>
 *   <li>a literal value may carry its own lead comment when it sits on its own line</li>
 *   <li>list literals take the lead comment above them and the line comment after their
 *       comma</li>
 * </ul>
 */
class Hcl1AstBuilder extends HclV1ParserBaseVisitor<Hcl1Ast.Node> {

    private final CommentAttacher comments;

    Hcl1AstBuilder(CommentAttacher comments) {
        this.comments = comments;
    }

    Hcl1Ast.File build(HclV1Parser.FileContext file) {
        Hcl1Ast.ObjectList root = (Hcl1Ast.ObjectList) visitObjectList(file.objectList());
        return new Hcl1Ast.File(root, comments.groups());
    }

    @Override
    public Hcl1Ast.Node visitObjectList(HclV1Parser.ObjectListContext ctx) {
        List<Hcl1Ast.ObjectItem> items = new ArrayList<>();
        for (HclV1Parser.ObjectItemContext item : ctx.objectItem()) {
            items.add((Hcl1Ast.ObjectItem) visitObjectItem(item));
        }
        Position pos = items.isEmpty() ? CommentAttacher.position(ctx.getStart()) : items.get(0).pos();
        return new Hcl1Ast.ObjectList(pos, items);
    }

    @Override
    public Hcl1Ast.Node visitObjectItem(HclV1Parser.ObjectItemContext ctx) {
        List<Hcl1Ast.ObjectKey> keys = new ArrayList<>();
        for (HclV1Parser.ObjectKeyContext key : ctx.objectKey()) {
            Token token = key.getStart();
            keys.add(new Hcl1Ast.ObjectKey(token.getText(), CommentAttacher.position(token)));
        }

        Token firstKey = ctx.objectKey(0).getStart();
        Hcl1Ast.CommentGroup lead = comments.leadBefore(firstKey);

        ParserRuleContext valueCtx = ctx.value() != null ? ctx.value() : ctx.objectType();
        Hcl1Ast.Node value = valueCtx == ctx.objectType()
            ? visitObjectType(ctx.objectType())
            : visitItemValue(ctx.value());

        Hcl1Ast.CommentGroup line = null;
        if (valueCtx.getStart().getLine() == firstKey.getLine()) {
            Token after = comments.next(valueCtx.getStop());
            if (after.getType() == HclV1Lexer.COMMA) {
                line = comments.lineBefore(after);
                if (line == null) {
                    line = comments.lineBefore(comments.next(after));
                }
            } else {
                line = comments.lineBefore(after);
            }
        }
        if (line == null && value instanceof Hcl1Ast.LiteralScalar) {
            // key = # comment
            //   "value"
            line = comments.lineBefore(valueCtx.getStart());
        }

        return new Hcl1Ast.ObjectItem(keys, value, lead, line);
    }

    private Hcl1Ast.Node visitItemValue(HclV1Parser.ValueContext ctx) {
        if (ctx.literal() != null) {
            Token token = ctx.literal().getStart();
            return literal(token, comments.leadBefore(token), null);
        }
        return visitValue(ctx);
    }

    @Override
    public Hcl1Ast.Node visitValue(HclV1Parser.ValueContext ctx) {
        if (ctx.objectType() != null) {
            return visitObjectType(ctx.objectType());
        }
        if (ctx.listType() != null) {
            return visitListType(ctx.listType());
        }
        return visitLiteral(ctx.literal());
    }

    @Override
    public Hcl1Ast.Node visitObjectType(HclV1Parser.ObjectTypeContext ctx) {
        Hcl1Ast.ObjectList list = (Hcl1Ast.ObjectList) visitObjectList(ctx.objectList());
        Position lbrace = CommentAttacher.position(ctx.LBRACE().getSymbol());
        if (list.items().isEmpty()) {
            list = new Hcl1Ast.ObjectList(lbrace, List.of());
        }
        return new Hcl1Ast.ObjectType(lbrace, CommentAttacher.position(ctx.RBRACE().getSymbol()), list);
    }

    @Override
    public Hcl1Ast.Node visitListType(HclV1Parser.ListTypeContext ctx) {
        List<Hcl1Ast.Node> elements = new ArrayList<>();
        for (HclV1Parser.ValueContext element : ctx.value()) {
            elements.add(visitValue(element));
        }
        return new Hcl1Ast.ListType(
            CommentAttacher.position(ctx.LBRACK().getSymbol()),
            CommentAttacher.position(ctx.RBRACK().getSymbol()),
            elements);
    }

    /**
     * Builds a list element literal, taking its lead comment and the line comment after
     * its comma (or after the literal itself when it is the last element).
     */
    @Override
    public Hcl1Ast.Node visitLiteral(HclV1Parser.LiteralContext ctx) {
        Token token = ctx.getStart();
        Hcl1Ast.CommentGroup lead = comments.leadBefore(token);
        Token after = comments.next(token);
        Hcl1Ast.CommentGroup line = after.getType() == HclV1Lexer.COMMA
            ? comments.lineBefore(comments.next(after))
            : comments.lineBefore(after);
        return literal(token, lead, line);
    }

    private static Hcl1Ast.LiteralScalar literal(Token token, Hcl1Ast.CommentGroup lead,
                                                 Hcl1Ast.CommentGroup line) {
        return new Hcl1Ast.LiteralScalar(kindOf(token), token.getText(), CommentAttacher.position(token), lead, line);
    }

    private static Hcl1Ast.LiteralKind kindOf(Token token) {
        return switch (token.getType()) {
            case HclV1Lexer.NUMBER -> Hcl1Ast.LiteralKind.NUMBER;
            case HclV1Lexer.FLOAT -> Hcl1Ast.LiteralKind.FLOAT;
            case HclV1Lexer.BOOL -> Hcl1Ast.LiteralKind.BOOL;
            case HclV1Lexer.STRING -> Hcl1Ast.LiteralKind.STRING;
            case HclV1Lexer.HEREDOC -> Hcl1Ast.LiteralKind.HEREDOC;
            default -> throw new IllegalStateException("unexpected literal token: " + token.getText());
        };
    }
}
