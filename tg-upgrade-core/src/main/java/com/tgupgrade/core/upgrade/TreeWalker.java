package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.hcl2.Hcl2Lexer;
import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.hcl2.Hcl2TokenType;
import com.tgupgrade.core.model.Position;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Emits an HCL 1 tree as HCL 2 tokens.
 *
 * <p>The walk is depth first in source order. Before each node, detached comments positioned
 * before it are taken from the {@link CommentIndex} and emitted: on their own lines when
 * the output is at the start of a line, inline (as block comments) otherwise. Lead and line
 * comments travel with the node they are attached to.
 *
 * <p>Items are written as blocks or attributes according to {@link StructureClassifier},
 * siblings are separated according to {@link BlankLinePolicy}, and scalars go through
 * {@link LiteralRewriter}.
 *
 * @since 1.0.0
 */
public class TreeWalker implements Hcl1Ast.Visitor<Void, TreeWalker.WalkContext> {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private final TokenStream out;
    private final CommentIndex comments;
    private final StructureClassifier classifier;
    private final BlankLinePolicy blankLines;
    private final LiteralRewriter literals;

    public TreeWalker(TokenStream out, CommentIndex comments) {
        this(out, comments, new StructureClassifier(), new BlankLinePolicy(), new LiteralRewriter());
    }

    public TreeWalker(TokenStream out, CommentIndex comments, StructureClassifier classifier,
                      BlankLinePolicy blankLines, LiteralRewriter literals) {
        this.out = out;
        this.comments = comments;
        this.classifier = classifier;
        this.blankLines = blankLines;
        this.literals = literals;
    }

    /**
     * Nesting depth and key of the enclosing item.
     */
    public record WalkContext(int depth, String parentKey) {

        public static WalkContext root() {
            return new WalkContext(0, null);
        }

        WalkContext child(String key) {
            return new WalkContext(depth + 1, key);
        }
    }

    @Override
    public Void visitObjectList(Hcl1Ast.ObjectList node, WalkContext context) {
        Hcl1Ast.ObjectItem previous = null;
        for (Hcl1Ast.ObjectItem item : node.items()) {
            if (previous != null && blankLines.needsBlankLine(previous, item, comments)) {
                out.ensureBlankLine();
            }
            item.accept(this, context);
            previous = item;
        }
        return null;
    }

    @Override
    public Void visitObjectItem(Hcl1Ast.ObjectItem node, WalkContext context) {
        emitDetached(node.pos(), true);

        if (node.leadComment() != null) {
            emitStandalone(node.leadComment());
        }
        // key = # lead of the value
        if (node.value() instanceof Hcl1Ast.LiteralScalar literal && literal.leadComment() != null) {
            emitStandalone(literal.leadComment());
        }

        List<Hcl1Ast.ObjectKey> keys = node.keys();
        List<Hcl1Ast.ObjectKey> extraKeys = keys.subList(1, keys.size());
        WalkContext child = context.child(node.keyName());

        if (classifier.classify(node, context.depth(), context.parentKey()) == StructureClassifier.Structure.BLOCK) {
            out.append(Hcl2TokenType.IDENT, keys.get(0).name());
            for (Hcl1Ast.ObjectKey label : extraKeys) {
                out.appendAll(quoted(label));
            }
            node.value().accept(this, child);
        } else {
            // a "b" { ... } as an attribute is a = { "b" = { ... } }
            out.appendAll(key(keys.get(0)));
            out.append(Hcl2TokenType.EQUAL, "=");
            for (Hcl1Ast.ObjectKey extra : extraKeys) {
                out.append(Hcl2TokenType.OBRACE, "{");
                out.newline();
                out.appendAll(key(extra));
                out.append(Hcl2TokenType.EQUAL, "=");
            }
            node.value().accept(this, child);
            for (int i = 0; i < extraKeys.size(); i++) {
                out.newline();
                out.append(Hcl2TokenType.CBRACE, "}");
            }
        }

        if (node.lineComment() != null) {
            emitTrailing(node.lineComment());
            // # and // comments already end the line
            if (!out.atLineStart()) {
                out.newline();
            }
        } else {
            out.newline();
        }
        return null;
    }

    @Override
    public Void visitObjectType(Hcl1Ast.ObjectType node, WalkContext context) {
        emitDetached(node.pos(), true);

        boolean closable = !Position.NONE.equals(node.rbrace());
        if (node.list().items().isEmpty() && closable && comments.peekBefore(node.rbrace()).isEmpty()) {
            out.append(Hcl2TokenType.OBRACE, "{");
            out.append(Hcl2TokenType.CBRACE, "}");
            return null;
        }

        out.append(Hcl2TokenType.OBRACE, "{");
        out.newline();
        node.list().accept(this, context);
        if (closable) {
            emitDetached(node.rbrace(), false);
        }
        out.append(Hcl2TokenType.CBRACE, "}");
        return null;
    }

    @Override
    public Void visitListType(Hcl1Ast.ListType node, WalkContext context) {
        emitDetached(node.pos(), true);
        out.append(Hcl2TokenType.OBRACK, "[");
        WalkContext elementContext = new WalkContext(context.depth() + 1, context.parentKey());

        if (!node.multiLine()) {
            for (int i = 0; i < node.elements().size(); i++) {
                if (i > 0) {
                    out.append(Hcl2TokenType.COMMA, ",");
                }
                Hcl1Ast.Node element = node.elements().get(i);
                Hcl1Ast.LiteralScalar literal = element instanceof Hcl1Ast.LiteralScalar l ? l : null;
                if (literal != null && literal.leadComment() != null) {
                    emitInline(literal.leadComment());
                }
                element.accept(this, elementContext);
                if (literal != null && literal.lineComment() != null) {
                    emitInline(literal.lineComment());
                }
            }
            emitDetached(node.rbrack(), false);
            out.append(Hcl2TokenType.CBRACK, "]");
            return null;
        }

        out.newline();
        for (Hcl1Ast.Node element : node.elements()) {
            emitDetached(element.pos(), true);
            Hcl1Ast.LiteralScalar literal = element instanceof Hcl1Ast.LiteralScalar l ? l : null;
            if (literal != null && literal.leadComment() != null) {
                emitStandalone(literal.leadComment());
            }
            element.accept(this, elementContext);
            out.append(Hcl2TokenType.COMMA, ",");
            if (literal != null && literal.lineComment() != null) {
                emitTrailing(literal.lineComment());
            }
            if (!out.atLineStart()) {
                out.newline();
            }
        }
        emitDetached(node.rbrack(), false);
        out.append(Hcl2TokenType.CBRACK, "]");
        return null;
    }

    @Override
    public Void visitLiteral(Hcl1Ast.LiteralScalar node, WalkContext context) {
        emitDetached(node.pos(), true);
        out.appendAll(literals.rewrite(node));
        return null;
    }

    @Override
    public Void visitCommentGroup(Hcl1Ast.CommentGroup node, WalkContext context) {
        emitStandalone(node);
        return null;
    }

    /**
     * Emits every detached comment not consumed by the walk, each after an empty line.
     */
    public void flushComments() {
        for (Hcl1Ast.CommentGroup group : comments.popAll()) {
            out.ensureBlankLine();
            group.accept(this, WalkContext.root());
        }
    }

    private void emitDetached(Position pos, boolean blankAfter) {
        for (Hcl1Ast.CommentGroup group : comments.popBefore(pos)) {
            if (out.atLineStart()) {
                out.ensureBlankLine();
                emitStandalone(group);
                if (blankAfter) {
                    out.newline();
                }
            } else {
                emitInline(group);
            }
        }
    }

    private void emitStandalone(Hcl1Ast.CommentGroup group) {
        for (Hcl1Ast.Comment comment : group.comments()) {
            if (comment.isBlock()) {
                out.append(Hcl2TokenType.COMMENT, comment.text());
                out.newline();
            } else {
                out.append(Hcl2TokenType.COMMENT, comment.text() + "\n");
            }
        }
    }

    private void emitTrailing(Hcl1Ast.CommentGroup group) {
        for (Hcl1Ast.Comment comment : group.comments()) {
            out.append(Hcl2TokenType.COMMENT, comment.isBlock() ? comment.text() : comment.text() + "\n");
        }
    }

    private void emitInline(Hcl1Ast.CommentGroup group) {
        for (Hcl1Ast.Comment comment : group.comments()) {
            out.append(Hcl2TokenType.COMMENT, comment.isBlock() ? comment.text() : asBlockComment(comment.text()));
        }
    }

    private static String asBlockComment(String lineComment) {
        String body = lineComment.startsWith("#") ? lineComment.substring(1) : lineComment.substring(2);
        return "/* " + body.strip() + " */";
    }

    private static List<Hcl2Token> key(Hcl1Ast.ObjectKey key) {
        if (IDENTIFIER.matcher(key.name()).matches()) {
            return List.of(Hcl2Token.of(Hcl2TokenType.IDENT, key.name()));
        }
        return quoted(key);
    }

    private static List<Hcl2Token> quoted(Hcl1Ast.ObjectKey key) {
        return Hcl2Lexer.lexExpression(key.quoted() ? key.text() : "\"" + key.text() + "\"");
    }
}
