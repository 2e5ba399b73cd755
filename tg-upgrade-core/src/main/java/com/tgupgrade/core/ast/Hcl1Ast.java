package com.tgupgrade.core.ast;

import com.tgupgrade.core.model.Position;

import java.util.List;
import java.util.Objects;

/**
 * AST node types for HCL 1 documents (terragrunt {@code terraform.tfvars} files).
 *
 * <p>This class contains record types representing the parsed syntax elements: object
 * lists, object items, objects, lists, scalar literals and comments. These records are
 * immutable and provide a type-safe API for the upgrade engine.
 *
 * <p>The node kinds form a closed set. Code that needs per-kind behavior implements
 * {@link Visitor}, so adding a kind is a compile error until every visitor handles it.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * # lead comment
 * terragrunt = {
 *   include {
 *     path = "${find_in_parent_folders()}" // line comment
 *   }
 * }
 * }</pre>
 * parses into an {@link ObjectList} with one {@link ObjectItem} ({@code terragrunt}) whose
 * value is an {@link ObjectType} containing the {@code include} item.
 *
 * @since 1.0.0
 */
public final class Hcl1Ast {

    private Hcl1Ast() {
        // Utility class - no instantiation
    }

    /**
     * Common supertype of all AST nodes.
     */
    public sealed interface Node permits ObjectList, ObjectItem, ObjectType, ListType, LiteralScalar, CommentGroup {

        /**
         * Source position of the node's first token.
         *
         * @return node position
         */
        Position pos();

        /**
         * Dispatches to the visitor method for this node kind.
         *
         * @param visitor visitor to call
         * @param context caller-defined context handed to the visitor
         * @param <R> visitor result type
         * @param <C> context type
         * @return visitor result
         */
        <R, C> R accept(Visitor<R, C> visitor, C context);
    }

    /**
     * One method per node kind.
     *
     * @param <R> result type
     * @param <C> context type
     */
    public interface Visitor<R, C> {
        R visitObjectList(ObjectList node, C context);

        R visitObjectItem(ObjectItem node, C context);

        R visitObjectType(ObjectType node, C context);

        R visitListType(ListType node, C context);

        R visitLiteral(LiteralScalar node, C context);

        R visitCommentGroup(CommentGroup node, C context);
    }

    /**
     * Ordered list of object items, the body of a document or an object.
     *
     * @param pos position of the first item, or of the enclosing brace
     * @param items items in source order
     */
    public record ObjectList(
        Position pos,
        List<ObjectItem> items
    ) implements Node {
        public ObjectList {
            items = items != null ? List.copyOf(items) : List.of();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitObjectList(this, context);
        }
    }

    /**
     * Key token of an object item.
     *
     * @param text raw token text, including quotes for string keys
     * @param pos key position
     */
    public record ObjectKey(
        String text,
        Position pos
    ) {
        public ObjectKey {
            Objects.requireNonNull(text, "text must not be null");
        }

        /**
         * Returns true if the key was written as a quoted string.
         *
         * @return true for {@code "key"}, false for {@code key}
         */
        public boolean quoted() {
            return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
        }

        /**
         * Key name with surrounding quotes removed.
         *
         * @return unquoted key text
         */
        public String name() {
            return quoted() ? text.substring(1, text.length() - 1) : text;
        }
    }

    /**
     * One {@code key = value} or {@code key "label" { ... }} entry.
     *
     * <p>Example:
     * <pre>{@code
     * extra_arguments "foo" {
     *   commands = ["plan"]
     * }
     * }</pre>
     *
     * @param keys key tokens; the first one is the item's classification key
     * @param value item value
     * @param leadComment comment group directly above the item, or null
     * @param lineComment comment group trailing the item on its last line, or null
     */
    public record ObjectItem(
        List<ObjectKey> keys,
        Node value,
        CommentGroup leadComment,
        CommentGroup lineComment
    ) implements Node {
        public ObjectItem {
            keys = keys != null ? List.copyOf(keys) : List.of();
            if (keys.isEmpty()) {
                throw new IllegalArgumentException("object item requires at least one key");
            }
            Objects.requireNonNull(value, "value must not be null");
        }

        /**
         * Name of the first key.
         *
         * @return classification key
         */
        public String keyName() {
            return keys.get(0).name();
        }

        @Override
        public Position pos() {
            return keys.get(0).pos();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitObjectItem(this, context);
        }
    }

    /**
     * Object literal or block body in braces.
     *
     * @param lbrace position of the opening brace
     * @param rbrace position of the closing brace, {@link Position#NONE} for synthesized objects
     * @param list object items
     */
    public record ObjectType(
        Position lbrace,
        Position rbrace,
        ObjectList list
    ) implements Node {
        public ObjectType {
            Objects.requireNonNull(list, "list must not be null");
        }

        @Override
        public Position pos() {
            return lbrace;
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitObjectType(this, context);
        }
    }

    /**
     * List literal in brackets.
     *
     * @param lbrack position of {@code [}
     * @param rbrack position of {@code ]}
     * @param elements list elements
     */
    public record ListType(
        Position lbrack,
        Position rbrack,
        List<Node> elements
    ) implements Node {
        public ListType {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        /**
         * Returns true if the brackets were on different source lines.
         *
         * @return true for multi-line lists
         */
        public boolean multiLine() {
            return lbrack.line() != rbrack.line();
        }

        @Override
        public Position pos() {
            return lbrack;
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitListType(this, context);
        }
    }

    /**
     * Scalar literal kinds.
     */
    public enum LiteralKind {
        NUMBER,
        FLOAT,
        BOOL,
        STRING,
        HEREDOC
    }

    /**
     * Scalar literal.
     *
     * @param kind literal kind
     * @param text raw token text (quotes and heredoc markers included)
     * @param pos literal position
     * @param leadComment comment group directly above the literal, or null
     * @param lineComment comment group trailing the literal, or null
     */
    public record LiteralScalar(
        LiteralKind kind,
        String text,
        Position pos,
        CommentGroup leadComment,
        CommentGroup lineComment
    ) implements Node {
        public LiteralScalar {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitLiteral(this, context);
        }
    }

    /**
     * Single comment.
     *
     * @param text raw comment text including its {@code #}, {@code //} or {@code /* *\/} markers
     * @param pos comment position
     */
    public record Comment(
        String text,
        Position pos
    ) {
        /**
         * Returns true for {@code /* ... *\/} comments.
         *
         * @return true if this is a block comment
         */
        public boolean isBlock() {
            return text.startsWith("/*");
        }

        /**
         * Line on which the comment ends.
         *
         * @return last line covered by the comment
         */
        public int endLine() {
            return pos.line() + (int) text.chars().filter(c -> c == '\n').count();
        }
    }

    /**
     * Comments on adjacent lines, treated as a unit.
     *
     * @param comments comments in source order
     */
    public record CommentGroup(
        List<Comment> comments
    ) implements Node {
        public CommentGroup {
            comments = comments != null ? List.copyOf(comments) : List.of();
            if (comments.isEmpty()) {
                throw new IllegalArgumentException("comment group must not be empty");
            }
        }

        @Override
        public Position pos() {
            return comments.get(0).pos();
        }

        /**
         * Line on which the last comment ends.
         *
         * @return last line covered by the group
         */
        public int endLine() {
            return comments.get(comments.size() - 1).endLine();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitCommentGroup(this, context);
        }
    }

    /**
     * A parsed document.
     *
     * @param root top-level object list
     * @param comments every comment group of the document in source order, attached or not
     */
    public record File(
        ObjectList root,
        List<CommentGroup> comments
    ) {
        public File {
            Objects.requireNonNull(root, "root must not be null");
            comments = comments != null ? List.copyOf(comments) : List.of();
        }
    }
}
