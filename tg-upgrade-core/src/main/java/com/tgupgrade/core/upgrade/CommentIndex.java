package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.model.Position;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Source-ordered cursor over the comments of a document that are not attached to any node.
 *
 * <p>Comments are consumed front to back: {@link #popBefore(Position)} removes every
 * remaining comment positioned before the given position, so calls must come in
 * non-decreasing position order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CommentIndex index = CommentIndex.build(file);
 * for (Hcl1Ast.CommentGroup group : index.popBefore(item.pos())) {
 *     // emit group above the item
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class CommentIndex {

    private final Deque<Hcl1Ast.CommentGroup> detached;

    private CommentIndex(List<Hcl1Ast.CommentGroup> detached) {
        this.detached = new ArrayDeque<>(detached);
    }

    /**
     * Collects the detached comments of a parsed document.
     *
     * @param file parsed document
     * @return index over every comment group that is neither a lead nor a line comment
     */
    public static CommentIndex build(Hcl1Ast.File file) {
        Set<Position> attached = new HashSet<>();
        file.root().accept(new AttachedCommentCollector(), attached);

        List<Hcl1Ast.CommentGroup> detached = new ArrayList<>();
        for (Hcl1Ast.CommentGroup group : file.comments()) {
            if (!attached.contains(group.pos())) {
                detached.add(group);
            }
        }
        return new CommentIndex(detached);
    }

    /**
     * Returns the remaining comments positioned strictly before {@code pos} without
     * removing them.
     */
    public List<Hcl1Ast.CommentGroup> peekBefore(Position pos) {
        List<Hcl1Ast.CommentGroup> result = new ArrayList<>();
        for (Hcl1Ast.CommentGroup group : detached) {
            if (!group.pos().isBefore(pos)) {
                break;
            }
            result.add(group);
        }
        return result;
    }

    /**
     * Removes and returns the remaining comments positioned strictly before {@code pos}.
     */
    public List<Hcl1Ast.CommentGroup> popBefore(Position pos) {
        List<Hcl1Ast.CommentGroup> result = new ArrayList<>();
        while (!detached.isEmpty() && detached.peekFirst().pos().isBefore(pos)) {
            result.add(detached.pollFirst());
        }
        return result;
    }

    /**
     * Removes and returns every remaining comment.
     */
    public List<Hcl1Ast.CommentGroup> popAll() {
        List<Hcl1Ast.CommentGroup> result = new ArrayList<>(detached);
        detached.clear();
        return result;
    }

    public boolean isEmpty() {
        return detached.isEmpty();
    }

    private static final class AttachedCommentCollector implements Hcl1Ast.Visitor<Void, Set<Position>> {

        @Override
        public Void visitObjectList(Hcl1Ast.ObjectList node, Set<Position> attached) {
            node.items().forEach(item -> item.accept(this, attached));
            return null;
        }

        @Override
        public Void visitObjectItem(Hcl1Ast.ObjectItem node, Set<Position> attached) {
            record(node.leadComment(), attached);
            record(node.lineComment(), attached);
            return node.value().accept(this, attached);
        }

        @Override
        public Void visitObjectType(Hcl1Ast.ObjectType node, Set<Position> attached) {
            return node.list().accept(this, attached);
        }

        @Override
        public Void visitListType(Hcl1Ast.ListType node, Set<Position> attached) {
            node.elements().forEach(element -> element.accept(this, attached));
            return null;
        }

        @Override
        public Void visitLiteral(Hcl1Ast.LiteralScalar node, Set<Position> attached) {
            record(node.leadComment(), attached);
            record(node.lineComment(), attached);
            return null;
        }

        @Override
        public Void visitCommentGroup(Hcl1Ast.CommentGroup node, Set<Position> attached) {
            return null;
        }

        private static void record(Hcl1Ast.CommentGroup group, Set<Position> attached) {
            if (group != null) {
                attached.add(group.pos());
            }
        }
    }
}
