package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;

/**
 * Decides whether an empty line separates two sibling items.
 *
 * <p>Consecutive single-line attributes are kept together so the formatter aligns them.
 * Items with a lead comment, objects and multi-line lists are set apart. Nothing is
 * inserted after an item with a line comment (the comment already ends its line with a
 * blank one) or before detached comments, which bring their own spacing.
 */
public class BlankLinePolicy {

    /**
     * @param previous item emitted just before
     * @param current item about to be emitted
     * @param comments remaining detached comments
     * @return whether to insert an empty line between the two items
     */
    public boolean needsBlankLine(Hcl1Ast.ObjectItem previous, Hcl1Ast.ObjectItem current, CommentIndex comments) {
        if (previous.lineComment() != null) {
            return false;
        }
        if (!comments.peekBefore(current.pos()).isEmpty()) {
            return false;
        }

        if (current.leadComment() != null) {
            return true;
        }
        if (current.value() instanceof Hcl1Ast.LiteralScalar literal && literal.leadComment() != null) {
            return true;
        }
        return isMultiLine(current.value()) || isMultiLine(previous.value());
    }

    private static boolean isMultiLine(Hcl1Ast.Node value) {
        if (value instanceof Hcl1Ast.ObjectType) {
            return true;
        }
        return value instanceof Hcl1Ast.ListType list && list.multiLine();
    }
}
