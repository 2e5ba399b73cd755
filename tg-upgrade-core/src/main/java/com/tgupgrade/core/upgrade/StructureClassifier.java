package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;

import java.util.Set;

/**
 * Decides whether an item is written as a block ({@code key { ... }}) or as an attribute
 * ({@code key = value}).
 *
 * <p>terragrunt 0.19 reads {@code terraform}, {@code remote_state}, {@code include} and
 * {@code dependencies} as top-level blocks, and {@code extra_arguments} as a block nested
 * in {@code terraform}. Every other key is an attribute.
 */
public class StructureClassifier {

    private static final Set<String> TOP_LEVEL_BLOCKS = Set.of("terraform", "remote_state", "include", "dependencies");
    private static final String TERRAFORM = "terraform";
    private static final String EXTRA_ARGUMENTS = "extra_arguments";

    public enum Structure {
        BLOCK,
        ATTRIBUTE
    }

    /**
     * Classifies a key by its position in the document.
     *
     * @param key item key
     * @param depth nesting depth, 0 for top-level items
     * @param parentKey key of the enclosing item, {@code null} at top level
     * @return block or attribute
     */
    public Structure classify(String key, int depth, String parentKey) {
        if (depth == 0 && TOP_LEVEL_BLOCKS.contains(key)) {
            return Structure.BLOCK;
        }
        if (depth == 1 && TERRAFORM.equals(parentKey) && EXTRA_ARGUMENTS.equals(key)) {
            return Structure.BLOCK;
        }
        return Structure.ATTRIBUTE;
    }

    /**
     * Classifies an item. Only object values have a block form, so a block key with any
     * other value stays an attribute.
     */
    public Structure classify(Hcl1Ast.ObjectItem item, int depth, String parentKey) {
        if (!(item.value() instanceof Hcl1Ast.ObjectType)) {
            return Structure.ATTRIBUTE;
        }
        return classify(item.keyName(), depth, parentKey);
    }
}
