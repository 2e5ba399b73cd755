package com.tgupgrade.core.upgrade;

import com.tgupgrade.core.ast.Hcl1Ast;
import com.tgupgrade.core.exception.NotTerragruntConfigException;
import com.tgupgrade.core.hcl2.Hcl2Token;
import com.tgupgrade.core.model.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves a terraform.tfvars document into the terragrunt.hcl layout.
 *
 * <p>The children of the top-level {@code terragrunt} object become the top-level items of
 * the new document. Every other top-level item is a module variable and moves into a
 * trailing {@code inputs} attribute. Comments not consumed by the walk are appended at the
 * end. Comments attached to the {@code terragrunt} item itself are not carried over.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * terragrunt = {
 *   terraform {
 *     source = "git::ssh://git@github.com/org/module.git"
 *   }
 * }
 * domain = "app.foo.com"
 * }</pre>
 * becomes
 * <pre>{@code
 * terraform {
 *   source = "git::ssh://git@github.com/org/module.git"
 * }
 *
 * inputs = {
 *   domain = "app.foo.com"
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class DocumentRestructurer {

    static final String TERRAGRUNT_KEY = "terragrunt";
    static final String INPUTS_KEY = "inputs";

    /**
     * Restructures a parsed document.
     *
     * @param file parsed HCL 1 document
     * @return HCL 2 tokens of the new document
     * @throws NotTerragruntConfigException if there is no top-level {@code terragrunt}
     *         object
     */
    public List<Hcl2Token> restructure(Hcl1Ast.File file) throws NotTerragruntConfigException {
        List<Hcl1Ast.ObjectItem> settings = new ArrayList<>();
        List<Hcl1Ast.ObjectItem> variables = new ArrayList<>();
        boolean found = false;

        for (Hcl1Ast.ObjectItem item : file.root().items()) {
            if (!TERRAGRUNT_KEY.equals(item.keyName())) {
                variables.add(item);
                continue;
            }
            if (!(item.value() instanceof Hcl1Ast.ObjectType object)) {
                throw new NotTerragruntConfigException(
                    "not a terragrunt config: terragrunt at " + item.pos() + " is not an object");
            }
            settings.addAll(object.list().items());
            found = true;
        }
        if (!found) {
            throw new NotTerragruntConfigException();
        }

        if (!variables.isEmpty()) {
            settings.add(inputs(variables));
        }

        TokenStream out = new TokenStream();
        TreeWalker walker = new TreeWalker(out, CommentIndex.build(file));
        Position start = settings.isEmpty() ? Position.NONE : settings.get(0).pos();
        new Hcl1Ast.ObjectList(start, settings).accept(walker, TreeWalker.WalkContext.root());
        walker.flushComments();
        return out.tokens();
    }

    /**
     * Wraps module variables in an {@code inputs} attribute. The synthetic nodes take the
     * position of the first variable and have no closing brace position.
     */
    private static Hcl1Ast.ObjectItem inputs(List<Hcl1Ast.ObjectItem> variables) {
        Position pos = variables.get(0).pos();
        Hcl1Ast.ObjectType object = new Hcl1Ast.ObjectType(pos, Position.NONE, new Hcl1Ast.ObjectList(pos, variables));
        return new Hcl1Ast.ObjectItem(List.of(new Hcl1Ast.ObjectKey(INPUTS_KEY, pos)), object, null, null);
    }
}
