package com.tgupgrade.core.ast;

import com.tgupgrade.core.exception.Hcl1ParseException;

/**
 * Parses HCL 1 source text into an {@link Hcl1Ast.File}.
 *
 * <p>Implementations must attach lead and line comments to the items and literals they
 * belong to, and must also return the flat list of every comment group in the document,
 * attached or not.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Hcl1Parser parser = new AntlrHcl1Parser();
 * Hcl1Ast.File file = parser.parse(Files.readString(Paths.get("terraform.tfvars")));
 *
 * for (Hcl1Ast.ObjectItem item : file.root().items()) {
 *     System.out.println("Key: " + item.keyName());
 * }
 * }</pre>
 *
 * @see com.tgupgrade.core.ast.antlr.AntlrHcl1Parser
 * @since 1.0.0
 */
public interface Hcl1Parser {

    /**
     * Parses a document.
     *
     * @param source document text
     * @return parsed document
     * @throws Hcl1ParseException if the text is not valid HCL 1
     */
    Hcl1Ast.File parse(String source) throws Hcl1ParseException;
}
