package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code $name = comdat <selection kind>}
 *
 * @param name The comdat name.
 * @param selectionKind The selection kind, or {@code null}.
 */
public record ComdatDefNode(ComdatNameNode name, KeywordNode selectionKind) implements TopLevelEntityNode {
    @Override
    public Token anchor() {
        return name.token();
    }
}
