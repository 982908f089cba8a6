package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of the syntax tree.
 *
 * @param entities The top-level entities in source order.
 */
public record ModuleNode(List<TopLevelEntityNode> entities) implements AstNode {
    @Override
    public Token anchor() {
        return entities.isEmpty() ? null : entities.get(0).anchor();
    }
}
