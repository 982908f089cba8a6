package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A function parameter.
 *
 * @param type The parameter type.
 * @param name The parameter name, or {@code null} for an unnamed parameter.
 */
public record ParamNode(TypeNode type, LocalIdentNode name) implements AstNode {
    @Override
    public Token anchor() {
        return name != null ? name.token() : type.anchor();
    }
}
