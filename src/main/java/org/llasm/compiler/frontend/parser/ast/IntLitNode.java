package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A (possibly signed) decimal integer constant in value position.
 *
 * @param token The literal token.
 */
public record IntLitNode(Token token) implements ValueNode {
    @Override
    public Token anchor() {
        return token;
    }
}
