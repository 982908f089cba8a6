package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A boolean literal.
 *
 * @param token The literal token.
 */
public record BoolLitNode(Token token) implements ValueNode {
    @Override
    public Token anchor() {
        return token;
    }
}
