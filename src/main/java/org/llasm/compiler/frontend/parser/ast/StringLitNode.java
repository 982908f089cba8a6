package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A quoted string literal.
 *
 * @param token The literal token, quotes included.
 */
public record StringLitNode(Token token) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
