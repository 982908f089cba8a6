package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * An integer type such as {@code i1} or {@code i64}.
 *
 * @param token The type token.
 */
public record IntTypeNode(Token token) implements TypeNode {
    @Override
    public Token anchor() {
        return token;
    }
}
