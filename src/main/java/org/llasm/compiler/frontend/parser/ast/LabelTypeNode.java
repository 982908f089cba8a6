package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * The {@code label} type.
 *
 * @param token The type token.
 */
public record LabelTypeNode(Token token) implements TypeNode {
    @Override
    public Token anchor() {
        return token;
    }
}
