package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * An {@code align <n>} attribute.
 *
 * @param token The {@code align} token.
 * @param n The alignment in bytes.
 */
public record AlignmentNode(Token token, UintLitNode n) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
