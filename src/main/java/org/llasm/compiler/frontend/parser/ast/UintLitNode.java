package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * An unsigned integer literal in attribute position (address spaces, alignments, calling convention codes).
 *
 * @param token The literal token.
 */
public record UintLitNode(Token token) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
