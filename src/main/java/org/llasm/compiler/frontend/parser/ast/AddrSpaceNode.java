package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * An {@code addrspace(<n>)} attribute.
 *
 * @param token The {@code addrspace} token.
 * @param n The address space number.
 */
public record AddrSpaceNode(Token token, UintLitNode n) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
