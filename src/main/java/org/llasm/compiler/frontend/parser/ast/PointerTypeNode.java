package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * The opaque pointer type {@code ptr}, optionally in a non-default address space.
 *
 * @param token The type token.
 * @param addrSpace The address space, or {@code null}.
 */
public record PointerTypeNode(Token token, AddrSpaceNode addrSpace) implements TypeNode {
    @Override
    public Token anchor() {
        return token;
    }
}
