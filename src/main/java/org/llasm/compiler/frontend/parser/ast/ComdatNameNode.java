package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A comdat name, spelled with a leading {@code $}.
 *
 * @param token The name token, sigil included.
 */
public record ComdatNameNode(Token token) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
