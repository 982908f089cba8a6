package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A module-scope identifier, spelled with a leading {@code @}.
 *
 * @param token The identifier token, sigil included.
 */
public record GlobalIdentNode(Token token) implements ValueNode {
    @Override
    public Token anchor() {
        return token;
    }
}
