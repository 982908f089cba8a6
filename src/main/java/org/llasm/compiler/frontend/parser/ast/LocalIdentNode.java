package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A function-scope identifier, spelled with a leading {@code %}. Used for local values and
 * for references to basic blocks.
 *
 * @param token The identifier token, sigil included.
 */
public record LocalIdentNode(Token token) implements ValueNode {
    @Override
    public Token anchor() {
        return token;
    }
}
