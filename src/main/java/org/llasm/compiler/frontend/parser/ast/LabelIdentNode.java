package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A basic block label definition, spelled with a trailing {@code :}.
 *
 * @param token The label token, terminator included.
 */
public record LabelIdentNode(Token token) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
