package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A keyword from one of the closed attribute vocabularies (linkage, ordering, predicate, ...).
 *
 * @param token The keyword token.
 */
public record KeywordNode(Token token) implements AstNode {

    /**
     * @return The exact spelling of the keyword.
     */
    public String text() {
        return token.text();
    }

    @Override
    public Token anchor() {
        return token;
    }
}
