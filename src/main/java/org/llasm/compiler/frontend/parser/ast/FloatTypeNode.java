package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A floating-point type such as {@code double}.
 *
 * @param kind The float kind keyword.
 */
public record FloatTypeNode(KeywordNode kind) implements TypeNode {
    @Override
    public Token anchor() {
        return kind.token();
    }
}
