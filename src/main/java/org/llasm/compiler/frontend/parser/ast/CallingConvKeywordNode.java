package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A calling convention given by name.
 *
 * @param keyword The calling convention keyword.
 */
public record CallingConvKeywordNode(KeywordNode keyword) implements CallingConvNode {
    @Override
    public Token anchor() {
        return keyword.token();
    }
}
