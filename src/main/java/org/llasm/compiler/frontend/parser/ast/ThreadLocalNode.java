package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * The {@code thread_local} marker of a global variable, optionally with an explicit model,
 * e.g. {@code thread_local(initialexec)}.
 *
 * @param token The {@code thread_local} token.
 * @param model The TLS model keyword, or {@code null} when none was given.
 */
public record ThreadLocalNode(Token token, KeywordNode model) implements AstNode {
    @Override
    public Token anchor() {
        return token;
    }
}
