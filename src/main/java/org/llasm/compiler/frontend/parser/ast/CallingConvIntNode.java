package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A calling convention given by numeric code, {@code cc <n>}.
 *
 * @param ccToken The {@code cc} keyword token.
 * @param code The numeric code.
 */
public record CallingConvIntNode(Token ccToken, UintLitNode code) implements CallingConvNode {
    @Override
    public Token anchor() {
        return ccToken;
    }
}
