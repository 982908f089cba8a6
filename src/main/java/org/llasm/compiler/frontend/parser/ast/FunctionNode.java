package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A function definition ({@code define}) or declaration ({@code declare}).
 *
 * @param header The function header.
 * @param blocks The body; empty for a declaration.
 */
public record FunctionNode(FunctionHeaderNode header, List<BasicBlockNode> blocks) implements TopLevelEntityNode {

    /**
     * @return {@code true} if this function has a body.
     */
    public boolean isDefinition() {
        return !blocks.isEmpty();
    }

    @Override
    public Token anchor() {
        return header.anchor();
    }
}
