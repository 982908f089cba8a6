package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * The instruction that ends a basic block.
 */
public sealed interface TerminatorNode extends AstNode permits RetTermNode, BrTermNode, CondBrTermNode, SwitchTermNode {

    /**
     * @return The opcode token.
     */
    Token opcode();

    @Override
    default Token anchor() {
        return opcode();
    }
}
