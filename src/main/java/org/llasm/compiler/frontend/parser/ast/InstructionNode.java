package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A non-terminator instruction.
 */
public sealed interface InstructionNode extends AstNode
        permits PhiInstNode, AddInstNode, ICmpInstNode, FCmpInstNode, AtomicRmwInstNode, CallInstNode {

    /**
     * @return The result name, or {@code null} if the instruction is unnamed.
     */
    LocalIdentNode name();

    /**
     * @return The opcode token.
     */
    Token opcode();

    @Override
    default Token anchor() {
        return opcode();
    }
}
