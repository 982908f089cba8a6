package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A basic block: an optional label, a list of instructions and a terminator.
 *
 * @param label The label, or {@code null} for an unnamed block.
 * @param instructions The non-terminator instructions.
 * @param terminator The terminator.
 */
public record BasicBlockNode(LabelIdentNode label, List<InstructionNode> instructions, TerminatorNode terminator)
        implements AstNode {

    @Override
    public Token anchor() {
        if (label != null) return label.token();
        if (!instructions.isEmpty()) return instructions.get(0).anchor();
        return terminator.anchor();
    }
}
