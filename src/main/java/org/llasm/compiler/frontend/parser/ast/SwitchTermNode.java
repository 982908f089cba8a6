package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code switch <type> <x>, label %default [ <cases> ]}
 *
 * @param opcode The opcode token.
 * @param x The value switched on.
 * @param defaultTarget The default target block.
 * @param cases The switch arms.
 */
public record SwitchTermNode(Token opcode, TypedValueNode x, LocalIdentNode defaultTarget, List<CaseNode> cases)
        implements TerminatorNode {
}
