package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code br i1 <cond>, label %t, label %f}
 *
 * @param opcode The opcode token.
 * @param cond The branch condition.
 * @param targetTrue The target taken when the condition holds.
 * @param targetFalse The target taken otherwise.
 */
public record CondBrTermNode(Token opcode, TypedValueNode cond, LocalIdentNode targetTrue, LocalIdentNode targetFalse)
        implements TerminatorNode {
}
