package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code %x = atomicrmw [volatile] <op> ptr <dst>, <type> <x> <ordering>}
 *
 * @param name The result name, or {@code null}.
 * @param opcode The opcode token.
 * @param volatileMarker The {@code volatile} token, or {@code null}.
 * @param op The atomic operation.
 * @param dst The address operand.
 * @param x The value operand.
 * @param ordering The atomic ordering.
 */
public record AtomicRmwInstNode(
        LocalIdentNode name,
        Token opcode,
        Token volatileMarker,
        KeywordNode op,
        TypedValueNode dst,
        TypedValueNode x,
        KeywordNode ordering
) implements InstructionNode {
}
