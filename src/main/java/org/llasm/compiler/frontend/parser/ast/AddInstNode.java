package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code %x = add [nuw] [nsw] <type> <x>, <y>}
 *
 * @param name The result name, or {@code null}.
 * @param opcode The opcode token.
 * @param overflowFlags The overflow flags.
 * @param type The operand and result type.
 * @param x The first operand.
 * @param y The second operand.
 */
public record AddInstNode(
        LocalIdentNode name,
        Token opcode,
        List<KeywordNode> overflowFlags,
        TypeNode type,
        ValueNode x,
        ValueNode y
) implements InstructionNode {
}
