package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code %x = icmp <pred> <type> <x>, <y>}
 *
 * @param name The result name, or {@code null}.
 * @param opcode The opcode token.
 * @param pred The integer comparison predicate.
 * @param type The operand type.
 * @param x The first operand.
 * @param y The second operand.
 */
public record ICmpInstNode(
        LocalIdentNode name,
        Token opcode,
        KeywordNode pred,
        TypeNode type,
        ValueNode x,
        ValueNode y
) implements InstructionNode {
}
