package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code %x = fcmp [fast-math flags] <pred> <type> <x>, <y>}
 *
 * @param name The result name, or {@code null}.
 * @param opcode The opcode token.
 * @param fastMathFlags The fast-math flags.
 * @param pred The floating-point comparison predicate.
 * @param type The operand type.
 * @param x The first operand.
 * @param y The second operand.
 */
public record FCmpInstNode(
        LocalIdentNode name,
        Token opcode,
        List<KeywordNode> fastMathFlags,
        KeywordNode pred,
        TypeNode type,
        ValueNode x,
        ValueNode y
) implements InstructionNode {
}
