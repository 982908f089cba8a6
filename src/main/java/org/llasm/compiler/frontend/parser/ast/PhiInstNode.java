package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code %x = phi [fast-math flags] <type> [ v0, %pred0 ], ...}
 *
 * @param name The result name, or {@code null}.
 * @param opcode The opcode token.
 * @param fastMathFlags Fast-math flags (only meaningful for floating-point phis).
 * @param type The result type.
 * @param incomings The incoming value/predecessor pairs.
 */
public record PhiInstNode(
        LocalIdentNode name,
        Token opcode,
        List<KeywordNode> fastMathFlags,
        TypeNode type,
        List<IncomingNode> incomings
) implements InstructionNode {
}
