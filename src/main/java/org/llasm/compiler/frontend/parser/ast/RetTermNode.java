package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code ret void} or {@code ret <type> <x>}.
 *
 * @param opcode The opcode token.
 * @param value The returned value, or {@code null} for {@code ret void}.
 */
public record RetTermNode(Token opcode, TypedValueNode value) implements TerminatorNode {
}
