package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * {@code br label %target}
 *
 * @param opcode The opcode token.
 * @param target The target block.
 */
public record BrTermNode(Token opcode, LocalIdentNode target) implements TerminatorNode {
}
