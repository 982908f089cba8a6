package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code [%x =] [tail|musttail|notail] call [cc] <type> <callee>(<args>)}
 *
 * @param name The result name, or {@code null}.
 * @param tail The tail marker keyword, or {@code null}.
 * @param opcode The opcode token.
 * @param callingConv The calling convention, or {@code null}.
 * @param returnType The return type.
 * @param callee The callee.
 * @param args The typed arguments.
 */
public record CallInstNode(
        LocalIdentNode name,
        KeywordNode tail,
        Token opcode,
        CallingConvNode callingConv,
        TypeNode returnType,
        ValueNode callee,
        List<TypedValueNode> args
) implements InstructionNode {
}
