package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * One arm of a {@code switch} terminator: {@code i32 1, label %target}.
 *
 * @param x The discriminant constant.
 * @param target The target basic block.
 */
public record CaseNode(TypedValueNode x, LocalIdentNode target) implements AstNode {
    @Override
    public Token anchor() {
        return x.anchor();
    }
}
