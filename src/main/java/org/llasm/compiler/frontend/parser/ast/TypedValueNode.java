package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A value preceded by its type, e.g. {@code i32 %x} or {@code i8 42}.
 *
 * @param type The type.
 * @param value The value.
 */
public record TypedValueNode(TypeNode type, ValueNode value) implements AstNode {
    @Override
    public Token anchor() {
        return value.anchor();
    }
}
