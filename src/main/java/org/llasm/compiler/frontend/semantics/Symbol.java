package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.frontend.lexer.Token;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrValue;

/**
 * A named entity of a function or module scope.
 *
 * @param name The decoded name, without sigil.
 * @param kind What the name denotes.
 * @param entity The program-model entity the name is bound to.
 * @param declaredAt The token of the declaration, or {@code null} for implicitly numbered entities.
 */
public record Symbol(String name, Kind kind, IrValue entity, Token declaredAt) {

    /**
     * The kind of entity a symbol denotes.
     */
    public enum Kind {
        /** A parameter, an instruction result, a global variable or a function. */
        VALUE,
        /** A basic block. */
        BASIC_BLOCK,
        /** Anything else that shares the namespace. */
        OTHER
    }

    /**
     * @param name The decoded name.
     * @param value The value.
     * @param declaredAt The declaration token, or {@code null}.
     * @return A {@link Kind#VALUE} symbol.
     */
    public static Symbol value(String name, IrValue value, Token declaredAt) {
        return new Symbol(name, Kind.VALUE, value, declaredAt);
    }

    /**
     * @param name The decoded name.
     * @param block The block.
     * @param declaredAt The declaration token, or {@code null}.
     * @return A {@link Kind#BASIC_BLOCK} symbol.
     */
    public static Symbol block(String name, IrBasicBlock block, Token declaredAt) {
        return new Symbol(name, Kind.BASIC_BLOCK, block, declaredAt);
    }
}
