package org.llasm.compiler.ir;

/**
 * Anything that can appear in operand position: constants, parameters, instruction results,
 * basic blocks, globals and functions.
 */
public interface IrValue {

    /**
     * @return The type of this value.
     */
    IrType type();

    /**
     * @return The identifier of this value as it would appear in operand position (e.g. {@code %x}, {@code 42}).
     */
    String ident();
}
