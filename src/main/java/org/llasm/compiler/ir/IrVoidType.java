package org.llasm.compiler.ir;

/**
 * The {@code void} type.
 */
public record IrVoidType() implements IrType {

    public static final IrVoidType INSTANCE = new IrVoidType();

    @Override
    public String toString() {
        return "void";
    }
}
