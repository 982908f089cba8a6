package org.llasm.compiler.ir;

/**
 * The type of basic blocks.
 */
public record IrLabelType() implements IrType {

    public static final IrLabelType INSTANCE = new IrLabelType();

    @Override
    public String toString() {
        return "label";
    }
}
