package org.llasm.compiler.ir;

/**
 * Integer type of a given bit width.
 *
 * @param bitSize The width in bits, at least 1.
 */
public record IrIntType(int bitSize) implements IrType {

    /** The boolean type {@code i1}. */
    public static final IrIntType I1 = new IrIntType(1);

    public IrIntType {
        if (bitSize < 1) {
            throw new IllegalArgumentException("integer type width must be positive, got " + bitSize);
        }
    }

    @Override
    public String toString() {
        return "i" + bitSize;
    }
}
