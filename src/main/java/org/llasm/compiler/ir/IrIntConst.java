package org.llasm.compiler.ir;

/**
 * Integer constant. The value holds the two's complement bit pattern truncated to the type's width.
 *
 * @param type The integer type.
 * @param value The value.
 */
public record IrIntConst(IrIntType type, long value) implements IrConstant {

    @Override
    public String ident() {
        if (type.bitSize() == 1) {
            return value == 0 ? "false" : "true";
        }
        return Long.toString(value);
    }
}
