package org.llasm.compiler.ir;

/**
 * Floating-point type.
 *
 * @param kind The floating-point format.
 */
public record IrFloatType(Kind kind) implements IrType {

    /**
     * The supported floating-point formats.
     */
    public enum Kind {
        HALF,
        BFLOAT,
        FLOAT,
        DOUBLE,
        X86_FP80,
        FP128,
        PPC_FP128,
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase();
    }
}
