package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.FastMathFlag;
import org.llasm.compiler.ir.enums.FloatPredicate;

import java.util.Set;

/**
 * Floating-point comparison; the result is {@code i1}.
 */
public final class IrFCmpInst extends IrInstruction {

    private Set<FastMathFlag> fastMathFlags = Set.of();
    private FloatPredicate pred;
    private IrValue x;
    private IrValue y;

    public IrFCmpInst(String name) {
        super(name, IrIntType.I1);
    }

    public void complete(Set<FastMathFlag> fastMathFlags, FloatPredicate pred, IrValue x, IrValue y) {
        markComplete();
        this.fastMathFlags = Set.copyOf(fastMathFlags);
        this.pred = pred;
        this.x = x;
        this.y = y;
    }

    public Set<FastMathFlag> fastMathFlags() {
        return fastMathFlags;
    }

    public FloatPredicate pred() {
        return pred;
    }

    public IrValue x() {
        return x;
    }

    public IrValue y() {
        return y;
    }
}
