package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.IntPredicate;

/**
 * Integer comparison; the result is {@code i1}.
 */
public final class IrICmpInst extends IrInstruction {

    private IntPredicate pred;
    private IrValue x;
    private IrValue y;

    public IrICmpInst(String name) {
        super(name, IrIntType.I1);
    }

    public void complete(IntPredicate pred, IrValue x, IrValue y) {
        markComplete();
        this.pred = pred;
        this.x = x;
        this.y = y;
    }

    public IntPredicate pred() {
        return pred;
    }

    public IrValue x() {
        return x;
    }

    public IrValue y() {
        return y;
    }
}
