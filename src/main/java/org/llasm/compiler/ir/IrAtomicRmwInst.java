package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.AtomicOp;
import org.llasm.compiler.ir.enums.AtomicOrdering;

/**
 * {@code atomicrmw}: atomically modifies memory and yields the previous value.
 */
public final class IrAtomicRmwInst extends IrInstruction {

    private boolean isVolatile;
    private AtomicOp op;
    private IrValue dst;
    private IrValue x;
    private AtomicOrdering ordering;

    public IrAtomicRmwInst(String name, IrType type) {
        super(name, type);
    }

    public void complete(boolean isVolatile, AtomicOp op, IrValue dst, IrValue x, AtomicOrdering ordering) {
        markComplete();
        this.isVolatile = isVolatile;
        this.op = op;
        this.dst = dst;
        this.x = x;
        this.ordering = ordering;
    }

    public boolean isVolatile() {
        return isVolatile;
    }

    public AtomicOp op() {
        return op;
    }

    public IrValue dst() {
        return dst;
    }

    public IrValue x() {
        return x;
    }

    public AtomicOrdering ordering() {
        return ordering;
    }
}
