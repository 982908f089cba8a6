package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.OverflowFlag;

import java.util.Set;

/**
 * Integer {@code add}.
 */
public final class IrAddInst extends IrInstruction {

    private Set<OverflowFlag> overflowFlags = Set.of();
    private IrValue x;
    private IrValue y;

    public IrAddInst(String name, IrType type) {
        super(name, type);
    }

    public void complete(Set<OverflowFlag> overflowFlags, IrValue x, IrValue y) {
        markComplete();
        this.overflowFlags = Set.copyOf(overflowFlags);
        this.x = x;
        this.y = y;
    }

    public Set<OverflowFlag> overflowFlags() {
        return overflowFlags;
    }

    public IrValue x() {
        return x;
    }

    public IrValue y() {
        return y;
    }
}
