package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.FastMathFlag;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code phi}: selects a value depending on the predecessor control arrived from.
 */
public final class IrPhiInst extends IrInstruction {

    private List<IrIncoming> incomings = List.of();
    private Set<FastMathFlag> fastMathFlags = EnumSet.noneOf(FastMathFlag.class);

    public IrPhiInst(String name, IrType type) {
        super(name, type);
    }

    public void complete(List<IrIncoming> incomings, Set<FastMathFlag> fastMathFlags) {
        markComplete();
        this.incomings = List.copyOf(incomings);
        this.fastMathFlags = Set.copyOf(fastMathFlags);
    }

    public List<IrIncoming> incomings() {
        return incomings;
    }

    public Set<FastMathFlag> fastMathFlags() {
        return fastMathFlags;
    }
}
