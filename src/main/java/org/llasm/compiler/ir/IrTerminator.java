package org.llasm.compiler.ir;

import java.util.List;

/**
 * Terminators of basic blocks.
 */
public sealed interface IrTerminator permits IrTerminator.Ret, IrTerminator.Br, IrTerminator.CondBr, IrTerminator.Switch {

    /**
     * {@code ret}.
     * @param x The returned value, or {@code null} for {@code ret void}.
     */
    record Ret(IrValue x) implements IrTerminator {}

    /**
     * Unconditional {@code br}.
     * @param target The target block.
     */
    record Br(IrBasicBlock target) implements IrTerminator {}

    /**
     * Conditional {@code br}.
     * @param cond The {@code i1} condition.
     * @param targetTrue The block taken when the condition holds.
     * @param targetFalse The block taken otherwise.
     */
    record CondBr(IrValue cond, IrBasicBlock targetTrue, IrBasicBlock targetFalse) implements IrTerminator {}

    /**
     * {@code switch}.
     * @param x The value switched on.
     * @param defaultTarget The default block.
     * @param cases The arms.
     */
    record Switch(IrValue x, IrBasicBlock defaultTarget, List<IrCase> cases) implements IrTerminator {
        public Switch {
            cases = List.copyOf(cases);
        }
    }
}
