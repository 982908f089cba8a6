package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.CallingConvention;
import org.llasm.compiler.ir.enums.Tail;

import java.util.List;

/**
 * {@code call}. A call returning {@code void} has no result name.
 */
public final class IrCallInst extends IrInstruction {

    private Tail tail = Tail.NONE;
    private CallingConvention callingConvention = CallingConvention.NONE;
    private IrValue callee;
    private List<IrValue> args = List.of();

    public IrCallInst(String name, IrType returnType) {
        super(name, returnType);
    }

    public void complete(Tail tail, CallingConvention callingConvention, IrValue callee, List<IrValue> args) {
        markComplete();
        this.tail = tail;
        this.callingConvention = callingConvention;
        this.callee = callee;
        this.args = List.copyOf(args);
    }

    public Tail tail() {
        return tail;
    }

    public CallingConvention callingConvention() {
        return callingConvention;
    }

    public IrValue callee() {
        return callee;
    }

    public List<IrValue> args() {
        return args;
    }
}
