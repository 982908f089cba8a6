package org.llasm.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block. Blocks are created before any instruction operand is lowered so that
 * branches and {@code phi} incomings can refer to blocks further down the function.
 */
public final class IrBasicBlock implements IrValue {

    private final String name;
    private final List<IrInstruction> instructions = new ArrayList<>();
    private IrTerminator terminator;

    /**
     * @param name The block name (implicit numeric names included).
     */
    public IrBasicBlock(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public void addInstruction(IrInstruction instruction) {
        instructions.add(instruction);
    }

    public List<IrInstruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    /**
     * @return The terminator, or {@code null} while the block is not lowered yet.
     */
    public IrTerminator terminator() {
        return terminator;
    }

    public void setTerminator(IrTerminator terminator) {
        this.terminator = terminator;
    }

    @Override
    public IrType type() {
        return IrLabelType.INSTANCE;
    }

    @Override
    public String ident() {
        return "%" + name;
    }

    @Override
    public String toString() {
        return "IrBasicBlock{" + ident() + "}";
    }
}
