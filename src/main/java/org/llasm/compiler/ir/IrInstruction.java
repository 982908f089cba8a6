package org.llasm.compiler.ir;

/**
 * Base class of non-terminator instructions.
 * <p>
 * An instruction is created as a shell carrying only its name and result type, so that it can be
 * referenced before its operands are known (e.g. by a loop-carried {@code phi}). Its operands are
 * supplied exactly once through the subclass's {@code complete} method.
 */
public abstract class IrInstruction implements IrValue {

    private final String name;
    private final IrType type;
    private boolean complete;

    /**
     * @param name The result name, or {@code null} if the instruction produces no value.
     * @param type The result type.
     */
    protected IrInstruction(String name, IrType type) {
        this.name = name;
        this.type = type;
    }

    /**
     * @return The result name, or {@code null} for instructions without a result.
     */
    public String name() {
        return name;
    }

    @Override
    public IrType type() {
        return type;
    }

    @Override
    public String ident() {
        return "%" + name;
    }

    /**
     * @return {@code true} once the operands have been supplied.
     */
    public boolean isComplete() {
        return complete;
    }

    protected final void markComplete() {
        if (complete) {
            throw new IllegalStateException("instruction " + ident() + " already completed");
        }
        complete = true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (name != null ? ident() + " : " : "") + type + "}";
    }
}
