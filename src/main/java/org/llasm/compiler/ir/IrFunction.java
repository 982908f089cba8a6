package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.CallingConvention;

import java.util.List;

/**
 * A function. Created from its header; the body is attached when the function is lowered.
 */
public final class IrFunction implements IrValue {

    private final String name;
    private final IrLinkageAttributes attributes;
    private final CallingConvention callingConvention;
    private final IrType returnType;
    private final List<IrParam> params;
    private final boolean variadic;
    private final long addrSpace;
    private final long alignment;
    private IrComdat comdat;
    private List<IrBasicBlock> blocks = List.of();

    /**
     * @param name The function name, without {@code @}.
     * @param attributes Linkage-related attributes.
     * @param callingConvention The calling convention.
     * @param returnType The return type.
     * @param params The parameters.
     * @param variadic Whether the function takes a variable argument list.
     * @param addrSpace The address space.
     * @param alignment The alignment in bytes, 0 if unspecified.
     */
    public IrFunction(String name, IrLinkageAttributes attributes, CallingConvention callingConvention, IrType returnType,
                      List<IrParam> params, boolean variadic, long addrSpace, long alignment) {
        this.name = name;
        this.attributes = attributes;
        this.callingConvention = callingConvention;
        this.returnType = returnType;
        this.params = List.copyOf(params);
        this.variadic = variadic;
        this.addrSpace = addrSpace;
        this.alignment = alignment;
    }

    public String name() {
        return name;
    }

    public IrLinkageAttributes attributes() {
        return attributes;
    }

    public CallingConvention callingConvention() {
        return callingConvention;
    }

    public IrType returnType() {
        return returnType;
    }

    public List<IrParam> params() {
        return params;
    }

    public boolean variadic() {
        return variadic;
    }

    public long addrSpace() {
        return addrSpace;
    }

    public long alignment() {
        return alignment;
    }

    public IrComdat comdat() {
        return comdat;
    }

    public void setComdat(IrComdat comdat) {
        this.comdat = comdat;
    }

    /**
     * @return The basic blocks in source order; empty for a declaration.
     */
    public List<IrBasicBlock> blocks() {
        return blocks;
    }

    public void setBlocks(List<IrBasicBlock> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    @Override
    public IrType type() {
        return new IrPointerType(addrSpace);
    }

    @Override
    public String ident() {
        return "@" + name;
    }

    @Override
    public String toString() {
        return "IrFunction{" + ident() + ", blocks=" + blocks.size() + "}";
    }
}
