package org.llasm.compiler.ir;

/**
 * Opaque pointer type.
 *
 * @param addrSpace The address space; 0 is the default.
 */
public record IrPointerType(long addrSpace) implements IrType {

    @Override
    public String toString() {
        return addrSpace == 0 ? "ptr" : "ptr addrspace(" + Long.toUnsignedString(addrSpace) + ")";
    }
}
