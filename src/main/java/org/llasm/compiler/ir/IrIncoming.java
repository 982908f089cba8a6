package org.llasm.compiler.ir;

/**
 * One incoming value of a {@code phi}: the value arriving from a given predecessor.
 *
 * @param x The incoming value.
 * @param pred The predecessor block.
 */
public record IrIncoming(IrValue x, IrBasicBlock pred) {
}
