package org.llasm.compiler.ir;

/**
 * One arm of a {@code switch}.
 *
 * @param x The discriminant constant.
 * @param target The block control transfers to when the switched value equals {@code x}.
 */
public record IrCase(IrConstant x, IrBasicBlock target) {
}
