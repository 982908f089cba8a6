package org.llasm.compiler.ir;

/**
 * A constant value.
 */
public sealed interface IrConstant extends IrValue permits IrIntConst {
}
