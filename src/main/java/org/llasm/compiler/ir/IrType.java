package org.llasm.compiler.ir;

/**
 * Base type of all first-class types in the program model.
 */
public sealed interface IrType permits IrIntType, IrFloatType, IrVoidType, IrLabelType, IrPointerType {
}
