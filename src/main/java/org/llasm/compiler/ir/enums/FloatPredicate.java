package org.llasm.compiler.ir.enums;

/**
 * Floating-point comparison predicate of {@code fcmp}. {@code O*} predicates are ordered
 * (false if either operand is NaN), {@code U*} predicates unordered.
 */
public enum FloatPredicate {
    FALSE,
    OEQ,
    OGT,
    OGE,
    OLT,
    OLE,
    ONE,
    ORD,
    UEQ,
    UGT,
    UGE,
    ULT,
    ULE,
    UNE,
    UNO,
    TRUE,
}
