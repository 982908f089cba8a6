package org.llasm.compiler.ir.enums;

/**
 * Operation of an {@code atomicrmw} instruction.
 */
public enum AtomicOp {
    XCHG,
    ADD,
    SUB,
    AND,
    NAND,
    OR,
    XOR,
    MAX,
    MIN,
    UMAX,
    UMIN,
    FADD,
    FSUB,
    FMAX,
    FMIN,
}
