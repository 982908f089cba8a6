package org.llasm.compiler.ir.enums;

/**
 * A single fast-math flag. Instructions carry a set of these.
 */
public enum FastMathFlag {
    AFN,
    ARCP,
    CONTRACT,
    FAST,
    NINF,
    NNAN,
    NSZ,
    REASSOC,
}
