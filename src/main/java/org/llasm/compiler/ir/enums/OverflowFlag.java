package org.llasm.compiler.ir.enums;

/**
 * A single integer overflow flag. Instructions carry a set of these.
 */
public enum OverflowFlag {
    NSW,
    NUW,
}
