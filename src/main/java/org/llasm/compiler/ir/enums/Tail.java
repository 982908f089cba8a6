package org.llasm.compiler.ir.enums;

/**
 * Tail call marker of a {@code call} instruction.
 */
public enum Tail {
    NONE,
    MUST_TAIL,
    NO_TAIL,
    TAIL,
}
