package org.llasm.compiler.ir.enums;

/**
 * Visibility of a global value.
 */
public enum Visibility {
    NONE,
    DEFAULT,
    HIDDEN,
    PROTECTED,
}
