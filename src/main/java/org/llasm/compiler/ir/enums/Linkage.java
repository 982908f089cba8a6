package org.llasm.compiler.ir.enums;

/**
 * Linkage type of a global value.
 */
public enum Linkage {
    /** No linkage keyword was given; the model treats this as external. */
    NONE,
    APPENDING,
    AVAILABLE_EXTERNALLY,
    COMMON,
    INTERNAL,
    LINK_ONCE,
    LINK_ONCE_ODR,
    PRIVATE,
    WEAK,
    WEAK_ODR,
    EXTERNAL,
    EXTERN_WEAK,
}
