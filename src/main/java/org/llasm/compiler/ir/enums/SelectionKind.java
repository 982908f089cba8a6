package org.llasm.compiler.ir.enums;

/**
 * Comdat selection kind. There is no "none": an absent kind means {@link #ANY}.
 */
public enum SelectionKind {
    ANY,
    EXACT_MATCH,
    LARGEST,
    NO_DEDUPLICATE,
    SAME_SIZE,
}
