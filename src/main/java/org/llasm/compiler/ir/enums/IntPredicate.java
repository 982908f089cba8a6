package org.llasm.compiler.ir.enums;

/**
 * Integer comparison predicate of {@code icmp}.
 */
public enum IntPredicate {
    EQUAL,
    NOT_EQUAL,
    UNSIGNED_GREATER_THAN,
    UNSIGNED_GREATER_THAN_OR_EQUAL,
    UNSIGNED_LESS_THAN,
    UNSIGNED_LESS_THAN_OR_EQUAL,
    SIGNED_GREATER_THAN,
    SIGNED_GREATER_THAN_OR_EQUAL,
    SIGNED_LESS_THAN,
    SIGNED_LESS_THAN_OR_EQUAL,
}
