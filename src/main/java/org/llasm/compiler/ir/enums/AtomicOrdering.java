package org.llasm.compiler.ir.enums;

/**
 * Memory ordering constraint of an atomic instruction.
 */
public enum AtomicOrdering {
    UNORDERED,
    MONOTONIC,
    ACQUIRE,
    RELEASE,
    ACQ_REL,
    SEQ_CST,
}
