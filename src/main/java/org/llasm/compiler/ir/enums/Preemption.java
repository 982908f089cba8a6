package org.llasm.compiler.ir.enums;

/**
 * Runtime preemption specifier of a global value.
 */
public enum Preemption {
    NONE,
    DSO_LOCAL,
    DSO_PREEMPTABLE,
}
