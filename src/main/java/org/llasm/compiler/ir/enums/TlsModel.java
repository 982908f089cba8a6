package org.llasm.compiler.ir.enums;

/**
 * Thread-local storage model of a global variable.
 */
public enum TlsModel {
    /** Not thread local. */
    NONE,
    /** {@code thread_local} without an explicit model. */
    GENERAL_DYNAMIC,
    LOCAL_DYNAMIC,
    INITIAL_EXEC,
    LOCAL_EXEC,
}
