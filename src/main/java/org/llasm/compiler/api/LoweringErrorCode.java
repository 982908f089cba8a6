package org.llasm.compiler.api;

/**
 * Defines unique, testable error codes for the semantic failures that can occur while lowering.
 * This decouples the test logic from the wording of the error messages.
 */
public enum LoweringErrorCode {
    // region Name resolution
    /** A name was referenced but never declared in the scope being searched. */
    UNRESOLVED_REFERENCE,
    /** A name resolved, but to an entity of the wrong kind (e.g. a value where a block was required). */
    KIND_MISMATCH,
    /** A name was declared twice in the same scope. */
    REDEFINITION,
    /** An explicit numeric local name does not match the next implicit id. */
    INVALID_LOCAL_ID,
    // endregion

    // region Values and types
    /** An operand's type does not match the type the construct requires. */
    TYPE_MISMATCH,
    /** An integer constant does not fit its declared type. */
    INVALID_INTEGER_CONSTANT,
    /** A type spelling is malformed (e.g. a zero-width integer type). */
    INVALID_TYPE,
    /** An alignment attribute is not a power of two. */
    INVALID_ALIGNMENT,
    // endregion

    // region General
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
