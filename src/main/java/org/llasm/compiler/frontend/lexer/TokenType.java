package org.llasm.compiler.frontend.lexer;

/**
 * Defines the token types the lowering core consumes.
 */
public enum TokenType {
    // Identifiers.
    /** A module-scope identifier such as {@code @main} or {@code @"a b"}. */
    GLOBAL_IDENT,
    /** A function-scope identifier such as {@code %x} or {@code %0}. */
    LOCAL_IDENT,
    /** A basic block label definition such as {@code loop:}. */
    LABEL_IDENT,
    /** A comdat name such as {@code $foo}. */
    COMDAT_NAME,

    // Literals.
    /** {@code true} or {@code false}. */
    BOOL_LIT,
    /** An integer literal, possibly signed. */
    INT_LIT,
    /** A quoted string literal. */
    STRING_LIT,

    // Keywords.
    /** A keyword from one of the closed attribute vocabularies, or a type name. */
    KEYWORD
}
