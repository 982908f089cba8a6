package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.SelectionKind;

/**
 * A comdat definition.
 *
 * @param name The comdat name, without {@code $}.
 * @param kind The selection kind.
 */
public record IrComdat(String name, SelectionKind kind) {
}
