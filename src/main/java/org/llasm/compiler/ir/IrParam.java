package org.llasm.compiler.ir;

/**
 * A function parameter.
 *
 * @param name The parameter name (implicit numeric names included).
 * @param type The parameter type.
 */
public record IrParam(String name, IrType type) implements IrValue {

    @Override
    public String ident() {
        return "%" + name;
    }
}
