package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.parser.ast.ValueNode;
import org.llasm.compiler.ir.IrConstant;
import org.llasm.compiler.ir.IrType;

/**
 * Lowers constant operands of a known type.
 * <p>
 * Implementations must be stateless with respect to the function being lowered.
 */
public interface ConstantLowerer {

	/**
	 * Lowers a constant.
	 *
	 * @param type  The type the constant must have.
	 * @param value The constant as written.
	 * @return The lowered constant, of type {@code type}.
	 * @throws LoweringException if the constant is out of range or does not fit the type.
	 */
	IrConstant lower(IrType type, ValueNode value) throws LoweringException;
}
