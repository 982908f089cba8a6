package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.ITerminatorLowerer;
import org.llasm.compiler.frontend.parser.ast.RetTermNode;
import org.llasm.compiler.ir.IrTerminator;

/**
 * Lowers {@code ret} and {@code ret void}.
 */
public final class RetTermLowerer implements ITerminatorLowerer<RetTermNode> {

	@Override
	public IrTerminator lower(RetTermNode node, FunctionLoweringContext ctx) throws LoweringException {
		if (node.value() == null) {
			return new IrTerminator.Ret(null);
		}
		return new IrTerminator.Ret(ctx.lowerTypedValue(node.value(), "return value"));
	}
}
