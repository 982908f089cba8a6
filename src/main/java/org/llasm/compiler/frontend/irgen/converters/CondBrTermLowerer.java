package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.ITerminatorLowerer;
import org.llasm.compiler.frontend.parser.ast.CondBrTermNode;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrTerminator;
import org.llasm.compiler.ir.IrValue;

/**
 * Lowers conditional branches. The condition must be an {@code i1}.
 */
public final class CondBrTermLowerer implements ITerminatorLowerer<CondBrTermNode> {

	@Override
	public IrTerminator lower(CondBrTermNode node, FunctionLoweringContext ctx) throws LoweringException {
		IrValue cond = ctx.lowerValue(IrIntType.I1, node.cond().value(), "branch condition");
		return new IrTerminator.CondBr(cond,
				ctx.resolveBlock(node.targetTrue(), "branch target"),
				ctx.resolveBlock(node.targetFalse(), "branch target"));
	}
}
