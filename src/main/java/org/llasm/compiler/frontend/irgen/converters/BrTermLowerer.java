package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.ITerminatorLowerer;
import org.llasm.compiler.frontend.parser.ast.BrTermNode;
import org.llasm.compiler.ir.IrTerminator;

/**
 * Lowers unconditional branches.
 */
public final class BrTermLowerer implements ITerminatorLowerer<BrTermNode> {

	@Override
	public IrTerminator lower(BrTermNode node, FunctionLoweringContext ctx) throws LoweringException {
		return new IrTerminator.Br(ctx.resolveBlock(node.target(), "branch target"));
	}
}
