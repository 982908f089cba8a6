package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.parser.ast.IncomingNode;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrIncoming;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrValue;

/**
 * Lowers the incoming arms of a {@code phi} instruction.
 * <p>
 * Both halves of an arm may refer forward: the value to an instruction further down the
 * function, the predecessor to a block that follows.
 */
public final class IncomingLowering {

	private final FunctionLoweringContext ctx;

	IncomingLowering(FunctionLoweringContext ctx) {
		this.ctx = ctx;
	}

	/**
	 * @param type The type of the {@code phi}.
	 * @param n    The arm, e.g. {@code [ %x, %loop ]}.
	 * @return The lowered arm.
	 * @throws LoweringException if the value is unresolved or mistyped, or if the predecessor
	 *                           does not name a basic block.
	 */
	public IrIncoming lower(IrType type, IncomingNode n) throws LoweringException {
		IrValue x = ctx.lowerValue(type, n.x(), "phi incoming value");
		IrBasicBlock pred = ctx.resolveBlock(n.pred(), "phi incoming predecessor");
		return new IrIncoming(x, pred);
	}
}
