package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.ITerminatorLowerer;
import org.llasm.compiler.frontend.parser.ast.CaseNode;
import org.llasm.compiler.frontend.parser.ast.SwitchTermNode;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrCase;
import org.llasm.compiler.ir.IrTerminator;
import org.llasm.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code switch} terminators. Every case discriminant must have the type of the
 * switch operand.
 */
public final class SwitchTermLowerer implements ITerminatorLowerer<SwitchTermNode> {

	@Override
	public IrTerminator lower(SwitchTermNode node, FunctionLoweringContext ctx) throws LoweringException {
		IrValue x = ctx.lowerTypedValue(node.x(), "switch operand");
		IrBasicBlock defaultTarget = ctx.resolveBlock(node.defaultTarget(), "switch default target");
		List<IrCase> cases = new ArrayList<>(node.cases().size());
		for (CaseNode n : node.cases()) {
			IrCase c = ctx.cases().lower(n);
			if (!c.x().type().equals(x.type())) {
				throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, c.x().ident(), "switch case discriminant",
						String.format("switch case discriminant has type %s, expected %s", c.x().type(), x.type()),
						n.x().source());
			}
			cases.add(c);
		}
		return new IrTerminator.Switch(x, defaultTarget, cases);
	}
}
