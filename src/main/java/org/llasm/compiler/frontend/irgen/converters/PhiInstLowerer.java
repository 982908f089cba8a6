package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.IncomingNode;
import org.llasm.compiler.frontend.parser.ast.PhiInstNode;
import org.llasm.compiler.ir.IrIncoming;
import org.llasm.compiler.ir.IrPhiInst;
import org.llasm.compiler.ir.IrType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code phi} instructions. Incoming values commonly refer forward, e.g. to the
 * loop-carried value computed at the end of the loop body.
 */
public final class PhiInstLowerer implements IInstructionLowerer<PhiInstNode, IrPhiInst> {

	@Override
	public IrType resultType(PhiInstNode node) throws LoweringException {
		return TypeLowering.lower(node.type());
	}

	@Override
	public IrPhiInst declare(PhiInstNode node, String name, IrType type) {
		return new IrPhiInst(name, type);
	}

	@Override
	public void complete(PhiInstNode node, IrPhiInst shell, FunctionLoweringContext ctx) throws LoweringException {
		List<IrIncoming> incomings = new ArrayList<>(node.incomings().size());
		for (IncomingNode n : node.incomings()) {
			incomings.add(ctx.incomings().lower(shell.type(), n));
		}
		shell.complete(incomings, EnumResolver.fastMathFlags(node.fastMathFlags()));
	}
}
