package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.AddInstNode;
import org.llasm.compiler.ir.IrAddInst;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrValue;

/**
 * Lowers {@code add} instructions.
 */
public final class AddInstLowerer implements IInstructionLowerer<AddInstNode, IrAddInst> {

	@Override
	public IrType resultType(AddInstNode node) throws LoweringException {
		return TypeLowering.lower(node.type());
	}

	@Override
	public IrAddInst declare(AddInstNode node, String name, IrType type) {
		return new IrAddInst(name, type);
	}

	@Override
	public void complete(AddInstNode node, IrAddInst shell, FunctionLoweringContext ctx) throws LoweringException {
		IrValue x = ctx.lowerValue(shell.type(), node.x(), "add operand");
		IrValue y = ctx.lowerValue(shell.type(), node.y(), "add operand");
		shell.complete(EnumResolver.overflowFlags(node.overflowFlags()), x, y);
	}
}
