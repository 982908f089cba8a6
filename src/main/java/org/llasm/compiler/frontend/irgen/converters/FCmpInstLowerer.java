package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.FCmpInstNode;
import org.llasm.compiler.ir.IrFCmpInst;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrType;

/**
 * Lowers {@code fcmp} instructions. The result is always {@code i1}.
 */
public final class FCmpInstLowerer implements IInstructionLowerer<FCmpInstNode, IrFCmpInst> {

	@Override
	public IrType resultType(FCmpInstNode node) {
		return IrIntType.I1;
	}

	@Override
	public IrFCmpInst declare(FCmpInstNode node, String name, IrType type) {
		return new IrFCmpInst(name);
	}

	@Override
	public void complete(FCmpInstNode node, IrFCmpInst shell, FunctionLoweringContext ctx) throws LoweringException {
		IrType operandType = TypeLowering.lower(node.type());
		shell.complete(EnumResolver.fastMathFlags(node.fastMathFlags()),
				EnumResolver.floatPredicate(node.pred()),
				ctx.lowerValue(operandType, node.x(), "fcmp operand"),
				ctx.lowerValue(operandType, node.y(), "fcmp operand"));
	}
}
