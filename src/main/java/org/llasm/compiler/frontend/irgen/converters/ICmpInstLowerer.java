package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.ICmpInstNode;
import org.llasm.compiler.ir.IrICmpInst;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrType;

/**
 * Lowers {@code icmp} instructions. The result is always {@code i1}.
 */
public final class ICmpInstLowerer implements IInstructionLowerer<ICmpInstNode, IrICmpInst> {

	@Override
	public IrType resultType(ICmpInstNode node) {
		return IrIntType.I1;
	}

	@Override
	public IrICmpInst declare(ICmpInstNode node, String name, IrType type) {
		return new IrICmpInst(name);
	}

	@Override
	public void complete(ICmpInstNode node, IrICmpInst shell, FunctionLoweringContext ctx) throws LoweringException {
		IrType operandType = TypeLowering.lower(node.type());
		shell.complete(EnumResolver.intPredicate(node.pred()),
				ctx.lowerValue(operandType, node.x(), "icmp operand"),
				ctx.lowerValue(operandType, node.y(), "icmp operand"));
	}
}
