package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.AttributeDecoder;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.AtomicRmwInstNode;
import org.llasm.compiler.ir.IrAtomicRmwInst;
import org.llasm.compiler.ir.IrPointerType;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrValue;

/**
 * Lowers {@code atomicrmw} instructions. The result has the type of the operand.
 */
public final class AtomicRmwInstLowerer implements IInstructionLowerer<AtomicRmwInstNode, IrAtomicRmwInst> {

	@Override
	public IrType resultType(AtomicRmwInstNode node) throws LoweringException {
		return TypeLowering.lower(node.x().type());
	}

	@Override
	public IrAtomicRmwInst declare(AtomicRmwInstNode node, String name, IrType type) {
		return new IrAtomicRmwInst(name, type);
	}

	@Override
	public void complete(AtomicRmwInstNode node, IrAtomicRmwInst shell, FunctionLoweringContext ctx) throws LoweringException {
		IrType dstType = TypeLowering.lower(node.dst().type());
		if (!(dstType instanceof IrPointerType)) {
			throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, dstType.toString(), "atomicrmw destination",
					"atomicrmw destination must be a pointer, got " + dstType, node.dst().source());
		}
		IrValue dst = ctx.lowerValue(dstType, node.dst().value(), "atomicrmw destination");
		IrValue x = ctx.lowerValue(shell.type(), node.x().value(), "atomicrmw operand");
		shell.complete(AttributeDecoder.isPresent(node.volatileMarker()), EnumResolver.atomicOp(node.op()), dst, x,
				EnumResolver.atomicOrdering(node.ordering()));
	}
}
