package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.parser.ast.InstructionNode;
import org.llasm.compiler.frontend.parser.ast.TerminatorNode;
import org.llasm.compiler.ir.IrInstruction;
import org.llasm.compiler.ir.IrTerminator;
import org.llasm.compiler.ir.IrType;

/**
 * Fallback for instructions and terminators without a registered lowerer.
 * Reports them as not yet supported.
 */
public final class DefaultInstructionLowerer implements IInstructionLowerer<InstructionNode, IrInstruction>,
		ITerminatorLowerer<TerminatorNode> {

	@Override
	public IrType resultType(InstructionNode node) throws UnimplementedFeatureException {
		throw new UnimplementedFeatureException("instruction", node.opcode().text());
	}

	@Override
	public IrInstruction declare(InstructionNode node, String name, IrType type) {
		throw new InternalConsistencyException("no lowerer for instruction " + node.opcode().text());
	}

	@Override
	public void complete(InstructionNode node, IrInstruction shell, FunctionLoweringContext ctx) {
		throw new InternalConsistencyException("no lowerer for instruction " + node.opcode().text());
	}

	@Override
	public IrTerminator lower(TerminatorNode node, FunctionLoweringContext ctx) throws UnimplementedFeatureException {
		throw new UnimplementedFeatureException("terminator", node.opcode().text());
	}
}
