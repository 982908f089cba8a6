package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.parser.ast.TerminatorNode;
import org.llasm.compiler.ir.IrTerminator;

/**
 * Lowers one kind of terminator. Terminators produce no value, so they are lowered in the
 * resolving pass only.
 *
 * @param <T> The terminator node type handled by this lowerer.
 */
public interface ITerminatorLowerer<T extends TerminatorNode> {

	/**
	 * @param node The terminator.
	 * @param ctx  The function lowering context, with all local names declared.
	 * @return The lowered terminator.
	 * @throws LoweringException if an operand or target does not resolve.
	 * @throws UnimplementedFeatureException if the terminator is not supported.
	 */
	IrTerminator lower(T node, FunctionLoweringContext ctx) throws LoweringException, UnimplementedFeatureException;
}
