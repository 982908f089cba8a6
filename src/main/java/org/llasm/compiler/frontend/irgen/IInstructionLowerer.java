package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.parser.ast.InstructionNode;
import org.llasm.compiler.ir.IrInstruction;
import org.llasm.compiler.ir.IrType;

/**
 * Lowers one kind of instruction in two steps.
 * <p>
 * In the declaring pass, {@link #resultType} and {@link #declare} create an operand-less shell
 * that can already be referenced by name. In the resolving pass, {@link #complete} resolves
 * the operands and fills in the shell. Implementations should be stateless.
 *
 * @param <T> The instruction node type handled by this lowerer.
 * @param <I> The instruction model type produced.
 */
public interface IInstructionLowerer<T extends InstructionNode, I extends IrInstruction> {

	/**
	 * @param node The instruction.
	 * @return The type of the instruction's result; {@code void} if it produces none.
	 * @throws LoweringException if a type in the instruction is invalid.
	 * @throws UnimplementedFeatureException if the instruction is not supported.
	 */
	IrType resultType(T node) throws LoweringException, UnimplementedFeatureException;

	/**
	 * @param node The instruction.
	 * @param name The result name, or {@code null} if the result type is {@code void}.
	 * @param type The result type as returned by {@link #resultType}.
	 * @return The operand-less shell.
	 */
	I declare(T node, String name, IrType type);

	/**
	 * Resolves the operands of the instruction and completes the shell.
	 *
	 * @param node  The instruction.
	 * @param shell The shell created by {@link #declare}.
	 * @param ctx   The function lowering context, with all local names declared.
	 * @throws LoweringException if an operand does not resolve.
	 * @throws UnimplementedFeatureException if an operand uses an unsupported feature.
	 */
	void complete(T node, I shell, FunctionLoweringContext ctx) throws LoweringException, UnimplementedFeatureException;
}
