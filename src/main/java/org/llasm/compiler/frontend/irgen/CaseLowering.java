package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.lowering.IdentifierDecoder;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.CaseNode;
import org.llasm.compiler.frontend.semantics.ForwardReferenceResolver;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrCase;
import org.llasm.compiler.ir.IrConstant;
import org.llasm.compiler.ir.IrType;

/**
 * Lowers one arm of a {@code switch} terminator, e.g. {@code i32 1, label %one}.
 * <p>
 * An arm is built only if both its discriminant and its target lower successfully. A failure
 * of either half is rethrown with its error code unchanged, attributed to that half.
 */
public final class CaseLowering {

	static final String DISCRIMINANT = "switch case discriminant";
	static final String TARGET = "switch case target";

	private final ConstantLowerer constants;
	private final ForwardReferenceResolver locals;

	/**
	 * @param constants The constant lowerer for discriminants.
	 * @param locals    The resolver of the enclosing function, in its resolving phase.
	 */
	public CaseLowering(ConstantLowerer constants, ForwardReferenceResolver locals) {
		this.constants = constants;
		this.locals = locals;
	}

	/**
	 * @param n The arm.
	 * @return The lowered arm.
	 * @throws LoweringException if the discriminant or the target fails to lower.
	 */
	public IrCase lower(CaseNode n) throws LoweringException {
		IrConstant x;
		try {
			IrType type = TypeLowering.lower(n.x().type());
			x = constants.lower(type, n.x().value());
		} catch (LoweringException e) {
			throw e.within(DISCRIMINANT);
		}
		IrBasicBlock target;
		try {
			target = locals.resolveBlock(IdentifierDecoder.local(n.target()), "label", n.target().source());
		} catch (LoweringException e) {
			throw e.within(TARGET);
		}
		return new IrCase(x, target);
	}
}
