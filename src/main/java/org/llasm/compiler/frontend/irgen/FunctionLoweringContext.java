package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.lowering.IdentifierDecoder;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.BoolLitNode;
import org.llasm.compiler.frontend.parser.ast.GlobalIdentNode;
import org.llasm.compiler.frontend.parser.ast.IntLitNode;
import org.llasm.compiler.frontend.parser.ast.LocalIdentNode;
import org.llasm.compiler.frontend.parser.ast.TypedValueNode;
import org.llasm.compiler.frontend.parser.ast.ValueNode;
import org.llasm.compiler.frontend.semantics.ForwardReferenceResolver;
import org.llasm.compiler.frontend.semantics.SymbolTable;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrValue;

/**
 * State shared by the lowerers of one function body: the function's forward reference resolver,
 * the module-wide table of globals and functions, and the constant lowerer.
 * <p>
 * Operand lookups go through here so that local, global and constant operands are treated
 * alike by every instruction lowerer.
 */
public final class FunctionLoweringContext {

	private final String functionName;
	private final ForwardReferenceResolver locals;
	private final SymbolTable globals;
	private final ConstantLowerer constants;
	private final IncomingLowering incomings;
	private final CaseLowering cases;

	/**
	 * @param functionName The name of the function, for diagnostics.
	 * @param locals       The function's resolver.
	 * @param globals      The module's globals and functions.
	 * @param constants    The constant lowerer.
	 */
	public FunctionLoweringContext(String functionName, ForwardReferenceResolver locals, SymbolTable globals,
								   ConstantLowerer constants) {
		this.functionName = functionName;
		this.locals = locals;
		this.globals = globals;
		this.constants = constants;
		this.incomings = new IncomingLowering(this);
		this.cases = new CaseLowering(constants, locals);
	}

	public String functionName() {
		return functionName;
	}

	public ForwardReferenceResolver locals() {
		return locals;
	}

	public SymbolTable globals() {
		return globals;
	}

	public ConstantLowerer constants() {
		return constants;
	}

	public IncomingLowering incomings() {
		return incomings;
	}

	public CaseLowering cases() {
		return cases;
	}

	/**
	 * Lowers an operand that must have the given type.
	 *
	 * @param type      The expected type.
	 * @param value     The operand.
	 * @param construct The construct the operand belongs to, e.g. "add operand".
	 * @return The value.
	 * @throws LoweringException if a name does not resolve to a value of type {@code type}.
	 */
	public IrValue lowerValue(IrType type, ValueNode value, String construct) throws LoweringException {
		if (value instanceof IntLitNode || value instanceof BoolLitNode) {
			return constants.lower(type, value);
		}
		IrValue v = lowerUntypedValue(value, construct);
		if (!v.type().equals(type)) {
			throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, v.ident(), construct,
					String.format("type mismatch in %s; %s has type %s, expected %s", construct, v.ident(), v.type(), type),
					value.source());
		}
		return v;
	}

	/**
	 * Lowers a type-annotated operand.
	 */
	public IrValue lowerTypedValue(TypedValueNode tv, String construct) throws LoweringException {
		return lowerValue(TypeLowering.lower(tv.type()), tv.value(), construct);
	}

	/**
	 * Lowers an operand whose type is implied by the name it refers to, such as a callee.
	 */
	public IrValue lowerUntypedValue(ValueNode value, String construct) throws LoweringException {
		if (value instanceof LocalIdentNode l) {
			return locals.resolveValue(IdentifierDecoder.local(l), construct, l.source());
		}
		if (value instanceof GlobalIdentNode g) {
			return globals.resolveValue(IdentifierDecoder.global(g), construct, g.source());
		}
		if (value instanceof IntLitNode || value instanceof BoolLitNode) {
			throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, value.anchor().text(), construct,
					"constant operand of " + construct + " requires an explicit type", value.source());
		}
		throw new InternalConsistencyException("unknown value node " + value.getClass().getName());
	}

	/**
	 * Resolves a branch target.
	 */
	public IrBasicBlock resolveBlock(LocalIdentNode target, String construct) throws LoweringException {
		return locals.resolveBlock(IdentifierDecoder.local(target), construct, target.source());
	}
}
