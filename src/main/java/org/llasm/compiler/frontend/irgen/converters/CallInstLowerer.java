package org.llasm.compiler.frontend.irgen.converters;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.irgen.FunctionLoweringContext;
import org.llasm.compiler.frontend.irgen.IInstructionLowerer;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.CallInstNode;
import org.llasm.compiler.frontend.parser.ast.TypedValueNode;
import org.llasm.compiler.ir.IrCallInst;
import org.llasm.compiler.ir.IrFunction;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code call} instructions. A call returning {@code void} has no result name.
 */
public final class CallInstLowerer implements IInstructionLowerer<CallInstNode, IrCallInst> {

	@Override
	public IrType resultType(CallInstNode node) throws LoweringException {
		return TypeLowering.lower(node.returnType());
	}

	@Override
	public IrCallInst declare(CallInstNode node, String name, IrType type) {
		return new IrCallInst(name, type);
	}

	@Override
	public void complete(CallInstNode node, IrCallInst shell, FunctionLoweringContext ctx)
			throws LoweringException, UnimplementedFeatureException {
		IrValue callee = ctx.lowerUntypedValue(node.callee(), "callee");
		List<IrValue> args = new ArrayList<>(node.args().size());
		for (TypedValueNode arg : node.args()) {
			args.add(ctx.lowerTypedValue(arg, "call argument"));
		}
		if (callee instanceof IrFunction f) {
			checkSignature(f, shell, args, node);
		}
		shell.complete(EnumResolver.optTail(node.tail()), EnumResolver.optCallingConvention(node.callingConv()),
				callee, args);
	}

	private static void checkSignature(IrFunction f, IrCallInst shell, List<IrValue> args, CallInstNode node)
			throws LoweringException {
		if (!f.returnType().equals(shell.type())) {
			throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, f.ident(), "call",
					String.format("call of %s expects return type %s, got %s", f.ident(), f.returnType(), shell.type()),
					node.source());
		}
		int fixed = f.params().size();
		if (args.size() < fixed || (!f.variadic() && args.size() > fixed)) {
			throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, f.ident(), "call",
					String.format("call of %s passes %d arguments, expected %s%d", f.ident(), args.size(),
							f.variadic() ? "at least " : "", fixed), node.source());
		}
		for (int i = 0; i < fixed; i++) {
			IrType expected = f.params().get(i).type();
			if (!expected.equals(args.get(i).type())) {
				throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, args.get(i).ident(), "call argument",
						String.format("argument %d of %s has type %s, expected %s", i, f.ident(), args.get(i).type(), expected),
						node.args().get(i).source());
			}
		}
	}
}
