package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.lowering.LiteralDecoder;
import org.llasm.compiler.frontend.parser.ast.BoolLitNode;
import org.llasm.compiler.frontend.parser.ast.IntLitNode;
import org.llasm.compiler.frontend.parser.ast.ValueNode;
import org.llasm.compiler.ir.IrConstant;
import org.llasm.compiler.ir.IrIntConst;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrType;

import java.math.BigInteger;

/**
 * Lowers integer and boolean literals.
 * <p>
 * An integer literal is accepted for {@code iN} if it lies in the signed or the unsigned range
 * of {@code N} bits; the stored value is truncated to {@code N} bits and sign-extended. An {@code i1}
 * constant is stored as 0 or 1, like a boolean literal.
 */
public final class TypedConstantLowerer implements ConstantLowerer {

	@Override
	public IrConstant lower(IrType type, ValueNode value) throws LoweringException {
		if (value instanceof BoolLitNode b) {
			if (!IrIntType.I1.equals(type)) {
				throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, b.token().text(), "boolean constant",
						"boolean constant requires type i1, got " + type, b.source());
			}
			return new IrIntConst(IrIntType.I1, LiteralDecoder.bool(b) ? 1 : 0);
		}
		if (value instanceof IntLitNode i) {
			if (!(type instanceof IrIntType intType)) {
				throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, i.token().text(), "integer constant",
						"integer constant requires an integer type, got " + type, i.source());
			}
			return new IrIntConst(intType, parse(intType, i));
		}
		throw new InternalConsistencyException("not a constant: " + value.getClass().getSimpleName());
	}

	private static long parse(IrIntType type, IntLitNode n) throws LoweringException {
		String text = n.token().text();
		BigInteger x;
		try {
			x = new BigInteger(text);
		} catch (NumberFormatException e) {
			throw new InternalConsistencyException("unable to parse integer literal '" + text + "'", e);
		}
		int bits = type.bitSize();
		if (bits > Long.SIZE) {
			if (x.bitLength() >= Long.SIZE) {
				throw invalid(type, n, "value does not fit in 64 bits");
			}
			return x.longValue();
		}
		BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
		BigInteger max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
		if (x.compareTo(min) < 0 || x.compareTo(max) > 0) {
			throw invalid(type, n, "value out of range");
		}
		long v = x.longValue();
		if (bits == 1) {
			return v & 1;
		}
		int shift = Long.SIZE - bits;
		return (v << shift) >> shift;
	}

	private static LoweringException invalid(IrIntType type, IntLitNode n, String reason) {
		String text = n.token().text();
		return new LoweringException(LoweringErrorCode.INVALID_INTEGER_CONSTANT, text, "integer constant",
				String.format("invalid integer constant %s of type %s; %s", text, type, reason), n.source());
	}
}
