package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.parser.ast.FloatTypeNode;
import org.llasm.compiler.frontend.parser.ast.IntTypeNode;
import org.llasm.compiler.frontend.parser.ast.LabelTypeNode;
import org.llasm.compiler.frontend.parser.ast.PointerTypeNode;
import org.llasm.compiler.frontend.parser.ast.TypeNode;
import org.llasm.compiler.frontend.parser.ast.VoidTypeNode;
import org.llasm.compiler.ir.IrFloatType;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrLabelType;
import org.llasm.compiler.ir.IrPointerType;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrVoidType;

/**
 * Lowers type nodes to model types.
 */
public final class TypeLowering {

    /** Upper bound on integer widths accepted by the model. */
    public static final int MAX_INT_BITS = (1 << 23) - 1;

    public static final KeywordTable<IrFloatType.Kind> FLOAT_KINDS = KeywordTable.builder("floating-point type", IrFloatType.Kind.class)
            .put("half", IrFloatType.Kind.HALF)
            .put("bfloat", IrFloatType.Kind.BFLOAT)
            .put("float", IrFloatType.Kind.FLOAT)
            .put("double", IrFloatType.Kind.DOUBLE)
            .put("x86_fp80", IrFloatType.Kind.X86_FP80)
            .put("fp128", IrFloatType.Kind.FP128)
            .put("ppc_fp128", IrFloatType.Kind.PPC_FP128)
            .build();

    private TypeLowering() {}

    /**
     * @param n A type node.
     * @return The model type.
     * @throws LoweringException if an integer width is zero or too large.
     */
    public static IrType lower(TypeNode n) throws LoweringException {
        if (n instanceof IntTypeNode i) {
            return intType(i);
        }
        if (n instanceof FloatTypeNode f) {
            return new IrFloatType(FLOAT_KINDS.lookup(f.kind().text()));
        }
        if (n instanceof VoidTypeNode) {
            return IrVoidType.INSTANCE;
        }
        if (n instanceof LabelTypeNode) {
            return IrLabelType.INSTANCE;
        }
        if (n instanceof PointerTypeNode p) {
            return new IrPointerType(AttributeDecoder.optAddrSpace(p.addrSpace()));
        }
        throw new InternalConsistencyException("unknown type node " + n.getClass().getName());
    }

    private static IrIntType intType(IntTypeNode n) throws LoweringException {
        String text = n.token().text();
        if (text.length() < 2 || text.charAt(0) != 'i') {
            throw new InternalConsistencyException("invalid integer type `" + text + "`; missing 'i' prefix");
        }
        long bits = LiteralDecoder.parseUint(text.substring(1));
        if (bits == 0 || Long.compareUnsigned(bits, MAX_INT_BITS) > 0) {
            throw new LoweringException(LoweringErrorCode.INVALID_TYPE, text, "integer type",
                    "integer type width must be between 1 and " + MAX_INT_BITS + ", got " + Long.toUnsignedString(bits),
                    n.source());
        }
        return new IrIntType((int) bits);
    }
}
