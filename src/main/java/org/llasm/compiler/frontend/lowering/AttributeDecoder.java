package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.frontend.parser.ast.AddrSpaceNode;
import org.llasm.compiler.frontend.parser.ast.AlignmentNode;

/**
 * Decodes attributes that are neither keywords of a closed vocabulary nor names:
 * presence-only markers, address spaces and alignments.
 */
public final class AttributeDecoder {

    private AttributeDecoder() {}

    /**
     * Presence-only markers such as {@code volatile}, {@code externally_initialized} or {@code ...}
     * carry no value; the marker's node (or token) is {@code null} exactly when it is absent.
     *
     * @param marker The marker node or token, or {@code null}.
     * @return {@code true} if the marker was written.
     */
    public static boolean isPresent(Object marker) {
        return marker != null;
    }

    /**
     * @param n An {@code addrspace(n)} attribute.
     * @return The address space.
     */
    public static long addrSpace(AddrSpaceNode n) {
        return LiteralDecoder.uint(n.n());
    }

    /**
     * @param n An {@code addrspace(n)} attribute, or {@code null}.
     * @return The address space, 0 when absent.
     */
    public static long optAddrSpace(AddrSpaceNode n) {
        return n == null ? 0 : addrSpace(n);
    }

    /**
     * @param n An {@code align n} attribute.
     * @return The alignment in bytes.
     * @throws LoweringException if the alignment is not a power of two.
     */
    public static long alignment(AlignmentNode n) throws LoweringException {
        long align = LiteralDecoder.uint(n.n());
        if (Long.bitCount(align) != 1) {
            throw new LoweringException(LoweringErrorCode.INVALID_ALIGNMENT, Long.toUnsignedString(align), "alignment",
                    "alignment " + Long.toUnsignedString(align) + " is not a power of two", n.source());
        }
        return align;
    }

    /**
     * @param n An {@code align n} attribute, or {@code null}.
     * @return The alignment, 0 when absent.
     * @throws LoweringException if the alignment is not a power of two.
     */
    public static long optAlignment(AlignmentNode n) throws LoweringException {
        return n == null ? 0 : alignment(n);
    }
}
