package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.frontend.parser.ast.BoolLitNode;
import org.llasm.compiler.frontend.parser.ast.StringLitNode;
import org.llasm.compiler.frontend.parser.ast.UintLitNode;
import org.llasm.compiler.util.EscapeCodec;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Converts literal tokens into typed values.
 */
public final class LiteralDecoder {

    private LiteralDecoder() {}

    /**
     * @param n A boolean literal.
     * @return Its value.
     * @throws InternalConsistencyException if the spelling is neither {@code true} nor {@code false}.
     */
    public static boolean bool(BoolLitNode n) {
        String text = n.token().text();
        switch (text) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new InternalConsistencyException(String.format(
                        "invalid boolean literal; expected `true` or `false`, got `%s`", text));
        }
    }

    /**
     * Parses an unsigned decimal literal into 64 bits. The result is to be read as unsigned
     * (see {@link Long#toUnsignedString(long)}).
     *
     * @param n An unsigned integer literal.
     * @return The value.
     * @throws InternalConsistencyException on an empty, signed, non-decimal or overflowing spelling.
     */
    public static long uint(UintLitNode n) {
        return parseUint(n.token().text());
    }

    /**
     * Batch form of {@link #uint(UintLitNode)}; order is preserved.
     *
     * @param ns The literals.
     * @return Their values.
     */
    public static long[] uints(List<UintLitNode> ns) {
        long[] xs = new long[ns.size()];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = uint(ns.get(i));
        }
        return xs;
    }

    /**
     * @param n A quoted string literal.
     * @return The decoded text and bytes.
     */
    public static StringLiteral string(StringLitNode n) {
        String text = n.token().text();
        if (!EscapeCodec.isQuoted(text)) {
            throw new InternalConsistencyException(String.format("invalid string literal %s; missing quotes", text));
        }
        byte[] bytes = EscapeCodec.unquote(text);
        return new StringLiteral(new String(bytes, StandardCharsets.UTF_8), bytes);
    }

    static long parseUint(String text) {
        // Long.parseUnsignedLong would accept a leading '+'; the grammar's optional sign is not supported.
        if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InternalConsistencyException(String.format(
                    "unable to parse unsigned integer literal %s; not an unsigned decimal", IdentifierDecoder.quoteForMessage(text)));
        }
        try {
            return Long.parseUnsignedLong(text, 10);
        } catch (NumberFormatException e) {
            throw new InternalConsistencyException(String.format(
                    "unable to parse unsigned integer literal %s; value out of range", IdentifierDecoder.quoteForMessage(text)), e);
        }
    }
}
