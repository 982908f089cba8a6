package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.frontend.parser.ast.ComdatNameNode;
import org.llasm.compiler.frontend.parser.ast.GlobalIdentNode;
import org.llasm.compiler.frontend.parser.ast.LabelIdentNode;
import org.llasm.compiler.frontend.parser.ast.LocalIdentNode;
import org.llasm.compiler.util.EscapeCodec;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Extracts the names denoted by identifier tokens: strips the sigil (or the label terminator)
 * and unquotes quoted spellings.
 * <p>
 * A token without its sigil cannot come out of a grammar-conformant parser, so it is reported
 * as an {@link InternalConsistencyException} rather than as a diagnostic.
 */
public final class IdentifierDecoder {

    private static final String GLOBAL_PREFIX = "@";
    private static final String LOCAL_PREFIX = "%";
    private static final String COMDAT_PREFIX = "$";
    private static final String LABEL_SUFFIX = ":";

    private IdentifierDecoder() {}

    /**
     * @param n A global identifier such as {@code @main} or {@code @"foo bar"}.
     * @return The name without {@code @}.
     */
    public static String global(GlobalIdentNode n) {
        return unquote(stripPrefix(n.token().text(), GLOBAL_PREFIX, "global identifier"));
    }

    /**
     * @param n A local identifier such as {@code %x}, {@code %0} or {@code %"a.b"}.
     * @return The name without {@code %}.
     */
    public static String local(LocalIdentNode n) {
        return unquote(stripPrefix(n.token().text(), LOCAL_PREFIX, "local identifier"));
    }

    /**
     * Decodes an optional local identifier.
     *
     * @param n The identifier, or {@code null} if the construct is unnamed.
     * @return Empty if there is no identifier; otherwise the decoded name, which may itself be
     *         the empty string for {@code %""}.
     */
    public static Optional<String> optionalLocal(LocalIdentNode n) {
        if (n == null) {
            return Optional.empty();
        }
        return Optional.of(local(n));
    }

    /**
     * @param n A label definition such as {@code entry:} or {@code "exit block":}.
     * @return The name without the trailing {@code :}.
     */
    public static String label(LabelIdentNode n) {
        String text = n.token().text();
        if (!text.endsWith(LABEL_SUFFIX)) {
            throw new InternalConsistencyException(String.format(
                    "invalid label identifier %s; missing '%s' suffix", quoteForMessage(text), LABEL_SUFFIX));
        }
        return unquote(text.substring(0, text.length() - LABEL_SUFFIX.length()));
    }

    /**
     * @param n The label, or {@code null} for an unnamed basic block.
     * @return Empty if there is no label, otherwise the decoded name.
     */
    public static Optional<String> optionalLabel(LabelIdentNode n) {
        if (n == null) {
            return Optional.empty();
        }
        return Optional.of(label(n));
    }

    /**
     * @param n A comdat name such as {@code $foo}.
     * @return The name without {@code $}.
     */
    public static String comdat(ComdatNameNode n) {
        return unquote(stripPrefix(n.token().text(), COMDAT_PREFIX, "comdat name"));
    }

    /**
     * Returns the unquoted version of {@code s} if quoted, and {@code s} unchanged otherwise.
     *
     * @param s A spelling without sigil.
     * @return The decoded name.
     */
    public static String unquote(String s) {
        if (EscapeCodec.isQuoted(s)) {
            return new String(EscapeCodec.unquote(s), StandardCharsets.UTF_8);
        }
        return s;
    }

    private static String stripPrefix(String text, String prefix, String what) {
        if (!text.startsWith(prefix)) {
            throw new InternalConsistencyException(String.format(
                    "invalid %s %s; missing '%s' prefix", what, quoteForMessage(text), prefix));
        }
        return text.substring(prefix.length());
    }

    static String quoteForMessage(String text) {
        return EscapeCodec.quote(text.getBytes(StandardCharsets.UTF_8));
    }
}
