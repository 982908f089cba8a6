package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.frontend.lexer.Token;

/**
 * The base interface for all nodes of the IR assembly syntax tree.
 * <p>
 * Nodes are produced by the parser and are assumed to be grammar-conformant.
 */
public interface AstNode {

    /**
     * @return The token that best locates this node in the source, or {@code null} if it has none.
     */
    Token anchor();

    /**
     * @return The source position of {@link #anchor()}, or {@link SourceInfo#UNKNOWN}.
     */
    default SourceInfo source() {
        Token t = anchor();
        return t != null ? t.source() : SourceInfo.UNKNOWN;
    }
}
