package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * One {@code [ value, %pred ]} pair of a {@code phi} instruction.
 *
 * @param x The incoming value.
 * @param pred The predecessor basic block.
 */
public record IncomingNode(ValueNode x, LocalIdentNode pred) implements AstNode {
    @Override
    public Token anchor() {
        return pred.token();
    }
}
