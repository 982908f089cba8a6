package org.llasm.compiler.frontend.parser.ast;

/**
 * An operand in value position: a local or global identifier, or a literal constant.
 */
public sealed interface ValueNode extends AstNode permits LocalIdentNode, GlobalIdentNode, IntLitNode, BoolLitNode {
}
