package org.llasm.compiler.frontend.parser.ast;

/**
 * A first-class type as written in the source.
 */
public sealed interface TypeNode extends AstNode permits IntTypeNode, FloatTypeNode, VoidTypeNode, LabelTypeNode, PointerTypeNode {
}
