package org.llasm.compiler.frontend.parser.ast;

/**
 * A module-level entity.
 */
public sealed interface TopLevelEntityNode extends AstNode permits ComdatDefNode, GlobalVarNode, FunctionNode {
}
