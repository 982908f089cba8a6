package org.llasm.compiler.frontend.parser.ast;

/**
 * A calling convention, either as a named keyword ({@code fastcc}) or as a numeric code ({@code cc 11}).
 */
public sealed interface CallingConvNode extends AstNode permits CallingConvKeywordNode, CallingConvIntNode {
}
