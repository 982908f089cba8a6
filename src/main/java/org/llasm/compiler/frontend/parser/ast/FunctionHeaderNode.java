package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The header of a function definition or declaration. Every attribute node is {@code null} when absent.
 *
 * @param linkage The linkage keyword.
 * @param preemption The preemption keyword.
 * @param visibility The visibility keyword.
 * @param dllStorageClass The DLL storage class keyword.
 * @param callingConv The calling convention.
 * @param returnType The return type.
 * @param name The function name.
 * @param params The parameters.
 * @param ellipsis The {@code ...} token of a variadic function.
 * @param unnamedAddr The unnamed address keyword.
 * @param addrSpace The address space.
 * @param comdat The comdat the function belongs to.
 * @param align The alignment.
 */
public record FunctionHeaderNode(
        KeywordNode linkage,
        KeywordNode preemption,
        KeywordNode visibility,
        KeywordNode dllStorageClass,
        CallingConvNode callingConv,
        TypeNode returnType,
        GlobalIdentNode name,
        List<ParamNode> params,
        Token ellipsis,
        KeywordNode unnamedAddr,
        AddrSpaceNode addrSpace,
        ComdatNameNode comdat,
        AlignmentNode align
) implements AstNode {
    @Override
    public Token anchor() {
        return name.token();
    }
}
