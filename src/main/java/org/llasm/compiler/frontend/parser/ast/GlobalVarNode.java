package org.llasm.compiler.frontend.parser.ast;

import org.llasm.compiler.frontend.lexer.Token;

/**
 * A global variable definition or declaration. Every attribute node is {@code null} when absent.
 *
 * @param name The global name.
 * @param linkage The linkage keyword.
 * @param preemption The preemption keyword.
 * @param visibility The visibility keyword.
 * @param dllStorageClass The DLL storage class keyword.
 * @param threadLocal The {@code thread_local} marker.
 * @param unnamedAddr The unnamed address keyword.
 * @param addrSpace The address space.
 * @param externallyInitialized The {@code externally_initialized} token.
 * @param immutable {@code global} or {@code constant}.
 * @param contentType The content type.
 * @param init The initializer, or {@code null} for a declaration.
 * @param comdat The comdat the global belongs to.
 * @param align The alignment.
 */
public record GlobalVarNode(
        GlobalIdentNode name,
        KeywordNode linkage,
        KeywordNode preemption,
        KeywordNode visibility,
        KeywordNode dllStorageClass,
        ThreadLocalNode threadLocal,
        KeywordNode unnamedAddr,
        AddrSpaceNode addrSpace,
        Token externallyInitialized,
        KeywordNode immutable,
        TypeNode contentType,
        ValueNode init,
        ComdatNameNode comdat,
        AlignmentNode align
) implements TopLevelEntityNode {
    @Override
    public Token anchor() {
        return name.token();
    }
}
